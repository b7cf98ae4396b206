package org.chronotext.format.plan;

import org.chronotext.format.calendar.CalendarField;

import java.util.Objects;

/**
 * Decimal field value.
 *
 * @param field rendered field.
 * @param minPrintDigits zero-padding width.
 * @param minParseDigits fewest digits accepted.
 * @param maxParseDigits most digits consumed, at most 9.
 * @param signed whether a leading sign is printed for negatives and accepted when parsing.
 */
public record NumberField(
        CalendarField field,
        int minPrintDigits,
        int minParseDigits,
        int maxParseDigits,
        boolean signed
) implements PlanInstruction {

    public NumberField {
        Objects.requireNonNull(field, "field");
        if (minPrintDigits < 1 || minParseDigits < 1 || maxParseDigits < minParseDigits || maxParseDigits > 9) {
            throw new IllegalArgumentException("invalid digit bounds for " + field + ": print=" + minPrintDigits
                    + ", parse=" + minParseDigits + ".." + maxParseDigits);
        }
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        appendPadded(out, context.fields().get(field), minPrintDigits);
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int limit = text.length();
        int cursor = position;
        boolean negative = false;
        if (signed && cursor < limit) {
            char c = text.charAt(cursor);
            if (c == '-' || c == '+') {
                negative = c == '-';
                cursor++;
            }
        }
        int start = cursor;
        int end = Math.min(limit, start + maxParseDigits);
        int value = 0;
        while (cursor < end && isDigit(text.charAt(cursor))) {
            value = value * 10 + (text.charAt(cursor) - '0');
            cursor++;
        }
        if (cursor - start < minParseDigits) {
            return context.fail(start, describe());
        }
        context.set(field, negative ? -value : value);
        return cursor;
    }

    private String describe() {
        String digits = minParseDigits == maxParseDigits
                ? String.valueOf(minParseDigits)
                : minParseDigits + "-" + maxParseDigits;
        return digits + " digit(s) for " + field;
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static void appendPadded(StringBuilder out, long value, int minDigits) {
        if (value < 0) {
            out.append('-');
            value = -value;
        }
        String digits = Long.toString(value);
        for (int i = digits.length(); i < minDigits; i++) {
            out.append('0');
        }
        out.append(digits);
    }
}
