package org.chronotext.format.plan;

import org.chronotext.core.time.TimeUtils;
import org.chronotext.format.calendar.CalendarField;

/**
 * Fraction of second. Prints exactly {@code printDigits} digits, truncated and zero padded;
 * parses one to {@code maxParseDigits} digits.
 */
public record FractionField(int printDigits, int maxParseDigits) implements PlanInstruction {

    public FractionField {
        if (printDigits < 1 || maxParseDigits < printDigits || maxParseDigits > TimeUtils.MAX_FRACTION_DIGITS) {
            throw new IllegalArgumentException("invalid fraction digits: print " + printDigits
                    + ", parse up to " + maxParseDigits);
        }
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        out.append(TimeUtils.fractionDigits(context.fields().get(CalendarField.NANO_OF_SECOND), printDigits, printDigits));
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int end = Math.min(text.length(), position + maxParseDigits);
        int cursor = position;
        int fraction = 0;
        while (cursor < end && NumberField.isDigit(text.charAt(cursor))) {
            fraction = fraction * 10 + (text.charAt(cursor) - '0');
            cursor++;
        }
        if (cursor == position) {
            return context.fail(position, "fraction of second");
        }
        context.set(CalendarField.NANO_OF_SECOND, TimeUtils.fractionToNanos(fraction, cursor - position));
        return cursor;
    }
}
