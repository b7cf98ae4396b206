package org.chronotext.format.plan;

import org.chronotext.core.time.TimeUtils;
import org.chronotext.format.calendar.CalendarField;

import java.util.Objects;

/**
 * Two-digit year expanded through the parse pivot year.
 *
 * <p>When lenient, input with a sign or a digit count other than two is read as a full year.</p>
 *
 * @param field year-like field.
 * @param lenient whether full years are accepted.
 */
public record TwoDigitYearField(CalendarField field, boolean lenient) implements PlanInstruction {

    private static final int MAX_FULL_YEAR_DIGITS = 9;

    public TwoDigitYearField {
        Objects.requireNonNull(field, "field");
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        NumberField.appendPadded(out, Math.abs(context.fields().get(field) % 100), 2);
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int limit = text.length();
        if (lenient) {
            int cursor = position;
            boolean hasSign = false;
            boolean negative = false;
            if (cursor < limit && (text.charAt(cursor) == '-' || text.charAt(cursor) == '+')) {
                hasSign = true;
                negative = text.charAt(cursor) == '-';
                cursor++;
            }
            int start = cursor;
            int end = Math.min(limit, start + MAX_FULL_YEAR_DIGITS);
            int value = 0;
            while (cursor < end && NumberField.isDigit(text.charAt(cursor))) {
                value = value * 10 + (text.charAt(cursor) - '0');
                cursor++;
            }
            int digits = cursor - start;
            if (digits == 0) {
                return context.fail(cursor, "year digits for " + field);
            }
            if (hasSign || digits != 2) {
                context.set(field, negative ? -value : value);
                return cursor;
            }
        }
        if (position + 2 > limit
                || !NumberField.isDigit(text.charAt(position))
                || !NumberField.isDigit(text.charAt(position + 1))) {
            return context.fail(position, "2 digit(s) for " + field);
        }
        int twoDigit = (text.charAt(position) - '0') * 10 + (text.charAt(position + 1) - '0');
        context.set(field, TimeUtils.expandTwoDigitYear(twoDigit, context.pivotYear()));
        return position + 2;
    }
}
