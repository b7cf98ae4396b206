package org.chronotext.format.plan;

import org.chronotext.format.calendar.CalendarField;

/**
 * Zone offset as {@code ±HH[mm[ss]]}, optionally colon separated.
 *
 * <p>Parsing accepts {@code parseZeroText}, {@code ±HH}, {@code ±HHmm}, {@code ±HH:mm} and
 * seconds in the same separator style.</p>
 *
 * @param printZeroText text printed for a zero offset, or {@code null} to print digits.
 * @param parseZeroText text accepted as a zero offset, or {@code null}.
 * @param colon whether components are colon separated when printed.
 */
public record OffsetField(String printZeroText, String parseZeroText, boolean colon) implements PlanInstruction {

    private static final String EXPECTED = "zone offset";

    @Override
    public void print(PrintContext context, StringBuilder out) {
        int offset = context.fields().get(CalendarField.OFFSET_SECONDS);
        if (offset == 0 && printZeroText != null) {
            out.append(printZeroText);
            return;
        }
        out.append(offset < 0 ? '-' : '+');
        int total = Math.abs(offset);
        NumberField.appendPadded(out, total / 3600, 2);
        if (colon) {
            out.append(':');
        }
        NumberField.appendPadded(out, (total / 60) % 60, 2);
        int seconds = total % 60;
        if (seconds != 0) {
            if (colon) {
                out.append(':');
            }
            NumberField.appendPadded(out, seconds, 2);
        }
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int limit = text.length();
        if (parseZeroText != null && position + parseZeroText.length() <= limit
                && parseZeroText.regionMatches(true, 0, text.toString(), position, parseZeroText.length())) {
            context.set(CalendarField.OFFSET_SECONDS, 0);
            return position + parseZeroText.length();
        }
        if (position >= limit || (text.charAt(position) != '+' && text.charAt(position) != '-')) {
            return context.fail(position, EXPECTED);
        }
        boolean negative = text.charAt(position) == '-';
        int cursor = position + 1;
        int hours = twoDigits(text, cursor);
        if (hours < 0) {
            return context.fail(cursor, EXPECTED + " hours");
        }
        cursor += 2;
        int minutes = 0;
        int seconds = 0;
        boolean separated = cursor < limit && text.charAt(cursor) == ':';
        int minuteStart = separated ? cursor + 1 : cursor;
        int parsedMinutes = twoDigits(text, minuteStart);
        if (parsedMinutes >= 0) {
            if (parsedMinutes > 59) {
                return context.fail(minuteStart, EXPECTED + " minutes");
            }
            minutes = parsedMinutes;
            cursor = minuteStart + 2;
            boolean secondSeparator = cursor < limit && text.charAt(cursor) == ':';
            if (secondSeparator == separated) {
                int secondStart = separated ? cursor + 1 : cursor;
                int parsedSeconds = twoDigits(text, secondStart);
                if (parsedSeconds >= 0 && parsedSeconds <= 59) {
                    seconds = parsedSeconds;
                    cursor = secondStart + 2;
                }
            }
        }
        int total = hours * 3600 + minutes * 60 + seconds;
        context.set(CalendarField.OFFSET_SECONDS, negative ? -total : total);
        return cursor;
    }

    private static int twoDigits(CharSequence text, int position) {
        if (position + 2 > text.length()
                || !NumberField.isDigit(text.charAt(position))
                || !NumberField.isDigit(text.charAt(position + 1))) {
            return -1;
        }
        return (text.charAt(position) - '0') * 10 + (text.charAt(position + 1) - '0');
    }
}
