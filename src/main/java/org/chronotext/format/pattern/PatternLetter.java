package org.chronotext.format.pattern;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.chronotext.format.calendar.CalendarField;

/**
 * Reserved pattern letters and the field each one renders.
 */
@Getter
@Accessors(fluent = true)
public enum PatternLetter {
    ERA('G', CalendarField.ERA, Kind.TEXT, 0, false),
    YEAR_OF_ERA('Y', CalendarField.YEAR_OF_ERA, Kind.YEAR, 0, false),
    WEEKYEAR('x', CalendarField.WEEKYEAR, Kind.YEAR, 0, true),
    WEEK_OF_WEEKYEAR('w', CalendarField.WEEK_OF_WEEKYEAR, Kind.NUMBER, 2, false),
    DAY_OF_WEEK_NUMBER('e', CalendarField.DAY_OF_WEEK, Kind.NUMBER, 1, false),
    DAY_OF_WEEK_TEXT('E', CalendarField.DAY_OF_WEEK, Kind.TEXT, 0, false),
    YEAR('y', CalendarField.YEAR, Kind.YEAR, 0, true),
    DAY_OF_YEAR('D', CalendarField.DAY_OF_YEAR, Kind.NUMBER, 3, false),
    MONTH_OF_YEAR('M', CalendarField.MONTH_OF_YEAR, Kind.MONTH, 2, false),
    DAY_OF_MONTH('d', CalendarField.DAY_OF_MONTH, Kind.NUMBER, 2, false),
    HALFDAY_OF_DAY('a', CalendarField.HALFDAY_OF_DAY, Kind.TEXT, 0, false),
    HOUR_OF_HALFDAY('K', CalendarField.HOUR_OF_HALFDAY, Kind.NUMBER, 2, false),
    CLOCKHOUR_OF_HALFDAY('h', CalendarField.CLOCKHOUR_OF_HALFDAY, Kind.NUMBER, 2, false),
    HOUR_OF_DAY('H', CalendarField.HOUR_OF_DAY, Kind.NUMBER, 2, false),
    CLOCKHOUR_OF_DAY('k', CalendarField.CLOCKHOUR_OF_DAY, Kind.NUMBER, 2, false),
    MINUTE_OF_HOUR('m', CalendarField.MINUTE_OF_HOUR, Kind.NUMBER, 2, false),
    SECOND_OF_MINUTE('s', CalendarField.SECOND_OF_MINUTE, Kind.NUMBER, 2, false),
    FRACTION_OF_SECOND('S', CalendarField.NANO_OF_SECOND, Kind.FRACTION, 9, false),
    ZONE('Z', CalendarField.OFFSET_SECONDS, Kind.ZONE, 0, false);

    private final char letter;
    private final CalendarField field;
    private final Kind kind;
    /** Natural maximum digit count of numeric letters. */
    private final int maxDigits;
    private final boolean signed;

    PatternLetter(char letter, CalendarField field, Kind kind, int maxDigits, boolean signed) {
        this.letter = letter;
        this.field = field;
        this.kind = kind;
        this.maxDigits = maxDigits;
        this.signed = signed;
    }

    /**
     * Rendering family of a letter.
     */
    public enum Kind {
        NUMBER,
        YEAR,
        /** Number for one or two letters, short name for three, full name for four or more. */
        MONTH,
        TEXT,
        FRACTION,
        ZONE
    }
}
