package org.chronotext.format.calendar;

/**
 * Semantic field kinds exchanged between the format engine and a {@link CalendarSystem}.
 *
 * <p>Day-of-week values run 1 (Monday) to 7 (Sunday). Halfday is 0 (AM) or 1 (PM).
 * Weekyear and week-of-weekyear follow ISO-8601 week numbering regardless of chronology.</p>
 */
public enum CalendarField {
    ERA,
    YEAR_OF_ERA,
    YEAR,
    WEEKYEAR,
    WEEK_OF_WEEKYEAR,
    MONTH_OF_YEAR,
    DAY_OF_MONTH,
    DAY_OF_YEAR,
    DAY_OF_WEEK,
    HALFDAY_OF_DAY,
    HOUR_OF_HALFDAY,
    CLOCKHOUR_OF_HALFDAY,
    HOUR_OF_DAY,
    CLOCKHOUR_OF_DAY,
    MINUTE_OF_HOUR,
    SECOND_OF_MINUTE,
    NANO_OF_SECOND,
    OFFSET_SECONDS
}
