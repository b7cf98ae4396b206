package org.chronotext.format.calendar;

import lombok.experimental.UtilityClass;

import java.time.chrono.IsoChronology;
import java.time.chrono.MinguoChronology;
import java.time.chrono.ThaiBuddhistChronology;

/**
 * Built-in calendar systems.
 */
@UtilityClass
public final class CalendarSystems {
    public static final String ID_ISO = "ISO";
    public static final String ID_THAI_BUDDHIST = "THAI_BUDDHIST";
    public static final String ID_MINGUO = "MINGUO";

    /** Proleptic Gregorian calendar with ISO-8601 year numbering (year 0 = 1 BC). */
    public static final CalendarSystem ISO = new ChronologyCalendarSystem(ID_ISO, IsoChronology.INSTANCE);
    /** Thai solar calendar: Gregorian months, years offset by 543. */
    public static final CalendarSystem THAI_BUDDHIST =
            new ChronologyCalendarSystem(ID_THAI_BUDDHIST, ThaiBuddhistChronology.INSTANCE);
    /** Republic of China calendar: Gregorian months, years offset by 1911. */
    public static final CalendarSystem MINGUO = new ChronologyCalendarSystem(ID_MINGUO, MinguoChronology.INSTANCE);

    /**
     * Returns the default calendar system.
     */
    public static CalendarSystem iso() {
        return ISO;
    }
}
