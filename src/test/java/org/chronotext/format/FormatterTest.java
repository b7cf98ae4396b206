package org.chronotext.format;

import org.chronotext.core.time.TimeUtils;
import org.chronotext.format.calendar.CalendarSystems;
import org.chronotext.format.pattern.PatternCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Formatter Tests")
class FormatterTest {

    @Test
    @DisplayName("Compiled formatters default to UTC, default locale, ISO and current-year pivot")
    void testDefaults() {
        Formatter formatter = DateFormats.compile("yyyy");
        assertEquals(ZoneOffset.UTC, formatter.getZone());
        assertNull(formatter.getLocale());
        assertSame(CalendarSystems.ISO, formatter.getCalendarSystem());
        assertNull(formatter.getPivotYear());
        assertTrue(formatter.isPrinter());
        assertTrue(formatter.isParser());
    }

    @Test
    @DisplayName("with* methods return new formatters and leave the receiver unchanged")
    void testWithMethodsCopy() {
        Formatter base = DateFormats.compile("yyyy-MM-dd HH:mm");
        ZoneId paris = ZoneId.of("Europe/Paris");

        Formatter zoned = base.withZone(paris);
        Formatter localized = base.withLocale(Locale.FRANCE);
        Formatter thai = base.withChronology(CalendarSystems.THAI_BUDDHIST);
        Formatter pivoted = base.withPivotYear(2050);

        assertEquals(ZoneOffset.UTC, base.getZone());
        assertNull(base.getLocale());
        assertSame(CalendarSystems.ISO, base.getCalendarSystem());
        assertNull(base.getPivotYear());

        assertEquals(paris, zoned.getZone());
        assertEquals(Locale.FRANCE, localized.getLocale());
        assertSame(CalendarSystems.THAI_BUDDHIST, thai.getCalendarSystem());
        assertEquals(2050, pivoted.getPivotYear());
        assertSame(base.getPlan(), zoned.getPlan());
    }

    @Test
    @DisplayName("Formatters with equal plans and settings are equal")
    void testEquality() {
        assertEquals(DateFormats.compile("yyyy-MM-dd"), DateFormats.compile("yyyy-MM-dd"));
        assertNotEquals(DateFormats.compile("yyyy-MM-dd"), DateFormats.compile("yyyy-MM-dd").withPivotYear(2050));
        assertEquals(DateFormats.compile("HH").hashCode(), Formatter.of(PatternCompiler.compile("HH")).hashCode());
    }

    @Test
    @DisplayName("Formatter zone is mandatory")
    void testZoneRequired() {
        Formatter formatter = DateFormats.compile("yyyy");
        assertThrows(NullPointerException.class, () -> formatter.withZone(null));
        assertThrows(NullPointerException.class, () -> formatter.withChronology(null));
    }

    @Test
    @DisplayName("Absent pivot year means the current UTC year")
    void testDefaultPivotYear() {
        int expectedYear = TimeUtils.expandTwoDigitYear(49, TimeUtils.currentYear(Clock.systemUTC()));
        assertEquals(LocalDate.of(expectedYear, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                DateFormats.compile("yy").parse("49"));
    }

    @Test
    @DisplayName("Locale applies to names only")
    void testLocaleChangesNames() {
        Formatter formatter = DateFormats.compile("MMMM").withLocale(Locale.US);
        assertEquals("March", formatter.print(java.time.Instant.parse("2010-03-11T00:00:00Z")));
        assertEquals("mars", formatter.withLocale(Locale.FRANCE).print(java.time.Instant.parse("2010-03-11T00:00:00Z")));
        assertFalse(DateFormats.formatter("date-opt-time").isPrinter());
    }
}
