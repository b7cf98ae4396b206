package org.chronotext.format.engine;

import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.Formatter;
import org.chronotext.format.calendar.CalendarSystems;
import org.chronotext.format.pattern.PatternCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("DateTimePrinter Tests")
class DateTimePrinterTest {
    private static final Instant MIDNIGHT = Instant.parse("2010-03-11T00:00:00Z");

    private static String print(String pattern, Instant instant) {
        return DateTimePrinter.print(DateFormats.compile(pattern).withLocale(Locale.US), instant);
    }

    @ParameterizedTest
    @CsvSource({
            "'yyyy-MM-dd HH:mm:ss.SSS Z', 2010-03-11T00:00:00Z, '2010-03-11 00:00:00.000 +0000'",
            "'EEEE, MMMM d', 2010-03-11T00:00:00Z, 'Thursday, March 11'",
            "'EEE, dd MMM yy', 2010-03-11T00:00:00Z, 'Thu, 11 Mar 10'",
            "'hh a', 2010-03-11T15:00:00Z, '03 PM'",
            "'h a', 2010-03-11T00:00:00Z, '12 AM'",
            "'kk', 2010-03-11T00:00:00Z, '24'",
            "'KK', 2010-03-11T12:00:00Z, '00'",
            "'D', 2010-03-11T00:00:00Z, '70'",
            "'xxxx-''W''ww-e', 2010-03-11T00:00:00Z, '2010-W10-4'",
            "'ss.S', 2010-03-11T00:00:01.120Z, '01.1'",
            "'ss.SSS', 2010-03-11T00:00:01.120Z, '01.120'",
            "'S', 2010-03-11T00:00:00.000000005Z, '0'",
            "'SSSSSSSSS', 2010-03-11T00:00:00.000000005Z, '000000005'",
            "'HH:mm:ss.SSS', 2010-03-11T00:00:00.001500Z, '00:00:00.001'",
            "'HH:mm:ss.SSS', 2010-03-11T00:00:00.123456789Z, '00:00:00.123'",
            "'ss.S', 2010-03-11T00:00:00.123456789Z, '00.1'",
            "'ss.SSSSSS', 2010-03-11T00:00:00.0015Z, '00.001500'",
            "'HH''''mm', 2010-03-11T15:00:00Z, '15''00'",
            "'h ''o''''clock'' a', 2010-03-11T15:00:00Z, '3 o''clock PM'"
    })
    void testPatterns(String pattern, String instant, String expected) {
        assertEquals(expected, print(pattern, Instant.parse(instant)));
    }

    @Test
    @DisplayName("Offsets print in the formatter zone")
    void testOffsets() {
        Formatter kolkata = DateFormats.compile("yyyy-MM-dd HH:mm ZZ", ZoneId.of("Asia/Kolkata"));
        assertEquals("2010-03-11 05:30 +05:30", kolkata.print(MIDNIGHT));

        Formatter newYork = DateFormats.compile("yyyy-MM-dd HH:mm Z", ZoneId.of("America/New_York"));
        assertEquals("2010-03-10 19:00 -0500", newYork.print(MIDNIGHT));
    }

    @Test
    @DisplayName("Zone id directive prints the formatter zone")
    void testZoneId() {
        assertEquals("Europe/Paris", DateFormats.compile("ZZZ", ZoneId.of("Europe/Paris")).print(MIDNIGHT));
        assertEquals("UTC", DateFormats.compile("ZZZ").print(MIDNIGHT));
        assertEquals("+05:30", DateFormats.compile("ZZZ", ZoneOffset.ofHoursMinutes(5, 30)).print(MIDNIGHT));
    }

    @Test
    @DisplayName("Years before year zero print signed")
    void testNegativeYears() {
        Instant idesOfMarch = LocalDate.of(-44, 3, 15).atStartOfDay(ZoneOffset.UTC).toInstant();
        assertEquals("-0044-03-15", print("yyyy-MM-dd", idesOfMarch));
        assertEquals("0045 BC", print("YYYY G", idesOfMarch));
        assertEquals("2010 AD", print("YYYY G", MIDNIGHT));
    }

    @Test
    @DisplayName("Calendar system supplies the printed fields")
    void testCalendarSystem() {
        Formatter thai = DateFormats.compile("yyyy-MM-dd").withChronology(CalendarSystems.THAI_BUDDHIST);
        assertEquals("2553-03-11", thai.print(MIDNIGHT));
        Formatter minguo = DateFormats.compile("yyy").withChronology(CalendarSystems.MINGUO);
        assertEquals("099", minguo.print(MIDNIGHT));
    }

    @Test
    @DisplayName("Locale supplies the printed names")
    void testLocaleNames() {
        Formatter french = DateFormats.compile("d MMMM yyyy").withLocale(Locale.FRANCE);
        assertEquals("11 mars 2010", french.print(MIDNIGHT));
    }

    @Test
    @DisplayName("Printing into an existing buffer appends")
    void testPrintTo() {
        StringBuilder out = new StringBuilder("at ");
        DateTimePrinter.printTo(DateFormats.compile("HH:mm"), Instant.parse("2010-03-11T09:05:00Z"), out);
        assertEquals("at 09:05", out.toString());
    }

    @Test
    @DisplayName("Plan-level render uses the given settings")
    void testRenderPlan() {
        String rendered = DateTimePrinter.render(
                PatternCompiler.compile("EEEE d MMMM yyyy HH:mm"),
                MIDNIGHT,
                ZoneId.of("Asia/Tokyo"),
                Locale.FRANCE,
                CalendarSystems.ISO
        );
        assertEquals("jeudi 11 mars 2010 09:00", rendered);
        assertEquals("2553", DateTimePrinter.render(
                PatternCompiler.compile("yyyy"), MIDNIGHT, ZoneOffset.UTC, null, CalendarSystems.THAI_BUDDHIST));
    }

    @Test
    @DisplayName("Instants outside the zone's local range are reported, not leaked")
    void testInstantOutOfRange() {
        Formatter formatter = DateFormats.formatter("date-time").withZone(ZoneOffset.ofHours(18));
        DateFormatException ex = assertThrows(DateFormatException.class, () -> formatter.print(Instant.MAX));
        assertEquals(DateFormats.REASON_INSTANT_OUT_OF_RANGE, ex.getReasonCode());
        assertEquals("999999999-06-30", DateFormats.formatter("date")
                .print(LocalDateTime.of(999_999_999, 6, 30, 23, 59).toInstant(ZoneOffset.UTC)));
    }

    @Test
    @DisplayName("Parse-only formatters refuse to print")
    void testParseOnlyFormatterRejected() {
        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> DateFormats.formatter("date-time-parser").print(MIDNIGHT)
        );
        assertEquals(DateFormats.REASON_PRINT_UNSUPPORTED, ex.getReasonCode());
    }
}
