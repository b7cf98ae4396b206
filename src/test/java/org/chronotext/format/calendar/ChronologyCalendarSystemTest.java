package org.chronotext.format.calendar;

import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.InvalidFieldsException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ChronologyCalendarSystem Tests")
class ChronologyCalendarSystemTest {
    private static final Instant SAMPLE = Instant.parse("2010-03-11T15:04:05.123Z");

    @Test
    @DisplayName("fieldsOf returns every field of an instant")
    void testFieldsOfIso() {
        FieldValues fields = CalendarSystems.ISO.fieldsOf(SAMPLE, ZoneOffset.UTC);

        assertEquals(1, fields.get(CalendarField.ERA));
        assertEquals(2010, fields.get(CalendarField.YEAR));
        assertEquals(2010, fields.get(CalendarField.YEAR_OF_ERA));
        assertEquals(2010, fields.get(CalendarField.WEEKYEAR));
        assertEquals(10, fields.get(CalendarField.WEEK_OF_WEEKYEAR));
        assertEquals(3, fields.get(CalendarField.MONTH_OF_YEAR));
        assertEquals(11, fields.get(CalendarField.DAY_OF_MONTH));
        assertEquals(70, fields.get(CalendarField.DAY_OF_YEAR));
        assertEquals(4, fields.get(CalendarField.DAY_OF_WEEK));
        assertEquals(1, fields.get(CalendarField.HALFDAY_OF_DAY));
        assertEquals(3, fields.get(CalendarField.HOUR_OF_HALFDAY));
        assertEquals(3, fields.get(CalendarField.CLOCKHOUR_OF_HALFDAY));
        assertEquals(15, fields.get(CalendarField.HOUR_OF_DAY));
        assertEquals(15, fields.get(CalendarField.CLOCKHOUR_OF_DAY));
        assertEquals(4, fields.get(CalendarField.MINUTE_OF_HOUR));
        assertEquals(5, fields.get(CalendarField.SECOND_OF_MINUTE));
        assertEquals(123_000_000, fields.get(CalendarField.NANO_OF_SECOND));
        assertEquals(0, fields.get(CalendarField.OFFSET_SECONDS));
    }

    @Test
    @DisplayName("fieldsOf observes the instant in the given zone")
    void testFieldsOfInZone() {
        FieldValues fields = CalendarSystems.ISO.fieldsOf(SAMPLE, ZoneId.of("Asia/Kolkata"));
        assertEquals(20, fields.get(CalendarField.HOUR_OF_DAY));
        assertEquals(34, fields.get(CalendarField.MINUTE_OF_HOUR));
        assertEquals(19_800, fields.get(CalendarField.OFFSET_SECONDS));
    }

    @Test
    @DisplayName("Unset fields default to the epoch")
    void testEmptyFieldsResolveToEpoch() {
        assertEquals(Instant.EPOCH, CalendarSystems.ISO.instantOf(FieldValues.builder().build(), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Parsed offset takes precedence over the zone")
    void testOffsetBeatsZone() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.YEAR, 2010)
                .set(CalendarField.MONTH_OF_YEAR, 3)
                .set(CalendarField.DAY_OF_MONTH, 11)
                .set(CalendarField.HOUR_OF_DAY, 5)
                .set(CalendarField.MINUTE_OF_HOUR, 30)
                .set(CalendarField.OFFSET_SECONDS, 19_800)
                .build();
        assertEquals(Instant.parse("2010-03-11T00:00:00Z"),
                CalendarSystems.ISO.instantOf(fields, ZoneId.of("America/New_York")));
    }

    @ParameterizedTest
    @CsvSource({
            "2010, 1, 1, 2010-01-04",
            "2010, 10, 4, 2010-03-11",
            "2009, 53, 7, 2010-01-03",
            "2020, 53, 5, 2021-01-01"
    })
    void testWeekDateResolution(int weekyear, int week, int dayOfWeek, String expectedDate) {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.WEEKYEAR, weekyear)
                .set(CalendarField.WEEK_OF_WEEKYEAR, week)
                .set(CalendarField.DAY_OF_WEEK, dayOfWeek)
                .build();
        assertEquals(Instant.parse(expectedDate + "T00:00:00Z"), CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Week 53 of a 52-week year is rejected")
    void testWeek53OfShortYearRejected() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.WEEKYEAR, 2010)
                .set(CalendarField.WEEK_OF_WEEKYEAR, 53)
                .build();
        assertThrows(InvalidFieldsException.class, () -> CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Day of year alone selects an ordinal date")
    void testOrdinalDate() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.YEAR, 2010)
                .set(CalendarField.DAY_OF_YEAR, 70)
                .build();
        assertEquals(Instant.parse("2010-03-11T00:00:00Z"), CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @ParameterizedTest
    @CsvSource({
            "2010, 4, 31",
            "2011, 2, 29",
            "2010, 13, 1",
            "2010, 0, 1"
    })
    void testInvalidCalendarDateRejected(int year, int month, int day) {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.YEAR, year)
                .set(CalendarField.MONTH_OF_YEAR, month)
                .set(CalendarField.DAY_OF_MONTH, day)
                .build();
        InvalidFieldsException ex = assertThrows(
                InvalidFieldsException.class,
                () -> CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC)
        );
        assertEquals(DateFormats.REASON_INVALID_FIELDS, ex.getReasonCode());
    }

    @Test
    @DisplayName("Conflicting day of week is rejected")
    void testConflictingDayOfWeekRejected() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.YEAR, 2010)
                .set(CalendarField.MONTH_OF_YEAR, 3)
                .set(CalendarField.DAY_OF_MONTH, 11)
                .set(CalendarField.DAY_OF_WEEK, 5)
                .build();
        assertThrows(InvalidFieldsException.class, () -> CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Local time inside a zone gap is rejected")
    void testZoneGapRejected() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.YEAR, 2010)
                .set(CalendarField.MONTH_OF_YEAR, 3)
                .set(CalendarField.DAY_OF_MONTH, 28)
                .set(CalendarField.HOUR_OF_DAY, 2)
                .set(CalendarField.MINUTE_OF_HOUR, 30)
                .build();
        assertThrows(InvalidFieldsException.class,
                () -> CalendarSystems.ISO.instantOf(fields, ZoneId.of("Europe/Paris")));
    }

    @ParameterizedTest
    @CsvSource({
            "CLOCKHOUR_OF_DAY, 24, 0",
            "CLOCKHOUR_OF_DAY, 13, 13",
            "HOUR_OF_DAY, 23, 23"
    })
    void testHourResolution(CalendarField field, int value, int expectedHour) {
        FieldValues fields = FieldValues.builder().set(field, value).build();
        Instant instant = CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC);
        assertEquals(expectedHour * 3600L, instant.getEpochSecond());
    }

    @ParameterizedTest
    @CsvSource({
            "0, 12, 0",
            "1, 12, 12",
            "1, 3, 15",
            "0, 11, 11"
    })
    void testClockHourOfHalfdayResolution(int halfday, int clockHour, int expectedHour) {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.HALFDAY_OF_DAY, halfday)
                .set(CalendarField.CLOCKHOUR_OF_HALFDAY, clockHour)
                .build();
        assertEquals(expectedHour * 3600L, CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC).getEpochSecond());
    }

    @Test
    @DisplayName("Year of era with BC era resolves to a proleptic year")
    void testYearOfEraBeforeChrist() {
        FieldValues fields = FieldValues.builder()
                .set(CalendarField.ERA, 0)
                .set(CalendarField.YEAR_OF_ERA, 45)
                .build();
        assertEquals(LocalDate.of(-44, 1, 1).atStartOfDay(ZoneOffset.UTC).toInstant(),
                CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Thai Buddhist years are offset by 543")
    void testThaiBuddhistYears() {
        FieldValues fields = CalendarSystems.THAI_BUDDHIST.fieldsOf(SAMPLE, ZoneOffset.UTC);
        assertEquals(2553, fields.get(CalendarField.YEAR));
        assertEquals(2010, fields.get(CalendarField.WEEKYEAR));

        FieldValues parsed = FieldValues.builder()
                .set(CalendarField.YEAR, 2553)
                .set(CalendarField.MONTH_OF_YEAR, 3)
                .set(CalendarField.DAY_OF_MONTH, 11)
                .build();
        assertEquals(Instant.parse("2010-03-11T00:00:00Z"),
                CalendarSystems.THAI_BUDDHIST.instantOf(parsed, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Field values builder snapshots are independent")
    void testFieldValuesBuilderSnapshot() {
        FieldValues.Builder builder = FieldValues.builder().set(CalendarField.YEAR, 2010);
        FieldValues.Builder snapshot = builder.copy();
        builder.set(CalendarField.MONTH_OF_YEAR, 3);
        assertTrue(builder.isSet(CalendarField.MONTH_OF_YEAR));

        builder.restore(snapshot);
        FieldValues restored = builder.build();
        assertFalse(restored.isSet(CalendarField.MONTH_OF_YEAR));
        assertEquals(2010, restored.get(CalendarField.YEAR));
        assertEquals(7, restored.getOrDefault(CalendarField.MONTH_OF_YEAR, 7));
        assertThrows(IllegalStateException.class, () -> restored.get(CalendarField.DAY_OF_MONTH));
    }

    @ParameterizedTest
    @CsvSource({
            "1, 1969-12-29",
            "4, 1970-01-01",
            "7, 1970-01-04"
    })
    void testDayOfWeekAloneMovesWithinDefaultWeek(int dayOfWeek, String expected) {
        FieldValues fields = FieldValues.builder().set(CalendarField.DAY_OF_WEEK, dayOfWeek).build();
        assertEquals(LocalDate.parse(expected).atStartOfDay(ZoneOffset.UTC).toInstant(),
                CalendarSystems.ISO.instantOf(fields, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Instants beyond the local date-time range are reported with a reason code")
    void testFieldsOfOutOfRange() {
        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> CalendarSystems.ISO.fieldsOf(Instant.MAX, ZoneOffset.ofHours(18))
        );
        assertEquals(DateFormats.REASON_INSTANT_OUT_OF_RANGE, ex.getReasonCode());
        assertThrows(DateFormatException.class,
                () -> CalendarSystems.THAI_BUDDHIST.fieldsOf(Instant.MIN, ZoneOffset.ofHours(-18)));
    }
}
