package org.chronotext.format.config;

import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.Formatter;
import org.chronotext.format.calendar.CalendarSystemRegistry;
import org.chronotext.format.calendar.CalendarSystems;
import org.chronotext.format.pattern.PatternCompiler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("FormatterRuntimeBinder Tests")
class FormatterRuntimeBinderTest {

    @Test
    @DisplayName("Missing runtime config is rejected")
    void testMissingRuntimeConfigRejected() {
        FormatterRuntimeBinder binder = new FormatterRuntimeBinder();
        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> binder.bind(null, CalendarSystemRegistry.defaultRegistry())
        );
        assertEquals(DateFormats.REASON_CONFIG_REQUIRED, ex.getReasonCode());
    }

    @ParameterizedTest
    @CsvSource({
            "Mars/Olympus, , , F6_UNKNOWN_ZONE",
            "UTC, 'not a tag!', , F6_INVALID_LOCALE",
            "UTC, '  ', , F6_INVALID_LOCALE",
            "UTC, en-US, JULIAN, F6_UNKNOWN_CALENDAR_SYSTEM"
    })
    void testInvalidConfigRejected(String zoneId, String localeTag, String calendarSystemId, String reasonCode) {
        FormatterRuntimeConfig config = FormatterRuntimeConfig.builder()
                .zoneId(zoneId)
                .localeTag(localeTag)
                .calendarSystemId(calendarSystemId)
                .build();
        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> new FormatterRuntimeBinder().bind(config, CalendarSystemRegistry.defaultRegistry())
        );
        assertEquals(reasonCode, ex.getReasonCode());
    }

    @Test
    @DisplayName("Pivot year outside the supported year range is rejected")
    void testPivotYearOutOfRange() {
        FormatterRuntimeConfig config = FormatterRuntimeConfig.builder().pivotYear(1_000_000_000).build();
        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> new FormatterRuntimeBinder().bind(config, CalendarSystemRegistry.defaultRegistry())
        );
        assertEquals(DateFormats.REASON_PIVOT_YEAR_OUT_OF_RANGE, ex.getReasonCode());
    }

    @Test
    @DisplayName("Blank ids fall back to UTC and ISO")
    void testBlankIdsUseDefaults() {
        FormatterDefaults defaults = new FormatterRuntimeBinder().bind(
                FormatterRuntimeConfig.builder().zoneId("   ").calendarSystemId("").build(),
                CalendarSystemRegistry.defaultRegistry()
        );
        assertEquals(ZoneOffset.UTC, defaults.getZone());
        assertNull(defaults.getLocale());
        assertSame(CalendarSystems.ISO, defaults.getCalendarSystem());
        assertNull(defaults.getPivotYear());
    }

    @Test
    @DisplayName("UTC convenience config binds to UTC and ISO")
    void testUtcConfig() {
        FormatterDefaults defaults = new FormatterRuntimeBinder().bind(
                FormatterRuntimeConfig.utc(),
                CalendarSystemRegistry.defaultRegistry()
        );
        assertEquals(ZoneId.of("UTC"), defaults.getZone());
        assertSame(CalendarSystems.ISO, defaults.getCalendarSystem());
    }

    @Test
    @DisplayName("Bound defaults drive compiled formatters")
    void testBoundDefaultsApplied() {
        FormatterDefaults defaults = new FormatterRuntimeBinder().bind(
                FormatterRuntimeConfig.builder()
                        .zoneId(" Asia/Bangkok ")
                        .localeTag("th-TH")
                        .calendarSystemId(CalendarSystems.ID_THAI_BUDDHIST)
                        .pivotYear(2050)
                        .build(),
                CalendarSystemRegistry.defaultRegistry()
        );
        assertEquals(ZoneId.of("Asia/Bangkok"), defaults.getZone());
        assertEquals(Locale.forLanguageTag("th-TH"), defaults.getLocale());
        assertSame(CalendarSystems.THAI_BUDDHIST, defaults.getCalendarSystem());
        assertEquals(2050, defaults.getPivotYear());

        Formatter formatter = defaults.apply(PatternCompiler.compile("yyyy-MM-dd HH:mm"));
        assertEquals("2553-03-11 07:00", formatter.print(Instant.parse("2010-03-11T00:00:00Z")));
        assertEquals(Instant.parse("2010-03-11T00:00:00Z"), formatter.parse("2553-03-11 07:00"));
    }

    @Test
    @DisplayName("Custom calendar registry resolves only its own systems")
    void testCustomCalendarRegistry() {
        CalendarSystemRegistry registry = CalendarSystemRegistry.builder().register(CalendarSystems.MINGUO).build();
        FormatterRuntimeBinder binder = new FormatterRuntimeBinder();

        FormatterDefaults defaults = binder.bind(
                FormatterRuntimeConfig.builder().calendarSystemId(CalendarSystems.ID_MINGUO).build(),
                registry
        );
        assertSame(CalendarSystems.MINGUO, defaults.getCalendarSystem());

        DateFormatException ex = assertThrows(
                DateFormatException.class,
                () -> binder.bind(FormatterRuntimeConfig.builder().build(), registry)
        );
        assertEquals(DateFormats.REASON_UNKNOWN_CALENDAR_SYSTEM, ex.getReasonCode());
    }
}
