package org.chronotext.format.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.calendar.CalendarSystemRegistry;
import org.chronotext.format.calendar.CalendarSystems;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoField;
import java.util.IllformedLocaleException;
import java.util.Locale;
import java.util.Objects;

/**
 * Startup-only formatter defaults binder.
 *
 * <p>Validates one runtime config, resolves zone, locale and calendar system once, and returns
 * immutable {@link FormatterDefaults} used for every formatter compiled afterwards.</p>
 */
public final class FormatterRuntimeBinder {
    private static final Logger LOGGER = LogManager.getLogger(FormatterRuntimeBinder.class);

    /**
     * Binds one runtime config.
     *
     * @param runtimeConfig formatter runtime configuration.
     * @param calendarSystemRegistry registry resolving {@code calendarSystemId}.
     * @return immutable defaults.
     * @throws DateFormatException with an {@code F6_*} reason code when the config is invalid.
     */
    public FormatterDefaults bind(FormatterRuntimeConfig runtimeConfig, CalendarSystemRegistry calendarSystemRegistry) {
        if (runtimeConfig == null) {
            throw new DateFormatException(
                    DateFormats.REASON_CONFIG_REQUIRED,
                    "formatterRuntimeConfig must be provided at startup"
            );
        }
        CalendarSystemRegistry nonNullRegistry =
                Objects.requireNonNull(calendarSystemRegistry, "calendarSystemRegistry");

        ZoneId zone = resolveZone(normalizeOptionalId(runtimeConfig.getZoneId()));
        Locale locale = resolveLocale(runtimeConfig.getLocaleTag());

        String calendarSystemId = normalizeOptionalId(runtimeConfig.getCalendarSystemId());
        if (calendarSystemId == null) {
            calendarSystemId = CalendarSystems.ID_ISO;
        }
        CalendarSystem calendarSystem = nonNullRegistry.calendarSystem(calendarSystemId);
        if (calendarSystem == null) {
            throw new DateFormatException(
                    DateFormats.REASON_UNKNOWN_CALENDAR_SYSTEM,
                    "unknown calendar system id: " + calendarSystemId
            );
        }

        Integer pivotYear = runtimeConfig.getPivotYear();
        if (pivotYear != null && !ChronoField.YEAR.range().isValidIntValue(pivotYear)) {
            throw new DateFormatException(
                    DateFormats.REASON_PIVOT_YEAR_OUT_OF_RANGE,
                    "pivotYear out of range: " + pivotYear
            );
        }

        FormatterDefaults defaults = FormatterDefaults.builder()
                .zone(zone)
                .locale(locale)
                .calendarSystem(calendarSystem)
                .pivotYear(pivotYear)
                .build();
        LOGGER.info("bound formatter defaults zone={} locale={} calendarSystem={} pivotYear={}",
                zone.getId(),
                locale == null ? "<default>" : locale.toLanguageTag(),
                calendarSystem.id(),
                pivotYear == null ? "<current year>" : pivotYear);
        return defaults;
    }

    private static ZoneId resolveZone(String zoneId) {
        if (zoneId == null) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException ex) {
            throw new DateFormatException(
                    DateFormats.REASON_UNKNOWN_ZONE,
                    "unknown zone id: " + zoneId,
                    ex
            );
        }
    }

    private static Locale resolveLocale(String localeTag) {
        if (localeTag == null) {
            return null;
        }
        String normalized = localeTag.trim();
        if (normalized.isEmpty()) {
            throw new DateFormatException(
                    DateFormats.REASON_INVALID_LOCALE,
                    "localeTag must be non-blank when provided"
            );
        }
        try {
            return new Locale.Builder().setLanguageTag(normalized).build();
        } catch (IllformedLocaleException ex) {
            throw new DateFormatException(
                    DateFormats.REASON_INVALID_LOCALE,
                    "ill-formed locale tag: " + normalized,
                    ex
            );
        }
    }

    private static String normalizeOptionalId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        return normalized;
    }
}
