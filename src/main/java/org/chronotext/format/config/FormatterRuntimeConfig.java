package org.chronotext.format.config;

import lombok.Builder;
import lombok.Value;
import org.chronotext.format.calendar.CalendarSystems;

/**
 * Startup configuration of formatter defaults, bound once by {@link FormatterRuntimeBinder}.
 */
@Value
@Builder
public class FormatterRuntimeConfig {

    /**
     * Default zone id (for example {@code UTC} or {@code Europe/Paris}). Blank means UTC.
     */
    String zoneId;

    /**
     * IETF BCP 47 locale tag (for example {@code en-US}). Absent means the default format locale at
     * use time.
     */
    String localeTag;

    /**
     * Calendar system id registered in a {@code CalendarSystemRegistry}. Blank means {@code ISO}.
     */
    String calendarSystemId;

    /**
     * Two-digit-year pivot. Absent means the current UTC year at parse time.
     */
    Integer pivotYear;

    /**
     * Returns convenience config for UTC with the ISO calendar.
     */
    public static FormatterRuntimeConfig utc() {
        return FormatterRuntimeConfig.builder()
                .zoneId("UTC")
                .calendarSystemId(CalendarSystems.ID_ISO)
                .build();
    }
}
