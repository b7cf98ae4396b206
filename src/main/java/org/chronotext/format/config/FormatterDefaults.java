package org.chronotext.format.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.chronotext.format.Formatter;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.calendar.CalendarSystems;
import org.chronotext.format.plan.CompiledPlan;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;

/**
 * Immutable validated formatter settings applied to freshly compiled plans.
 */
@Value
@Builder
public class FormatterDefaults {
    @NonNull
    ZoneId zone;

    /** Nullable; {@code null} means the default format locale at use time. */
    Locale locale;

    @NonNull
    CalendarSystem calendarSystem;

    /** Nullable; {@code null} means the current UTC year at parse time. */
    Integer pivotYear;

    /**
     * Binds {@code plan} to these settings.
     */
    public Formatter apply(CompiledPlan plan) {
        return new Formatter(plan, zone, locale, calendarSystem, pivotYear);
    }

    /**
     * UTC, default locale, ISO calendar, current-year pivot.
     */
    public static FormatterDefaults utc() {
        return FormatterDefaults.builder()
                .zone(ZoneOffset.UTC)
                .calendarSystem(CalendarSystems.iso())
                .build();
    }
}
