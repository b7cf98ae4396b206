package org.chronotext.format;

import lombok.Value;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.calendar.CalendarSystems;
import org.chronotext.format.engine.DateTimeParser;
import org.chronotext.format.engine.DateTimePrinter;
import org.chronotext.format.plan.CompiledPlan;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable compiled plan bound to a zone, locale, calendar system and pivot year.
 *
 * <p>The {@code with*} methods return new formatters and never modify the receiver. Instances
 * are safe to share between threads.</p>
 */
@Value
public class Formatter {
    CompiledPlan plan;
    ZoneId zone;
    /** Locale for names; {@code null} means the default format locale at use time. */
    Locale locale;
    CalendarSystem calendarSystem;
    /** Two-digit-year pivot; {@code null} means the current UTC year at parse time. */
    Integer pivotYear;

    /**
     * Creates a formatter.
     *
     * @param plan compiled plan.
     * @param zone print and default parse zone.
     * @param locale name locale, nullable.
     * @param calendarSystem calendar system.
     * @param pivotYear two-digit-year pivot, nullable.
     */
    public Formatter(CompiledPlan plan, ZoneId zone, Locale locale, CalendarSystem calendarSystem, Integer pivotYear) {
        this.plan = Objects.requireNonNull(plan, "plan");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.locale = locale;
        this.calendarSystem = Objects.requireNonNull(calendarSystem, "calendarSystem");
        this.pivotYear = pivotYear;
    }

    /**
     * Binds {@code plan} to UTC, the default locale, the ISO calendar and the current-year pivot.
     */
    public static Formatter of(CompiledPlan plan) {
        return new Formatter(plan, ZoneOffset.UTC, null, CalendarSystems.iso(), null);
    }

    public Formatter withZone(ZoneId newZone) {
        return new Formatter(plan, newZone, locale, calendarSystem, pivotYear);
    }

    public Formatter withLocale(Locale newLocale) {
        return new Formatter(plan, zone, newLocale, calendarSystem, pivotYear);
    }

    public Formatter withChronology(CalendarSystem newCalendarSystem) {
        return new Formatter(plan, zone, locale, newCalendarSystem, pivotYear);
    }

    public Formatter withPivotYear(Integer newPivotYear) {
        return new Formatter(plan, zone, locale, calendarSystem, newPivotYear);
    }

    public boolean isPrinter() {
        return plan.isPrinter();
    }

    /**
     * Parsing is supported by every plan.
     */
    public boolean isParser() {
        return true;
    }

    public String print(Instant instant) {
        return DateTimePrinter.print(this, instant);
    }

    public Instant parse(String text) {
        return DateTimeParser.parse(this, text);
    }

    public ParsedInstant parsePrefix(String text, int startIndex) {
        return DateTimeParser.parsePrefix(this, text, startIndex);
    }
}
