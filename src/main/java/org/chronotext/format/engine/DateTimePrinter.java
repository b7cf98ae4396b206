package org.chronotext.format.engine;

import lombok.experimental.UtilityClass;
import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.Formatter;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.locale.LocaleNameTable;
import org.chronotext.format.plan.CompiledPlan;
import org.chronotext.format.plan.PrintContext;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders instants through compiled plans.
 */
@UtilityClass
public class DateTimePrinter {

    /**
     * Prints {@code instant} with {@code formatter}'s plan and settings.
     *
     * @throws DateFormatException with {@code F5_PRINT_UNSUPPORTED} when the plan is parse-only.
     */
    public static String print(Formatter formatter, Instant instant) {
        Objects.requireNonNull(formatter, "formatter");
        return render(formatter.getPlan(), instant, formatter.getZone(), formatter.getLocale(),
                formatter.getCalendarSystem());
    }

    /**
     * Appends the rendering of {@code instant} to {@code out}.
     */
    public static void printTo(Formatter formatter, Instant instant, StringBuilder out) {
        Objects.requireNonNull(formatter, "formatter");
        render(formatter.getPlan(), instant, formatter.getZone(), formatter.getLocale(),
                formatter.getCalendarSystem(), out);
    }

    /**
     * Renders {@code instant} observed in {@code zone} under {@code calendarSystem}.
     *
     * @param locale locale for names, or {@code null} for the default format locale.
     * @throws DateFormatException with {@code F5_PRINT_UNSUPPORTED} when the plan is parse-only.
     */
    public static String render(
            CompiledPlan plan,
            Instant instant,
            ZoneId zone,
            Locale locale,
            CalendarSystem calendarSystem
    ) {
        StringBuilder out = new StringBuilder(32);
        render(plan, instant, zone, locale, calendarSystem, out);
        return out.toString();
    }

    /**
     * Appends the rendering of {@code instant} to {@code out}.
     */
    public static void render(
            CompiledPlan plan,
            Instant instant,
            ZoneId zone,
            Locale locale,
            CalendarSystem calendarSystem,
            StringBuilder out
    ) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(calendarSystem, "calendarSystem");
        Objects.requireNonNull(out, "out");
        if (!plan.isPrinter()) {
            throw new DateFormatException(DateFormats.REASON_PRINT_UNSUPPORTED,
                    "formatter contains parse-only sections and cannot print");
        }
        PrintContext context = new PrintContext(
                calendarSystem.fieldsOf(instant, zone),
                LocaleNameTable.forLocale(locale),
                zone
        );
        plan.print(context, out);
    }
}
