package org.chronotext.format.engine;

import lombok.experimental.UtilityClass;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.chronotext.core.time.TimeUtils;
import org.chronotext.format.DateParseException;
import org.chronotext.format.Formatter;
import org.chronotext.format.InvalidFieldsException;
import org.chronotext.format.ParsedInstant;
import org.chronotext.format.TrailingInputException;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.locale.LocaleNameTable;
import org.chronotext.format.plan.CompiledPlan;
import org.chronotext.format.plan.ParseContext;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * Parses text through compiled plans and resolves the collected fields into instants.
 */
@UtilityClass
public class DateTimeParser {
    private static final Logger LOGGER = LogManager.getLogger(DateTimeParser.class);

    /**
     * Parses the whole of {@code text}.
     *
     * @throws DateParseException when the text does not match the plan.
     * @throws TrailingInputException when the plan matched a strict prefix.
     * @throws InvalidFieldsException when the matched fields name no valid instant.
     */
    public static Instant parse(Formatter formatter, String text) {
        Objects.requireNonNull(formatter, "formatter");
        return parse(formatter.getPlan(), text, formatter.getZone(), formatter.getLocale(),
                formatter.getCalendarSystem(), formatter.getPivotYear());
    }

    /**
     * Parses the whole of {@code text} with explicit settings.
     *
     * @param zone zone used when the text carries no offset or zone id.
     * @param locale locale for names, or {@code null} for the default format locale.
     * @param pivotYear two-digit-year pivot, or {@code null} for the current UTC year.
     */
    public static Instant parse(
            CompiledPlan plan,
            String text,
            ZoneId zone,
            Locale locale,
            CalendarSystem calendarSystem,
            Integer pivotYear
    ) {
        return execute(plan, text, 0, true, zone, locale, calendarSystem, pivotYear).instant();
    }

    /**
     * Parses from {@code startIndex}, allowing unconsumed text after the match.
     *
     * @return instant plus the index just past the match.
     */
    public static ParsedInstant parsePrefix(Formatter formatter, String text, int startIndex) {
        Objects.requireNonNull(formatter, "formatter");
        Objects.requireNonNull(text, "text");
        if (startIndex < 0 || startIndex > text.length()) {
            throw new IndexOutOfBoundsException("startIndex " + startIndex + " outside text of length " + text.length());
        }
        return execute(formatter.getPlan(), text, startIndex, false, formatter.getZone(), formatter.getLocale(),
                formatter.getCalendarSystem(), formatter.getPivotYear());
    }

    private static ParsedInstant execute(
            CompiledPlan plan,
            String text,
            int startIndex,
            boolean requireFullMatch,
            ZoneId zone,
            Locale locale,
            CalendarSystem calendarSystem,
            Integer pivotYear
    ) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(calendarSystem, "calendarSystem");
        int pivot = pivotYear != null ? pivotYear : TimeUtils.currentYear(Clock.systemUTC());
        ParseContext context = new ParseContext(LocaleNameTable.forLocale(locale), pivot);
        int end = plan.parse(context, text, startIndex);
        if (end < 0) {
            int position = Math.max(~end, context.errorPosition());
            LOGGER.trace("parse of \"{}\" failed at index {}", text, position);
            throw new DateParseException(text, position, context.expected() == null ? "input" : context.expected());
        }
        if (requireFullMatch && end < text.length()) {
            throw new TrailingInputException(text, end);
        }
        ZoneId resolutionZone = context.parsedZone() != null ? context.parsedZone() : zone;
        Instant instant = calendarSystem.instantOf(context.fields(), resolutionZone);
        return new ParsedInstant(instant, end);
    }
}
