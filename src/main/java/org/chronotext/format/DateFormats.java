package org.chronotext.format;

import lombok.experimental.UtilityClass;
import org.chronotext.format.calendar.CalendarSystem;
import org.chronotext.format.config.FormatterDefaults;
import org.chronotext.format.engine.DateTimeParser;
import org.chronotext.format.engine.DateTimePrinter;
import org.chronotext.format.pattern.PatternCompiler;
import org.chronotext.format.registry.BestEffortResolver;
import org.chronotext.format.registry.BuiltInFormatters;
import org.chronotext.format.registry.RegistryEntry;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Public entry points for compiling, printing and parsing, and the catalog of reason codes.
 */
@UtilityClass
public class DateFormats {
    public static final String REASON_INVALID_PATTERN = "F1_INVALID_PATTERN";
    public static final String REASON_PARSE_MISMATCH = "F2_PARSE_MISMATCH";
    public static final String REASON_TRAILING_INPUT = "F2_TRAILING_INPUT";
    public static final String REASON_INVALID_FIELDS = "F3_INVALID_FIELDS";
    public static final String REASON_NO_MATCH = "F4_NO_MATCH";
    public static final String REASON_PRINT_UNSUPPORTED = "F5_PRINT_UNSUPPORTED";
    public static final String REASON_INSTANT_OUT_OF_RANGE = "F5_INSTANT_OUT_OF_RANGE";
    public static final String REASON_CONFIG_REQUIRED = "F6_CONFIG_REQUIRED";
    public static final String REASON_UNKNOWN_ZONE = "F6_UNKNOWN_ZONE";
    public static final String REASON_INVALID_LOCALE = "F6_INVALID_LOCALE";
    public static final String REASON_UNKNOWN_CALENDAR_SYSTEM = "F6_UNKNOWN_CALENDAR_SYSTEM";
    public static final String REASON_PIVOT_YEAR_OUT_OF_RANGE = "F6_PIVOT_YEAR_OUT_OF_RANGE";

    /**
     * Compiles {@code pattern} bound to UTC, the default locale and the ISO calendar.
     *
     * @throws PatternException when the pattern is malformed.
     */
    public static Formatter compile(String pattern) {
        return Formatter.of(PatternCompiler.compile(pattern));
    }

    /**
     * Compiles {@code pattern} bound to {@code zone}.
     */
    public static Formatter compile(String pattern, ZoneId zone) {
        return compile(pattern).withZone(zone);
    }

    /**
     * Compiles {@code pattern} bound to startup defaults.
     */
    public static Formatter compile(String pattern, FormatterDefaults defaults) {
        Objects.requireNonNull(defaults, "defaults");
        return defaults.apply(PatternCompiler.compile(pattern));
    }

    public static String print(Formatter formatter, Instant instant) {
        return DateTimePrinter.print(formatter, instant);
    }

    public static Instant parse(Formatter formatter, String text) {
        return DateTimeParser.parse(formatter, text);
    }

    public static ParsedInstant parsePrefix(Formatter formatter, String text, int startIndex) {
        return DateTimeParser.parsePrefix(formatter, text, startIndex);
    }

    /**
     * Parses {@code text} with the first default-registry entry, in name order, that accepts it.
     *
     * @throws NoMatchException when no entry accepts the text.
     */
    public static Instant parseAny(String text) {
        return BestEffortResolver.defaultResolver().parseAny(text);
    }

    public static Formatter withZone(Formatter formatter, ZoneId zone) {
        return formatter.withZone(zone);
    }

    public static Formatter withLocale(Formatter formatter, Locale locale) {
        return formatter.withLocale(locale);
    }

    public static Formatter withChronology(Formatter formatter, CalendarSystem calendarSystem) {
        return formatter.withChronology(calendarSystem);
    }

    public static Formatter withPivotYear(Formatter formatter, Integer pivotYear) {
        return formatter.withPivotYear(pivotYear);
    }

    /**
     * Returns default-registry entries in ascending name order.
     */
    public static List<RegistryEntry> listRegistry() {
        return BuiltInFormatters.defaultRegistry().listRegistry();
    }

    /**
     * Returns the default-registry formatter named {@code name}.
     *
     * @throws IllegalArgumentException when no entry has that name.
     */
    public static Formatter formatter(String name) {
        return BuiltInFormatters.defaultRegistry().formatter(name);
    }
}
