package org.chronotext.format.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.chronotext.format.Formatter;
import org.chronotext.format.pattern.PatternCompiler;
import org.chronotext.format.plan.CompiledPlan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable catalog of named formatters, ordered by name.
 *
 * <p>The default catalog holds the ISO-8601 family and {@code rfc822}, all bound to UTC. The
 * {@code *-parser}, {@code date-opt-time} and {@code local-*} entries are parse-only.</p>
 */
public final class BuiltInFormatters {
    private static final Logger LOGGER = LogManager.getLogger(BuiltInFormatters.class);

    public static final String BASIC_DATE = "basic-date";
    public static final String BASIC_DATE_TIME = "basic-date-time";
    public static final String BASIC_DATE_TIME_NO_MS = "basic-date-time-no-ms";
    public static final String BASIC_ORDINAL_DATE = "basic-ordinal-date";
    public static final String BASIC_ORDINAL_DATE_TIME = "basic-ordinal-date-time";
    public static final String BASIC_ORDINAL_DATE_TIME_NO_MS = "basic-ordinal-date-time-no-ms";
    public static final String BASIC_TIME = "basic-time";
    public static final String BASIC_TIME_NO_MS = "basic-time-no-ms";
    public static final String BASIC_T_TIME = "basic-t-time";
    public static final String BASIC_T_TIME_NO_MS = "basic-t-time-no-ms";
    public static final String BASIC_WEEK_DATE = "basic-week-date";
    public static final String BASIC_WEEK_DATE_TIME = "basic-week-date-time";
    public static final String BASIC_WEEK_DATE_TIME_NO_MS = "basic-week-date-time-no-ms";
    public static final String DATE = "date";
    public static final String DATE_ELEMENT_PARSER = "date-element-parser";
    public static final String DATE_HOUR = "date-hour";
    public static final String DATE_HOUR_MINUTE = "date-hour-minute";
    public static final String DATE_HOUR_MINUTE_SECOND = "date-hour-minute-second";
    public static final String DATE_HOUR_MINUTE_SECOND_FRACTION = "date-hour-minute-second-fraction";
    public static final String DATE_HOUR_MINUTE_SECOND_MS = "date-hour-minute-second-ms";
    public static final String DATE_OPT_TIME = "date-opt-time";
    public static final String DATE_PARSER = "date-parser";
    public static final String DATE_TIME = "date-time";
    public static final String DATE_TIME_NO_MS = "date-time-no-ms";
    public static final String DATE_TIME_PARSER = "date-time-parser";
    public static final String HOUR = "hour";
    public static final String HOUR_MINUTE = "hour-minute";
    public static final String HOUR_MINUTE_SECOND = "hour-minute-second";
    public static final String HOUR_MINUTE_SECOND_FRACTION = "hour-minute-second-fraction";
    public static final String HOUR_MINUTE_SECOND_MS = "hour-minute-second-ms";
    public static final String LOCAL_DATE_OPT_TIME = "local-date-opt-time";
    public static final String LOCAL_DATE = "local-date";
    public static final String LOCAL_TIME = "local-time";
    public static final String ORDINAL_DATE = "ordinal-date";
    public static final String ORDINAL_DATE_TIME = "ordinal-date-time";
    public static final String ORDINAL_DATE_TIME_NO_MS = "ordinal-date-time-no-ms";
    public static final String TIME = "time";
    public static final String TIME_ELEMENT_PARSER = "time-element-parser";
    public static final String TIME_NO_MS = "time-no-ms";
    public static final String TIME_PARSER = "time-parser";
    public static final String T_TIME = "t-time";
    public static final String T_TIME_NO_MS = "t-time-no-ms";
    public static final String WEEK_DATE = "week-date";
    public static final String WEEK_DATE_TIME = "week-date-time";
    public static final String WEEK_DATE_TIME_NO_MS = "week-date-time-no-ms";
    public static final String WEEKYEAR = "weekyear";
    public static final String WEEKYEAR_WEEK = "weekyear-week";
    public static final String WEEKYEAR_WEEK_DAY = "weekyear-week-day";
    public static final String YEAR = "year";
    public static final String YEAR_MONTH = "year-month";
    public static final String YEAR_MONTH_DAY = "year-month-day";
    public static final String RFC822 = "rfc822";

    /** RFC 822 date-time layout, English names. */
    public static final String RFC822_PATTERN = "EEE, dd MMM yyyy HH:mm:ss Z";

    private final Map<String, RegistryEntry> entriesByName;
    private final List<RegistryEntry> entries;

    /**
     * Creates a registry with built-in entries only.
     */
    public BuiltInFormatters() {
        this(null, true);
    }

    /**
     * Creates a registry by merging built-ins with custom entries.
     *
     * <p>Custom entry names override built-ins when names collide.</p>
     */
    public BuiltInFormatters(Collection<RegistryEntry> customEntries) {
        this(customEntries, true);
    }

    /**
     * Creates an explicit registry from the given entries.
     */
    public BuiltInFormatters(Collection<RegistryEntry> entries, boolean includeBuiltIns) {
        TreeMap<String, RegistryEntry> sorted = new TreeMap<>();
        if (includeBuiltIns) {
            for (RegistryEntry entry : defaultEntries()) {
                sorted.put(entry.name(), entry);
            }
        }
        if (entries != null) {
            for (RegistryEntry entry : entries) {
                RegistryEntry nonNullEntry = Objects.requireNonNull(entry, "entry");
                sorted.put(normalizeRequiredName(nonNullEntry.name()), nonNullEntry);
            }
        }
        this.entriesByName = Collections.unmodifiableMap(sorted);
        this.entries = List.copyOf(sorted.values());
    }

    /**
     * Returns entry by name, or {@code null} when not registered.
     */
    public RegistryEntry entry(String name) {
        if (name == null) {
            return null;
        }
        return entriesByName.get(name);
    }

    /**
     * Returns the formatter registered under {@code name}.
     *
     * @throws IllegalArgumentException when no entry has that name.
     */
    public Formatter formatter(String name) {
        RegistryEntry entry = entry(name);
        if (entry == null) {
            throw new IllegalArgumentException("unknown formatter name: " + name);
        }
        return entry.formatter();
    }

    /**
     * Returns registered names in ascending order.
     */
    public Set<String> names() {
        return entriesByName.keySet();
    }

    /**
     * Returns all entries in ascending name order.
     */
    public List<RegistryEntry> listRegistry() {
        return entries;
    }

    /**
     * Returns parse-capable entries in ascending name order.
     */
    public List<RegistryEntry> parsers() {
        List<RegistryEntry> parsers = new ArrayList<>();
        for (RegistryEntry entry : entries) {
            if (entry.canParse()) {
                parsers.add(entry);
            }
        }
        return Collections.unmodifiableList(parsers);
    }

    /**
     * Returns print-capable entries in ascending name order.
     */
    public List<RegistryEntry> printers() {
        List<RegistryEntry> printers = new ArrayList<>();
        for (RegistryEntry entry : entries) {
            if (entry.canPrint()) {
                printers.add(entry);
            }
        }
        return Collections.unmodifiableList(printers);
    }

    /**
     * Returns the process-wide default registry, built on first use.
     */
    public static BuiltInFormatters defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    private static List<RegistryEntry> defaultEntries() {
        List<RegistryEntry> entries = new ArrayList<>();
        add(entries, BASIC_DATE, IsoLayouts.basicDate());
        add(entries, BASIC_DATE_TIME, IsoLayouts.basicDateTime());
        add(entries, BASIC_DATE_TIME_NO_MS, IsoLayouts.basicDateTimeNoMillis());
        add(entries, BASIC_ORDINAL_DATE, IsoLayouts.basicOrdinalDate());
        add(entries, BASIC_ORDINAL_DATE_TIME, IsoLayouts.basicOrdinalDateTime());
        add(entries, BASIC_ORDINAL_DATE_TIME_NO_MS, IsoLayouts.basicOrdinalDateTimeNoMillis());
        add(entries, BASIC_TIME, IsoLayouts.basicTime());
        add(entries, BASIC_TIME_NO_MS, IsoLayouts.basicTimeNoMillis());
        add(entries, BASIC_T_TIME, IsoLayouts.basicTTime());
        add(entries, BASIC_T_TIME_NO_MS, IsoLayouts.basicTTimeNoMillis());
        add(entries, BASIC_WEEK_DATE, IsoLayouts.basicWeekDate());
        add(entries, BASIC_WEEK_DATE_TIME, IsoLayouts.basicWeekDateTime());
        add(entries, BASIC_WEEK_DATE_TIME_NO_MS, IsoLayouts.basicWeekDateTimeNoMillis());
        add(entries, DATE, IsoLayouts.date());
        add(entries, DATE_ELEMENT_PARSER, IsoLayouts.dateElementParser());
        add(entries, DATE_HOUR, IsoLayouts.withDate(IsoLayouts.hour()));
        add(entries, DATE_HOUR_MINUTE, IsoLayouts.withDate(IsoLayouts.hourMinute()));
        add(entries, DATE_HOUR_MINUTE_SECOND, IsoLayouts.withDate(IsoLayouts.hourMinuteSecond()));
        add(entries, DATE_HOUR_MINUTE_SECOND_FRACTION, IsoLayouts.withDate(IsoLayouts.hourMinuteSecondFraction()));
        add(entries, DATE_HOUR_MINUTE_SECOND_MS, IsoLayouts.withDate(IsoLayouts.hourMinuteSecondMillis()));
        add(entries, DATE_OPT_TIME, IsoLayouts.dateOptionalTimeParser());
        add(entries, DATE_PARSER, IsoLayouts.dateParser());
        add(entries, DATE_TIME, IsoLayouts.dateTime());
        add(entries, DATE_TIME_NO_MS, IsoLayouts.dateTimeNoMillis());
        add(entries, DATE_TIME_PARSER, IsoLayouts.dateTimeParser());
        add(entries, HOUR, IsoLayouts.hour());
        add(entries, HOUR_MINUTE, IsoLayouts.hourMinute());
        add(entries, HOUR_MINUTE_SECOND, IsoLayouts.hourMinuteSecond());
        add(entries, HOUR_MINUTE_SECOND_FRACTION, IsoLayouts.hourMinuteSecondFraction());
        add(entries, HOUR_MINUTE_SECOND_MS, IsoLayouts.hourMinuteSecondMillis());
        add(entries, LOCAL_DATE_OPT_TIME, IsoLayouts.localDateOptionalTimeParser());
        add(entries, LOCAL_DATE, IsoLayouts.localDateParser());
        add(entries, LOCAL_TIME, IsoLayouts.localTimeParser());
        add(entries, ORDINAL_DATE, IsoLayouts.ordinalDate());
        add(entries, ORDINAL_DATE_TIME, IsoLayouts.ordinalDateTime());
        add(entries, ORDINAL_DATE_TIME_NO_MS, IsoLayouts.ordinalDateTimeNoMillis());
        add(entries, TIME, IsoLayouts.time());
        add(entries, TIME_ELEMENT_PARSER, IsoLayouts.timeElementParser());
        add(entries, TIME_NO_MS, IsoLayouts.timeNoMillis());
        add(entries, TIME_PARSER, IsoLayouts.timeParser());
        add(entries, T_TIME, IsoLayouts.tTime());
        add(entries, T_TIME_NO_MS, IsoLayouts.tTimeNoMillis());
        add(entries, WEEK_DATE, IsoLayouts.weekDate());
        add(entries, WEEK_DATE_TIME, IsoLayouts.weekDateTime());
        add(entries, WEEK_DATE_TIME_NO_MS, IsoLayouts.weekDateTimeNoMillis());
        add(entries, WEEKYEAR, IsoLayouts.weekyear());
        add(entries, WEEKYEAR_WEEK, IsoLayouts.weekyearWeek());
        add(entries, WEEKYEAR_WEEK_DAY, IsoLayouts.weekDate());
        add(entries, YEAR, IsoLayouts.year());
        add(entries, YEAR_MONTH, IsoLayouts.yearMonth());
        add(entries, YEAR_MONTH_DAY, IsoLayouts.date());
        entries.add(RegistryEntry.of(RFC822, Formatter.of(PatternCompiler.compile(RFC822_PATTERN)).withLocale(Locale.US)));
        return entries;
    }

    private static void add(List<RegistryEntry> entries, String name, CompiledPlan plan) {
        entries.add(RegistryEntry.of(name, Formatter.of(plan)));
    }

    private static String normalizeRequiredName(String name) {
        String normalized = name.trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("entry.name must be non-blank");
        }
        return normalized;
    }

    private static final class DefaultHolder {
        private static final BuiltInFormatters INSTANCE = build();

        private static BuiltInFormatters build() {
            BuiltInFormatters registry = new BuiltInFormatters();
            LOGGER.debug("built default formatter registry with {} entries ({} parsers, {} printers)",
                    registry.entries.size(), registry.parsers().size(), registry.printers().size());
            return registry;
        }
    }
}
