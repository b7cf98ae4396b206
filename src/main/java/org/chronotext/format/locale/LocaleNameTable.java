package org.chronotext.format.locale;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.chronotext.format.calendar.CalendarField;

import java.text.DateFormatSymbols;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Locale-specific names for era, month, day-of-week and halfday fields.
 *
 * <p>Names come from the JDK locale data ({@link DateFormatSymbols}). Tables are immutable and
 * memoised per locale, so concurrent printers and parsers share them without coordination.</p>
 */
public final class LocaleNameTable {
    private static final ConcurrentMap<Locale, LocaleNameTable> TABLES = new ConcurrentHashMap<>();
    private static final int NOT_FOUND = -1;

    private final Locale locale;
    private final String[] eras;
    private final String[] months;
    private final String[] shortMonths;
    // Indexed by ISO day of week, slot 0 unused.
    private final String[] weekdays;
    private final String[] shortWeekdays;
    private final String[] amPm;
    private final Map<CalendarField, NameIndex> indexes = new EnumMap<>(CalendarField.class);

    private LocaleNameTable(Locale locale) {
        this.locale = locale;
        DateFormatSymbols symbols = DateFormatSymbols.getInstance(locale);
        this.eras = symbols.getEras();
        this.months = symbols.getMonths();
        this.shortMonths = symbols.getShortMonths();
        this.weekdays = toIsoWeekdays(symbols.getWeekdays());
        this.shortWeekdays = toIsoWeekdays(symbols.getShortWeekdays());
        this.amPm = symbols.getAmPmStrings();

        indexes.put(CalendarField.ERA, NameIndex.of(0, eras));
        indexes.put(CalendarField.MONTH_OF_YEAR, NameIndex.of(1, months, shortMonths));
        indexes.put(CalendarField.DAY_OF_WEEK, NameIndex.of(0, weekdays, shortWeekdays));
        indexes.put(CalendarField.HALFDAY_OF_DAY, NameIndex.of(0, amPm));
    }

    /**
     * Returns the table for {@code locale}, or for the default format locale when {@code null}.
     */
    public static LocaleNameTable forLocale(Locale locale) {
        Locale effective = locale == null ? Locale.getDefault(Locale.Category.FORMAT) : locale;
        return TABLES.computeIfAbsent(effective, LocaleNameTable::new);
    }

    /**
     * Returns the locale backing this table.
     */
    public Locale locale() {
        return locale;
    }

    /**
     * Returns whether {@code field} has locale names.
     */
    public boolean supports(CalendarField field) {
        return indexes.containsKey(field);
    }

    /**
     * Returns the display name of one field value. Values without a name render as decimal.
     *
     * @param field named field.
     * @param value field value.
     * @param style short or full rendering; ignored for era and halfday.
     * @return display name.
     */
    public String text(CalendarField field, int value, NameStyle style) {
        Objects.requireNonNull(field, "field");
        switch (field) {
            case ERA:
                return nameOrNumber(eras, value, value);
            case MONTH_OF_YEAR:
                return nameOrNumber(style == NameStyle.FULL ? months : shortMonths, value - 1, value);
            case DAY_OF_WEEK:
                return nameOrNumber(style == NameStyle.FULL ? weekdays : shortWeekdays, value, value);
            case HALFDAY_OF_DAY:
                return nameOrNumber(amPm, value, value);
            default:
                throw new IllegalArgumentException("field has no locale names: " + field);
        }
    }

    /**
     * Finds the longest name of {@code field} at {@code position}, ignoring case. Short and full
     * names are both accepted.
     *
     * @return match, or {@code null} when no name matches.
     */
    public NameMatch match(CalendarField field, CharSequence text, int position) {
        NameIndex index = indexes.get(field);
        if (index == null) {
            throw new IllegalArgumentException("field has no locale names: " + field);
        }
        return index.match(text, position);
    }

    private static String nameOrNumber(String[] names, int index, int value) {
        if (index >= 0 && index < names.length && names[index] != null && !names[index].isEmpty()) {
            return names[index];
        }
        return Integer.toString(value);
    }

    private static String[] toIsoWeekdays(String[] calendarWeekdays) {
        // java.util.Calendar numbering: SUNDAY = 1 .. SATURDAY = 7.
        String[] iso = new String[8];
        for (int isoDay = 1; isoDay <= 7; isoDay++) {
            iso[isoDay] = calendarWeekdays[isoDay % 7 + 1];
        }
        return iso;
    }

    /**
     * One longest-match name hit.
     *
     * @param value matched field value.
     * @param length number of characters consumed.
     */
    public record NameMatch(int value, int length) {
    }

    private static final class NameIndex {
        private final Object2IntOpenHashMap<String> valueByName;
        private final int maxLength;

        private NameIndex(Object2IntOpenHashMap<String> valueByName, int maxLength) {
            this.valueByName = valueByName;
            this.maxLength = maxLength;
        }

        static NameIndex of(int firstValue, String[]... tables) {
            Object2IntOpenHashMap<String> map = new Object2IntOpenHashMap<>();
            map.defaultReturnValue(NOT_FOUND);
            int maxLength = 0;
            for (String[] table : tables) {
                for (int i = 0; i < table.length; i++) {
                    String name = table[i];
                    if (name == null || name.isEmpty()) {
                        continue;
                    }
                    String key = name.toLowerCase(Locale.ROOT);
                    map.putIfAbsent(key, i + firstValue);
                    maxLength = Math.max(maxLength, key.length());
                }
            }
            map.trim();
            return new NameIndex(map, maxLength);
        }

        NameMatch match(CharSequence text, int position) {
            int available = Math.min(maxLength, text.length() - position);
            for (int length = available; length > 0; length--) {
                String candidate = text.subSequence(position, position + length).toString().toLowerCase(Locale.ROOT);
                int value = valueByName.getInt(candidate);
                if (value != NOT_FOUND) {
                    return new NameMatch(value, length);
                }
            }
            return null;
        }
    }
}
