package org.chronotext.format.calendar;

import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.InvalidFieldsException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.chrono.ChronoLocalDate;
import java.time.chrono.ChronoZonedDateTime;
import java.time.chrono.Chronology;
import java.time.chrono.Era;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.util.Objects;

/**
 * {@link CalendarSystem} backed by a {@code java.time} {@link Chronology}.
 *
 * <p>Date fields follow the wrapped chronology; time-of-day, offset and ISO week fields are
 * chronology independent. Resolution is strict: out-of-range values, a day-of-week that conflicts
 * with a parsed month, day or day-of-year and local times that fall into a zone gap are rejected.
 * A day-of-week without those fields selects that weekday in the week of the default date.</p>
 */
public final class ChronologyCalendarSystem implements CalendarSystem {
    private static final int EPOCH_WEEKYEAR = 1970;

    private final String id;
    private final Chronology chronology;
    private final int epochYear;
    private final int defaultEraValue;

    /**
     * Creates a calendar system for one chronology.
     *
     * @param id stable calendar-system id.
     * @param chronology backing chronology.
     */
    public ChronologyCalendarSystem(String id, Chronology chronology) {
        String normalizedId = Objects.requireNonNull(id, "id").trim();
        if (normalizedId.isEmpty()) {
            throw new IllegalArgumentException("id must be non-blank");
        }
        this.id = normalizedId;
        this.chronology = Objects.requireNonNull(chronology, "chronology");
        ChronoLocalDate epoch = chronology.date(LocalDate.EPOCH);
        this.epochYear = epoch.get(ChronoField.YEAR);
        this.defaultEraValue = epoch.getEra().getValue();
    }

    @Override
    public String id() {
        return id;
    }

    /**
     * Returns the wrapped chronology.
     */
    public Chronology chronology() {
        return chronology;
    }

    @Override
    public FieldValues fieldsOf(Instant instant, ZoneId zone) {
        Objects.requireNonNull(instant, "instant");
        Objects.requireNonNull(zone, "zone");
        try {
            return toFields(instant, zone);
        } catch (DateTimeException ex) {
            throw new DateFormatException(
                    DateFormats.REASON_INSTANT_OUT_OF_RANGE,
                    "instant " + instant + " has no " + id + " date-time in zone " + zone,
                    ex
            );
        }
    }

    private FieldValues toFields(Instant instant, ZoneId zone) {
        ChronoZonedDateTime<? extends ChronoLocalDate> dateTime = chronology.zonedDateTime(instant, zone);
        ChronoLocalDate date = dateTime.toLocalDate();
        LocalDate isoDate = LocalDate.from(date);
        LocalTime time = dateTime.toLocalTime();
        return FieldValues.builder()
                .set(CalendarField.ERA, date.get(ChronoField.ERA))
                .set(CalendarField.YEAR_OF_ERA, date.get(ChronoField.YEAR_OF_ERA))
                .set(CalendarField.YEAR, date.get(ChronoField.YEAR))
                .set(CalendarField.WEEKYEAR, isoDate.get(IsoFields.WEEK_BASED_YEAR))
                .set(CalendarField.WEEK_OF_WEEKYEAR, isoDate.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR))
                .set(CalendarField.MONTH_OF_YEAR, date.get(ChronoField.MONTH_OF_YEAR))
                .set(CalendarField.DAY_OF_MONTH, date.get(ChronoField.DAY_OF_MONTH))
                .set(CalendarField.DAY_OF_YEAR, date.get(ChronoField.DAY_OF_YEAR))
                .set(CalendarField.DAY_OF_WEEK, isoDate.get(ChronoField.DAY_OF_WEEK))
                .set(CalendarField.HALFDAY_OF_DAY, time.get(ChronoField.AMPM_OF_DAY))
                .set(CalendarField.HOUR_OF_HALFDAY, time.get(ChronoField.HOUR_OF_AMPM))
                .set(CalendarField.CLOCKHOUR_OF_HALFDAY, time.get(ChronoField.CLOCK_HOUR_OF_AMPM))
                .set(CalendarField.HOUR_OF_DAY, time.getHour())
                .set(CalendarField.CLOCKHOUR_OF_DAY, time.get(ChronoField.CLOCK_HOUR_OF_DAY))
                .set(CalendarField.MINUTE_OF_HOUR, time.getMinute())
                .set(CalendarField.SECOND_OF_MINUTE, time.getSecond())
                .set(CalendarField.NANO_OF_SECOND, time.getNano())
                .set(CalendarField.OFFSET_SECONDS, dateTime.getOffset().getTotalSeconds())
                .build();
    }

    @Override
    public Instant instantOf(FieldValues fields, ZoneId zone) {
        Objects.requireNonNull(fields, "fields");
        Objects.requireNonNull(zone, "zone");
        try {
            LocalDate date = LocalDate.from(resolveDate(fields));
            LocalTime time = resolveTime(fields);
            return resolveInstant(LocalDateTime.of(date, time), fields, zone);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new InvalidFieldsException(
                    "fields do not form a valid " + id + " date-time: " + ex.getMessage() + " " + fields,
                    ex
            );
        }
    }

    private ChronoLocalDate resolveDate(FieldValues fields) {
        boolean calendarDate = fields.isSet(CalendarField.MONTH_OF_YEAR)
                || fields.isSet(CalendarField.DAY_OF_MONTH)
                || fields.isSet(CalendarField.DAY_OF_YEAR);
        boolean weekDate = fields.isSet(CalendarField.WEEKYEAR) || fields.isSet(CalendarField.WEEK_OF_WEEKYEAR);
        if (weekDate && !calendarDate) {
            return resolveWeekDate(fields);
        }

        int year = resolveYear(fields);
        ChronoLocalDate date;
        if (fields.isSet(CalendarField.DAY_OF_YEAR)
                && !fields.isSet(CalendarField.MONTH_OF_YEAR)
                && !fields.isSet(CalendarField.DAY_OF_MONTH)) {
            date = chronology.dateYearDay(year, fields.get(CalendarField.DAY_OF_YEAR));
        } else {
            date = chronology.date(
                    year,
                    fields.getOrDefault(CalendarField.MONTH_OF_YEAR, 1),
                    fields.getOrDefault(CalendarField.DAY_OF_MONTH, 1)
            );
        }

        if (fields.isSet(CalendarField.DAY_OF_WEEK) && !calendarDate) {
            // weekday alone moves within the Monday-based week of the default date
            return date.with(ChronoField.DAY_OF_WEEK,
                    ChronoField.DAY_OF_WEEK.checkValidIntValue(fields.get(CalendarField.DAY_OF_WEEK)));
        }
        if (fields.isSet(CalendarField.DAY_OF_WEEK)) {
            int expected = ChronoField.DAY_OF_WEEK.checkValidIntValue(fields.get(CalendarField.DAY_OF_WEEK));
            int actual = date.get(ChronoField.DAY_OF_WEEK);
            if (expected != actual) {
                throw new DateTimeException(
                        "day of week " + expected + " conflicts with date " + date + " (day of week " + actual + ")"
                );
            }
        }
        return date;
    }

    private ChronoLocalDate resolveWeekDate(FieldValues fields) {
        int weekyear = ChronoField.YEAR.checkValidIntValue(fields.getOrDefault(CalendarField.WEEKYEAR, EPOCH_WEEKYEAR));
        LocalDate anchor = LocalDate.of(weekyear, 1, 4);
        int week = fields.getOrDefault(CalendarField.WEEK_OF_WEEKYEAR, 1);
        IsoFields.WEEK_OF_WEEK_BASED_YEAR.rangeRefinedBy(anchor)
                .checkValidValue(week, IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        int dayOfWeek = ChronoField.DAY_OF_WEEK.checkValidIntValue(fields.getOrDefault(CalendarField.DAY_OF_WEEK, 1));
        LocalDate isoDate = anchor
                .with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week)
                .with(ChronoField.DAY_OF_WEEK, dayOfWeek);
        return chronology.date(isoDate);
    }

    private int resolveYear(FieldValues fields) {
        if (fields.isSet(CalendarField.YEAR)) {
            return fields.get(CalendarField.YEAR);
        }
        if (fields.isSet(CalendarField.YEAR_OF_ERA)) {
            int yearOfEra = chronology.range(ChronoField.YEAR_OF_ERA)
                    .checkValidIntValue(fields.get(CalendarField.YEAR_OF_ERA), ChronoField.YEAR_OF_ERA);
            Era era = chronology.eraOf(fields.getOrDefault(CalendarField.ERA, defaultEraValue));
            return chronology.prolepticYear(era, yearOfEra);
        }
        return epochYear;
    }

    private static LocalTime resolveTime(FieldValues fields) {
        int hour;
        if (fields.isSet(CalendarField.HOUR_OF_DAY)) {
            hour = ChronoField.HOUR_OF_DAY.checkValidIntValue(fields.get(CalendarField.HOUR_OF_DAY));
        } else if (fields.isSet(CalendarField.CLOCKHOUR_OF_DAY)) {
            int clockHour = ChronoField.CLOCK_HOUR_OF_DAY.checkValidIntValue(fields.get(CalendarField.CLOCKHOUR_OF_DAY));
            hour = clockHour == 24 ? 0 : clockHour;
        } else {
            int halfday = ChronoField.AMPM_OF_DAY.checkValidIntValue(fields.getOrDefault(CalendarField.HALFDAY_OF_DAY, 0));
            int hourOfHalfday = 0;
            if (fields.isSet(CalendarField.HOUR_OF_HALFDAY)) {
                hourOfHalfday = ChronoField.HOUR_OF_AMPM.checkValidIntValue(fields.get(CalendarField.HOUR_OF_HALFDAY));
            } else if (fields.isSet(CalendarField.CLOCKHOUR_OF_HALFDAY)) {
                int clockHour = ChronoField.CLOCK_HOUR_OF_AMPM.checkValidIntValue(
                        fields.get(CalendarField.CLOCKHOUR_OF_HALFDAY)
                );
                hourOfHalfday = clockHour == 12 ? 0 : clockHour;
            }
            hour = halfday * 12 + hourOfHalfday;
        }
        return LocalTime.of(
                hour,
                fields.getOrDefault(CalendarField.MINUTE_OF_HOUR, 0),
                fields.getOrDefault(CalendarField.SECOND_OF_MINUTE, 0),
                fields.getOrDefault(CalendarField.NANO_OF_SECOND, 0)
        );
    }

    private static Instant resolveInstant(LocalDateTime local, FieldValues fields, ZoneId zone) {
        if (fields.isSet(CalendarField.OFFSET_SECONDS)) {
            return local.toInstant(ZoneOffset.ofTotalSeconds(fields.get(CalendarField.OFFSET_SECONDS)));
        }
        if (zone.getRules().getValidOffsets(local).isEmpty()) {
            throw new InvalidFieldsException("local date-time " + local + " falls into a transition gap of zone " + zone);
        }
        return ZonedDateTime.ofLocal(local, zone, null).toInstant();
    }

    @Override
    public String toString() {
        return "CalendarSystem[" + id + "]";
    }
}
