package org.chronotext.format.calendar;

import org.chronotext.format.InvalidFieldsException;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Calendar capability consumed by the format engine.
 *
 * <p>The engine never performs calendar arithmetic itself: it asks the calendar system for the
 * field values of an instant and for the instant named by a set of field values.</p>
 */
public interface CalendarSystem {

    /**
     * Stable calendar-system id (for example {@code ISO}).
     */
    String id();

    /**
     * Returns every {@link CalendarField} of {@code instant} observed in {@code zone}.
     *
     * @param instant instant to decompose.
     * @param zone zone in which fields are observed.
     * @return complete field snapshot.
     */
    FieldValues fieldsOf(Instant instant, ZoneId zone);

    /**
     * Resolves parsed field values into an instant.
     *
     * <p>Unset fields default to their value at 1970-01-01T00:00. A set
     * {@link CalendarField#OFFSET_SECONDS} takes precedence over {@code zone}.</p>
     *
     * @param fields parsed fields.
     * @param zone zone used when no offset was parsed.
     * @return resolved instant.
     * @throws InvalidFieldsException when the fields do not name a valid instant.
     */
    Instant instantOf(FieldValues fields, ZoneId zone);
}
