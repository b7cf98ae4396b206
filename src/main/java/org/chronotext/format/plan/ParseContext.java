package org.chronotext.format.plan;

import org.chronotext.format.calendar.CalendarField;
import org.chronotext.format.calendar.FieldValues;
import org.chronotext.format.locale.LocaleNameTable;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Mutable state of one parse call: accumulated fields, a parsed zone, and the furthest failure.
 *
 * <p>One instance serves exactly one parse on one thread.</p>
 */
public final class ParseContext {
    private final LocaleNameTable names;
    private final int pivotYear;
    private final FieldValues.Builder fields = FieldValues.builder();
    private ZoneId parsedZone;
    private int errorPosition = -1;
    private String expected;

    /**
     * @param names locale name table for name directives.
     * @param pivotYear upper bound of the two-digit-year window.
     */
    public ParseContext(LocaleNameTable names, int pivotYear) {
        this.names = Objects.requireNonNull(names, "names");
        this.pivotYear = pivotYear;
    }

    public LocaleNameTable names() {
        return names;
    }

    public int pivotYear() {
        return pivotYear;
    }

    public void set(CalendarField field, int value) {
        fields.set(field, value);
    }

    public FieldValues fields() {
        return fields.build();
    }

    public ZoneId parsedZone() {
        return parsedZone;
    }

    public void setParsedZone(ZoneId zone) {
        this.parsedZone = zone;
    }

    /**
     * Records a failure and returns its encoded position. Only the furthest failure is kept.
     *
     * @param position failing index.
     * @param expectedInput description of the expected input.
     * @return {@code ~position}.
     */
    public int fail(int position, String expectedInput) {
        if (position > errorPosition) {
            errorPosition = position;
            expected = expectedInput;
        }
        return ~position;
    }

    /**
     * Returns the furthest recorded failure index, or {@code -1} when nothing failed.
     */
    public int errorPosition() {
        return errorPosition;
    }

    /**
     * Returns what was expected at {@link #errorPosition()}.
     */
    public String expected() {
        return expected;
    }

    /**
     * Captures fields and parsed zone before a speculative branch.
     */
    public Snapshot snapshot() {
        return new Snapshot(fields.copy(), parsedZone);
    }

    /**
     * Rolls fields and parsed zone back to {@code snapshot}. Failure tracking is kept.
     */
    public void restore(Snapshot snapshot) {
        fields.restore(snapshot.fields);
        parsedZone = snapshot.parsedZone;
    }

    /**
     * Opaque saved parse state.
     */
    public static final class Snapshot {
        private final FieldValues.Builder fields;
        private final ZoneId parsedZone;

        private Snapshot(FieldValues.Builder fields, ZoneId parsedZone) {
            this.fields = fields;
            this.parsedZone = parsedZone;
        }
    }
}
