package org.chronotext.format.calendar;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable, possibly partial, set of calendar field values.
 *
 * <p>The printer receives a complete snapshot from {@link CalendarSystem#fieldsOf}; the parser
 * accumulates a partial one through {@link Builder} and hands it to
 * {@link CalendarSystem#instantOf}.</p>
 */
public final class FieldValues {
    private static final int FIELD_COUNT = CalendarField.values().length;

    private final int[] values;
    private final boolean[] present;

    private FieldValues(int[] values, boolean[] present) {
        this.values = values;
        this.present = present;
    }

    /**
     * Returns whether {@code field} carries a value.
     */
    public boolean isSet(CalendarField field) {
        return present[field.ordinal()];
    }

    /**
     * Returns the value of {@code field}.
     *
     * @throws IllegalStateException when the field is not set.
     */
    public int get(CalendarField field) {
        if (!present[field.ordinal()]) {
            throw new IllegalStateException("field not set: " + field);
        }
        return values[field.ordinal()];
    }

    /**
     * Returns the value of {@code field}, or {@code fallback} when unset.
     */
    public int getOrDefault(CalendarField field, int fallback) {
        return present[field.ordinal()] ? values[field.ordinal()] : fallback;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FieldValues)) {
            return false;
        }
        FieldValues other = (FieldValues) o;
        if (!Arrays.equals(present, other.present)) {
            return false;
        }
        for (int i = 0; i < FIELD_COUNT; i++) {
            if (present[i] && values[i] != other.values[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int hash = Arrays.hashCode(present);
        for (int i = 0; i < FIELD_COUNT; i++) {
            if (present[i]) {
                hash = 31 * hash + values[i];
            }
        }
        return hash;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FieldValues{");
        boolean first = true;
        for (CalendarField field : CalendarField.values()) {
            if (!present[field.ordinal()]) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(field).append('=').append(values[field.ordinal()]);
            first = false;
        }
        return sb.append('}').toString();
    }

    /**
     * Mutable accumulator. Last write wins when a field is set twice.
     */
    public static final class Builder {
        private final int[] values;
        private final boolean[] present;

        private Builder() {
            this(new int[FIELD_COUNT], new boolean[FIELD_COUNT]);
        }

        private Builder(int[] values, boolean[] present) {
            this.values = values;
            this.present = present;
        }

        public Builder set(CalendarField field, int value) {
            Objects.requireNonNull(field, "field");
            values[field.ordinal()] = value;
            present[field.ordinal()] = true;
            return this;
        }

        public boolean isSet(CalendarField field) {
            return present[field.ordinal()];
        }

        /**
         * Returns an independent copy, used to snapshot parser state before a speculative branch.
         */
        public Builder copy() {
            return new Builder(values.clone(), present.clone());
        }

        /**
         * Replaces this builder's content with {@code snapshot}'s content.
         */
        public void restore(Builder snapshot) {
            System.arraycopy(snapshot.values, 0, values, 0, FIELD_COUNT);
            System.arraycopy(snapshot.present, 0, present, 0, FIELD_COUNT);
        }

        public FieldValues build() {
            return new FieldValues(values.clone(), present.clone());
        }
    }
}
