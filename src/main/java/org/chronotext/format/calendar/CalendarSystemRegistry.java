package org.chronotext.format.calendar;

import java.time.chrono.Chronology;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable id lookup of calendar systems.
 *
 * <p>Ids are matched case-insensitively and reported upper case. A later registration replaces an
 * earlier one with the same id, so custom systems registered after {@link Builder#withBuiltIns()}
 * override the built-ins.</p>
 */
public final class CalendarSystemRegistry {
    private static final CalendarSystemRegistry DEFAULT = builder().withBuiltIns().build();

    private final Map<String, CalendarSystem> systemsById;

    private CalendarSystemRegistry(Map<String, CalendarSystem> systemsById) {
        this.systemsById = Collections.unmodifiableMap(new TreeMap<>(systemsById));
    }

    /**
     * Registry of {@code ISO}, {@code THAI_BUDDHIST} and {@code MINGUO}.
     */
    public static CalendarSystemRegistry defaultRegistry() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the calendar system registered under {@code id}, or {@code null}.
     */
    public CalendarSystem calendarSystem(String id) {
        if (id == null) {
            return null;
        }
        return systemsById.get(canonicalId(id));
    }

    /**
     * Returns registered ids in ascending order.
     */
    public Set<String> ids() {
        return systemsById.keySet();
    }

    private static String canonicalId(String id) {
        return id.trim().toUpperCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, CalendarSystem> systems = new TreeMap<>();

        private Builder() {
        }

        public Builder withBuiltIns() {
            return register(CalendarSystems.ISO)
                    .register(CalendarSystems.THAI_BUDDHIST)
                    .register(CalendarSystems.MINGUO);
        }

        public Builder register(CalendarSystem system) {
            Objects.requireNonNull(system, "calendarSystem");
            String id = canonicalId(Objects.requireNonNull(system.id(), "calendarSystem.id"));
            if (id.isEmpty()) {
                throw new IllegalArgumentException("calendarSystem.id must be non-blank");
            }
            systems.put(id, system);
            return this;
        }

        /**
         * Registers {@code chronology} under {@code id}.
         */
        public Builder register(String id, Chronology chronology) {
            return register(new ChronologyCalendarSystem(id, chronology));
        }

        public CalendarSystemRegistry build() {
            return new CalendarSystemRegistry(systems);
        }
    }
}
