package org.chronotext.format.registry;

import org.chronotext.format.Formatter;

import java.util.Objects;

/**
 * Named catalog formatter with its capabilities.
 *
 * @param name registry key.
 * @param formatter bound formatter.
 * @param canParse whether the entry takes part in best-effort parsing.
 * @param canPrint whether the formatter renders text.
 */
public record RegistryEntry(String name, Formatter formatter, boolean canParse, boolean canPrint) {

    public RegistryEntry {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(formatter, "formatter");
        if (canPrint && !formatter.isPrinter()) {
            throw new IllegalArgumentException("entry " + name + " cannot print: its plan is parse-only");
        }
    }

    /**
     * Creates an entry whose capabilities follow the formatter.
     */
    public static RegistryEntry of(String name, Formatter formatter) {
        return new RegistryEntry(name, formatter, formatter.isParser(), formatter.isPrinter());
    }
}
