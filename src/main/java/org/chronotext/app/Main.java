package org.chronotext.app;

import org.chronotext.format.DateFormatException;
import org.chronotext.format.DateFormats;
import org.chronotext.format.registry.BuiltInFormatters;
import org.chronotext.format.registry.RegistryEntry;

import java.io.PrintStream;
import java.time.Instant;

/**
 * Prints every print-capable registry formatter applied to one instant.
 *
 * <p>Usage: {@code Main [instant]}. The optional argument is resolved with best-effort parsing;
 * without it the current instant is used.</p>
 */
public class Main {
    private static final String ROW_FORMAT = "%-40s%s%n";

    /**
     * Launches the sample-output routine.
     *
     * @param args optional instant text.
     */
    public static void main(String[] args) {
        Instant instant;
        try {
            instant = args.length > 0 ? DateFormats.parseAny(args[0]) : Instant.now();
        } catch (DateFormatException ex) {
            System.err.println(ex.getMessage());
            System.exit(2);
            return;
        }
        showFormatters(instant, BuiltInFormatters.defaultRegistry(), System.out);
    }

    /**
     * Writes one {@code name rendering} row per print-capable entry, in name order.
     *
     * @param instant instant to render.
     * @param registry formatter registry.
     * @param out destination.
     */
    public static void showFormatters(Instant instant, BuiltInFormatters registry, PrintStream out) {
        for (RegistryEntry entry : registry.printers()) {
            out.printf(ROW_FORMAT, entry.name(), entry.formatter().print(instant));
        }
    }
}
