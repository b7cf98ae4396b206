package org.chronotext.format.registry;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.chronotext.format.DateParseException;
import org.chronotext.format.InvalidFieldsException;
import org.chronotext.format.NoMatchException;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Parses text of unknown layout by trying every parse-capable registry entry in name order.
 *
 * <p>The first entry that accepts the whole text wins. Per-entry failures are contained; only
 * a {@link NoMatchException} escapes when every entry rejects the text.</p>
 */
public final class BestEffortResolver {
    private static final Logger LOGGER = LogManager.getLogger(BestEffortResolver.class);

    private final List<RegistryEntry> candidates;

    /**
     * Creates a resolver over {@code registry}'s parse-capable entries.
     */
    public BestEffortResolver(BuiltInFormatters registry) {
        this.candidates = Objects.requireNonNull(registry, "registry").parsers();
    }

    /**
     * Returns a resolver over the default registry.
     */
    public static BestEffortResolver defaultResolver() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Parses {@code text} with the first accepting entry.
     *
     * @throws NoMatchException when no entry accepts the text.
     */
    public Instant parseAny(String text) {
        Objects.requireNonNull(text, "text");
        for (RegistryEntry candidate : candidates) {
            try {
                Instant instant = candidate.formatter().parse(text);
                LOGGER.debug("resolved \"{}\" with formatter {}", text, candidate.name());
                return instant;
            } catch (DateParseException | InvalidFieldsException ex) {
                LOGGER.trace("formatter {} rejected \"{}\": {}", candidate.name(), text, ex.getMessage());
            }
        }
        throw new NoMatchException(text);
    }

    /**
     * Returns the candidate entries in trial order.
     */
    public List<RegistryEntry> candidates() {
        return candidates;
    }

    private static final class DefaultHolder {
        private static final BestEffortResolver INSTANCE = new BestEffortResolver(BuiltInFormatters.defaultRegistry());
    }
}
