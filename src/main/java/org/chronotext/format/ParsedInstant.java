package org.chronotext.format;

import java.time.Instant;

/**
 * Result of a prefix parse: the resolved instant and the index just past the consumed text.
 */
public record ParsedInstant(Instant instant, int endIndex) {
}
