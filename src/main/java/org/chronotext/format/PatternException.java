package org.chronotext.format;

import lombok.Getter;

/**
 * Malformed pattern string. Raised by the pattern compiler; no partial plan is ever produced.
 */
@Getter
public final class PatternException extends DateFormatException {
    private final String pattern;
    private final int position;
    private final char offendingCharacter;

    /**
     * Creates a pattern failure pointing at one character of the pattern.
     *
     * @param pattern full pattern being compiled.
     * @param position zero-based index of the offending character.
     * @param message descriptive error message.
     */
    public PatternException(String pattern, int position, String message) {
        super(DateFormats.REASON_INVALID_PATTERN, message + " at index " + position + " of pattern \"" + pattern + "\"");
        this.pattern = pattern;
        this.position = position;
        this.offendingCharacter = position >= 0 && position < pattern.length() ? pattern.charAt(position) : '\0';
    }
}
