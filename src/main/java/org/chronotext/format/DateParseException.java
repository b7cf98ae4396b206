package org.chronotext.format;

import lombok.Getter;

/**
 * Input text does not match a compiled plan.
 *
 * <p>{@link #getPosition()} is the furthest index the parser reached before failing and
 * {@link #getExpected()} describes what the plan required there.</p>
 */
@Getter
public class DateParseException extends DateFormatException {
    private final String text;
    private final int position;
    private final String expected;

    /**
     * Creates a parse mismatch failure.
     *
     * @param text full input text.
     * @param position failing index in {@code text}.
     * @param expected description of the expected input.
     */
    public DateParseException(String text, int position, String expected) {
        this(DateFormats.REASON_PARSE_MISMATCH, text, position, expected);
    }

    protected DateParseException(String reasonCode, String text, int position, String expected) {
        super(reasonCode, describe(text, position, expected));
        this.text = text;
        this.position = position;
        this.expected = expected;
    }

    private static String describe(String text, int position, String expected) {
        if (position >= text.length()) {
            return "invalid format: \"" + text + "\" is too short, expected " + expected + " at index " + position;
        }
        return "invalid format: \"" + text + "\" is malformed at \"" + text.substring(position)
                + "\", expected " + expected + " at index " + position;
    }
}
