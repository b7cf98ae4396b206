package org.chronotext.format;

/**
 * Plan matched a prefix of the input but unconsumed text remains.
 */
public final class TrailingInputException extends DateParseException {

    /**
     * Creates a trailing-input failure.
     *
     * @param text full input text.
     * @param position index of the first unconsumed character.
     */
    public TrailingInputException(String text, int position) {
        super(DateFormats.REASON_TRAILING_INPUT, text, position, "end of input");
    }
}
