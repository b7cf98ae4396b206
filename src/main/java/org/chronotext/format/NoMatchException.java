package org.chronotext.format;

/**
 * Best-effort parsing tried every parse-capable registry entry and none accepted the text.
 */
public final class NoMatchException extends DateFormatException {

    /**
     * @param text input that no candidate accepted.
     */
    public NoMatchException(String text) {
        super(DateFormats.REASON_NO_MATCH, "no registered layout accepts \"" + text + "\"");
    }
}
