package org.chronotext.format;

import lombok.Getter;

import java.util.Objects;

/**
 * Unchecked failure of compiling, printing, parsing or configuring a formatter.
 *
 * <p>Every failure carries one of the {@code DateFormats.REASON_*} codes, and its message starts
 * with that code in brackets, for example {@code [F2_TRAILING_INPUT] ...}. The code prefix names
 * the family: {@code F1} pattern, {@code F2} text mismatch, {@code F3} field resolution,
 * {@code F4} best-effort parsing, {@code F5} printing, {@code F6} startup configuration.</p>
 */
@Getter
public class DateFormatException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode one of the {@code DateFormats.REASON_*} codes.
     * @param message detail shown after the code.
     */
    public DateFormatException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * @param reasonCode one of the {@code DateFormats.REASON_*} codes.
     * @param message detail shown after the code.
     * @param cause lower-level failure, for example a {@code java.time} range error.
     */
    public DateFormatException(String reasonCode, String message, Throwable cause) {
        super("[" + checkedCode(reasonCode) + "] " + Objects.requireNonNull(message, "message"), cause);
        this.reasonCode = reasonCode;
    }

    private static String checkedCode(String reasonCode) {
        if (Objects.requireNonNull(reasonCode, "reasonCode").isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return reasonCode;
    }
}
