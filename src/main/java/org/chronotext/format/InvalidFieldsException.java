package org.chronotext.format;

/**
 * Parsed field values are individually well-formed but do not name a valid instant
 * (day 31 of a 30-day month, hour 25, a local time inside a zone gap).
 */
public final class InvalidFieldsException extends DateFormatException {

    public InvalidFieldsException(String message) {
        super(DateFormats.REASON_INVALID_FIELDS, message);
    }

    public InvalidFieldsException(String message, Throwable cause) {
        super(DateFormats.REASON_INVALID_FIELDS, message, cause);
    }
}
