package org.chronotext.format.locale;

/**
 * Width of a locale-rendered field name.
 */
public enum NameStyle {
    /** Abbreviated name, for example {@code Mar} or {@code Thu}. */
    SHORT,
    /** Full name, for example {@code March} or {@code Thursday}. */
    FULL
}
