package org.chronotext.format.pattern;

import lombok.experimental.UtilityClass;
import org.chronotext.core.time.TimeUtils;
import org.chronotext.format.locale.NameStyle;
import org.chronotext.format.plan.PlanBuilder;

/**
 * Maps a run of one pattern letter to plan instructions.
 *
 * <table>
 *   <caption>Directive summary</caption>
 *   <tr><td>G, a</td><td>locale text</td></tr>
 *   <tr><td>E</td><td>short weekday name below 4 letters, full name from 4</td></tr>
 *   <tr><td>y, x, Y</td><td>year; {@code yy} is a pivoted two-digit year</td></tr>
 *   <tr><td>M</td><td>number below 3 letters, short name at 3, full name from 4</td></tr>
 *   <tr><td>S</td><td>fraction of second, printed at exactly the run length and truncated</td></tr>
 *   <tr><td>Z, ZZ, ZZZ</td><td>offset {@code +HHmm}, offset {@code +HH:mm}, zone id</td></tr>
 *   <tr><td>others</td><td>zero-padded number</td></tr>
 * </table>
 */
@UtilityClass
public class FieldDirectiveTable {
    private static final int MAX_YEAR_DIGITS = 9;
    private static final PatternLetter[] BY_CHAR = new PatternLetter[128];

    static {
        for (PatternLetter letter : PatternLetter.values()) {
            BY_CHAR[letter.letter()] = letter;
        }
    }

    /**
     * Returns the directive for {@code c}, or {@code null} when the letter is not reserved.
     */
    public static PatternLetter lookup(char c) {
        return c < BY_CHAR.length ? BY_CHAR[c] : null;
    }

    /**
     * Returns whether a run renders as digits, which makes a preceding numeric run fixed width.
     */
    public static boolean isNumeric(PatternLetter letter, int count) {
        switch (letter.kind()) {
            case NUMBER:
            case YEAR:
            case FRACTION:
                return true;
            case MONTH:
                return count <= 2;
            default:
                return false;
        }
    }

    /**
     * Appends the instruction for {@code count} repetitions of {@code letter}.
     *
     * @param builder target plan.
     * @param letter directive letter.
     * @param count run length, at least 1.
     * @param followedByNumeric whether the next token is a numeric directive.
     * @throws IllegalArgumentException when the run cannot be expressed (for example more than 9
     *                                  fraction digits).
     */
    public static void appendDirective(PlanBuilder builder, PatternLetter letter, int count, boolean followedByNumeric) {
        switch (letter.kind()) {
            case YEAR:
                appendYear(builder, letter, count, followedByNumeric);
                break;
            case MONTH:
                if (count >= 4) {
                    builder.appendName(letter.field(), NameStyle.FULL);
                } else if (count == 3) {
                    builder.appendName(letter.field(), NameStyle.SHORT);
                } else {
                    appendNumber(builder, letter, count, followedByNumeric);
                }
                break;
            case TEXT:
                builder.appendName(letter.field(), count >= 4 ? NameStyle.FULL : NameStyle.SHORT);
                break;
            case FRACTION:
                if (count > TimeUtils.MAX_FRACTION_DIGITS) {
                    throw new IllegalArgumentException("fraction supports at most "
                            + TimeUtils.MAX_FRACTION_DIGITS + " digits");
                }
                builder.appendFraction(count, followedByNumeric ? count : TimeUtils.MAX_FRACTION_DIGITS);
                break;
            case ZONE:
                if (count == 1) {
                    builder.appendOffset(null, "Z", false);
                } else if (count == 2) {
                    builder.appendOffset(null, "Z", true);
                } else {
                    builder.appendZoneId();
                }
                break;
            default:
                appendNumber(builder, letter, count, followedByNumeric);
        }
    }

    private static void appendYear(PlanBuilder builder, PatternLetter letter, int count, boolean followedByNumeric) {
        if (count == 2) {
            builder.appendTwoDigitYear(letter.field(), !followedByNumeric);
            return;
        }
        if (count > MAX_YEAR_DIGITS) {
            throw new IllegalArgumentException("year supports at most " + MAX_YEAR_DIGITS + " digits");
        }
        int maxDigits = followedByNumeric ? count : MAX_YEAR_DIGITS;
        if (letter.signed()) {
            builder.appendSignedNumber(letter.field(), count, maxDigits);
        } else if (followedByNumeric) {
            builder.appendFixedNumber(letter.field(), count);
        } else {
            builder.appendNumber(letter.field(), count, maxDigits);
        }
    }

    private static void appendNumber(PlanBuilder builder, PatternLetter letter, int count, boolean followedByNumeric) {
        if (count > MAX_YEAR_DIGITS) {
            throw new IllegalArgumentException(letter.field() + " supports at most " + MAX_YEAR_DIGITS + " digits");
        }
        if (followedByNumeric) {
            builder.appendFixedNumber(letter.field(), count);
        } else {
            builder.appendNumber(letter.field(), count, Math.max(count, letter.maxDigits()));
        }
    }
}
