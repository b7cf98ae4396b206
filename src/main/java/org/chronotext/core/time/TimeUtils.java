package org.chronotext.core.time;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Shared deterministic helpers for year windows and second fractions.
 *
 * <p>All methods are pure; the only clock access goes through an explicit {@link Clock}.</p>
 */
public final class TimeUtils {

    /** Width of the two-digit-year window. */
    public static final int TWO_DIGIT_YEAR_WINDOW = 100;
    /** Digits of a nanosecond fraction. */
    public static final int MAX_FRACTION_DIGITS = 9;

    private static final int[] POWERS_OF_TEN = {
            1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000, 1_000_000_000
    };

    /**
     * Prevents instantiation of this utility class.
     */
    private TimeUtils() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns the current year in UTC according to {@code clock}.
     *
     * @param clock source of the current instant.
     * @return proleptic ISO year.
     */
    public static int currentYear(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).getYear();
    }

    /**
     * Expands a two-digit year into the 100-year window ending at {@code pivotYear}.
     *
     * <p>The window is {@code (pivotYear - 100, pivotYear]}: with pivot 2050, {@code 49 -> 2049},
     * {@code 50 -> 2050} and {@code 51 -> 1951}.</p>
     *
     * @param twoDigitYear value in {@code [0, 99]}.
     * @param pivotYear upper bound of the window.
     * @return expanded year.
     */
    public static int expandTwoDigitYear(int twoDigitYear, int pivotYear) {
        if (twoDigitYear < 0 || twoDigitYear > 99) {
            throw new IllegalArgumentException("two-digit year out of range: " + twoDigitYear);
        }
        int pivotLastTwo = Math.floorMod(pivotYear, TWO_DIGIT_YEAR_WINDOW);
        int century = pivotYear - pivotLastTwo;
        if (twoDigitYear > pivotLastTwo) {
            century -= TWO_DIGIT_YEAR_WINDOW;
        }
        return century + twoDigitYear;
    }

    /**
     * Renders nanos as fraction-of-second digits, truncated to {@code maxDigits} and with
     * trailing zeros removed down to {@code minDigits}.
     *
     * @param nanoOfSecond value in {@code [0, 999_999_999]}.
     * @param minDigits minimum digits emitted.
     * @param maxDigits maximum digits emitted.
     * @return digit string without decimal point.
     */
    public static String fractionDigits(int nanoOfSecond, int minDigits, int maxDigits) {
        validateFractionDigits(minDigits, maxDigits);
        StringBuilder digits = new StringBuilder(MAX_FRACTION_DIGITS);
        String raw = Integer.toString(nanoOfSecond);
        for (int i = raw.length(); i < MAX_FRACTION_DIGITS; i++) {
            digits.append('0');
        }
        digits.append(raw);
        int length = maxDigits;
        while (length > minDigits && digits.charAt(length - 1) == '0') {
            length--;
        }
        return digits.substring(0, length);
    }

    /**
     * Scales a parsed fraction of {@code digitCount} digits to nanoseconds.
     *
     * @param fraction parsed digits as an integer.
     * @param digitCount number of digits parsed, at most {@value #MAX_FRACTION_DIGITS}.
     * @return nanoseconds.
     */
    public static int fractionToNanos(int fraction, int digitCount) {
        if (digitCount < 1 || digitCount > MAX_FRACTION_DIGITS) {
            throw new IllegalArgumentException("fraction digit count out of range: " + digitCount);
        }
        return fraction * POWERS_OF_TEN[MAX_FRACTION_DIGITS - digitCount];
    }

    private static void validateFractionDigits(int minDigits, int maxDigits) {
        if (minDigits < 1 || maxDigits > MAX_FRACTION_DIGITS || minDigits > maxDigits) {
            throw new IllegalArgumentException(
                    "fraction digits must satisfy 1 <= min <= max <= 9, got " + minDigits + ".." + maxDigits);
        }
    }
}
