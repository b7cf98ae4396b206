package org.chronotext.format.plan;

import org.chronotext.format.calendar.CalendarField;
import org.chronotext.format.locale.NameStyle;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Mutable assembler of {@link CompiledPlan}s. Adjacent literals are merged into one run.
 */
public final class PlanBuilder {
    private static final int MAX_DIGITS = 9;

    private final List<PlanInstruction> instructions = new ArrayList<>();
    private final StringBuilder pendingLiteral = new StringBuilder();

    public PlanBuilder appendLiteral(String text) {
        pendingLiteral.append(text);
        return this;
    }

    public PlanBuilder appendLiteral(char c) {
        pendingLiteral.append(c);
        return this;
    }

    /**
     * Unsigned number printed with {@code minPrintDigits} padding, parsed as 1..maxParseDigits digits.
     */
    public PlanBuilder appendNumber(CalendarField field, int minPrintDigits, int maxParseDigits) {
        return append(new NumberField(field, minPrintDigits, 1, Math.max(minPrintDigits, maxParseDigits), false));
    }

    /**
     * Unsigned number of exactly {@code digits} digits.
     */
    public PlanBuilder appendFixedNumber(CalendarField field, int digits) {
        return append(new NumberField(field, digits, digits, digits, false));
    }

    /**
     * Signed year-like number printed with {@code minDigits} padding; fixed width when
     * {@code minDigits == maxDigits}.
     */
    public PlanBuilder appendSignedNumber(CalendarField field, int minDigits, int maxDigits) {
        int minParse = minDigits == maxDigits ? minDigits : 1;
        return append(new NumberField(field, minDigits, minParse, Math.min(maxDigits, MAX_DIGITS), true));
    }

    public PlanBuilder appendTwoDigitYear(CalendarField field, boolean lenient) {
        return append(new TwoDigitYearField(field, lenient));
    }

    /**
     * Fraction of second printed at exactly {@code printDigits}, parsed at up to
     * {@code maxParseDigits}.
     */
    public PlanBuilder appendFraction(int printDigits, int maxParseDigits) {
        return append(new FractionField(printDigits, maxParseDigits));
    }

    public PlanBuilder appendName(CalendarField field, NameStyle style) {
        return append(new NameField(field, style));
    }

    public PlanBuilder appendOffset(String printZeroText, String parseZeroText, boolean colon) {
        return append(new OffsetField(printZeroText, parseZeroText, colon));
    }

    public PlanBuilder appendZoneId() {
        return append(new ZoneIdField());
    }

    public PlanBuilder appendOptional(CompiledPlan plan) {
        return append(new OptionalSection(plan));
    }

    public PlanBuilder appendAlternatives(CompiledPlan... branches) {
        return append(new Alternatives(Arrays.asList(branches)));
    }

    /**
     * Inlines every instruction of {@code plan}.
     */
    public PlanBuilder append(CompiledPlan plan) {
        for (PlanInstruction instruction : plan.instructions()) {
            append(instruction);
        }
        return this;
    }

    public PlanBuilder append(PlanInstruction instruction) {
        if (instruction instanceof LiteralText literal) {
            pendingLiteral.append(literal.text());
            return this;
        }
        flushLiteral();
        instructions.add(instruction);
        return this;
    }

    public CompiledPlan build() {
        flushLiteral();
        return new CompiledPlan(instructions);
    }

    private void flushLiteral() {
        if (pendingLiteral.length() > 0) {
            instructions.add(new LiteralText(pendingLiteral.toString()));
            pendingLiteral.setLength(0);
        }
    }
}
