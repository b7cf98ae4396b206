package org.chronotext.format.plan;

import java.util.Objects;

/**
 * Parse-only section that consumes nothing and restores state when its plan fails.
 */
public record OptionalSection(CompiledPlan plan) implements PlanInstruction {

    public OptionalSection {
        Objects.requireNonNull(plan, "plan");
    }

    @Override
    public boolean isPrinter() {
        return false;
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        throw new UnsupportedOperationException("optional sections are parse-only");
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        ParseContext.Snapshot snapshot = context.snapshot();
        int end = plan.parse(context, text, position);
        if (end < 0) {
            context.restore(snapshot);
            return position;
        }
        return end;
    }
}
