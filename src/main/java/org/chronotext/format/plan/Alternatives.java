package org.chronotext.format.plan;

import java.util.List;
import java.util.Objects;

/**
 * Parse-only choice between branches. The branch consuming the most text wins; ties go to the
 * earlier branch.
 */
public record Alternatives(List<CompiledPlan> branches) implements PlanInstruction {

    public Alternatives {
        branches = List.copyOf(Objects.requireNonNull(branches, "branches"));
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("alternatives need at least one branch");
        }
    }

    @Override
    public boolean isPrinter() {
        return false;
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        throw new UnsupportedOperationException("alternatives are parse-only");
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        ParseContext.Snapshot initial = context.snapshot();
        ParseContext.Snapshot best = null;
        int bestEnd = -1;
        for (CompiledPlan branch : branches) {
            context.restore(initial);
            int end = branch.parse(context, text, position);
            if (end > bestEnd) {
                bestEnd = end;
                best = context.snapshot();
                if (end == text.length()) {
                    break;
                }
            }
        }
        if (best == null) {
            context.restore(initial);
            return ~Math.max(position, context.errorPosition());
        }
        context.restore(best);
        return bestEnd;
    }
}
