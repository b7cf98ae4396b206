package org.chronotext.format.plan;

import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered instruction sequence. Plans built from the same instructions are equal.
 *
 * @param instructions instructions in execution order.
 */
public record CompiledPlan(List<PlanInstruction> instructions) {

    public CompiledPlan {
        instructions = List.copyOf(Objects.requireNonNull(instructions, "instructions"));
    }

    /**
     * Returns whether every instruction can print.
     */
    public boolean isPrinter() {
        for (PlanInstruction instruction : instructions) {
            if (!instruction.isPrinter()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Executes every instruction in order against {@code out}.
     */
    public void print(PrintContext context, StringBuilder out) {
        for (PlanInstruction instruction : instructions) {
            instruction.print(context, out);
        }
    }

    /**
     * Executes every instruction in order, stopping at the first failure.
     *
     * @return end position, or {@code ~failurePosition}.
     */
    public int parse(ParseContext context, CharSequence text, int position) {
        int cursor = position;
        for (PlanInstruction instruction : instructions) {
            cursor = instruction.parse(context, text, cursor);
            if (cursor < 0) {
                return cursor;
            }
        }
        return cursor;
    }
}
