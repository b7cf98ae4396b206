package org.chronotext.format.plan;

/**
 * One step of a {@link CompiledPlan}: a literal run or a field directive.
 *
 * <p>Parsing follows the {@code ~position} convention: a non-negative result is the index just
 * past the consumed text, a negative result is the bitwise complement of the failing index.</p>
 */
public interface PlanInstruction {

    /**
     * Returns whether this instruction can render text. Parse-only instructions (optional
     * sections, alternatives) return {@code false}.
     */
    default boolean isPrinter() {
        return true;
    }

    /**
     * Appends this instruction's rendering of the context fields.
     */
    void print(PrintContext context, StringBuilder out);

    /**
     * Consumes text at {@code position}, recording field values into {@code context}.
     *
     * @return new position, or {@code ~failurePosition}.
     */
    int parse(ParseContext context, CharSequence text, int position);
}
