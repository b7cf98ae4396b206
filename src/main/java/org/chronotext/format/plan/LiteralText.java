package org.chronotext.format.plan;

import java.util.Objects;

/**
 * Fixed text. Matches case-insensitively when parsing.
 *
 * @param text literal run, never empty.
 */
public record LiteralText(String text) implements PlanInstruction {

    public LiteralText {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("literal text must be non-empty");
        }
    }

    @Override
    public void print(PrintContext context, StringBuilder out) {
        out.append(text);
    }

    @Override
    public int parse(ParseContext context, CharSequence text, int position) {
        int length = this.text.length();
        if (position + length > text.length()
                || !this.text.regionMatches(true, 0, text.toString(), position, length)) {
            return context.fail(position, "'" + this.text + "'");
        }
        return position + length;
    }
}
