package org.chronotext.format.pattern;

import lombok.experimental.UtilityClass;
import org.chronotext.format.PatternException;
import org.chronotext.format.plan.CompiledPlan;
import org.chronotext.format.plan.PlanBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compiles pattern strings into {@link CompiledPlan}s.
 *
 * <p>ASCII letters are directives, text inside single quotes is literal, {@code ''} is a single
 * quote inside or outside quoted text, and every other character is literal. A numeric run
 * immediately followed by another numeric run parses exactly its letter count of digits.</p>
 */
@UtilityClass
public class PatternCompiler {

    /**
     * Compiles {@code pattern}.
     *
     * @param pattern pattern string.
     * @return compiled plan.
     * @throws PatternException for an empty pattern, an unknown letter, an unterminated quote, or
     *                          an unsupported run length.
     */
    public static CompiledPlan compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (pattern.isEmpty()) {
            throw new PatternException(pattern, 0, "pattern must be non-empty");
        }
        List<Token> tokens = tokenize(pattern);
        PlanBuilder builder = new PlanBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.letter == null) {
                builder.appendLiteral(token.literal);
                continue;
            }
            boolean followedByNumeric = i + 1 < tokens.size() && tokens.get(i + 1).isNumeric();
            try {
                FieldDirectiveTable.appendDirective(builder, token.letter, token.count, followedByNumeric);
            } catch (IllegalArgumentException e) {
                throw new PatternException(pattern, token.position, e.getMessage());
            }
        }
        return builder.build();
    }

    private static List<Token> tokenize(String pattern) {
        List<Token> tokens = new ArrayList<>();
        int length = pattern.length();
        int i = 0;
        while (i < length) {
            char c = pattern.charAt(i);
            if (isAsciiLetter(c)) {
                int end = i;
                while (end < length && pattern.charAt(end) == c) {
                    end++;
                }
                PatternLetter letter = FieldDirectiveTable.lookup(c);
                if (letter == null) {
                    throw new PatternException(pattern, i, "unknown pattern letter '" + c + "'");
                }
                tokens.add(Token.field(letter, end - i, i));
                i = end;
            } else if (c == '\'') {
                if (i + 1 < length && pattern.charAt(i + 1) == '\'') {
                    tokens.add(Token.literal("'"));
                    i += 2;
                    continue;
                }
                StringBuilder quoted = new StringBuilder();
                int cursor = i + 1;
                boolean closed = false;
                while (cursor < length) {
                    char q = pattern.charAt(cursor);
                    if (q != '\'') {
                        quoted.append(q);
                        cursor++;
                    } else if (cursor + 1 < length && pattern.charAt(cursor + 1) == '\'') {
                        quoted.append('\'');
                        cursor += 2;
                    } else {
                        closed = true;
                        cursor++;
                        break;
                    }
                }
                if (!closed) {
                    throw new PatternException(pattern, i, "unterminated quoted literal");
                }
                tokens.add(Token.literal(quoted.toString()));
                i = cursor;
            } else {
                tokens.add(Token.literal(String.valueOf(c)));
                i++;
            }
        }
        return tokens;
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static final class Token {
        final PatternLetter letter;
        final int count;
        final int position;
        final String literal;

        private Token(PatternLetter letter, int count, int position, String literal) {
            this.letter = letter;
            this.count = count;
            this.position = position;
            this.literal = literal;
        }

        static Token field(PatternLetter letter, int count, int position) {
            return new Token(letter, count, position, null);
        }

        static Token literal(String text) {
            return new Token(null, 0, -1, text);
        }

        boolean isNumeric() {
            return letter != null && FieldDirectiveTable.isNumeric(letter, count);
        }
    }
}
