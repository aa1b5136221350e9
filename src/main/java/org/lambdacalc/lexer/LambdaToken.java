package org.lambdacalc.lexer;

/**
 * Token types for the lambda lexer.
 *
 * <p>{@code offset} is the index in the input line the token originated from.
 */
public sealed interface LambdaToken {
    int offset();

    /**
     * Literal text of the token as it appears in the joined token string.
     */
    String symbol();

    record Variable(int offset, String name) implements LambdaToken {
        @Override
        public String symbol() {
            return name;
        }
    }

    // \
    record Backslash(int offset) implements LambdaToken {
        @Override
        public String symbol() {
            return "\\";
        }
    }

    // ( - virtual when inserted for a dot
    record OpenParen(int offset, boolean virtual) implements LambdaToken {
        @Override
        public String symbol() {
            return "(";
        }
    }

    // ) - synthetic when appended to balance dot groups
    record CloseParen(int offset, boolean synthetic) implements LambdaToken {
        @Override
        public String symbol() {
            return ")";
        }
    }
}
