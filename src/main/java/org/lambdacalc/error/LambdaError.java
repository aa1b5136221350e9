package org.lambdacalc.error;

import org.lambdacalc.lang.Cause;

/**
 * Reason a line was rejected by the lexer or the parser.
 */
public sealed interface LambdaError extends Cause {

    /**
     * Index in the input line the error points at.
     */
    int offset();

    /**
     * Lexical rejection: the line is not made of well-formed tokens.
     */
    record LexicalError(Kind kind, int offset, String detail) implements LambdaError {
        public static LexicalError of(Kind kind, int offset) {
            return new LexicalError(kind, offset, "");
        }

        @Override
        public String message() {
            return detail.isEmpty()
                   ? kind.summary() + " at index " + offset
                   : kind.summary() + " '" + detail + "' at index " + offset;
        }

        public enum Kind {
            INVALID_CHARACTER("L001", "invalid character", "character is not part of the lambda syntax", null),
            INVALID_VARIABLE_NAME("L002", "invalid variable name", "not a valid variable name", null),
            EMPTY_PARENTHESES("L003", "empty parentheses", "missing expression inside parentheses",
                              "parentheses must enclose an expression"),
            UNMATCHED_CLOSING_BRACKET("L004", "unmatched closing bracket",
                                      "bracket ')' is not matched with an opening bracket '('", null),
            UNMATCHED_OPENING_BRACKET("L005", "unmatched opening bracket",
                                      "bracket '(' is not matched with a closing bracket ')'", null),
            SPACE_AFTER_BACKSLASH("L006", "invalid space after backslash", "space inserted after '\\'",
                                  "write the bound variable right after '\\', as in \\x.x"),
            BACKSLASH_WITHOUT_NAME("L007", "backslash not followed by valid name",
                                   "'\\' must be followed by a variable name", null),
            MISSING_LAMBDA_BODY("L008", "missing expression after lambda abstraction",
                                "abstraction has no body", null),
            MISSING_VARIABLE_BEFORE_DOT("L009", "must have a variable before '.'",
                                        "'.' must directly follow a variable name", null),
            MISSING_EXPRESSION_AFTER_DOT("L010", "missing expression after dot", "nothing follows '.'", null),
            EMPTY_INPUT("L011", "empty input", "expected a lambda expression", null),
            NESTING_TOO_DEEP("L012", "expression nested too deeply", "nesting limit exceeded here",
                             "split the term into smaller ones");

            private final String code;
            private final String summary;
            private final String label;
            private final String help;

            Kind(String code, String summary, String label, String help) {
                this.code = code;
                this.summary = summary;
                this.label = label;
                this.help = help;
            }

            public String code() {
                return code;
            }

            public String summary() {
                return summary;
            }

            public String label() {
                return label;
            }

            /**
             * Suggestion shown under the diagnostic, or {@code null}.
             */
            public String help() {
                return help;
            }
        }
    }

    /**
     * Token sequence that does not form a lambda term.
     * Not expected for sequences produced by the lexer.
     */
    sealed interface StructuralError extends LambdaError {
        /**
         * Position of the offending token in the token sequence.
         */
        int tokenIndex();
    }

    record UnexpectedToken(
    int tokenIndex,
    int offset,
    String found,
    String expected) implements StructuralError {
        @Override
        public String message() {
            return "Unexpected " + found + " at token " + tokenIndex + ", expected " + expected;
        }
    }

    record UnexpectedEnd(
    int tokenIndex,
    int offset,
    String expected) implements StructuralError {
        @Override
        public String message() {
            return "Unexpected end of input at token " + tokenIndex + ", expected " + expected;
        }
    }

    record NestingTooDeep(
    int tokenIndex,
    int offset,
    int limit) implements StructuralError {
        @Override
        public String message() {
            return "Nesting deeper than " + limit + " at token " + tokenIndex;
        }
    }

    record TrailingTokens(
    int tokenIndex,
    int offset,
    String found) implements StructuralError {
        @Override
        public String message() {
            return "Unconsumed " + found + " at token " + tokenIndex + ", expected end of input";
        }
    }
}
