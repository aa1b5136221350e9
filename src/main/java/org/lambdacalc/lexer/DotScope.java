package org.lambdacalc.lexer;

/**
 * Where the group opened by a dot ({@code x.body}) is closed.
 */
public enum DotScope {
    /**
     * Balance all {@code (} against all {@code )} once the whole line is read and close the
     * difference at end of input. A dot inside explicit parentheses is therefore closed after them:
     * {@code (x.y)z} becomes {@code ( x ( y ) z )}.
     */
    GLOBAL_COUNT,

    /**
     * Close dot groups right before the explicit {@code )} of the group they appear in, or at end of
     * input at top level: {@code (x.y)z} becomes {@code ( x ( y ) ) z}.
     */
    ENCLOSING_GROUP
}
