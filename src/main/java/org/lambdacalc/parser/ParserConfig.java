package org.lambdacalc.parser;

/**
 * Parser configuration options.
 *
 * @param strictEnd reject token sequences with tokens left over after the top-level expression;
 *                  when off, such tokens are ignored
 */
public record ParserConfig(boolean strictEnd) {
    public static final ParserConfig DEFAULT = new ParserConfig(false);
}
