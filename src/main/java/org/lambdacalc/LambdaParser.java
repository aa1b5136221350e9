package org.lambdacalc;

import org.lambdacalc.lang.Result;
import org.lambdacalc.lexer.DotScope;
import org.lambdacalc.lexer.LambdaLexer;
import org.lambdacalc.lexer.LambdaToken;
import org.lambdacalc.parser.ExpressionParser;
import org.lambdacalc.parser.ParserConfig;
import org.lambdacalc.render.RenderConfig;
import org.lambdacalc.render.TreeRenderer;
import org.lambdacalc.tree.LambdaNode;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for tokenizing, parsing and rendering lambda terms.
 *
 * <p>Example usage:
 * <pre>{@code
 * var parser = LambdaParser.create();
 *
 * var tree = parser.parse("(\\x.x) y").unwrap();
 * parser.printTree(tree, System.out);
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class LambdaParser {
    private final DotScope dotScope;
    private final ParserConfig parserConfig;
    private final TreeRenderer renderer;

    private LambdaParser(DotScope dotScope, ParserConfig parserConfig, RenderConfig renderConfig) {
        this.dotScope = dotScope;
        this.parserConfig = parserConfig;
        this.renderer = TreeRenderer.create(renderConfig);
    }

    /**
     * Create a parser with default configuration.
     */
    public static LambdaParser create() {
        return new LambdaParser(DotScope.GLOBAL_COUNT, ParserConfig.DEFAULT, RenderConfig.DEFAULT);
    }

    /**
     * Create a builder for custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Split a line into tokens, validating it on the way.
     */
    public Result<List<LambdaToken>> tokenize(String line) {
        return LambdaLexer.tokenize(line, dotScope);
    }

    /**
     * Build the tree for a token sequence.
     */
    public Result<LambdaNode> parse(List<LambdaToken> tokens) {
        return ExpressionParser.parse(tokens, parserConfig);
    }

    /**
     * Tokenize and parse a line.
     */
    public Result<LambdaNode> parse(String line) {
        return tokenize(line).flatMap(tokens -> parse(tokens));
    }

    public String render(LambdaNode node) {
        return renderer.render(node);
    }

    public String trace(LambdaNode node) {
        return renderer.trace(node);
    }

    public void printTree(LambdaNode node, PrintStream out) {
        renderer.printTree(node, out);
    }

    public static final class Builder {
        private DotScope dotScope = DotScope.GLOBAL_COUNT;
        private boolean strictEnd = ParserConfig.DEFAULT.strictEnd();
        private String separator = RenderConfig.DEFAULT.separator();
        private String indent = RenderConfig.DEFAULT.indent();
        private boolean parenthesizeAbstractionBody = RenderConfig.DEFAULT.parenthesizeAbstractionBody();

        private Builder() {}

        public Builder dotScope(DotScope dotScope) {
            this.dotScope = dotScope;
            return this;
        }

        public Builder strictEnd(boolean strictEnd) {
            this.strictEnd = strictEnd;
            return this;
        }

        public Builder separator(String separator) {
            this.separator = separator;
            return this;
        }

        public Builder indent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder parenthesizeAbstractionBody(boolean parenthesize) {
            this.parenthesizeAbstractionBody = parenthesize;
            return this;
        }

        public LambdaParser build() {
            Objects.requireNonNull(dotScope, "dotScope");
            return new LambdaParser(dotScope,
                                    new ParserConfig(strictEnd),
                                    new RenderConfig(separator, indent, parenthesizeAbstractionBody));
        }
    }
}
