package org.lambdacalc.parser;

import org.lambdacalc.error.LambdaError.NestingTooDeep;
import org.lambdacalc.error.LambdaError.TrailingTokens;
import org.lambdacalc.error.LambdaError.UnexpectedEnd;
import org.lambdacalc.error.LambdaError.UnexpectedToken;
import org.lambdacalc.lang.Result;
import org.lambdacalc.lexer.LambdaLexer;
import org.lambdacalc.lexer.LambdaToken;
import org.lambdacalc.tree.LambdaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for lambda token sequences.
 *
 * <pre>
 * Expression  <- Term Term*                 (left-associative application)
 * Term        <- Variable / Abstraction / Grouped
 * Abstraction <- '\' Variable Expression
 * Grouped     <- '(' Expression ')'
 * </pre>
 *
 * <p>Abstractions and groups deeper than {@link LambdaLexer#MAX_NESTING_DEPTH} are rejected with
 * {@link NestingTooDeep}; the lexer applies the same limit, so only hand-built token lists reach it here.
 */
public final class ExpressionParser {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionParser.class);
    private static final String TERM_START = "variable, '\\' or '('";

    private final List<LambdaToken> tokens;
    private int pos;
    private int depth;

    private ExpressionParser(List<LambdaToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse tokens into a tree with default configuration.
     */
    public static Result<LambdaNode> parse(List<LambdaToken> tokens) {
        return parse(tokens, ParserConfig.DEFAULT);
    }

    /**
     * Parse tokens into a tree.
     */
    public static Result<LambdaNode> parse(List<LambdaToken> tokens, ParserConfig config) {
        Objects.requireNonNull(tokens, "tokens");
        var parser = new ExpressionParser(List.copyOf(tokens));
        var result = parser.parseExpression();
        if (config.strictEnd()) {
            result = result.flatMap(parser::requireEnd);
        }
        return result.onFailure(cause -> logger.debug("Cannot parse {}: {}", tokens, cause.message()));
    }

    private Result<LambdaNode> parseExpression() {
        var first = parseTerm();
        if (first.isFailure()) {
            return first;
        }
        var expression = first.unwrap();

        while (!isAtEnd() && !(peek() instanceof LambdaToken.CloseParen)) {
            var next = parseTerm();
            if (next.isFailure()) {
                return next;
            }
            expression = new LambdaNode.Application(expression, next.unwrap());
        }

        return Result.success(expression);
    }

    private Result<LambdaNode> parseTerm() {
        if (isAtEnd()) {
            return Result.failure(new UnexpectedEnd(pos, endOffset(), TERM_START));
        }
        var token = peek();

        if (token instanceof LambdaToken.Variable variable) {
            advance();
            return Result.success(new LambdaNode.Variable(variable.name()));
        }
        if (token instanceof LambdaToken.Backslash) {
            return nested(this::parseAbstraction);
        }
        if (token instanceof LambdaToken.OpenParen) {
            return nested(this::parseGrouped);
        }

        return Result.failure(new UnexpectedToken(pos, token.offset(), tokenDescription(token), TERM_START));
    }

    private Result<LambdaNode> parseAbstraction() {
        advance(); // skip \
        if (isAtEnd()) {
            return Result.failure(new UnexpectedEnd(pos, endOffset(), "variable"));
        }
        if (!(peek() instanceof LambdaToken.Variable parameter)) {
            return Result.failure(new UnexpectedToken(pos, peek().offset(), tokenDescription(peek()), "variable"));
        }
        advance();

        // body extends as far as the enclosing expression does
        return parseExpression().map(body -> new LambdaNode.Abstraction(new LambdaNode.Variable(parameter.name()),
                                                                         body));
    }

    private Result<LambdaNode> parseGrouped() {
        advance(); // skip (
        var inner = parseExpression();
        if (inner.isFailure()) {
            return inner;
        }
        if (isAtEnd()) {
            return Result.failure(new UnexpectedEnd(pos, endOffset(), "')'"));
        }
        if (!(peek() instanceof LambdaToken.CloseParen)) {
            return Result.failure(new UnexpectedToken(pos, peek().offset(), tokenDescription(peek()), "')'"));
        }
        advance();

        return Result.success(new LambdaNode.Grouped(inner.unwrap()));
    }

    private Result<LambdaNode> nested(Supplier<Result<LambdaNode>> production) {
        if (depth >= LambdaLexer.MAX_NESTING_DEPTH) {
            return Result.failure(new NestingTooDeep(pos, peek().offset(), LambdaLexer.MAX_NESTING_DEPTH));
        }
        depth++ ;
        var result = production.get();
        depth-- ;
        return result;
    }

    private Result<LambdaNode> requireEnd(LambdaNode node) {
        if (isAtEnd()) {
            return Result.success(node);
        }
        return Result.failure(new TrailingTokens(pos, peek().offset(), tokenDescription(peek())));
    }

    private boolean isAtEnd() {
        return pos >= tokens.size();
    }

    private LambdaToken peek() {
        return tokens.get(pos);
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++ ;
        }
    }

    private int endOffset() {
        if (tokens.isEmpty()) {
            return 0;
        }
        var last = tokens.get(tokens.size() - 1);
        if (last instanceof LambdaToken.CloseParen close && close.synthetic()) {
            return last.offset();
        }
        return last.offset() + last.symbol()
                                   .length();
    }

    private static String tokenDescription(LambdaToken token) {
        if (token instanceof LambdaToken.Variable variable) {
            return "variable '" + variable.name() + "'";
        }
        return "'" + token.symbol() + "'";
    }
}
