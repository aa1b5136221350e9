package org.lambdacalc.lexer;

import org.lambdacalc.error.LambdaError.LexicalError;
import org.lambdacalc.error.LambdaError.LexicalError.Kind;
import org.lambdacalc.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.lambdacalc.lexer.CharClasses.isIdentifierChar;
import static org.lambdacalc.lexer.CharClasses.isIdentifierStart;
import static org.lambdacalc.lexer.CharClasses.isValidSyntaxChar;
import static org.lambdacalc.lexer.CharClasses.isValidVariableName;

/**
 * Lexer and validator for lambda terms.
 *
 * <p>Dot-sugar is resolved here: {@code x.body} becomes {@code x ( body )}, where the inserted
 * {@code (} is virtual. It does not count as an explicit bracket and is closed as {@link DotScope} says.
 */
public final class LambdaLexer {
    private static final Logger logger = LoggerFactory.getLogger(LambdaLexer.class);

    public static final int MAX_INPUT_SIZE = 100_000;
    /**
     * Deepest accepted combination of open brackets, virtual ones included, and abstractions whose body is still
     * open.
     */
    public static final int MAX_NESTING_DEPTH = 1_000;
    private static final int DEFAULT_NAME_CAPACITY = 16;

    private final String input;
    private final DotScope dotScope;
    private final List<LambdaToken> tokens = new ArrayList<>();
    // explicit '(' not yet closed, innermost first
    private final Deque<Group> groups = new ArrayDeque<>();
    private int pos;

    private LambdaLexer(String input, DotScope dotScope) {
        this.input = input;
        this.dotScope = dotScope;
        this.pos = 0;
    }

    /**
     * Tokenize one line, closing dot groups at end of input.
     *
     * @return the token sequence, or the first {@link LexicalError} found
     */
    public static Result<List<LambdaToken>> tokenize(String input) {
        return tokenize(input, DotScope.GLOBAL_COUNT);
    }

    /**
     * Tokenize one line.
     *
     * @return the token sequence, or the first {@link LexicalError} found
     */
    public static Result<List<LambdaToken>> tokenize(String input, DotScope dotScope) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(dotScope, "dotScope");
        if (input.length() > MAX_INPUT_SIZE) {
            throw new IllegalArgumentException(
            "Input exceeds maximum size of " + MAX_INPUT_SIZE + " characters");
        }
        return new LambdaLexer(input, dotScope).tokenizeAll()
                                               .onFailure(cause -> logger.debug("Rejected '{}': {}",
                                                                                input,
                                                                                cause.message()));
    }

    /**
     * Join token symbols, e.g. {@code \_x_(_x_)} for {@code \x.x} with separator {@code _}.
     */
    public static String join(List<LambdaToken> tokens, String separator) {
        return tokens.stream()
                     .map(LambdaToken::symbol)
                     .collect(Collectors.joining(separator));
    }

    private Result<List<LambdaToken>> tokenizeAll() {
        while (!isAtEnd()) {
            char c = peek();
            if (Character.isWhitespace(c)) {
                pos++ ;
                continue;
            }
            if (!isValidSyntaxChar(c)) {
                return Result.failure(new LexicalError(Kind.INVALID_CHARACTER, pos, String.valueOf(c)));
            }
            var error = nextToken(c);
            if (error.isPresent()) {
                return Result.failure(error.get());
            }
        }
        if (!groups.isEmpty()) {
            return Result.failure(LexicalError.of(Kind.UNMATCHED_OPENING_BRACKET, groups.peekLast().offset));
        }
        closeDotGroups();
        if (tokens.isEmpty()) {
            return Result.failure(LexicalError.of(Kind.EMPTY_INPUT, 0));
        }
        var tooDeep = checkNesting();
        if (tooDeep.isPresent()) {
            return Result.failure(tooDeep.get());
        }
        return Result.success(List.copyOf(tokens));
    }

    private Optional<LexicalError> nextToken(char c) {
        if (isIdentifierStart(c)) {
            return scanVariable();
        }
        return switch (c) {
            case '(' -> scanOpenParen();
            case ')' -> scanCloseParen();
            case '\\' -> scanAbstraction();
            case '.' -> scanDot();
            default -> Optional.of(new LexicalError(Kind.INVALID_CHARACTER, pos, String.valueOf(c)));
        };
    }

    private Optional<LexicalError> scanVariable() {
        int start = pos;
        var name = scanName();
        if (!isValidVariableName(name)) {
            return Optional.of(new LexicalError(Kind.INVALID_VARIABLE_NAME, start, name));
        }
        tokens.add(new LambdaToken.Variable(start, name));
        return Optional.empty();
    }

    private Optional<LexicalError> scanOpenParen() {
        tokens.add(new LambdaToken.OpenParen(pos, false));
        groups.push(new Group(pos));
        pos++ ;
        if (!isAtEnd() && peek() == ')') {
            return Optional.of(LexicalError.of(Kind.EMPTY_PARENTHESES, pos));
        }
        return Optional.empty();
    }

    private Optional<LexicalError> scanCloseParen() {
        if (groups.isEmpty()) {
            return Optional.of(LexicalError.of(Kind.UNMATCHED_CLOSING_BRACKET, pos));
        }
        var group = groups.pop();
        if (dotScope == DotScope.ENCLOSING_GROUP) {
            for (int i = 0; i < group.dotOpens; i++) {
                tokens.add(new LambdaToken.CloseParen(pos, true));
            }
        }
        tokens.add(new LambdaToken.CloseParen(pos, false));
        pos++ ;
        return Optional.empty();
    }

    private Optional<LexicalError> scanAbstraction() {
        int backslash = pos;
        int next = pos + 1;
        if (next < input.length() && Character.isWhitespace(input.charAt(next))) {
            return Optional.of(LexicalError.of(Kind.SPACE_AFTER_BACKSLASH, backslash));
        }
        if (next >= input.length() || !isIdentifierStart(input.charAt(next))) {
            return Optional.of(LexicalError.of(Kind.BACKSLASH_WITHOUT_NAME, backslash));
        }
        pos = next;
        var name = scanName();
        if (!isValidVariableName(name)) {
            return Optional.of(new LexicalError(Kind.INVALID_VARIABLE_NAME, next, name));
        }
        tokens.add(new LambdaToken.Backslash(backslash));
        tokens.add(new LambdaToken.Variable(next, name));
        // only the next character is checked, not that a whole body follows
        if (isAtEnd() || !(isValidSyntaxChar(peek()) || Character.isWhitespace(peek()))) {
            return Optional.of(LexicalError.of(Kind.MISSING_LAMBDA_BODY, backslash));
        }
        return Optional.empty();
    }

    private Optional<LexicalError> scanDot() {
        if (tokens.isEmpty()
            || !(tokens.get(tokens.size() - 1) instanceof LambdaToken.Variable)
            || pos == 0
            || !isIdentifierChar(input.charAt(pos - 1))) {
            return Optional.of(LexicalError.of(Kind.MISSING_VARIABLE_BEFORE_DOT, pos));
        }
        tokens.add(new LambdaToken.OpenParen(pos, true));
        if (!groups.isEmpty()) {
            groups.peek().dotOpens++ ;
        }
        pos++ ;
        if (isAtEnd() || peek() == ')') {
            return Optional.of(LexicalError.of(Kind.MISSING_EXPRESSION_AFTER_DOT, pos));
        }
        return Optional.empty();
    }

    private String scanName() {
        var sb = new StringBuilder(DEFAULT_NAME_CAPACITY);
        while (!isAtEnd() && isIdentifierChar(peek())) {
            sb.append(input.charAt(pos++ ));
        }
        return sb.toString();
    }

    /**
     * Append {@code )} until every {@code (}, virtual ones included, has a partner.
     */
    private void closeDotGroups() {
        long opens = tokens.stream()
                           .filter(LambdaToken.OpenParen.class::isInstance)
                           .count();
        long closes = tokens.stream()
                            .filter(LambdaToken.CloseParen.class::isInstance)
                            .count();
        for (long i = closes; i < opens; i++) {
            tokens.add(new LambdaToken.CloseParen(input.length(), true));
        }
    }

    /**
     * Reject token sequences nested deeper than {@link #MAX_NESTING_DEPTH}.
     * An abstraction body runs to the end of its enclosing group, so a {@code \} stays open until that group closes.
     */
    private Optional<LexicalError> checkNesting() {
        var enclosingLambdas = new ArrayDeque<Integer>();
        int lambdas = 0;
        int depth = 0;
        for (var token : tokens) {
            if (token instanceof LambdaToken.OpenParen) {
                enclosingLambdas.push(lambdas);
                lambdas = 0;
                depth++ ;
            } else if (token instanceof LambdaToken.Backslash) {
                lambdas++ ;
                depth++ ;
            } else if (token instanceof LambdaToken.CloseParen && !enclosingLambdas.isEmpty()) {
                depth -= lambdas + 1;
                lambdas = enclosingLambdas.pop();
            }
            if (depth > MAX_NESTING_DEPTH) {
                return Optional.of(LexicalError.of(Kind.NESTING_TOO_DEEP, token.offset()));
            }
        }
        return Optional.empty();
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private static final class Group {
        private final int offset;
        private int dotOpens;

        private Group(int offset) {
            this.offset = offset;
        }
    }
}
