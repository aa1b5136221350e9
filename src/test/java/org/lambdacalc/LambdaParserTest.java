package org.lambdacalc;

import org.junit.jupiter.api.Test;
import org.lambdacalc.error.LambdaError;
import org.lambdacalc.error.LambdaError.LexicalError;
import org.lambdacalc.error.LambdaError.LexicalError.Kind;
import org.lambdacalc.lexer.DotScope;
import org.lambdacalc.lexer.LambdaLexer;
import org.lambdacalc.lexer.LambdaToken;
import org.lambdacalc.tree.LambdaNode;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.lambdacalc.tree.LambdaNode.abstraction;
import static org.lambdacalc.tree.LambdaNode.application;
import static org.lambdacalc.tree.LambdaNode.grouped;
import static org.lambdacalc.tree.LambdaNode.variable;

/**
 * End-to-end tests: line in, tree and text out.
 */
class LambdaParserTest {

    private final LambdaParser parser = LambdaParser.create();

    private LexicalError lexicalRejection(String line) {
        var result = parser.parse(line);
        assertTrue(result.isFailure(), "expected rejection of '" + line + "'");
        return assertInstanceOf(LexicalError.class, result.cause());
    }

    // === Scenarios ===

    @Test
    void identityWithDot_parsesToAbstractionOverGroupedBody() {
        var tokens = parser.tokenize("\\x.x").unwrap();
        assertThat(tokens).extracting(LambdaToken::symbol)
                          .containsExactly("\\", "x", "(", "x", ")");

        var tree = parser.parse(tokens).unwrap();

        var abstraction = assertInstanceOf(LambdaNode.Abstraction.class, tree);
        assertEquals("x", abstraction.parameter().name());
        assertEquals(grouped(variable("x")), abstraction.body());
    }

    @Test
    void appliedIdentity_globalCount_keepsArgumentInsideDotGroup() {
        var tokens = parser.tokenize("(\\x.x)y").unwrap();
        assertEquals("(_\\_x_(_x_)_y_)", LambdaLexer.join(tokens, "_"));

        var tree = parser.parse(tokens).unwrap();

        var expected = grouped(abstraction("x", application(grouped(variable("x")), variable("y"))));
        assertEquals(expected, tree);
    }

    @Test
    void appliedIdentity_enclosingGroup_appliesGroupedAbstractionToArgument() {
        var enclosing = LambdaParser.builder()
                                    .dotScope(DotScope.ENCLOSING_GROUP)
                                    .build();

        var tree = enclosing.parse("(\\x.x)y").unwrap();

        var application = assertInstanceOf(LambdaNode.Application.class, tree);
        assertEquals(grouped(abstraction("x", grouped(variable("x")))), application.function());
        assertEquals(variable("y"), application.argument());
        assertEquals("(\\_x_((x)))_y", enclosing.render(tree));
    }

    @Test
    void termSequence_isLeftAssociative() {
        var tree = parser.parse("x y z").unwrap();

        assertEquals(application(application(variable("x"), variable("y")), variable("z")), tree);
    }

    @Test
    void unclosedParen_rejectedAsUnmatchedOpening() {
        var error = lexicalRejection("(x");

        assertEquals(Kind.UNMATCHED_OPENING_BRACKET, error.kind());
        assertEquals(0, error.offset());
    }

    @Test
    void spaceAfterBackslash_rejected() {
        var error = lexicalRejection("\\ x.x");

        assertEquals(Kind.SPACE_AFTER_BACKSLASH, error.kind());
        assertEquals(0, error.offset());
    }

    // === Boundaries ===

    @Test
    void boundaryInputs_rejected() {
        assertEquals(Kind.EMPTY_INPUT, lexicalRejection("").kind());
        assertEquals(Kind.UNMATCHED_OPENING_BRACKET, lexicalRejection("(").kind());
        assertEquals(Kind.UNMATCHED_CLOSING_BRACKET, lexicalRejection(")").kind());
        assertEquals(Kind.MISSING_LAMBDA_BODY, lexicalRejection("\\x").kind());
        assertEquals(Kind.EMPTY_PARENTHESES, lexicalRejection("()").kind());
    }

    @Test
    void rejection_isRepeatable() {
        for (var line : List.of("(x", "\\ x.x", "x y)", "a$b", "\\x.)")) {
            assertEquals(parser.parse(line).cause(), parser.parse(line).cause(), line);
        }
    }

    @Test
    void lexicallyValidButIncompleteBody_failsInParser() {
        var result = parser.parse("(\\x)");

        assertInstanceOf(LambdaError.StructuralError.class, result.cause());
    }

    // === Round trip ===

    @Test
    void parenthesizedInputs_matchManuallyBuiltTrees() {
        assertRoundTrip("(\\x (x y)) z",
                        application(grouped(abstraction("x", grouped(application(variable("x"), variable("y"))))),
                                    variable("z")),
                        "(\\_x_((x_y)))_z");
        assertRoundTrip("f (g x) y",
                        application(application(variable("f"), grouped(application(variable("g"), variable("x")))),
                                    variable("y")),
                        "f_(g_x)_y");
        assertRoundTrip("\\f \\x (f (f x))",
                        abstraction("f",
                                    abstraction("x",
                                                grouped(application(variable("f"),
                                                                    grouped(application(variable("f"),
                                                                                        variable("x"))))))),
                        "\\_f_(\\_x_((f_(f_x))))");
    }

    private void assertRoundTrip(String line, LambdaNode expected, String rendered) {
        var tree = parser.parse(line).unwrap();

        assertEquals(expected, tree, line);
        assertEquals(rendered, parser.render(tree), line);
        assertEquals(parser.render(expected), parser.render(tree), line);
    }

    // === Configuration ===

    @Test
    void builder_strictEnd_rejectsTrailingTokens() {
        var strict = LambdaParser.builder()
                                 .strictEnd(true)
                                 .build();
        var tokens = List.<LambdaToken>of(new LambdaToken.Variable(0, "x"),
                                          new LambdaToken.CloseParen(1, false),
                                          new LambdaToken.Variable(2, "y"));

        assertTrue(parser.parse(tokens).isSuccess());
        assertInstanceOf(LambdaError.TrailingTokens.class, strict.parse(tokens).cause());
    }

    @Test
    void builder_renderOptions_applyToRenderAndTrace() {
        var custom = LambdaParser.builder()
                                 .separator(" ")
                                 .indent("  ")
                                 .parenthesizeAbstractionBody(false)
                                 .build();

        var tree = custom.parse("\\x x y").unwrap();

        assertEquals("\\ x x y", custom.render(tree));
        assertThat(custom.trace(tree).lines()).containsExactly("\\ x x y", "  \\", "  x", "  x y", "    x", "    y");
    }

    @Test
    void printTree_writesTraceToStream() {
        var buffer = new ByteArrayOutputStream();
        var tree = parser.parse("x y").unwrap();

        parser.printTree(tree, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(parser.trace(tree), buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void builder_nullDotScope_rejected() {
        assertThrows(NullPointerException.class, () -> LambdaParser.builder()
                                                                   .dotScope(null)
                                                                   .build());
    }

    // === Deep input ===

    @Test
    void parse_deeplyNestedLines_rejectedWithoutStackOverflow() {
        var parens = "(".repeat(20_000) + "x" + ")".repeat(20_000);
        var dots = "a.".repeat(20_000) + "x";

        assertEquals(Kind.NESTING_TOO_DEEP, lexicalRejection(parens).kind());
        assertEquals(Kind.NESTING_TOO_DEEP, lexicalRejection(dots).kind());
    }

    @Test
    void parse_longFlatLine_parsesAndRenders() {
        var line = "x ".repeat(40_000).strip();

        var tree = parser.parse(line).unwrap();

        assertEquals("x" + "_x".repeat(39_999), parser.render(tree));
    }
}
