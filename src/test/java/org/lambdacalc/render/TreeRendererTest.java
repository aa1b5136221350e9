package org.lambdacalc.render;

import org.junit.jupiter.api.Test;
import org.lambdacalc.tree.LambdaNode;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.lambdacalc.tree.LambdaNode.abstraction;
import static org.lambdacalc.tree.LambdaNode.application;
import static org.lambdacalc.tree.LambdaNode.grouped;
import static org.lambdacalc.tree.LambdaNode.variable;

class TreeRendererTest {

    private final TreeRenderer renderer = TreeRenderer.create();

    @Test
    void render_variable_isItsName() {
        assertEquals("x1", renderer.render(variable("x1")));
    }

    @Test
    void render_application_joinsWithSeparator() {
        var tree = application(application(variable("x"), variable("y")), variable("z"));

        assertEquals("x_y_z", renderer.render(tree));
    }

    @Test
    void render_abstraction_wrapsBody() {
        assertEquals("\\_x_((x))", renderer.render(abstraction("x", grouped(variable("x")))));
        assertEquals("\\_f_(f_x)", renderer.render(abstraction("f", application(variable("f"), variable("x")))));
    }

    @Test
    void render_grouped_addsParens() {
        assertEquals("(x_y)_z",
                     renderer.render(application(grouped(application(variable("x"), variable("y"))), variable("z"))));
    }

    @Test
    void render_customConfig_usesSeparatorAndBareBody() {
        var custom = TreeRenderer.create(new RenderConfig(" ", "  ", false));

        assertEquals("\\ x (x y)", custom.render(abstraction("x", grouped(application(variable("x"), variable("y"))))));
    }

    @Test
    void trace_application_indentsChildren() {
        var tree = application(variable("x"), variable("y"));

        assertEquals("x_y\n----x\n----y\n", renderer.trace(tree));
    }

    @Test
    void trace_abstraction_includesMarkers() {
        var tree = abstraction("x", grouped(variable("x")));

        var expected = """
            \\_x_((x))
            ----\\
            ----x
            ----(x)
            --------(
            --------x
            --------)
            """;
        assertEquals(expected, renderer.trace(tree));
    }

    @Test
    void printTree_startsAtGivenDepth() {
        var buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        renderer.printTree(grouped(variable("y")), 1, out);

        assertEquals("----(y)\n--------(\n--------y\n--------)\n", buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void renderConfig_nullSeparator_rejected() {
        assertThrows(NullPointerException.class, () -> new RenderConfig(null, "-", true));
    }

    @Test
    void render_longApplicationChain_doesNotRecursePerTerm() {
        LambdaNode tree = variable("x");
        for (int i = 0; i < 50_000; i++) {
            tree = application(tree, variable("x"));
        }

        assertEquals("x" + "_x".repeat(50_000), renderer.render(tree));
    }

    @Test
    void trace_applicationChain_listsFunctionBeforeArgument() {
        var tree = application(application(variable("f"), variable("x")), grouped(variable("y")));

        assertEquals("f_x_(y)\n----f_x\n--------f\n--------x\n----(y)\n--------(\n--------y\n--------)\n",
                     renderer.trace(tree));
    }
}
