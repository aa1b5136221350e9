package org.lambdacalc.render;

import org.lambdacalc.tree.LambdaNode;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.List;

/**
 * Turns parse trees back into text.
 *
 * <p>With the default configuration {@code \x.x} renders as {@code \_x_((x))} and traces as:
 * <pre>
 * \_x_((x))
 * ----\
 * ----x
 * ----(x)
 * --------(
 * --------x
 * --------)
 * </pre>
 */
public final class TreeRenderer {
    private final RenderConfig config;

    private TreeRenderer(RenderConfig config) {
        this.config = config;
    }

    public static TreeRenderer create() {
        return new TreeRenderer(RenderConfig.DEFAULT);
    }

    public static TreeRenderer create(RenderConfig config) {
        return new TreeRenderer(config);
    }

    /**
     * Canonical linear form of a node.
     */
    public String render(LambdaNode node) {
        return switch (node.tag()) {
            case VARIABLE -> ((LambdaNode.Variable) node).name();
            case MARKER -> ((LambdaNode.Marker) node).symbol();
            case APPLICATION -> renderApplication((LambdaNode.Application) node);
            case ABSTRACTION -> {
                var abstraction = (LambdaNode.Abstraction) node;
                var body = render(abstraction.body());
                yield "\\" + config.separator() + render(abstraction.parameter()) + config.separator()
                      + (config.parenthesizeAbstractionBody()
                         ? "(" + body + ")"
                         : body);
            }
            case GROUPED -> "(" + render(((LambdaNode.Grouped) node).inner()) + ")";
        };
    }

    /**
     * Indented dump of the tree: one line per node, children one level deeper than their parent.
     */
    public String trace(LambdaNode node) {
        var sb = new StringBuilder();
        appendTree(node, 0, sb);
        return sb.toString();
    }

    public void printTree(LambdaNode node, PrintStream out) {
        printTree(node, 0, out);
    }

    public void printTree(LambdaNode node, int depth, PrintStream out) {
        var sb = new StringBuilder();
        appendTree(node, depth, sb);
        out.print(sb);
    }

    // application chains nest one level per term, so they are walked without recursion
    private String renderApplication(LambdaNode.Application application) {
        var arguments = new ArrayDeque<LambdaNode>();
        LambdaNode head = application;
        while (head instanceof LambdaNode.Application app) {
            arguments.push(app.argument());
            head = app.function();
        }
        var sb = new StringBuilder(render(head));
        for (var argument : arguments) {
            sb.append(config.separator())
              .append(render(argument));
        }
        return sb.toString();
    }

    private void appendTree(LambdaNode root, int depth, StringBuilder sb) {
        var pending = new ArrayDeque<Pending>();
        pending.push(new Pending(root, depth));
        while (!pending.isEmpty()) {
            var next = pending.pop();
            sb.append(config.indent()
                            .repeat(next.depth()))
              .append(render(next.node()))
              .append("\n");
            List<LambdaNode> children = next.node()
                                            .children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(new Pending(children.get(i), next.depth() + 1));
            }
        }
    }

    private record Pending(LambdaNode node, int depth) {}
}
