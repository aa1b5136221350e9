package org.lambdacalc.tree;

import java.util.List;
import java.util.Objects;

/**
 * Parse tree node for a lambda term.
 *
 * <p>Nodes are immutable and own their children exclusively. Punctuation is kept as
 * {@link Marker} leaves so a tree can be rendered back with its original grouping.
 */
public sealed interface LambdaNode {

    NodeTag tag();

    /**
     * Children in source order; empty for leaves.
     */
    List<LambdaNode> children();

    /**
     * Variable occurrence or bound variable: {@code x}, {@code f1}.
     */
    record Variable(String name) implements LambdaNode {
        public Variable {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public NodeTag tag() {
            return NodeTag.VARIABLE;
        }

        @Override
        public List<LambdaNode> children() {
            return List.of();
        }
    }

    /**
     * Literal punctuation kept for display: {@code \}, {@code (} or {@code )}.
     */
    record Marker(String symbol) implements LambdaNode {
        public static final Marker BACKSLASH = new Marker("\\");
        public static final Marker OPEN = new Marker("(");
        public static final Marker CLOSE = new Marker(")");

        public Marker {
            Objects.requireNonNull(symbol, "symbol");
        }

        @Override
        public NodeTag tag() {
            return NodeTag.MARKER;
        }

        @Override
        public List<LambdaNode> children() {
            return List.of();
        }
    }

    /**
     * Function application {@code function argument}.
     */
    record Application(LambdaNode function, LambdaNode argument) implements LambdaNode {
        public Application {
            Objects.requireNonNull(function, "function");
            Objects.requireNonNull(argument, "argument");
        }

        @Override
        public NodeTag tag() {
            return NodeTag.APPLICATION;
        }

        @Override
        public List<LambdaNode> children() {
            return List.of(function, argument);
        }
    }

    /**
     * Lambda abstraction {@code \parameter body}.
     */
    record Abstraction(Variable parameter, LambdaNode body) implements LambdaNode {
        public Abstraction {
            Objects.requireNonNull(parameter, "parameter");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public NodeTag tag() {
            return NodeTag.ABSTRACTION;
        }

        @Override
        public List<LambdaNode> children() {
            return List.of(Marker.BACKSLASH, parameter, body);
        }
    }

    /**
     * Explicitly parenthesized expression {@code (inner)}.
     */
    record Grouped(LambdaNode inner) implements LambdaNode {
        public Grouped {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public NodeTag tag() {
            return NodeTag.GROUPED;
        }

        @Override
        public List<LambdaNode> children() {
            return List.of(Marker.OPEN, inner, Marker.CLOSE);
        }
    }

    static Variable variable(String name) {
        return new Variable(name);
    }

    static Application application(LambdaNode function, LambdaNode argument) {
        return new Application(function, argument);
    }

    static Abstraction abstraction(String parameter, LambdaNode body) {
        return new Abstraction(new Variable(parameter), body);
    }

    static Grouped grouped(LambdaNode inner) {
        return new Grouped(inner);
    }
}
