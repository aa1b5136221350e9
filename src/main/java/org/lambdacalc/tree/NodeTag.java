package org.lambdacalc.tree;

/**
 * Kind of a {@link LambdaNode}. Shared by the parser and the renderer.
 */
public enum NodeTag {
    VARIABLE(0),
    MARKER(0),
    APPLICATION(2),
    ABSTRACTION(3),
    GROUPED(3);

    private final int arity;

    NodeTag(int arity) {
        this.arity = arity;
    }

    /**
     * Number of children a node with this tag always has.
     */
    public int arity() {
        return arity;
    }

    public boolean isLeaf() {
        return arity == 0;
    }
}
