package symreg.util;

import symreg.model.ExpressionGraph;

/**
 * A selected edge of a graph program: the node, the parent whose slot holds
 * it and which slot. {@code parent} is {@link ExpressionGraph#NONE} for the
 * root.
 */
public record GraphSlot(int node, int parent, Side side) {

    public boolean isRoot() {
        return side == Side.ROOT;
    }

    /** Points this slot at {@code replacement}, moving the root if this is the root slot. */
    public void replace(ExpressionGraph graph, int replacement) {
        switch (side) {
            case LEFT -> graph.setLeft(parent, replacement);
            case RIGHT -> graph.setRight(parent, replacement);
            case ROOT -> graph.setRoot(replacement);
        }
    }
}
