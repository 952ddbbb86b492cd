package symreg.util;

import symreg.model.ExprNode;

/**
 * A selected node with the parent holding it. {@code parent} is null when
 * {@code side} is {@link Side#ROOT}.
 */
public record NodeAndParent(ExprNode node, ExprNode parent, Side side) {

    public boolean isRoot() {
        return side == Side.ROOT;
    }

    /** Points the parent's slot (or nothing, for the root) at {@code replacement}. */
    public void replaceInParent(ExprNode replacement) {
        switch (side) {
            case LEFT -> parent.setLeft(replacement);
            case RIGHT -> parent.setRight(replacement);
            case ROOT -> throw new IllegalStateException("Root has no parent slot; rebind the tree handle instead");
        }
    }
}
