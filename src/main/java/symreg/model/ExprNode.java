package symreg.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Mutable node of an expression program.
 *
 * <p>A node of degree 0 is a leaf holding either a constant value or a
 * 1-based feature index. A node of degree 1 or 2 holds a 1-based operator
 * index and one or two children. Mutators edit nodes in place; callers own
 * the handle to the root.
 */
public final class ExprNode {

    private int degree;
    private boolean constant;
    private double value;
    private int feature;
    private int op;
    private ExprNode left;
    private ExprNode right;

    private ExprNode() {
    }

    public static ExprNode constant(double value) {
        ExprNode node = new ExprNode();
        node.constant = true;
        node.value = value;
        return node;
    }

    public static ExprNode feature(int feature) {
        if (feature < 1) {
            throw new IllegalArgumentException("Feature index must be >= 1 but was " + feature);
        }
        ExprNode node = new ExprNode();
        node.feature = feature;
        return node;
    }

    public static ExprNode unary(int op, ExprNode child) {
        requireOperator(op);
        ExprNode node = new ExprNode();
        node.degree = 1;
        node.op = op;
        node.left = Objects.requireNonNull(child, "child");
        return node;
    }

    public static ExprNode binary(int op, ExprNode left, ExprNode right) {
        requireOperator(op);
        ExprNode node = new ExprNode();
        node.degree = 2;
        node.op = op;
        node.left = Objects.requireNonNull(left, "left");
        node.right = Objects.requireNonNull(right, "right");
        return node;
    }

    public int degree() {
        return degree;
    }

    public boolean isLeaf() {
        return degree == 0;
    }

    public boolean isConstant() {
        return degree == 0 && constant;
    }

    public boolean isFeature() {
        return degree == 0 && !constant;
    }

    public double value() {
        if (!isConstant()) {
            throw new IllegalStateException("Node is not a constant leaf");
        }
        return value;
    }

    public void setValue(double value) {
        if (!isConstant()) {
            throw new IllegalStateException("Node is not a constant leaf");
        }
        this.value = value;
    }

    public int feature() {
        if (!isFeature()) {
            throw new IllegalStateException("Node is not a feature leaf");
        }
        return feature;
    }

    public int op() {
        if (degree == 0) {
            throw new IllegalStateException("Leaf nodes carry no operator");
        }
        return op;
    }

    public void setOp(int op) {
        if (degree == 0) {
            throw new IllegalStateException("Leaf nodes carry no operator");
        }
        requireOperator(op);
        this.op = op;
    }

    public ExprNode left() {
        return left;
    }

    public ExprNode right() {
        return right;
    }

    public void setLeft(ExprNode child) {
        if (degree < 1) {
            throw new IllegalStateException("Leaf nodes have no left child");
        }
        this.left = Objects.requireNonNull(child, "child");
    }

    public void setRight(ExprNode child) {
        if (degree < 2) {
            throw new IllegalStateException("Only binary nodes have a right child");
        }
        this.right = Objects.requireNonNull(child, "child");
    }

    /**
     * Overwrites this node with the contents of {@code other}, keeping this
     * node's position in its parent. Children are shared, not copied.
     */
    public void setFrom(ExprNode other) {
        Objects.requireNonNull(other, "other");
        this.degree = other.degree;
        this.constant = other.constant;
        this.value = other.value;
        this.feature = other.feature;
        this.op = other.op;
        this.left = other.left;
        this.right = other.right;
    }

    /** Deep copy. Shared references below this node are duplicated. */
    public ExprNode copy() {
        ExprNode node = new ExprNode();
        node.degree = degree;
        node.constant = constant;
        node.value = value;
        node.feature = feature;
        node.op = op;
        if (degree >= 1) {
            node.left = left.copy();
        }
        if (degree == 2) {
            node.right = right.copy();
        }
        return node;
    }

    /** Number of nodes visited by a walk from here; shared nodes count once per reference. */
    public int countNodes() {
        int[] count = {0};
        forEach(node -> count[0]++);
        return count[0];
    }

    public int depth() {
        return switch (degree) {
            case 0 -> 1;
            case 1 -> 1 + left.depth();
            default -> 1 + Math.max(left.depth(), right.depth());
        };
    }

    public boolean hasConstants() {
        return anyMatch(ExprNode::isConstant);
    }

    public boolean hasOperators() {
        return degree != 0;
    }

    public boolean anyMatch(Predicate<ExprNode> predicate) {
        Deque<ExprNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ExprNode node = stack.pop();
            if (predicate.test(node)) {
                return true;
            }
            pushChildren(stack, node);
        }
        return false;
    }

    /** Pre-order walk, left before right. */
    public void forEach(Consumer<ExprNode> action) {
        Deque<ExprNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            ExprNode node = stack.pop();
            action.accept(node);
            pushChildren(stack, node);
        }
    }

    private static void pushChildren(Deque<ExprNode> stack, ExprNode node) {
        if (node.degree == 2) {
            stack.push(node.right);
        }
        if (node.degree >= 1) {
            stack.push(node.left);
        }
    }

    public boolean structurallyEquals(ExprNode other) {
        if (other == null || degree != other.degree) {
            return false;
        }
        return switch (degree) {
            case 0 -> constant == other.constant
                    && (constant
                            ? Double.compare(value, other.value) == 0
                            : feature == other.feature);
            case 1 -> op == other.op && left.structurallyEquals(other.left);
            default -> op == other.op
                    && left.structurallyEquals(other.left)
                    && right.structurallyEquals(other.right);
        };
    }

    public String toString(OperatorSet operators) {
        StringBuilder sb = new StringBuilder();
        render(sb, operators);
        return sb.toString();
    }

    private void render(StringBuilder sb, OperatorSet operators) {
        switch (degree) {
            case 0 -> {
                if (constant) {
                    sb.append(String.format(Locale.ROOT, "%s", value));
                } else {
                    sb.append('x').append(feature);
                }
            }
            case 1 -> {
                sb.append(operators.unaryName(op)).append('(');
                left.render(sb, operators);
                sb.append(')');
            }
            default -> {
                sb.append('(');
                left.render(sb, operators);
                sb.append(' ').append(operators.binaryName(op)).append(' ');
                right.render(sb, operators);
                sb.append(')');
            }
        }
    }

    @Override
    public String toString() {
        return toString(OperatorSet.DEFAULT);
    }

    private static void requireOperator(int op) {
        if (op < 1) {
            throw new IllegalArgumentException("Operator index must be >= 1 but was " + op);
        }
    }
}
