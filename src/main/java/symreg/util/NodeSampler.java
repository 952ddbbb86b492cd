package symreg.util;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Random;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;

/**
 * Uniform random selection of nodes matching a filter, done as a single
 * reservoir-sampling walk so no candidate list is built.
 */
public final class NodeSampler {

    private NodeSampler() {
    }

    public static ExprNode sample(ExprNode tree, Random random) {
        return sample(tree, node -> true, random);
    }

    /**
     * Picks one node among those matching {@code filter}, each with equal
     * probability.
     *
     * @throws EmptySelectionException if no node matches
     */
    public static ExprNode sample(ExprNode tree, Predicate<ExprNode> filter, Random random) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(random, "random");

        ExprNode chosen = null;
        int seen = 0;
        Deque<ExprNode> stack = new ArrayDeque<>();
        stack.push(tree);
        while (!stack.isEmpty()) {
            ExprNode node = stack.pop();
            if (filter.test(node)) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = node;
                }
            }
            if (node.degree() == 2) {
                stack.push(node.right());
            }
            if (node.degree() >= 1) {
                stack.push(node.left());
            }
        }
        if (chosen == null) {
            throw new EmptySelectionException("No node of the " + tree.countNodes()
                    + "-node tree matches the selection filter");
        }
        return chosen;
    }

    /**
     * Picks a node uniformly among all nodes of the tree, together with the
     * parent and slot that hold it. The root comes back with side
     * {@link Side#ROOT} and no parent.
     */
    public static NodeAndParent sampleWithParent(ExprNode tree, Random random) {
        Objects.requireNonNull(tree, "tree");
        Objects.requireNonNull(random, "random");

        NodeAndParent chosen = new NodeAndParent(tree, null, Side.ROOT);
        int seen = 1;
        Deque<ExprNode> stack = new ArrayDeque<>();
        stack.push(tree);
        while (!stack.isEmpty()) {
            ExprNode node = stack.pop();
            if (node.degree() >= 1) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = new NodeAndParent(node.left(), node, Side.LEFT);
                }
            }
            if (node.degree() == 2) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = new NodeAndParent(node.right(), node, Side.RIGHT);
                }
                stack.push(node.right());
            }
            if (node.degree() >= 1) {
                stack.push(node.left());
            }
        }
        return chosen;
    }

    /**
     * Graph counterpart of {@link #sample(ExprNode, Predicate, Random)} over
     * the distinct reachable nodes.
     *
     * @throws EmptySelectionException if no reachable node matches
     */
    public static int sample(ExpressionGraph graph, IntPredicate filter, Random random) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(random, "random");

        int chosen = ExpressionGraph.NONE;
        int seen = 0;
        int[] nodes = graph.reachable();
        for (int id : nodes) {
            if (filter.test(id)) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = id;
                }
            }
        }
        if (chosen == ExpressionGraph.NONE) {
            throw new EmptySelectionException("No node of the " + nodes.length
                    + "-node graph matches the selection filter");
        }
        return chosen;
    }

    /**
     * Picks uniformly among the root slot and every child slot of the
     * reachable nodes. A shared node is picked through one of its parents
     * with probability proportional to how many slots reference it.
     *
     * @throws EmptySelectionException if the graph has no root
     */
    public static GraphSlot sampleSlot(ExpressionGraph graph, Random random) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(random, "random");
        if (graph.root() == ExpressionGraph.NONE) {
            throw new EmptySelectionException("Graph has no root to select from");
        }

        GraphSlot chosen = new GraphSlot(graph.root(), ExpressionGraph.NONE, Side.ROOT);
        int seen = 1;
        for (int id : graph.reachable()) {
            int degree = graph.degree(id);
            if (degree >= 1) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = new GraphSlot(graph.left(id), id, Side.LEFT);
                }
            }
            if (degree == 2) {
                seen++;
                if (random.nextInt(seen) == 0) {
                    chosen = new GraphSlot(graph.right(id), id, Side.RIGHT);
                }
            }
        }
        return chosen;
    }
}
