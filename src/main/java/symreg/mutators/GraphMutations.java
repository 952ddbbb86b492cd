package symreg.mutators;

import java.util.Objects;
import java.util.Random;

import symreg.model.ExpressionGraph;
import symreg.runtime.MutationOptions;
import symreg.util.GraphSlot;
import symreg.util.NodeSampler;

/**
 * Point, growth and delete edits on graph programs. Nodes are edited in
 * place, so every parent of a shared node sees the change. Each method
 * returns whether the graph changed; prepend and delete may move the root.
 * New nodes are appended to the arena, and replaced ones stay there until
 * {@link ExpressionGraph#compact()}.
 */
public final class GraphMutations {

    private final Random random;

    public GraphMutations(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Exchanges private copies of the contents of two distinct nodes. */
    public boolean swapNodePair(ExpressionGraph graph) {
        if (graph.degree(graph.root()) == 0) {
            return false;
        }
        int first = NodeSampler.sample(graph, id -> true, random);
        int second = NodeSampler.sample(graph, id -> id != first, random);

        int firstContents = graph.copySubtree(first);
        int secondContents = graph.copySubtree(second);
        graph.setFrom(first, secondContents);
        graph.setFrom(second, firstContents);
        return true;
    }

    public boolean swapOperands(ExpressionGraph graph) {
        if (!any(graph, 2)) {
            return false;
        }
        int node = NodeSampler.sample(graph, id -> graph.degree(id) == 2, random);
        int left = graph.left(node);
        graph.setLeft(node, graph.right(node));
        graph.setRight(node, left);
        return true;
    }

    public boolean mutateOperator(ExpressionGraph graph, MutationOptions options) {
        if (graph.degree(graph.root()) == 0) {
            return false;
        }
        int node = NodeSampler.sample(graph, id -> graph.degree(id) != 0, random);
        graph.setOp(node, OperatorPicker.randomOperator(options, graph.degree(node), random));
        return true;
    }

    public boolean mutateConstant(ExpressionGraph graph, MutationOptions options, double temperature) {
        if (!graph.hasConstants()) {
            return false;
        }
        int node = NodeSampler.sample(graph, graph::isConstant, random);
        graph.setValue(node, ConstantMutator.perturb(graph.value(node), temperature, options, random));
        return true;
    }

    /**
     * Turns a random leaf into an operator node over fresh leaves.
     *
     * @param makeBinary fixed arity, or {@code null} to draw it weighted by operator counts
     */
    public boolean appendRandomOp(ExpressionGraph graph, MutationOptions options, int featureCount,
                                  Boolean makeBinary) {
        int leaf = NodeSampler.sample(graph, id -> graph.degree(id) == 0, random);
        boolean binary = makeBinary != null ? makeBinary : OperatorPicker.chooseBinary(options, random);
        int firstChild = LeafFactory.makeLeaf(graph, featureCount, random);
        graph.setFrom(leaf, OperatorPicker.newOperatorNode(graph, binary, firstChild, options, featureCount, random));
        return true;
    }

    /** Pushes a random node one level down under a new operator node. */
    public boolean insertRandomOp(ExpressionGraph graph, MutationOptions options, int featureCount) {
        int node = NodeSampler.sample(graph, id -> true, random);
        boolean binary = OperatorPicker.chooseBinary(options, random);
        int displaced = graph.copyNode(node);
        graph.setFrom(node, OperatorPicker.newOperatorNode(graph, binary, displaced, options, featureCount, random));
        return true;
    }

    public boolean prependRandomOp(ExpressionGraph graph, MutationOptions options, int featureCount) {
        boolean binary = OperatorPicker.chooseBinary(options, random);
        graph.setRoot(OperatorPicker.newOperatorNode(graph, binary, graph.root(), options, featureCount, random));
        return true;
    }

    /**
     * Re-rolls a random leaf in place, or points one slot holding an
     * operator node at one of that node's children. Other parents of the
     * spliced node keep it.
     */
    public boolean deleteRandomOp(ExpressionGraph graph, int featureCount) {
        GraphSlot slot = NodeSampler.sampleSlot(graph, random);
        int node = slot.node();
        int promoted;
        switch (graph.degree(node)) {
            case 0 -> {
                graph.setFrom(node, LeafFactory.makeLeaf(graph, featureCount, random));
                return true;
            }
            case 1 -> promoted = graph.left(node);
            default -> promoted = random.nextBoolean() ? graph.left(node) : graph.right(node);
        }
        slot.replace(graph, promoted);
        return true;
    }

    private static boolean any(ExpressionGraph graph, int degree) {
        for (int id : graph.reachable()) {
            if (graph.degree(id) == degree) {
                return true;
            }
        }
        return false;
    }
}
