package symreg.graph;

import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import symreg.model.ExpressionGraph;
import symreg.util.LoggingConfig;
import symreg.util.NodeSampler;

/**
 * Adds and removes sharing edges in graph programs. All methods edit the
 * graph in place and report whether anything changed; the root id never
 * changes.
 */
public final class GraphConnectionEngine {
    private static final Logger LOGGER = LoggingConfig.getLogger(GraphConnectionEngine.class);

    static final int MIN_ORDERED_NODES = 3;
    static final int MIN_TRIAL_NODES = 5;
    static final int MAX_ATTEMPTS = 10;

    private final Random random;

    public GraphConnectionEngine(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Points a child slot of a node at some node placed earlier in a random
     * topological order. Such a node can never reach its new parent, so no
     * cycle can form. Nothing happens when fewer than three nodes are
     * reachable or when the drawn parent is a leaf.
     */
    public boolean formRandomConnection(ExpressionGraph graph) {
        int[] order = graph.randomizedTopologicalSort(random);
        if (order.length < MIN_ORDERED_NODES) {
            return false;
        }
        int parentIndex = 1 + random.nextInt(order.length - 1);
        int childIndex = random.nextInt(parentIndex);
        int parent = order[parentIndex];
        int child = order[childIndex];

        if (graph.degree(parent) == 0) {
            LOGGER.log(Level.FINER, "Drawn parent {0} is a leaf; no connection formed", parent);
            return false;
        }
        install(graph, parent, child);
        return true;
    }

    /**
     * Same effect as {@link #formRandomConnection} but samples endpoint pairs
     * and rejects those where the child already reaches the parent. Gives up
     * after {@link #MAX_ATTEMPTS} rejections.
     */
    public boolean formRandomConnectionByTrial(ExpressionGraph graph) {
        if (graph.countNodes() < MIN_TRIAL_NODES) {
            return false;
        }
        int root = graph.root();
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            int parent = NodeSampler.sample(graph, id -> graph.degree(id) != 0, random);
            int child = NodeSampler.sample(graph, id -> id != root, random);
            if (graph.reaches(child, parent)) {
                continue;
            }
            install(graph, parent, child);
            return true;
        }
        LOGGER.log(Level.FINE, "No loop-free connection found after {0} attempts", MAX_ATTEMPTS);
        return false;
    }

    /**
     * Gives one child slot of a random operator node its own copy of the
     * child subgraph. The original child stays in place for its other
     * parents.
     */
    public boolean breakRandomConnection(ExpressionGraph graph) {
        if (graph.root() == ExpressionGraph.NONE || graph.degree(graph.root()) == 0) {
            return false;
        }
        int parent = NodeSampler.sample(graph, id -> graph.degree(id) != 0, random);
        if (graph.degree(parent) == 1 || random.nextBoolean()) {
            graph.setLeft(parent, graph.copySubtree(graph.left(parent)));
        } else {
            graph.setRight(parent, graph.copySubtree(graph.right(parent)));
        }
        return true;
    }

    private void install(ExpressionGraph graph, int parent, int child) {
        if (graph.degree(parent) == 1 || random.nextBoolean()) {
            graph.setLeft(parent, child);
        } else {
            graph.setRight(parent, child);
        }
    }
}
