package symreg.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Random;

import org.junit.jupiter.api.Test;

import symreg.generation.RandomTreeGenerator;
import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;
import symreg.model.NodeType;
import symreg.runtime.MutationOptions;

final class GraphConnectionEngineTest {

    private static final int FEATURES = 3;
    private final MutationOptions options = MutationOptions.builder().nodeType(NodeType.GRAPH).build();

    /** Walks from the root, failing if any node is re-entered while on the current path. */
    private static void assertTraversalTerminates(ExpressionGraph graph) {
        assertFalse(graph.hasCycle());
        int[] reachable = graph.reachable();
        boolean[] seen = new boolean[graph.arenaSize()];
        for (int id : reachable) {
            assertFalse(seen[id], "node " + id + " visited twice");
            seen[id] = true;
        }
    }

    @Test
    void repeatedOrderedConnectionsStayAcyclic() {
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(70));
        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(71));
        ExpressionGraph graph = generator.genRandomGraphFixedSize(25, options, FEATURES);
        int formed = 0;
        for (int trial = 0; trial < 1_000; trial++) {
            if (engine.formRandomConnection(graph)) {
                formed++;
            }
            assertTraversalTerminates(graph);
            if (graph.countNodes() < 3) {
                graph = generator.genRandomGraphFixedSize(25, options, FEATURES);
            }
        }
        assertTrue(formed > 0);
    }

    @Test
    void orderedConnectionsOnFreshGraphsStayAcyclic() {
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(72));
        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(73));
        for (int trial = 0; trial < 1_000; trial++) {
            ExpressionGraph graph = generator.genRandomGraphFixedSize(3 + trial % 20, options, FEATURES);
            engine.formRandomConnection(graph);
            engine.formRandomConnection(graph);
            assertTraversalTerminates(graph);
        }
    }

    @Test
    void tinyGraphsAreLeftAlone() {
        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(74));
        ExpressionGraph graph = new ExpressionGraph();
        int leaf = graph.addFeature(1);
        graph.setRoot(graph.addUnary(1, leaf));

        assertFalse(engine.formRandomConnection(graph));
        assertFalse(engine.formRandomConnectionByTrial(graph));
        assertEquals(2, graph.countNodes());
        assertEquals(leaf, graph.left(graph.root()));
    }

    @Test
    void trialConnectionsStayAcyclic() {
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(75));
        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(76));
        int formed = 0;
        for (int trial = 0; trial < 500; trial++) {
            ExpressionGraph graph = generator.genRandomGraphFixedSize(5 + trial % 10, options, FEATURES);
            for (int step = 0; step < 3; step++) {
                if (engine.formRandomConnectionByTrial(graph)) {
                    formed++;
                }
                assertTraversalTerminates(graph);
            }
        }
        assertTrue(formed > 0);
    }

    @Test
    void breakingKeepsTheExpressionIntact() {
        ExpressionGraph graph = new ExpressionGraph();
        int x = graph.addFeature(1);
        int shared = graph.addUnary(2, x);
        graph.setRoot(graph.addUnary(1, shared));
        ExprNode before = graph.toTree();

        assertTrue(new GraphConnectionEngine(new Random(77)).breakRandomConnection(graph));

        assertTraversalTerminates(graph);
        assertEquals(3, graph.countNodes());
        assertTrue(before.structurallyEquals(graph.toTree()));
    }

    @Test
    void breakingRemovesSharing() {
        ExpressionGraph graph = new ExpressionGraph();
        int x = graph.addFeature(1);
        int shared = graph.addUnary(2, x);
        int root = graph.addBinary(1, shared, shared);
        graph.setRoot(root);
        ExprNode before = graph.toTree();
        assertEquals(3, graph.countNodes());

        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(78));
        boolean broke = false;
        for (int trial = 0; trial < 40 && !broke; trial++) {
            assertTrue(engine.breakRandomConnection(graph));
            broke = graph.left(root) != graph.right(root);
        }

        assertTrue(broke);
        assertEquals(5, graph.countNodes());
        assertEquals(0, graph.parentCount(root));
        assertTrue(before.structurallyEquals(graph.toTree()));
        assertTraversalTerminates(graph);
    }

    @Test
    void breakingSingleLeafDoesNothing() {
        ExpressionGraph graph = new ExpressionGraph();
        graph.setRoot(graph.addConstant(3.0));
        assertFalse(new GraphConnectionEngine(new Random(79)).breakRandomConnection(graph));
        assertEquals(1, graph.arenaSize());
    }

    @Test
    void breakingRootlessGraphDoesNothing() {
        ExpressionGraph graph = new ExpressionGraph();
        GraphConnectionEngine engine = new GraphConnectionEngine(new Random(90));
        assertFalse(engine.breakRandomConnection(graph));
        assertFalse(engine.formRandomConnection(graph));
        assertEquals(0, graph.arenaSize());
    }
}
