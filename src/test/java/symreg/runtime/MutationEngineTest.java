package symreg.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import symreg.generation.RandomTreeGenerator;
import symreg.graph.GraphConnectionEngine;
import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;
import symreg.model.NodeType;
import symreg.model.TreeInvariants;
import symreg.mutators.MutationResult;
import symreg.mutators.MutationStatus;
import symreg.mutators.MutatorType;
import symreg.runtime.MutatorStats.Outcome;

final class MutationEngineTest {

    private static final int FEATURES = 3;

    @Test
    void everyMutatorKeepsInvariantsOnRandomTrees() {
        MutationOptions options = MutationOptions.builder().nodeType(NodeType.GRAPH).build();
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(80));
        MutationEngine engine = new MutationEngine(new Random(81));
        for (MutatorType type : MutatorType.values()) {
            for (int trial = 0; trial < 100; trial++) {
                ExprNode tree = generator.genRandomTreeFixedSize(1 + trial % 15, options, FEATURES);
                MutationResult result = engine.mutate(type, tree, options, FEATURES, 0.5);
                TreeInvariants.assertValid(result.tree(), options, FEATURES);
                if (!type.rebindsRoot() && result.status() == MutationStatus.SUCCESS) {
                    assertSame(tree, result.tree(), type + " must edit in place");
                }
            }
            assertEquals(100, engine.stats().total(type));
        }
    }

    @Test
    void connectionMutatorsNeedGraphPrograms() {
        MutationOptions options = MutationOptions.defaults();
        MutationEngine engine = new MutationEngine(new Random(82));
        ExprNode tree = new RandomTreeGenerator(new Random(83)).genRandomTreeFixedSize(9, options, FEATURES);
        ExprNode before = tree.copy();

        MutationResult formed = engine.mutate(MutatorType.FORM_CONNECTION, tree, options, FEATURES, 1.0);
        MutationResult broken = engine.mutate(MutatorType.BREAK_CONNECTION, tree, options, FEATURES, 1.0);

        assertEquals(MutationStatus.SKIPPED, formed.status());
        assertEquals(MutationStatus.SKIPPED, broken.status());
        TreeInvariants.assertSameShape(before, tree);
        assertEquals(1, engine.stats().count(MutatorType.FORM_CONNECTION, Outcome.SKIPPED));
    }

    @Test
    void inapplicableMutatorsAreCountedAsSkipped() {
        MutationOptions options = MutationOptions.defaults();
        MutationEngine engine = new MutationEngine(new Random(84));
        ExprNode leaf = ExprNode.feature(1);

        MutationResult result = engine.mutate(MutatorType.SWAP_OPERANDS, leaf, options, FEATURES, 1.0);

        assertEquals(MutationStatus.SKIPPED, result.status());
        assertSame(leaf, result.tree());
        assertEquals(1, engine.stats().count(MutatorType.SWAP_OPERANDS, Outcome.SKIPPED));
        assertEquals(0, engine.stats().count(MutatorType.SWAP_OPERANDS, Outcome.SUCCESS));
    }

    @Test
    void prependRebindsTheRoot() {
        MutationOptions options = MutationOptions.defaults();
        MutationEngine engine = new MutationEngine(new Random(85));
        ExprNode tree = ExprNode.feature(2);

        MutationResult result = engine.mutate(MutatorType.PREPEND_OP, tree, options, FEATURES, 1.0);

        assertNotSame(tree, result.tree());
        assertSame(tree, result.tree().left());
        assertEquals(1, engine.stats().count(MutatorType.PREPEND_OP, Outcome.SUCCESS));
    }

    @Test
    void sameSeedReproducesTheSameEdits() {
        MutationOptions options = MutationOptions.defaults();
        ExprNode first = runSequence(options, 1234L);
        ExprNode second = runSequence(options, 1234L);
        TreeInvariants.assertSameShape(first, second);
    }

    private static ExprNode runSequence(MutationOptions options, long seed) {
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(seed));
        MutationEngine engine = new MutationEngine(new Random(seed));
        ExprNode tree = generator.genRandomTreeFixedSize(10, options, FEATURES);
        MutatorType[] types = {
            MutatorType.MUTATE_CONSTANT, MutatorType.APPEND_OP, MutatorType.SWAP_OPERANDS,
            MutatorType.INSERT_OP, MutatorType.DELETE_OP, MutatorType.MUTATE_OPERATOR,
            MutatorType.SWAP_NODE_PAIR, MutatorType.PREPEND_OP
        };
        for (int round = 0; round < 5; round++) {
            for (MutatorType type : types) {
                tree = engine.mutate(type, tree, options, FEATURES, 0.3).tree();
            }
        }
        return tree;
    }

    @Test
    void contractViolationsSurfaceAndAreCounted() {
        MutationOptions binaryOnly = MutationOptions.builder()
                .operators(List.of(), List.of("+"))
                .build();
        MutationEngine engine = new MutationEngine(new Random(86));
        ExprNode tree = ExprNode.unary(1, ExprNode.feature(1));

        assertThrows(IllegalStateException.class,
                () -> engine.mutate(MutatorType.MUTATE_OPERATOR, tree, binaryOnly, FEATURES, 1.0));
        assertEquals(1, engine.stats().count(MutatorType.MUTATE_OPERATOR, Outcome.FAILED));
        assertEquals(1L, engine.stats().snapshot(Outcome.FAILED).get(MutatorType.MUTATE_OPERATOR));
    }

    @Test
    void everyMutatorKeepsGraphProgramsValid() {
        MutationOptions options = MutationOptions.defaults();
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(87));
        GraphConnectionEngine sharing = new GraphConnectionEngine(new Random(88));
        MutationEngine engine = new MutationEngine(new Random(89));
        for (MutatorType type : MutatorType.values()) {
            for (int trial = 0; trial < 100; trial++) {
                ExpressionGraph graph = generator.genRandomGraphFixedSize(1 + trial % 15, options, FEATURES);
                sharing.formRandomConnection(graph);
                sharing.formRandomConnection(graph);

                engine.mutate(type, graph, options, FEATURES, 0.5);

                assertFalse(graph.hasCycle(), type + " closed a cycle");
                TreeInvariants.assertValid(graph, options, FEATURES);
            }
            assertEquals(100, engine.stats().total(type));
        }
    }

    @Test
    void graphConnectionsFormRegardlessOfNodeTypeTag() {
        MutationOptions options = MutationOptions.defaults();
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(90));
        MutationEngine engine = new MutationEngine(new Random(91));
        for (int trial = 0; trial < 50; trial++) {
            ExpressionGraph graph = generator.genRandomGraphFixedSize(12, options, FEATURES);
            engine.mutate(MutatorType.FORM_CONNECTION, graph, options, FEATURES, 1.0);
            assertFalse(graph.hasCycle());
        }
        assertTrue(engine.stats().count(MutatorType.FORM_CONNECTION, Outcome.SUCCESS) > 0);
    }

    @Test
    void graphDeleteCanMoveTheRoot() {
        MutationOptions options = MutationOptions.defaults();
        MutationEngine engine = new MutationEngine(new Random(92));
        boolean moved = false;
        for (int trial = 0; trial < 100 && !moved; trial++) {
            ExpressionGraph graph = new ExpressionGraph();
            int x2 = graph.addFeature(2);
            graph.setRoot(graph.addUnary(1, x2));

            assertEquals(MutationStatus.SUCCESS,
                    engine.mutate(MutatorType.DELETE_OP, graph, options, FEATURES, 1.0));
            moved = graph.root() == x2;
        }
        assertTrue(moved);
    }

    @Test
    void rootlessGraphsAreSkipped() {
        MutationEngine engine = new MutationEngine(new Random(93));
        MutationStatus status = engine.mutate(MutatorType.BREAK_CONNECTION, new ExpressionGraph(),
                MutationOptions.defaults(), FEATURES, 1.0);

        assertEquals(MutationStatus.SKIPPED, status);
        assertEquals(1, engine.stats().count(MutatorType.BREAK_CONNECTION, Outcome.SKIPPED));
    }
}
