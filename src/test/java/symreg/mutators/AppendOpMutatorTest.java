package symreg.mutators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import symreg.generation.RandomTreeGenerator;
import symreg.model.ExprNode;
import symreg.model.TreeInvariants;
import symreg.runtime.MutationOptions;

final class AppendOpMutatorTest {

    private static final int FEATURES = 3;
    private final MutationOptions options = MutationOptions.defaults();

    @Test
    void forcedBinaryOnSingleLeafYieldsThreeNodes() {
        ExprNode tree = ExprNode.constant(1.0);

        MutationResult result = new AppendOpMutator(new Random(4), true)
                .mutate(new MutationContext(tree, options, FEATURES));

        ExprNode grown = result.tree();
        assertSame(tree, grown);
        assertEquals(3, grown.countNodes());
        assertEquals(2, grown.degree());
        assertTrue(grown.left().isLeaf());
        assertTrue(grown.right().isLeaf());
        TreeInvariants.assertValid(grown, options, FEATURES);
    }

    @Test
    void forcedArityFixesGrowth() {
        RandomTreeGenerator generator = new RandomTreeGenerator(new Random(10));
        Random random = new Random(11);
        for (int trial = 0; trial < 200; trial++) {
            ExprNode tree = generator.genRandomTreeFixedSize(1 + trial % 12, options, FEATURES);
            int before = tree.countNodes();

            new AppendOpMutator(random, true).appendRandomOp(tree, options, FEATURES, true);
            assertEquals(before + 2, tree.countNodes());

            new AppendOpMutator(random, false).appendRandomOp(tree, options, FEATURES, false);
            assertEquals(before + 3, tree.countNodes());
            TreeInvariants.assertValid(tree, options, FEATURES);
        }
    }

    @Test
    void weightedArityFollowsOperatorCounts() {
        MutationOptions unaryOnly = MutationOptions.builder()
                .operators(List.of("sin"), List.of())
                .build();
        AppendOpMutator mutator = new AppendOpMutator(new Random(5));
        ExprNode tree = ExprNode.feature(1);
        for (int i = 0; i < 20; i++) {
            tree = mutator.appendRandomOp(tree, unaryOnly, FEATURES);
        }
        assertEquals(21, tree.countNodes());
        assertEquals(21, tree.depth());
    }

    @Test
    void forcedArityWithoutOperatorsIsNotApplicable() {
        MutationOptions unaryOnly = MutationOptions.builder()
                .operators(List.of("sin"), List.of())
                .build();
        ExprNode tree = ExprNode.feature(1);
        MutationContext ctx = new MutationContext(tree, unaryOnly, FEATURES);
        AppendOpMutator mutator = new AppendOpMutator(new Random(6), true);

        assertFalse(mutator.isApplicable(ctx));
        assertEquals(MutationStatus.SKIPPED, mutator.mutate(ctx).status());
        assertEquals(1, tree.countNodes());
    }
}
