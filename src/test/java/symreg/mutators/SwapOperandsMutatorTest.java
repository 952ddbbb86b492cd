package symreg.mutators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.Random;

import org.junit.jupiter.api.Test;

import symreg.model.ExprNode;
import symreg.model.TreeInvariants;
import symreg.runtime.MutationOptions;

final class SwapOperandsMutatorTest {

    private final MutationOptions options = MutationOptions.defaults();

    @Test
    void swapsChildrenOfTheOnlyBinaryNode() {
        ExprNode x1 = ExprNode.feature(1);
        ExprNode two = ExprNode.constant(2.0);
        ExprNode tree = ExprNode.binary(4, x1, two);

        MutationResult result = new SwapOperandsMutator(new Random(1))
                .mutate(new MutationContext(tree, options, 1));

        assertEquals(MutationStatus.SUCCESS, result.status());
        assertSame(tree, result.tree());
        assertSame(two, tree.left());
        assertSame(x1, tree.right());
        assertEquals(4, tree.op());
        assertEquals(2, tree.degree());
        assertEquals("(2.0 / x1)", tree.toString(options.operators()));
    }

    @Test
    void leavesTreesWithoutBinaryNodesUntouched() {
        ExprNode tree = ExprNode.unary(1, ExprNode.unary(2, ExprNode.feature(1)));
        ExprNode before = tree.copy();
        MutationContext ctx = new MutationContext(tree, options, 1);
        SwapOperandsMutator mutator = new SwapOperandsMutator(new Random(2));

        assertFalse(mutator.isApplicable(ctx));
        MutationResult result = mutator.mutate(ctx);

        assertEquals(MutationStatus.SKIPPED, result.status());
        TreeInvariants.assertSameShape(before, result.tree());
    }
}
