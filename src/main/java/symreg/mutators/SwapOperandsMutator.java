package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeSampler;

/** Swaps left and right child of a random binary node, e.g. for pow and divide. */
public class SwapOperandsMutator implements Mutator {
    private final Random random;

    public SwapOperandsMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "No binary node to swap operands of");
        }
        ExprNode node = NodeSampler.sample(tree, t -> t.degree() == 2, random);
        ExprNode left = node.left();
        node.setLeft(node.right());
        node.setRight(left);
        return MutationResult.success(tree);
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().anyMatch(node -> node.degree() == 2);
    }
}
