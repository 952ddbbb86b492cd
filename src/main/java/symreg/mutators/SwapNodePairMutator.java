package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeSampler;

/**
 * Exchanges the contents of two distinct nodes picked uniformly from the
 * tree. When one node lies below the other, the outer position ends up
 * holding the inner subtree and the inner one drops out with the old
 * outer contents.
 */
public class SwapNodePairMutator implements Mutator {
    private final Random random;

    public SwapNodePairMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "Tree has fewer than two nodes");
        }
        ExprNode first = NodeSampler.sample(tree, random);
        ExprNode second = NodeSampler.sample(tree, node -> node != first, random);

        ExprNode firstContents = first.copy();
        first.setFrom(second.copy());
        second.setFrom(firstContents);
        return MutationResult.success(tree);
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().degree() != 0;
    }
}
