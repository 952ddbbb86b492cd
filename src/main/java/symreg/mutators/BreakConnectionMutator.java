package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeSampler;

/**
 * Replaces one child reference of a random operator node with a private
 * copy of that child, so the edge no longer shares the node with other
 * parents. Other parents keep the original.
 */
public class BreakConnectionMutator implements Mutator {
    private final Random random;

    public BreakConnectionMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "Single leaf has no connections");
        }
        ExprNode parent = NodeSampler.sample(tree, t -> t.degree() != 0, random);
        if (parent.degree() == 1 || random.nextBoolean()) {
            parent.setLeft(parent.left().copy());
        } else {
            parent.setRight(parent.right().copy());
        }
        return MutationResult.success(tree);
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().degree() != 0;
    }
}
