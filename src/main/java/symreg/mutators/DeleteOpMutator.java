package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeAndParent;
import symreg.util.NodeSampler;

/**
 * Splices a random node out of the tree. A leaf is re-rolled in place; an
 * operator node is replaced by one of its children (the only one, or a
 * 50/50 pick), discarding the other branch. Removing the root of an
 * operator tree returns the promoted child as the new root.
 */
public class DeleteOpMutator implements Mutator {
    private final Random random;

    public DeleteOpMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        return MutationResult.success(deleteRandomOp(ctx.tree(), ctx.featureCount()));
    }

    public ExprNode deleteRandomOp(ExprNode tree, int featureCount) {
        NodeAndParent selected = NodeSampler.sampleWithParent(tree, random);
        return delete(tree, selected, featureCount);
    }

    ExprNode delete(ExprNode tree, NodeAndParent selected, int featureCount) {
        ExprNode node = selected.node();
        ExprNode promoted;
        switch (node.degree()) {
            case 0 -> {
                node.setFrom(LeafFactory.makeLeaf(featureCount, random));
                return tree;
            }
            case 1 -> promoted = node.left();
            default -> promoted = random.nextBoolean() ? node.left() : node.right();
        }
        if (selected.isRoot()) {
            return promoted;
        }
        selected.replaceInParent(promoted);
        return tree;
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return true;
    }
}
