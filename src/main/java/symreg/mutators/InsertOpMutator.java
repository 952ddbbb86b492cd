package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.runtime.MutationOptions;
import symreg.util.NodeSampler;

/**
 * Pushes a random subtree one level down under a new operator node; a
 * binary operator also gets a fresh leaf on its right. Edits in place, so
 * the root handle stays valid even when the root is chosen.
 */
public class InsertOpMutator implements Mutator {
    private final Random random;

    public InsertOpMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        return MutationResult.success(insertRandomOp(ctx.tree(), ctx.options(), ctx.featureCount()));
    }

    public ExprNode insertRandomOp(ExprNode tree, MutationOptions options, int featureCount) {
        ExprNode node = NodeSampler.sample(tree, random);
        boolean binary = OperatorPicker.chooseBinary(options, random);
        ExprNode displaced = node.copy();
        node.setFrom(OperatorPicker.newOperatorNode(binary, displaced, options, featureCount, random));
        return tree;
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return true;
    }
}
