package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.runtime.MutationOptions;

/**
 * Puts a new operator node on top of the tree. Returns the new root; the
 * argument becomes its left child, so callers must rebind their handle.
 */
public class PrependOpMutator implements Mutator {
    private final Random random;

    public PrependOpMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        return MutationResult.success(prependRandomOp(ctx.tree(), ctx.options(), ctx.featureCount()));
    }

    public ExprNode prependRandomOp(ExprNode tree, MutationOptions options, int featureCount) {
        boolean binary = OperatorPicker.chooseBinary(options, random);
        return OperatorPicker.newOperatorNode(binary, tree, options, featureCount, random);
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return true;
    }
}
