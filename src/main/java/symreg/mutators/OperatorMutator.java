package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeSampler;

/**
 * Redraws the operator of a random operator node within its arity. The new
 * index may equal the old one.
 */
public class OperatorMutator implements Mutator {
    private final Random random;

    public OperatorMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "Tree has no operators");
        }
        ExprNode node = NodeSampler.sample(tree, t -> t.degree() != 0, random);
        node.setOp(OperatorPicker.randomOperator(ctx.options(), node.degree(), random));
        return MutationResult.success(tree);
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().hasOperators();
    }
}
