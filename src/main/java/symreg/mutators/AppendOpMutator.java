package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.runtime.MutationOptions;
import symreg.util.NodeSampler;

/**
 * Grows the tree at a random leaf: the leaf becomes an operator node whose
 * children are fresh leaves. Adds one node for a unary and two for a binary
 * operator. Edits in place; the root handle stays valid.
 */
public class AppendOpMutator implements Mutator {
    private final Random random;
    private final Boolean forceBinary;

    public AppendOpMutator(Random random) {
        this(random, null);
    }

    /**
     * @param forceBinary {@code true}/{@code false} to fix the arity, or
     *                    {@code null} to draw it weighted by operator counts
     */
    public AppendOpMutator(Random random, Boolean forceBinary) {
        this.random = random;
        this.forceBinary = forceBinary;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(ctx.tree(), "No operators of the forced arity configured");
        }
        return MutationResult.success(
                appendRandomOp(ctx.tree(), ctx.options(), ctx.featureCount(), forceBinary));
    }

    public ExprNode appendRandomOp(ExprNode tree, MutationOptions options, int featureCount) {
        return appendRandomOp(tree, options, featureCount, null);
    }

    public ExprNode appendRandomOp(ExprNode tree, MutationOptions options, int featureCount, Boolean makeBinary) {
        ExprNode leaf = NodeSampler.sample(tree, ExprNode::isLeaf, random);
        boolean binary = makeBinary != null ? makeBinary : OperatorPicker.chooseBinary(options, random);
        ExprNode firstChild = LeafFactory.makeLeaf(featureCount, random);
        leaf.setFrom(OperatorPicker.newOperatorNode(binary, firstChild, options, featureCount, random));
        return tree;
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        if (forceBinary == null) {
            return true;
        }
        MutationOptions options = ctx.options();
        return forceBinary ? options.numBinary() > 0 : options.numUnary() > 0;
    }
}
