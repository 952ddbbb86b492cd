package symreg.mutators;

import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import symreg.model.ExprNode;
import symreg.util.LoggingConfig;
import symreg.util.NodeSampler;

/**
 * Makes an existing node a second child of some operator node, turning the
 * structure into a shared graph. Candidate pairs are drawn at random and
 * rejected when the new child already reaches the parent; after
 * {@link #MAX_ATTEMPTS} rejections the tree is left alone.
 */
public class FormConnectionMutator implements Mutator {
    private static final Logger LOGGER = LoggingConfig.getLogger(FormConnectionMutator.class);

    static final int MIN_NODES = 5;
    static final int MAX_ATTEMPTS = 10;

    private final Random random;

    public FormConnectionMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "Tree has fewer than " + MIN_NODES + " nodes");
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            ExprNode parent = NodeSampler.sample(tree, t -> t.degree() != 0, random);
            ExprNode newChild = NodeSampler.sample(tree, t -> t != tree, random);

            boolean wouldFormLoop = newChild.anyMatch(t -> t == parent);
            if (wouldFormLoop) {
                continue;
            }
            if (parent.degree() == 1 || random.nextBoolean()) {
                parent.setLeft(newChild);
            } else {
                parent.setRight(newChild);
            }
            return MutationResult.success(tree);
        }
        LOGGER.log(Level.FINE, "No loop-free connection found after {0} attempts", MAX_ATTEMPTS);
        return MutationResult.skipped(tree, "Every candidate connection would form a loop");
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().countNodes() >= MIN_NODES;
    }
}
