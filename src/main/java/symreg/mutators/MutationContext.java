package symreg.mutators;

import java.util.Objects;

import symreg.model.ExprNode;
import symreg.runtime.MutationOptions;

/**
 * Inputs of a single mutation event. The random source is not part of the
 * context; each {@link Mutator} owns the one it was constructed with.
 */
public final class MutationContext {

    private final ExprNode tree;
    private final MutationOptions options;
    private final int featureCount;
    private final double temperature;

    public MutationContext(ExprNode tree, MutationOptions options, int featureCount, double temperature) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.options = Objects.requireNonNull(options, "options");
        if (featureCount < 1) {
            throw new IllegalArgumentException("featureCount must be >= 1 but was " + featureCount);
        }
        this.featureCount = featureCount;
        this.temperature = temperature;
    }

    public MutationContext(ExprNode tree, MutationOptions options, int featureCount) {
        this(tree, options, featureCount, 1.0);
    }

    public ExprNode tree() {
        return tree;
    }

    public MutationOptions options() {
        return options;
    }

    public int featureCount() {
        return featureCount;
    }

    /** Annealing temperature in [0, 1], read by constant perturbation. */
    public double temperature() {
        return temperature;
    }
}
