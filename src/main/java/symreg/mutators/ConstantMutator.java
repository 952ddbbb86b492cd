package symreg.mutators;

import java.util.Locale;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import symreg.model.ExprNode;
import symreg.runtime.MutationOptions;
import symreg.util.LoggingConfig;
import symreg.util.NodeSampler;

/**
 * Scales a random constant by a factor in {@code [1, maxChange]} up or down,
 * where {@code maxChange = perturbationFactor * temperature + 1.1}.
 */
public class ConstantMutator implements Mutator {
    private static final Logger LOGGER = LoggingConfig.getLogger(ConstantMutator.class);
    private static final double BOTTOM = 0.1;

    private final Random random;

    public ConstantMutator(Random random) {
        this.random = random;
    }

    @Override
    public MutationResult mutate(MutationContext ctx) {
        ExprNode tree = ctx.tree();
        if (!isApplicable(ctx)) {
            return MutationResult.skipped(tree, "Tree has no constants");
        }
        ExprNode node = NodeSampler.sample(tree, ExprNode::isConstant, random);
        double before = node.value();
        node.setValue(perturb(before, ctx.temperature(), ctx.options()));
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(String.format(Locale.ROOT, "Constant %s -> %s (temperature=%s)",
                    before, node.value(), ctx.temperature()));
        }
        return MutationResult.success(tree);
    }

    /**
     * Note the sign flip fires when a uniform draw exceeds
     * {@code probabilityNegateConstant}, i.e. with probability
     * {@code 1 - probabilityNegateConstant}.
     */
    double perturb(double value, double temperature, MutationOptions options) {
        return perturb(value, temperature, options, random);
    }

    static double perturb(double value, double temperature, MutationOptions options, Random random) {
        double maxChange = options.perturbationFactor() * temperature + 1 + BOTTOM;
        double factor = Math.pow(maxChange, random.nextDouble());
        boolean makeConstBigger = random.nextBoolean();

        double result = makeConstBigger ? value * factor : value / factor;
        if (random.nextDouble() > options.probabilityNegateConstant()) {
            result = -result;
        }
        return result;
    }

    @Override
    public boolean isApplicable(MutationContext ctx) {
        return ctx.tree().hasConstants();
    }
}
