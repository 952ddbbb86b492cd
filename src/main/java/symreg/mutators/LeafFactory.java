package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;

/**
 * Fresh leaves: with equal probability a standard-normal constant or a
 * feature reference drawn uniformly from {@code [1, featureCount]}.
 */
public final class LeafFactory {

    private LeafFactory() {
    }

    public static ExprNode makeLeaf(int featureCount, Random random) {
        requireFeatures(featureCount);
        if (random.nextBoolean()) {
            return ExprNode.constant(random.nextGaussian());
        }
        return ExprNode.feature(1 + random.nextInt(featureCount));
    }

    /** Allocates the leaf in {@code graph} and returns its id. */
    public static int makeLeaf(ExpressionGraph graph, int featureCount, Random random) {
        requireFeatures(featureCount);
        if (random.nextBoolean()) {
            return graph.addConstant(random.nextGaussian());
        }
        return graph.addFeature(1 + random.nextInt(featureCount));
    }

    private static void requireFeatures(int featureCount) {
        if (featureCount < 1) {
            throw new IllegalArgumentException("featureCount must be >= 1 but was " + featureCount);
        }
    }
}
