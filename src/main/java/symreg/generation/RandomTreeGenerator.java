package symreg.generation;

import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;
import symreg.mutators.AppendOpMutator;
import symreg.mutators.LeafFactory;
import symreg.runtime.MutationOptions;
import symreg.util.LoggingConfig;

/**
 * Builds random programs from scratch by repeatedly appending operators to
 * random leaves.
 */
public final class RandomTreeGenerator {
    private static final Logger LOGGER = LoggingConfig.getLogger(RandomTreeGenerator.class);

    private final Random random;
    private final AppendOpMutator appender;

    public RandomTreeGenerator(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        this.appender = new AppendOpMutator(random);
    }

    /**
     * Applies {@code length} appends to a placeholder constant. Each append
     * adds one or two nodes, so the result usually has more than
     * {@code length} nodes.
     */
    public ExprNode genRandomTree(int length, MutationOptions options, int featureCount) {
        ExprNode tree = ExprNode.constant(1.0);
        for (int i = 0; i < length; i++) {
            tree = appender.appendRandomOp(tree, options, featureCount);
        }
        return tree;
    }

    /**
     * Grows a random leaf until it has at least {@code nodeCount} nodes. With
     * one node missing only a unary append fits; without unary operators the
     * tree is returned one node short instead.
     */
    public ExprNode genRandomTreeFixedSize(int nodeCount, MutationOptions options, int featureCount) {
        ExprNode tree = LeafFactory.makeLeaf(featureCount, random);
        int curSize = tree.countNodes();
        while (curSize < nodeCount) {
            if (curSize == nodeCount - 1) {
                if (options.numUnary() == 0) {
                    LOGGER.log(Level.FINE, "Stopping at {0} of {1} nodes: no unary operator fits",
                            new Object[] {curSize, nodeCount});
                    break;
                }
                tree = appender.appendRandomOp(tree, options, featureCount, false);
            } else {
                tree = appender.appendRandomOp(tree, options, featureCount);
            }
            curSize = tree.countNodes();
        }
        return tree;
    }

    /** Graph-program counterpart of {@link #genRandomTreeFixedSize}; starts without sharing. */
    public ExpressionGraph genRandomGraphFixedSize(int nodeCount, MutationOptions options, int featureCount) {
        return ExpressionGraph.fromTree(genRandomTreeFixedSize(nodeCount, options, featureCount));
    }
}
