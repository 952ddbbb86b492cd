package symreg.mutators;

import java.util.Random;

import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;
import symreg.runtime.MutationOptions;

/** Arity and operator draws shared by the growth operators. */
final class OperatorPicker {

    private OperatorPicker() {
    }

    /** Coin flip weighted by the number of operators of each arity. */
    static boolean chooseBinary(MutationOptions options, Random random) {
        double pBinary = options.numBinary() / (double) (options.numUnary() + options.numBinary());
        return random.nextDouble() < pBinary;
    }

    static int randomOperator(MutationOptions options, int degree, Random random) {
        int available = degree == 1 ? options.numUnary() : options.numBinary();
        if (available == 0) {
            throw new IllegalStateException("No " + (degree == 1 ? "unary" : "binary")
                    + " operators configured; cannot draw one");
        }
        return 1 + random.nextInt(available);
    }

    /**
     * Operator node whose first child is {@code left}; a binary node gets a
     * fresh leaf on the right.
     */
    static ExprNode newOperatorNode(boolean binary, ExprNode left, MutationOptions options,
                                    int featureCount, Random random) {
        if (binary) {
            int op = randomOperator(options, 2, random);
            return ExprNode.binary(op, left, LeafFactory.makeLeaf(featureCount, random));
        }
        return ExprNode.unary(randomOperator(options, 1, random), left);
    }

    /** Arena counterpart of {@link #newOperatorNode(boolean, ExprNode, MutationOptions, int, Random)}. */
    static int newOperatorNode(ExpressionGraph graph, boolean binary, int left, MutationOptions options,
                               int featureCount, Random random) {
        if (binary) {
            int op = randomOperator(options, 2, random);
            return graph.addBinary(op, left, LeafFactory.makeLeaf(graph, featureCount, random));
        }
        return graph.addUnary(randomOperator(options, 1, random), left);
    }
}
