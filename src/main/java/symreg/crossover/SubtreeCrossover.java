package symreg.crossover;

import java.util.Objects;
import java.util.Random;

import symreg.model.ExprNode;
import symreg.util.NodeAndParent;
import symreg.util.NodeSampler;

/**
 * Exchanges one random subtree between two programs. Works on copies: the
 * arguments are never modified and the returned trees share no nodes with
 * them or with each other.
 */
public final class SubtreeCrossover {

    private final Random random;

    public SubtreeCrossover(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    public TreePair crossoverTrees(ExprNode first, ExprNode second) {
        ExprNode tree1 = Objects.requireNonNull(first, "first").copy();
        ExprNode tree2 = Objects.requireNonNull(second, "second").copy();

        NodeAndParent selected1 = NodeSampler.sampleWithParent(tree1, random);
        NodeAndParent selected2 = NodeSampler.sampleWithParent(tree2, random);

        // Taken before tree1's slot is overwritten.
        ExprNode fromFirst = selected1.node().copy();

        ExprNode fromSecond = selected2.node().copy();
        if (selected1.isRoot()) {
            tree1 = fromSecond;
        } else {
            selected1.replaceInParent(fromSecond);
        }

        if (selected2.isRoot()) {
            tree2 = fromFirst;
        } else {
            selected2.replaceInParent(fromFirst);
        }
        return new TreePair(tree1, tree2);
    }
}
