package symreg.crossover;

import java.util.Objects;

import symreg.model.ExprNode;

public record TreePair(ExprNode first, ExprNode second) {

    public TreePair {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }
}
