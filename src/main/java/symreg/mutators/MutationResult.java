package symreg.mutators;

import java.util.Objects;

import symreg.model.ExprNode;

/**
 * Outcome of one mutator call. {@code tree} is the root the caller must keep
 * using; for skipped calls it is the unchanged input.
 */
public record MutationResult(MutationStatus status, ExprNode tree, String detail) {

    public MutationResult {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(tree, "tree");
        detail = detail == null ? "" : detail;
    }

    public static MutationResult success(ExprNode tree) {
        return new MutationResult(MutationStatus.SUCCESS, tree, "");
    }

    public static MutationResult skipped(ExprNode tree, String detail) {
        return new MutationResult(MutationStatus.SKIPPED, tree, detail);
    }

    public boolean succeeded() {
        return status == MutationStatus.SUCCESS;
    }
}
