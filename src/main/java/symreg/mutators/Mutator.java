package symreg.mutators;

public interface Mutator {
    /**
     * Applies the edit. Implementations either edit {@code ctx.tree()} in place
     * and return it, or, where {@link MutatorType#rebindsRoot()} says so, may
     * return a different root.
     */
    MutationResult mutate(MutationContext ctx);

    boolean isApplicable(MutationContext ctx);
}
