package symreg.mutators;

public enum MutatorType {
    SWAP_NODE_PAIR(false, false),
    SWAP_OPERANDS(false, false),
    MUTATE_OPERATOR(false, false),
    MUTATE_CONSTANT(false, false),
    APPEND_OP(false, false),
    INSERT_OP(false, false),
    PREPEND_OP(true, false),
    DELETE_OP(true, false),
    FORM_CONNECTION(false, true),
    BREAK_CONNECTION(false, true);

    private final boolean rebindsRoot;
    private final boolean requiresGraphPrograms;

    MutatorType(boolean rebindsRoot, boolean requiresGraphPrograms) {
        this.rebindsRoot = rebindsRoot;
        this.requiresGraphPrograms = requiresGraphPrograms;
    }

    /** Whether the returned root may differ from the one passed in. */
    public boolean rebindsRoot() {
        return rebindsRoot;
    }

    /** Whether the edit introduces or removes sharing, which only graph programs allow. */
    public boolean requiresGraphPrograms() {
        return requiresGraphPrograms;
    }
}
