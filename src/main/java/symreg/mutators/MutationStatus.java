package symreg.mutators;

public enum MutationStatus {
    SUCCESS,
    SKIPPED
}
