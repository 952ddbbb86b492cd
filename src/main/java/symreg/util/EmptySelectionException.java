package symreg.util;

/**
 * Raised when a random selection is asked to pick from a non-empty program
 * in which no node satisfies the filter. This signals caller misuse, for
 * example requesting a binary node when the options configure none.
 */
public class EmptySelectionException extends RuntimeException {

    public EmptySelectionException(String message) {
        super(message);
    }
}
