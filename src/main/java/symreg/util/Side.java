package symreg.util;

/** Slot a selected node occupies in its parent. */
public enum Side {
    LEFT('l'),
    RIGHT('r'),
    ROOT('n');

    private final char code;

    Side(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }
}
