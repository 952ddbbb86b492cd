package symreg.model;

import java.util.List;
import java.util.Objects;

/**
 * Fixed operator table of a search run, partitioned by arity. Operator
 * indices stored in nodes are 1-based into the matching list.
 */
public final class OperatorSet {

    public static final OperatorSet DEFAULT = new OperatorSet(
            List.of("cos", "exp"),
            List.of("+", "-", "*", "/"));

    private final List<String> unary;
    private final List<String> binary;

    public OperatorSet(List<String> unary, List<String> binary) {
        this.unary = List.copyOf(Objects.requireNonNull(unary, "unary"));
        this.binary = List.copyOf(Objects.requireNonNull(binary, "binary"));
    }

    public int numUnary() {
        return unary.size();
    }

    public int numBinary() {
        return binary.size();
    }

    public List<String> unary() {
        return unary;
    }

    public List<String> binary() {
        return binary;
    }

    public String unaryName(int op) {
        return nameOrPlaceholder(unary, op, "unary");
    }

    public String binaryName(int op) {
        return nameOrPlaceholder(binary, op, "binary");
    }

    private static String nameOrPlaceholder(List<String> names, int op, String kind) {
        if (op >= 1 && op <= names.size()) {
            return names.get(op - 1);
        }
        return kind + "#" + op;
    }

    @Override
    public String toString() {
        return "OperatorSet{unary=" + unary + ", binary=" + binary + "}";
    }
}
