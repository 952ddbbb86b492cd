package symreg.runtime;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Logger;

import symreg.model.NodeType;
import symreg.model.OperatorSet;
import symreg.util.LoggingConfig;

/**
 * Immutable options read by the mutation operators. Values come from the
 * builder, then from a {@link Properties} source, then from system
 * properties, then from defaults.
 */
public final class MutationOptions {

    public static final double DEFAULT_PERTURBATION_FACTOR = 0.076;
    public static final double DEFAULT_PROBABILITY_NEGATE_CONSTANT = 0.01;

    public static final String PROP_PERTURBATION_FACTOR = "symreg.perturbationFactor";
    public static final String PROP_PROBABILITY_NEGATE_CONSTANT = "symreg.probabilityNegateConstant";
    public static final String PROP_NODE_TYPE = "symreg.nodeType";
    public static final String PROP_UNARY_OPERATORS = "symreg.unaryOperators";
    public static final String PROP_BINARY_OPERATORS = "symreg.binaryOperators";

    private static final Logger LOGGER = LoggingConfig.getLogger(MutationOptions.class);

    private final OperatorSet operators;
    private final double perturbationFactor;
    private final double probabilityNegateConstant;
    private final NodeType nodeType;

    private MutationOptions(Builder builder) {
        this.operators = builder.operators;
        this.perturbationFactor = builder.perturbationFactor;
        this.probabilityNegateConstant = builder.probabilityNegateConstant;
        this.nodeType = builder.nodeType;
    }

    public OperatorSet operators() {
        return operators;
    }

    public int numUnary() {
        return operators.numUnary();
    }

    public int numBinary() {
        return operators.numBinary();
    }

    public double perturbationFactor() {
        return perturbationFactor;
    }

    public double probabilityNegateConstant() {
        return probabilityNegateConstant;
    }

    public NodeType nodeType() {
        return nodeType;
    }

    public static MutationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .operators(operators)
                .perturbationFactor(perturbationFactor)
                .probabilityNegateConstant(probabilityNegateConstant)
                .nodeType(nodeType);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "MutationOptions{operators=%s, perturbationFactor=%s, probabilityNegateConstant=%s, nodeType=%s}",
                operators, perturbationFactor, probabilityNegateConstant, nodeType);
    }

    public static final class Builder {
        private OperatorSet operators;
        private Double perturbationFactor;
        private Double probabilityNegateConstant;
        private NodeType nodeType;

        private Builder() {
        }

        public Builder operators(OperatorSet operators) {
            this.operators = Objects.requireNonNull(operators, "operators");
            return this;
        }

        public Builder operators(List<String> unary, List<String> binary) {
            return operators(new OperatorSet(unary, binary));
        }

        public Builder perturbationFactor(double perturbationFactor) {
            this.perturbationFactor = perturbationFactor;
            return this;
        }

        public Builder probabilityNegateConstant(double probabilityNegateConstant) {
            this.probabilityNegateConstant = probabilityNegateConstant;
            return this;
        }

        public Builder nodeType(NodeType nodeType) {
            this.nodeType = Objects.requireNonNull(nodeType, "nodeType");
            return this;
        }

        /**
         * Fills every option not yet set explicitly from {@code properties}.
         * Malformed entries are logged and ignored.
         */
        public Builder fromProperties(Properties properties) {
            Objects.requireNonNull(properties, "properties");
            if (perturbationFactor == null) {
                perturbationFactor = parseDouble(properties.getProperty(PROP_PERTURBATION_FACTOR),
                        PROP_PERTURBATION_FACTOR);
            }
            if (probabilityNegateConstant == null) {
                probabilityNegateConstant = parseDouble(properties.getProperty(PROP_PROBABILITY_NEGATE_CONSTANT),
                        PROP_PROBABILITY_NEGATE_CONSTANT);
            }
            if (nodeType == null) {
                String raw = properties.getProperty(PROP_NODE_TYPE);
                nodeType = NodeType.parseOrNull(raw);
                if (nodeType == null && raw != null && !raw.isBlank()) {
                    LOGGER.warning(String.format(Locale.ROOT,
                            "Unknown node type '%s' for %s; using default", raw, PROP_NODE_TYPE));
                }
            }
            if (operators == null) {
                String unary = properties.getProperty(PROP_UNARY_OPERATORS);
                String binary = properties.getProperty(PROP_BINARY_OPERATORS);
                if (unary != null || binary != null) {
                    operators = new OperatorSet(
                            unary != null ? splitNames(unary) : OperatorSet.DEFAULT.unary(),
                            binary != null ? splitNames(binary) : OperatorSet.DEFAULT.binary());
                    LOGGER.fine(() -> "Operators resolved from properties: " + operators);
                }
            }
            return this;
        }

        public MutationOptions build() {
            fromProperties(System.getProperties());
            if (operators == null) {
                operators = OperatorSet.DEFAULT;
            }
            if (perturbationFactor == null) {
                perturbationFactor = DEFAULT_PERTURBATION_FACTOR;
            }
            if (probabilityNegateConstant == null) {
                probabilityNegateConstant = DEFAULT_PROBABILITY_NEGATE_CONSTANT;
            }
            if (nodeType == null) {
                nodeType = NodeType.TREE;
            }
            validate();
            MutationOptions options = new MutationOptions(this);
            LOGGER.fine(() -> "Resolved " + options);
            return options;
        }

        private void validate() {
            if (operators.numUnary() + operators.numBinary() == 0) {
                throw new IllegalArgumentException("At least one unary or binary operator is required.");
            }
            if (!Double.isFinite(perturbationFactor) || perturbationFactor < 0) {
                throw new IllegalArgumentException(
                        "perturbationFactor must be a finite value >= 0 but was " + perturbationFactor);
            }
            if (!(probabilityNegateConstant >= 0 && probabilityNegateConstant <= 1)) {
                throw new IllegalArgumentException(
                        "probabilityNegateConstant must lie in [0, 1] but was " + probabilityNegateConstant);
            }
        }

        private static Double parseDouble(String raw, String key) {
            if (raw == null || raw.isBlank()) {
                return null;
            }
            try {
                double parsed = Double.parseDouble(raw.trim());
                LOGGER.fine(() -> String.format(Locale.ROOT, "%s resolved to %s", key, parsed));
                return parsed;
            } catch (NumberFormatException e) {
                LOGGER.warning(String.format(Locale.ROOT,
                        "Ignoring malformed value '%s' for %s", raw, key));
                return null;
            }
        }

        private static List<String> splitNames(String raw) {
            return List.of(raw.trim().isEmpty() ? new String[0] : raw.trim().split("\\s*,\\s*"));
        }
    }
}
