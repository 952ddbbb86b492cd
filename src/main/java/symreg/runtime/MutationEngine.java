package symreg.runtime;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

import symreg.graph.GraphConnectionEngine;
import symreg.model.ExprNode;
import symreg.model.ExpressionGraph;
import symreg.model.NodeType;
import symreg.mutators.AppendOpMutator;
import symreg.mutators.BreakConnectionMutator;
import symreg.mutators.ConstantMutator;
import symreg.mutators.DeleteOpMutator;
import symreg.mutators.FormConnectionMutator;
import symreg.mutators.GraphMutations;
import symreg.mutators.InsertOpMutator;
import symreg.mutators.MutationContext;
import symreg.mutators.MutationResult;
import symreg.mutators.MutationStatus;
import symreg.mutators.Mutator;
import symreg.mutators.MutatorType;
import symreg.mutators.OperatorMutator;
import symreg.mutators.PrependOpMutator;
import symreg.mutators.SwapNodePairMutator;
import symreg.mutators.SwapOperandsMutator;
import symreg.runtime.MutatorStats.Outcome;
import symreg.util.EmptySelectionException;
import symreg.util.LoggingConfig;

/**
 * Applies one mutator, chosen by the caller, per mutation event. Every call
 * gets a mutator seeded from this engine's random source, so a run is
 * reproducible from the engine seed.
 *
 * <p>An engine is meant for one worker thread; the {@link MutatorStats} it
 * reports to may be shared.
 */
public final class MutationEngine {

    private static final Logger LOGGER = LoggingConfig.getLogger(MutationEngine.class);
    private static final Map<MutatorType, Function<Random, Mutator>> MUTATOR_FACTORIES = buildFactoryMap();

    private final Random random;
    private final MutatorStats stats;

    public MutationEngine(Random random) {
        this(random, new MutatorStats());
    }

    public MutationEngine(Random random, MutatorStats stats) {
        this.random = Objects.requireNonNull(random, "random");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    public MutatorStats stats() {
        return stats;
    }

    public MutationResult mutate(MutatorType mutatorType, ExprNode tree, MutationOptions options,
                                 int featureCount, double temperature) {
        return mutate(mutatorType, new MutationContext(tree, options, featureCount, temperature));
    }

    /**
     * @return the result whose {@code tree()} replaces the caller's handle
     * @throws EmptySelectionException if a node filter matches nothing in the tree
     * @throws IllegalStateException   if an operator of an arity with no
     *                                 configured operators is drawn
     */
    public MutationResult mutate(MutatorType mutatorType, MutationContext ctx) {
        Objects.requireNonNull(mutatorType, "mutatorType");
        Objects.requireNonNull(ctx, "ctx");

        if (mutatorType.requiresGraphPrograms() && ctx.options().nodeType() != NodeType.GRAPH) {
            LOGGER.log(Level.FINE, "Mutator {0} needs graph programs; skipping", mutatorType);
            stats.record(mutatorType, Outcome.SKIPPED);
            return MutationResult.skipped(ctx.tree(), mutatorType + " requires node type GRAPH");
        }

        long mutationSeed = random.nextLong();
        Mutator mutator = createMutator(mutatorType, new Random(mutationSeed));

        if (!mutator.isApplicable(ctx)) {
            LOGGER.log(Level.FINE, "Mutator {0} is not applicable", mutatorType);
            stats.record(mutatorType, Outcome.SKIPPED);
            return MutationResult.skipped(ctx.tree(), mutatorType + " not applicable");
        }

        long startNanos = System.nanoTime();
        MutationResult result;
        try {
            result = mutator.mutate(ctx);
        } catch (EmptySelectionException | IllegalStateException ex) {
            LOGGER.log(Level.WARNING, String.format(Locale.ROOT,
                    "Mutator %s failed with seed %d: %s", mutatorType, mutationSeed, ex.getMessage()), ex);
            stats.record(mutatorType, Outcome.FAILED);
            throw ex;
        }

        stats.record(mutatorType, result.succeeded() ? Outcome.SUCCESS : Outcome.SKIPPED);
        if (LOGGER.isLoggable(Level.FINE)) {
            long elapsedMicros = (System.nanoTime() - startNanos) / 1_000L;
            LOGGER.fine(String.format(Locale.ROOT,
                    "Mutator %s %s with seed %d (duration=%d us)%s",
                    mutatorType,
                    result.succeeded() ? "applied" : "skipped",
                    mutationSeed,
                    elapsedMicros,
                    result.detail().isEmpty() ? "" : ": " + result.detail()));
        }
        return result;
    }

    /**
     * Applies one edit to a graph program in place. Connection edits are
     * always allowed here; {@code FORM_CONNECTION} uses the topological-order
     * method of {@link GraphConnectionEngine}. Prepend and delete may move
     * {@link ExpressionGraph#root()}.
     *
     * @throws EmptySelectionException if a node filter matches nothing in the graph
     * @throws IllegalStateException   if an operator of an arity with no
     *                                 configured operators is drawn
     */
    public MutationStatus mutate(MutatorType mutatorType, ExpressionGraph graph, MutationOptions options,
                                 int featureCount, double temperature) {
        Objects.requireNonNull(mutatorType, "mutatorType");
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(options, "options");
        if (featureCount < 1) {
            throw new IllegalArgumentException("featureCount must be >= 1 but was " + featureCount);
        }
        if (graph.root() == ExpressionGraph.NONE) {
            LOGGER.log(Level.FINE, "Graph has no root; skipping {0}", mutatorType);
            stats.record(mutatorType, Outcome.SKIPPED);
            return MutationStatus.SKIPPED;
        }

        long mutationSeed = random.nextLong();
        Random mutationRandom = new Random(mutationSeed);
        long startNanos = System.nanoTime();
        boolean changed;
        try {
            changed = applyToGraph(mutatorType, graph, options, featureCount, temperature, mutationRandom);
        } catch (EmptySelectionException | IllegalStateException ex) {
            LOGGER.log(Level.WARNING, String.format(Locale.ROOT,
                    "Graph mutator %s failed with seed %d: %s", mutatorType, mutationSeed, ex.getMessage()), ex);
            stats.record(mutatorType, Outcome.FAILED);
            throw ex;
        }

        stats.record(mutatorType, changed ? Outcome.SUCCESS : Outcome.SKIPPED);
        if (LOGGER.isLoggable(Level.FINE)) {
            long elapsedMicros = (System.nanoTime() - startNanos) / 1_000L;
            LOGGER.fine(String.format(Locale.ROOT,
                    "Graph mutator %s %s with seed %d (duration=%d us, nodes=%d)",
                    mutatorType, changed ? "applied" : "skipped", mutationSeed, elapsedMicros,
                    graph.countNodes()));
        }
        return changed ? MutationStatus.SUCCESS : MutationStatus.SKIPPED;
    }

    private static boolean applyToGraph(MutatorType type, ExpressionGraph graph, MutationOptions options,
                                        int featureCount, double temperature, Random random) {
        GraphMutations edits = new GraphMutations(random);
        return switch (type) {
            case SWAP_NODE_PAIR -> edits.swapNodePair(graph);
            case SWAP_OPERANDS -> edits.swapOperands(graph);
            case MUTATE_OPERATOR -> edits.mutateOperator(graph, options);
            case MUTATE_CONSTANT -> edits.mutateConstant(graph, options, temperature);
            case APPEND_OP -> edits.appendRandomOp(graph, options, featureCount, null);
            case INSERT_OP -> edits.insertRandomOp(graph, options, featureCount);
            case PREPEND_OP -> edits.prependRandomOp(graph, options, featureCount);
            case DELETE_OP -> edits.deleteRandomOp(graph, featureCount);
            case FORM_CONNECTION -> new GraphConnectionEngine(random).formRandomConnection(graph);
            case BREAK_CONNECTION -> new GraphConnectionEngine(random).breakRandomConnection(graph);
        };
    }

    static Mutator createMutator(MutatorType type, Random random) {
        Function<Random, Mutator> factory = MUTATOR_FACTORIES.get(type);
        if (factory == null) {
            throw new IllegalStateException("Unexpected mutator type: " + type);
        }
        return factory.apply(random);
    }

    private static Map<MutatorType, Function<Random, Mutator>> buildFactoryMap() {
        Map<MutatorType, Function<Random, Mutator>> map = new EnumMap<>(MutatorType.class);
        map.put(MutatorType.SWAP_NODE_PAIR, SwapNodePairMutator::new);
        map.put(MutatorType.SWAP_OPERANDS, SwapOperandsMutator::new);
        map.put(MutatorType.MUTATE_OPERATOR, OperatorMutator::new);
        map.put(MutatorType.MUTATE_CONSTANT, ConstantMutator::new);
        map.put(MutatorType.APPEND_OP, AppendOpMutator::new);
        map.put(MutatorType.INSERT_OP, InsertOpMutator::new);
        map.put(MutatorType.PREPEND_OP, PrependOpMutator::new);
        map.put(MutatorType.DELETE_OP, DeleteOpMutator::new);
        map.put(MutatorType.FORM_CONNECTION, FormConnectionMutator::new);
        map.put(MutatorType.BREAK_CONNECTION, BreakConnectionMutator::new);
        return map;
    }
}
