package symreg.runtime;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

import symreg.mutators.MutatorType;

/**
 * Per-mutator outcome counters. Safe to share between threads running
 * independent mutation calls.
 */
public final class MutatorStats {

    public enum Outcome {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private final LongAdder[] successCounts;
    private final LongAdder[] skipCounts;
    private final LongAdder[] failureCounts;

    public MutatorStats() {
        int size = MutatorType.values().length;
        this.successCounts = new LongAdder[size];
        this.skipCounts = new LongAdder[size];
        this.failureCounts = new LongAdder[size];
        for (int i = 0; i < size; i++) {
            successCounts[i] = new LongAdder();
            skipCounts[i] = new LongAdder();
            failureCounts[i] = new LongAdder();
        }
    }

    void record(MutatorType mutatorType, Outcome outcome) {
        if (mutatorType == null || outcome == null) {
            return;
        }
        int index = mutatorType.ordinal();
        switch (outcome) {
            case SUCCESS -> successCounts[index].increment();
            case SKIPPED -> skipCounts[index].increment();
            case FAILED -> failureCounts[index].increment();
        }
    }

    public long count(MutatorType mutatorType, Outcome outcome) {
        int index = mutatorType.ordinal();
        return switch (outcome) {
            case SUCCESS -> successCounts[index].sum();
            case SKIPPED -> skipCounts[index].sum();
            case FAILED -> failureCounts[index].sum();
        };
    }

    public long total(MutatorType mutatorType) {
        int index = mutatorType.ordinal();
        return successCounts[index].sum() + skipCounts[index].sum() + failureCounts[index].sum();
    }

    public Map<MutatorType, Long> snapshot(Outcome outcome) {
        Map<MutatorType, Long> snapshot = new EnumMap<>(MutatorType.class);
        for (MutatorType type : MutatorType.values()) {
            snapshot.put(type, count(type, outcome));
        }
        return snapshot;
    }
}
