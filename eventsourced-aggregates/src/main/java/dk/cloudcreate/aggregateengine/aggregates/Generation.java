package dk.cloudcreate.aggregateengine.aggregates;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The number of events that have been applied to an {@link AggregateState}.<br>
 * A freshly seeded state has generation {@link #INITIAL} and every {@link AggregateState#apply(Object)} increases it by exactly one,
 * so the generation can be used to detect stale state when appending to the event log
 */
public class Generation extends LongType<Generation> {
    public static final Generation INITIAL = Generation.of(0);

    public Generation(Long value) {
        super(value);
    }

    public static Generation of(long value) {
        return new Generation(value);
    }

    public Generation increaseAndGet() {
        return new Generation(value() + 1);
    }

    public Generation plus(long numberOfEvents) {
        return new Generation(value() + numberOfEvents);
    }
}
