package dk.cloudcreate.aggregateengine.aggregates.test_data;

public sealed interface CounterEvent {
    CounterId counterId();

    record Incremented(CounterId counterId, long by) implements CounterEvent {
    }

    record Reset(CounterId counterId) implements CounterEvent {
    }
}
