package dk.cloudcreate.aggregateengine.aggregates.test_data;

import dk.cloudcreate.aggregateengine.aggregates.DomainError;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public sealed interface CounterError extends DomainError {
    record LimitExceeded(CounterId counterId, long value, long by, long limit) implements CounterError {
        @Override
        public String description() {
            return msg("Incrementing counter '{}' with value {} by {} exceeds the limit {}", counterId, value, by, limit);
        }
    }

    record NothingToReset(CounterId counterId) implements CounterError {
        @Override
        public String description() {
            return msg("Counter '{}' is already 0", counterId);
        }
    }
}
