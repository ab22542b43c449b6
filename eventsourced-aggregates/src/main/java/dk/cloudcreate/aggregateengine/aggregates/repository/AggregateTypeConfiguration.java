package dk.cloudcreate.aggregateengine.aggregates.repository;

import dk.cloudcreate.aggregateengine.aggregates.*;
import dk.cloudcreate.aggregateengine.aggregates.processing.BatchValidationPolicy;
import dk.cloudcreate.aggregateengine.eventlog.serializer.EventCodec;
import dk.cloudcreate.aggregateengine.eventlog.types.EventStreamName;

import java.util.Objects;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Everything the {@link EventSourcedAggregateRepository} needs to know about ONE aggregate type: how to name its streams,
 * how to seed its state, how to encode/decode its events and how commands are processed.<br>
 * Create it using {@link #of(AggregateType, Function, AggregateStateFactory, EventCodec)} and adjust the defaults using the
 * <code>with...</code> methods, which all return a new configuration:
 * <pre>{@code
 * var configuration = AggregateTypeConfiguration.of(AggregateType.of("Accounts"),
 *                                                   accountId -> EventStreamName.of("account", accountId),
 *                                                   BankAccount::seed,
 *                                                   codec)
 *                                               .withBatchValidationPolicy(BatchValidationPolicy.SNAPSHOT);
 * }</pre>
 *
 * @param <ID>           the entity key type
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 * @param <STATE_TYPE>   the state type
 */
public final class AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>> {
    public static final int                   DEFAULT_MAX_EVENTS_PER_APPEND    = 1000;
    public static final BatchValidationPolicy DEFAULT_BATCH_VALIDATION_POLICY = BatchValidationPolicy.CUMULATIVE;

    public final AggregateType                                       aggregateType;
    /**
     * Resolves the name of the stream that contains the events of an entity
     */
    public final Function<ID, EventStreamName>                       streamNameResolver;
    public final AggregateStateFactory<ID, STATE_TYPE>               stateFactory;
    public final EventCodec<EVENT_TYPE>                              codec;
    public final BatchValidationPolicy                               batchValidationPolicy;
    /**
     * Should appends be conditioned on the event order of the last event the state was projected from
     */
    public final boolean                                             optimisticConcurrency;
    /**
     * The maximum number of events appended in one call to the event log
     */
    public final int                                                 maxEventsPerAppend;
    public final DomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE> errorListener;

    public AggregateTypeConfiguration(AggregateType aggregateType,
                                      Function<ID, EventStreamName> streamNameResolver,
                                      AggregateStateFactory<ID, STATE_TYPE> stateFactory,
                                      EventCodec<EVENT_TYPE> codec,
                                      BatchValidationPolicy batchValidationPolicy,
                                      boolean optimisticConcurrency,
                                      int maxEventsPerAppend,
                                      DomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE> errorListener) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.streamNameResolver = requireNonNull(streamNameResolver, "No streamNameResolver provided");
        this.stateFactory = requireNonNull(stateFactory, "No stateFactory provided");
        this.codec = requireNonNull(codec, "No codec provided");
        this.batchValidationPolicy = requireNonNull(batchValidationPolicy, "No batchValidationPolicy provided");
        requireTrue(maxEventsPerAppend > 0, "maxEventsPerAppend must be larger than 0");
        this.optimisticConcurrency = optimisticConcurrency;
        this.maxEventsPerAppend = maxEventsPerAppend;
        this.errorListener = requireNonNull(errorListener, "No errorListener provided");
    }

    /**
     * Create a configuration using the {@link #DEFAULT_BATCH_VALIDATION_POLICY}, optimistic concurrency, the {@link #DEFAULT_MAX_EVENTS_PER_APPEND}
     * and a {@link LoggingDomainErrorListener}
     */
    public static <ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>>
    AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> of(AggregateType aggregateType,
                                                                                          Function<ID, EventStreamName> streamNameResolver,
                                                                                          AggregateStateFactory<ID, STATE_TYPE> stateFactory,
                                                                                          EventCodec<EVENT_TYPE> codec) {
        return new AggregateTypeConfiguration<>(aggregateType,
                                                streamNameResolver,
                                                stateFactory,
                                                codec,
                                                DEFAULT_BATCH_VALIDATION_POLICY,
                                                true,
                                                DEFAULT_MAX_EVENTS_PER_APPEND,
                                                new LoggingDomainErrorListener<>());
    }

    public AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> withBatchValidationPolicy(BatchValidationPolicy batchValidationPolicy) {
        return new AggregateTypeConfiguration<>(aggregateType, streamNameResolver, stateFactory, codec, batchValidationPolicy, optimisticConcurrency, maxEventsPerAppend, errorListener);
    }

    public AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> withOptimisticConcurrency(boolean optimisticConcurrency) {
        return new AggregateTypeConfiguration<>(aggregateType, streamNameResolver, stateFactory, codec, batchValidationPolicy, optimisticConcurrency, maxEventsPerAppend, errorListener);
    }

    public AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> withMaxEventsPerAppend(int maxEventsPerAppend) {
        return new AggregateTypeConfiguration<>(aggregateType, streamNameResolver, stateFactory, codec, batchValidationPolicy, optimisticConcurrency, maxEventsPerAppend, errorListener);
    }

    public AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> withErrorListener(DomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE> errorListener) {
        return new AggregateTypeConfiguration<>(aggregateType, streamNameResolver, stateFactory, codec, batchValidationPolicy, optimisticConcurrency, maxEventsPerAppend, errorListener);
    }

    /**
     * @param aggregateId the entity key
     * @return the name of the stream that contains the entity's events
     */
    public EventStreamName resolveStreamName(ID aggregateId) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        return requireNonNull(streamNameResolver.apply(aggregateId), "The streamNameResolver returned no stream name");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateTypeConfiguration)) return false;
        AggregateTypeConfiguration<?, ?, ?, ?, ?> that = (AggregateTypeConfiguration<?, ?, ?, ?, ?>) o;
        return aggregateType.equals(that.aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "AggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventType=" + codec.eventType().getName() +
                ", batchValidationPolicy=" + batchValidationPolicy +
                ", optimisticConcurrency=" + optimisticConcurrency +
                ", maxEventsPerAppend=" + maxEventsPerAppend +
                '}';
    }
}
