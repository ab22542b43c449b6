package dk.cloudcreate.aggregateengine.aggregates.repository;

import dk.cloudcreate.aggregateengine.aggregates.*;
import dk.cloudcreate.aggregateengine.aggregates.processing.*;
import dk.cloudcreate.aggregateengine.aggregates.projection.Projector;
import dk.cloudcreate.aggregateengine.eventlog.*;
import dk.cloudcreate.aggregateengine.eventlog.serializer.EventDecodingException;
import dk.cloudcreate.aggregateengine.eventlog.types.*;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Command entry point for ONE aggregate type: it loads the current {@link AggregateState} of an entity from the {@link EventLog},
 * validates commands against it using the {@link CommandProcessor} and appends the events of the accepted commands to the entity's stream.
 * <p>
 * Here's how to create a repository for bank accounts:
 * <pre>{@code
 * EventSourcedAggregateRepository<AccountId, BankEvent, BankCommand, AccountError, BankAccount> repository =
 *          EventSourcedAggregateRepository.from(eventLog,
 *                                               AggregateTypeConfiguration.of(AggregateType.of("Accounts"),
 *                                                                             accountId -> EventStreamName.of("account", accountId),
 *                                                                             BankAccount::seed,
 *                                                                             codec));
 * var result = repository.handle(accountId, List.of(new DepositFunds(accountId, 100, CorrelationId.random()),
 *                                                   new WithdrawFunds(accountId, 50, CorrelationId.random())));
 * }</pre>
 * Rejected commands are reported to the configured {@link DomainErrorListener} and never cause an append.
 * Failures of the {@link EventLog} or the {@link dk.cloudcreate.aggregateengine.eventlog.serializer.EventCodec} propagate to the caller unchanged.
 *
 * @param <ID>           the entity key type
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 * @param <STATE_TYPE>   the state type
 */
public interface EventSourcedAggregateRepository<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>> {
    /**
     * @param eventLog      the event log that contains the streams of the aggregate type
     * @param configuration the aggregate type configuration
     * @return a repository instance that can load and handle commands for aggregates of the configured type
     */
    static <ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>>
    EventSourcedAggregateRepository<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> from(EventLog eventLog,
                                                                                               AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> configuration) {
        return new DefaultEventSourcedAggregateRepository<>(eventLog, configuration);
    }

    /**
     * Try to load the state of the entity
     *
     * @param aggregateId the entity key
     * @return the projected state or {@link Optional#empty()} if the entity's stream doesn't exist
     * @throws EventDecodingException in case one of the persisted events couldn't be decoded
     */
    Optional<STATE_TYPE> tryLoad(ID aggregateId);

    /**
     * Load the state of the entity
     *
     * @param aggregateId the entity key
     * @return the projected state or the seed state if the entity has no events
     * @throws EventDecodingException in case one of the persisted events couldn't be decoded
     */
    STATE_TYPE load(ID aggregateId);

    /**
     * Load the entity, validate the command and append its events if it was accepted
     *
     * @param aggregateId the entity key
     * @param command     the command
     * @return the result
     * @throws OptimisticAppendToStreamException in case another writer appended to the entity's stream after it was loaded
     */
    default CommandHandlingResult<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE> handle(ID aggregateId, COMMAND_TYPE command) {
        return handle(aggregateId, List.of(requireNonNull(command, "You must supply a command")));
    }

    /**
     * Load the entity, validate the commands in order (using the configured {@link BatchValidationPolicy}) and append the
     * events of all accepted commands in command order
     *
     * @param aggregateId the entity key
     * @param commands    the commands
     * @return the result
     * @throws OptimisticAppendToStreamException in case another writer appended to the entity's stream after it was loaded
     */
    CommandHandlingResult<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE> handle(ID aggregateId, List<? extends COMMAND_TYPE> commands);

    AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> configuration();

    default AggregateType aggregateType() {
        return configuration().aggregateType;
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    class DefaultEventSourcedAggregateRepository<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>>
            implements EventSourcedAggregateRepository<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(EventSourcedAggregateRepository.class);

        private final EventLog                                                                 eventLog;
        private final AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> configuration;
        private final Projector<ID, EVENT_TYPE, STATE_TYPE>                                    projector;
        private final CommandProcessor<EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>       commandProcessor;

        private DefaultEventSourcedAggregateRepository(EventLog eventLog,
                                                       AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> configuration) {
            this.eventLog = requireNonNull(eventLog, "You must supply an EventLog instance");
            this.configuration = requireNonNull(configuration, "You must supply a configuration");
            this.projector = new Projector<>(configuration.stateFactory);
            this.commandProcessor = new CommandProcessor<>(configuration.batchValidationPolicy);
        }

        @Override
        public AggregateTypeConfiguration<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> configuration() {
            return configuration;
        }

        @Override
        public Optional<STATE_TYPE> tryLoad(ID aggregateId) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            var streamName = configuration.resolveStreamName(aggregateId);
            log.trace("[{}] Trying to load '{}' from stream '{}'", configuration.aggregateType, aggregateId, streamName);
            var potentialEventStream = eventLog.fetchStream(streamName);
            if (potentialEventStream.isEmpty()) {
                log.trace("[{}] Didn't find stream '{}' for '{}'", configuration.aggregateType, streamName, aggregateId);
                return Optional.empty();
            }
            var eventStream = potentialEventStream.get();
            var state = projector.projectPersisted(aggregateId,
                                                   eventStream.eventList(),
                                                   (PersistedEvent persistedEvent) -> configuration.codec.decode(persistedEvent));
            log.debug("[{}] Loaded '{}' with generation {} from {} event(s) in stream '{}'",
                      configuration.aggregateType,
                      aggregateId,
                      state.generation(),
                      eventStream.size(),
                      streamName);
            return Optional.of(state);
        }

        @Override
        public STATE_TYPE load(ID aggregateId) {
            return tryLoad(aggregateId).orElseGet(() -> projector.seed(aggregateId));
        }

        @Override
        public CommandHandlingResult<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE> handle(ID aggregateId, List<? extends COMMAND_TYPE> commands) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            requireNonNull(commands, "You must supply a commands list");
            var state = load(aggregateId);
            var batch = commandProcessor.process(state, commands);

            batch.rejections().forEach(outcome -> configuration.errorListener.onCommandRejected(configuration.aggregateType,
                                                                                                  aggregateId,
                                                                                                  outcome.command,
                                                                                                  outcome.error().get()));

            var acceptedEvents = batch.acceptedEvents();
            if (acceptedEvents.isEmpty()) {
                log.debug("[{}] No events to append for '{}' after processing {} command(s)", configuration.aggregateType, aggregateId, commands.size());
                return new CommandHandlingResult<>(aggregateId, batch, List.of(), state.generation(), state.generation());
            }

            var serializedEvents = acceptedEvents.stream()
                                                 .map(configuration.codec::encode)
                                                 .collect(Collectors.toList());
            var appendedEvents = append(configuration.resolveStreamName(aggregateId), serializedEvents, state.generation());
            return new CommandHandlingResult<>(aggregateId,
                                               batch,
                                               appendedEvents,
                                               state.generation(),
                                               state.generation().plus(appendedEvents.size()));
        }

        /**
         * Append the events in chunks of at most {@link AggregateTypeConfiguration#maxEventsPerAppend}.
         * Each chunk is appended atomically; a failing chunk leaves the previously appended chunks in the stream.
         */
        private List<PersistedEvent> append(EventStreamName streamName, List<SerializedEvent> serializedEvents, Generation loadedGeneration) {
            var expectedLatestEventOrder = EventOrder.of(loadedGeneration.longValue() - 1);
            var appendedEvents           = new ArrayList<PersistedEvent>(serializedEvents.size());
            for (int fromIndex = 0; fromIndex < serializedEvents.size(); fromIndex += configuration.maxEventsPerAppend) {
                var chunk = serializedEvents.subList(fromIndex, Math.min(fromIndex + configuration.maxEventsPerAppend, serializedEvents.size()));
                if (log.isTraceEnabled()) {
                    log.trace("[{}] Appending {} event(s) to stream '{}' with expectedLatestEventOrder {}: {}",
                              configuration.aggregateType,
                              chunk.size(),
                              streamName,
                              configuration.optimisticConcurrency ? expectedLatestEventOrder : "n/a",
                              chunk.stream().map(serializedEvent -> serializedEvent.eventType.toString()).collect(Collectors.joining(", ")));
                } else {
                    log.debug("[{}] Appending {} event(s) to stream '{}'", configuration.aggregateType, chunk.size(), streamName);
                }
                var appended = eventLog.appendToStream(streamName,
                                                       List.copyOf(chunk),
                                                       configuration.optimisticConcurrency ? Optional.of(expectedLatestEventOrder) : Optional.empty());
                appendedEvents.addAll(appended.eventList());
                expectedLatestEventOrder = appended.latestEventOrder();
            }
            return appendedEvents;
        }

        @Override
        public String toString() {
            return "DefaultEventSourcedAggregateRepository{" +
                    "configuration=" + configuration +
                    '}';
        }
    }
}
