package dk.cloudcreate.aggregateengine.aggregates.repository;

import dk.cloudcreate.aggregateengine.aggregates.*;
import dk.cloudcreate.aggregateengine.aggregates.processing.CommandBatchResult;
import dk.cloudcreate.aggregateengine.eventlog.PersistedEvent;

import java.util.List;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The result of {@link EventSourcedAggregateRepository#handle(Object, List)}
 *
 * @param <ID>           the entity key type
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 */
public final class CommandHandlingResult<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError> {
    public final ID                                                   aggregateId;
    /**
     * The per command outcomes
     */
    public final CommandBatchResult<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE> batch;
    /**
     * The events that were appended to the event log (empty if no command was accepted)
     */
    public final List<PersistedEvent>                                 appendedEvents;
    /**
     * The generation of the state the commands were processed against
     */
    public final Generation                                           generationBefore;
    /**
     * The generation of the state after the appended events
     */
    public final Generation                                           generationAfter;

    public CommandHandlingResult(ID aggregateId,
                                 CommandBatchResult<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE> batch,
                                 List<PersistedEvent> appendedEvents,
                                 Generation generationBefore,
                                 Generation generationAfter) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.batch = requireNonNull(batch, "You must supply a batch");
        this.appendedEvents = List.copyOf(requireNonNull(appendedEvents, "You must supply appendedEvents"));
        this.generationBefore = requireNonNull(generationBefore, "You must supply generationBefore");
        this.generationAfter = requireNonNull(generationAfter, "You must supply generationAfter");
    }

    /**
     * @return true if nothing was appended to the event log
     */
    public boolean isNoOp() {
        return appendedEvents.isEmpty();
    }

    public boolean hasRejections() {
        return batch.hasRejections();
    }

    @Override
    public String toString() {
        return "CommandHandlingResult{" +
                "aggregateId=" + aggregateId +
                ", batch=" + batch +
                ", appendedEvents=" + appendedEvents.size() +
                ", generationBefore=" + generationBefore +
                ", generationAfter=" + generationAfter +
                '}';
    }
}
