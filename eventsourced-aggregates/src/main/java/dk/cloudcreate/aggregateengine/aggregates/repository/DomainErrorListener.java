package dk.cloudcreate.aggregateengine.aggregates.repository;

import dk.cloudcreate.aggregateengine.aggregates.*;

/**
 * Notified by the {@link EventSourcedAggregateRepository} about every command that was rejected, so the rejection
 * can be reported back to whoever issued the command (e.g. using the {@link DomainError#correlationId()})
 *
 * @param <ID>           the entity key type
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 */
@FunctionalInterface
public interface DomainErrorListener<ID, COMMAND_TYPE, ERROR_TYPE extends DomainError> {
    /**
     * @param aggregateType the aggregate type
     * @param aggregateId   the key of the entity the command was addressed to
     * @param command       the rejected command
     * @param error         the reason the command was rejected
     */
    void onCommandRejected(AggregateType aggregateType, ID aggregateId, COMMAND_TYPE command, ERROR_TYPE error);
}
