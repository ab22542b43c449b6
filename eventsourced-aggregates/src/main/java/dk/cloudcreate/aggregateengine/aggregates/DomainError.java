package dk.cloudcreate.aggregateengine.aggregates;

import dk.cloudcreate.aggregateengine.common.types.CorrelationId;

import java.util.Optional;

/**
 * Root type for the reasons an aggregate rejects a command.<br>
 * Domain errors are values returned through {@link CommandResult#rejected(DomainError)} and are never persisted.
 * Implementations are typically <code>record</code>'s in a <code>sealed</code> hierarchy per aggregate type that carry the
 * identifiers needed to act on the error (which entity, which sub-record).
 */
public interface DomainError {
    /**
     * @return human readable description of the precondition that the command failed
     */
    String description();

    /**
     * @return the correlation id of the rejected command, if the command carried one
     */
    default Optional<CorrelationId> correlationId() {
        return Optional.empty();
    }
}
