package dk.cloudcreate.aggregateengine.aggregates;

/**
 * Raised when an aggregate implementation breaks the contract of {@link AggregateState}, e.g. by not handling an event
 * or command variant. Never used for rejected commands, those are reported as {@link DomainError}'s.
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
