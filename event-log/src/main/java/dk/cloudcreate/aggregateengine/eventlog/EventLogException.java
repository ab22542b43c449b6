package dk.cloudcreate.aggregateengine.eventlog;

/**
 * Base exception for failures raised by an {@link EventLog} or by the encoding/decoding of the events it stores
 */
public class EventLogException extends RuntimeException {
    public EventLogException(String message) {
        super(message);
    }

    public EventLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
