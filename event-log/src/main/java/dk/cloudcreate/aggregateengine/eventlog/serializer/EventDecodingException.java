package dk.cloudcreate.aggregateengine.eventlog.serializer;

import dk.cloudcreate.aggregateengine.eventlog.EventLogException;

/**
 * A persisted event couldn't be turned back into a domain event. Fatal for the read/replay that encountered it.
 */
public class EventDecodingException extends EventLogException {
    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
