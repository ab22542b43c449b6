package dk.cloudcreate.aggregateengine.eventlog.serializer;

import dk.cloudcreate.aggregateengine.eventlog.types.EventTypeName;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The type tag of a persisted event has no domain event mapping, e.g. because the event was written
 * by a newer version of the application than the one reading it
 */
public class UnknownEventTypeException extends EventDecodingException {
    public final EventTypeName eventType;
    public final Class<?>      rootEventType;

    public UnknownEventTypeException(EventTypeName eventType, Class<?> rootEventType) {
        super(msg("No '{}' event is registered under event type '{}'",
                  rootEventType.getName(),
                  eventType));
        this.eventType = eventType;
        this.rootEventType = rootEventType;
    }
}
