package dk.cloudcreate.aggregateengine.eventlog.serializer;

import dk.cloudcreate.aggregateengine.eventlog.*;
import dk.cloudcreate.aggregateengine.eventlog.types.EventTypeName;

/**
 * Converts domain events to and from their persisted {@link SerializedEvent} representation.<br>
 * A codec must be total over its event type: every event it can be asked to encode has exactly one
 * {@link EventTypeName}, and every {@link EventTypeName} it produces can be decoded again.
 *
 * @param <EVENT_TYPE> the (sealed) root type of the domain events
 */
public interface EventCodec<EVENT_TYPE> {
    /**
     * @param event the domain event
     * @return the persisted representation of the event
     * @throws dk.cloudcreate.aggregateengine.eventlog.serializer.json.JSONSerializationException in case the event couldn't be serialized
     */
    SerializedEvent encode(EVENT_TYPE event);

    /**
     * @param serializedEvent the persisted representation of an event
     * @return the domain event
     * @throws UnknownEventTypeException in case the {@link SerializedEvent#eventType} has no known domain event mapping
     * @throws EventDecodingException    in case the payload couldn't be decoded
     */
    EVENT_TYPE decode(SerializedEvent serializedEvent);

    /**
     * Decode the event contained in a {@link PersistedEvent}
     *
     * @see #decode(SerializedEvent)
     */
    default EVENT_TYPE decode(PersistedEvent persistedEvent) {
        return decode(persistedEvent.event);
    }

    /**
     * @return the root type of the events this codec supports
     */
    Class<EVENT_TYPE> eventType();
}
