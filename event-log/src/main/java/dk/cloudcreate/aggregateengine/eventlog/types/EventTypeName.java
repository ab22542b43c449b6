package dk.cloudcreate.aggregateengine.eventlog.types;

import dk.cloudcreate.essentials.types.*;

/**
 * The string tag a persisted event is stored under, e.g. <code>funds-withdrawn</code>.<br>
 * The tag is the only type information the log keeps about an event; mapping it back to
 * a Java type is the responsibility of an {@link dk.cloudcreate.aggregateengine.eventlog.serializer.EventCodec}
 */
public class EventTypeName extends CharSequenceType<EventTypeName> implements Identifier {
    public EventTypeName(CharSequence value) {
        super(value);
    }

    public static EventTypeName of(CharSequence value) {
        return new EventTypeName(value);
    }
}
