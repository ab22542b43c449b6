package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.*;

import java.util.*;

/**
 * Write side of an {@link EventLog}
 */
public interface EventStreamAppender {
    /**
     * Atomically append the <code>events</code> to the named stream (which is created if it doesn't exist).<br>
     * Either all events are appended or none are.
     *
     * @param streamName               the name of the stream
     * @param events                   the events to append, in order. Must contain at least one event
     * @param expectedLatestEventOrder if present, the append is only performed if the {@link PersistedEvent#eventOrder} of the
     *                                 last event currently in the stream is equal to this value ({@link EventOrder#NO_EVENTS_PERSISTED} for a stream
     *                                 that must not exist yet)
     * @return the newly appended part of the stream
     * @throws OptimisticAppendToStreamException if <code>expectedLatestEventOrder</code> is present and doesn't match the stream
     * @throws AppendToStreamException           in case the events couldn't be appended
     */
    EventStream appendToStream(EventStreamName streamName,
                               List<SerializedEvent> events,
                               Optional<EventOrder> expectedLatestEventOrder);

    /**
     * Append <code>events</code> to the named stream without any optimistic concurrency check
     *
     * @see #appendToStream(EventStreamName, List, Optional)
     */
    default EventStream appendToStream(EventStreamName streamName, List<SerializedEvent> events) {
        return appendToStream(streamName, events, Optional.empty());
    }
}
