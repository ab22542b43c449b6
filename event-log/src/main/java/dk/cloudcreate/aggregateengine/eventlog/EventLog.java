package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.*;

/**
 * An append-only log that keeps one named {@link EventStream} per entity
 *
 * @see dk.cloudcreate.aggregateengine.eventlog.inmemory.InMemoryEventLog
 */
public interface EventLog extends EventStreamReader, EventStreamAppender {
    /**
     * @param streamName the name of the stream
     * @return the {@link EventOrder} of the last event appended to the stream or {@link EventOrder#NO_EVENTS_PERSISTED}
     */
    default EventOrder latestEventOrder(EventStreamName streamName) {
        return fetchStream(streamName).map(EventStream::latestEventOrder)
                                      .orElse(EventOrder.NO_EVENTS_PERSISTED);
    }
}
