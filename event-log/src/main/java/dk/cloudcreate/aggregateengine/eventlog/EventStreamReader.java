package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.EventStreamName;

import java.util.Optional;

/**
 * Read side of an {@link EventLog}
 */
public interface EventStreamReader {
    /**
     * Read all events in the named stream, from the beginning and in append order
     *
     * @param streamName the name of the stream
     * @return the complete stream or {@link Optional#empty()} if nothing has ever been appended to the stream
     * @throws EventLogException in case the log couldn't be read
     */
    Optional<EventStream> fetchStream(EventStreamName streamName);
}
