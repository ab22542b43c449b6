package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.*;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Raised when an append was conditioned on an expected latest {@link EventOrder} that no longer matches the stream,
 * i.e. another writer appended to the same stream since the caller read it
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final EventStreamName streamName;
    public final EventOrder      expectedLatestEventOrder;
    public final EventOrder      actualLatestEventOrder;

    public OptimisticAppendToStreamException(EventStreamName streamName, EventOrder expectedLatestEventOrder, EventOrder actualLatestEventOrder) {
        super(msg("Expected expectedLatestEventOrder '{}' for stream '{}' but found '{}' (actualLatestEventOrder) in the EventLog",
                  expectedLatestEventOrder,
                  streamName,
                  actualLatestEventOrder));
        this.streamName = streamName;
        this.expectedLatestEventOrder = expectedLatestEventOrder;
        this.actualLatestEventOrder = actualLatestEventOrder;
    }
}
