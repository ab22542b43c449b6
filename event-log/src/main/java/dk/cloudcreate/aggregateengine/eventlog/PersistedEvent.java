package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * A {@link SerializedEvent} that has been appended to an {@link EventStream}, together with
 * its position ({@link #eventOrder}) within the stream and the (UTC) time it was appended
 */
public final class PersistedEvent {
    public final EventStreamName streamName;
    /**
     * Zero based position of the event within the {@link #streamName} stream
     */
    public final EventOrder      eventOrder;
    public final SerializedEvent event;
    public final OffsetDateTime  timestamp;

    public PersistedEvent(EventStreamName streamName,
                          EventOrder eventOrder,
                          SerializedEvent event,
                          OffsetDateTime timestamp) {
        this.streamName = requireNonNull(streamName, "You must supply a streamName");
        this.eventOrder = requireNonNull(eventOrder, "You must supply an eventOrder");
        this.event = requireNonNull(event, "You must supply an event");
        this.timestamp = requireNonNull(timestamp, "You must supply a timestamp");
    }

    public EventTypeName eventType() {
        return event.eventType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        PersistedEvent that = (PersistedEvent) o;
        return streamName.equals(that.streamName) &&
                eventOrder.equals(that.eventOrder) &&
                event.equals(that.event) &&
                timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, eventOrder, event, timestamp);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "streamName=" + streamName +
                ", eventOrder=" + eventOrder +
                ", eventType=" + event.eventType +
                ", timestamp=" + timestamp +
                '}';
    }
}
