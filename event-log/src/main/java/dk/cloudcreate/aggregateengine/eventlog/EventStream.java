package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.*;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable, ordered view of (a part of) the events stored in a named stream.<br>
 * The events are always in append order, i.e. ascending {@link PersistedEvent#eventOrder}
 */
public final class EventStream {
    public final EventStreamName      streamName;
    private final List<PersistedEvent> events;

    public EventStream(EventStreamName streamName, List<PersistedEvent> events) {
        this.streamName = requireNonNull(streamName, "You must supply a streamName");
        this.events = List.copyOf(requireNonNull(events, "You must supply an events list"));
    }

    public List<PersistedEvent> eventList() {
        return events;
    }

    public Stream<PersistedEvent> events() {
        return events.stream();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * @return the {@link EventOrder} of the last event in this stream view or {@link EventOrder#NO_EVENTS_PERSISTED} if the view is empty
     */
    public EventOrder latestEventOrder() {
        if (events.isEmpty()) {
            return EventOrder.NO_EVENTS_PERSISTED;
        }
        return events.get(events.size() - 1).eventOrder;
    }

    @Override
    public String toString() {
        return "EventStream{" +
                "streamName=" + streamName +
                ", events=" + events.size() +
                ", latestEventOrder=" + latestEventOrder() +
                '}';
    }
}
