package dk.cloudcreate.aggregateengine.eventlog.types;

import dk.cloudcreate.aggregateengine.eventlog.EventStream;
import dk.cloudcreate.essentials.types.LongType;

/**
 * Each event has its own unique position within a stream, also known as the event-order,
 * which defines the order in which the events were appended to the {@link EventStream}<br>
 * <br>
 * The first eventOrder has value 0 and the event order grows by exactly one for each appended event.<br>
 * This is also commonly called the version or sequenceNumber.
 */
public class EventOrder extends LongType<EventOrder> {
    /**
     * Special value that signifies that no events have been persisted in the stream
     */
    public static final EventOrder NO_EVENTS_PERSISTED = EventOrder.of(-1);
    /**
     * The {@link EventOrder} of the FIRST event appended to a stream
     */
    public static final EventOrder FIRST_EVENT_ORDER   = EventOrder.of(0);

    public EventOrder(Long value) {
        super(value);
    }

    public static EventOrder of(long value) {
        return new EventOrder(value);
    }

    public EventOrder increaseAndGet() {
        return new EventOrder(value() + 1);
    }
}
