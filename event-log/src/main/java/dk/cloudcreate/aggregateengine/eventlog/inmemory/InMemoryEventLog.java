package dk.cloudcreate.aggregateengine.eventlog.inmemory;

import dk.cloudcreate.aggregateengine.eventlog.*;
import dk.cloudcreate.aggregateengine.eventlog.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thread safe {@link EventLog} that keeps all streams in memory.<br>
 * Appends to the same stream are serialized, appends to different streams don't block each other.
 * Intended for tests and for single process setups where durability isn't required.
 */
public class InMemoryEventLog implements EventLog {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventLog.class);

    private final ConcurrentHashMap<EventStreamName, List<PersistedEvent>> streams = new ConcurrentHashMap<>();
    private final Clock                                                    clock;

    public InMemoryEventLog() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock the clock used to timestamp appended events
     */
    public InMemoryEventLog(Clock clock) {
        this.clock = requireNonNull(clock, "You must supply a clock");
    }

    @Override
    public Optional<EventStream> fetchStream(EventStreamName streamName) {
        requireNonNull(streamName, "You must supply a streamName");
        var events = streams.get(streamName);
        if (events == null) {
            log.trace("Stream '{}' doesn't exist", streamName);
            return Optional.empty();
        }
        synchronized (events) {
            if (events.isEmpty()) {
                log.trace("Stream '{}' doesn't contain any events", streamName);
                return Optional.empty();
            }
            log.trace("Fetched {} event(s) from stream '{}'", events.size(), streamName);
            return Optional.of(new EventStream(streamName, events));
        }
    }

    @Override
    public EventStream appendToStream(EventStreamName streamName,
                                      List<SerializedEvent> eventsToAppend,
                                      Optional<EventOrder> expectedLatestEventOrder) {
        requireNonNull(streamName, "You must supply a streamName");
        requireNonNull(eventsToAppend, "You must supply an events list");
        requireNonNull(expectedLatestEventOrder, "You must supply an expectedLatestEventOrder Optional");
        if (eventsToAppend.isEmpty()) {
            throw new AppendToStreamException(msg("Cannot append an empty list of events to stream '{}'", streamName));
        }
        eventsToAppend.forEach(event -> requireNonNull(event, msg("Cannot append a null event to stream '{}'", streamName)));

        var events = streams.computeIfAbsent(streamName, name -> new ArrayList<>());
        synchronized (events) {
            var actualLatestEventOrder = events.isEmpty() ? EventOrder.NO_EVENTS_PERSISTED : events.get(events.size() - 1).eventOrder;
            if (expectedLatestEventOrder.isPresent() && !expectedLatestEventOrder.get().equals(actualLatestEventOrder)) {
                log.debug("Rejecting append of {} event(s) to stream '{}': expectedLatestEventOrder {} != actualLatestEventOrder {}",
                          eventsToAppend.size(),
                          streamName,
                          expectedLatestEventOrder.get(),
                          actualLatestEventOrder);
                throw new OptimisticAppendToStreamException(streamName, expectedLatestEventOrder.get(), actualLatestEventOrder);
            }

            var timestamp  = OffsetDateTime.now(clock);
            var eventOrder = actualLatestEventOrder;
            var appended   = new ArrayList<PersistedEvent>(eventsToAppend.size());
            for (var event : eventsToAppend) {
                eventOrder = eventOrder.increaseAndGet();
                appended.add(new PersistedEvent(streamName, eventOrder, event, timestamp));
            }
            events.addAll(appended);
            log.debug("Appended {} event(s) to stream '{}'. Latest eventOrder is now {}", appended.size(), streamName, eventOrder);
            return new EventStream(streamName, appended);
        }
    }

    /**
     * @return the names of all streams that contain at least one event
     */
    public Set<EventStreamName> streamNames() {
        var names = new HashSet<EventStreamName>();
        streams.forEach((name, events) -> {
            synchronized (events) {
                if (!events.isEmpty()) {
                    names.add(name);
                }
            }
        });
        return names;
    }

    @Override
    public String toString() {
        return "InMemoryEventLog{" +
                "streams=" + streams.size() +
                '}';
    }
}
