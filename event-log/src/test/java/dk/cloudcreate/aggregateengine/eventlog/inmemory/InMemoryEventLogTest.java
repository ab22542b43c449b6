package dk.cloudcreate.aggregateengine.eventlog.inmemory;

import dk.cloudcreate.aggregateengine.eventlog.*;
import dk.cloudcreate.aggregateengine.eventlog.types.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class InMemoryEventLogTest {
    private static final OffsetDateTime NOW = OffsetDateTime.of(2022, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private InMemoryEventLog eventLog;

    @BeforeEach
    void setup() {
        eventLog = new InMemoryEventLog(Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
    }

    @Test
    void fetching_a_stream_that_has_never_been_appended_to_returns_empty() {
        assertThat(eventLog.fetchStream(EventStreamName.of("account-1"))).isEmpty();
        assertThat(eventLog.latestEventOrder(EventStreamName.of("account-1")).longValue()).isEqualTo(-1L);
    }

    @Test
    void appended_events_are_read_back_in_append_order_with_consecutive_event_orders() {
        // Given
        var streamName = EventStreamName.of("account", "1");

        // When
        var firstAppend = eventLog.appendToStream(streamName, List.of(SerializedEvent.of("funds-deposited", "{\"amount\":1}"),
                                                                      SerializedEvent.of("funds-deposited", "{\"amount\":2}")));
        var secondAppend = eventLog.appendToStream(streamName, List.of(SerializedEvent.of("funds-withdrawn", "{\"amount\":3}")));

        // Then
        assertThat(firstAppend.size()).isEqualTo(2);
        assertThat(firstAppend.latestEventOrder().longValue()).isEqualTo(1L);
        assertThat(secondAppend.eventList().get(0).eventOrder.longValue()).isEqualTo(2L);

        var stream = eventLog.fetchStream(streamName).get();
        assertThat((CharSequence) stream.streamName).isEqualTo(EventStreamName.of("account-1"));
        assertThat(stream.size()).isEqualTo(3);
        assertThat(stream.eventList().get(0).eventOrder.longValue()).isEqualTo(0L);
        assertThat(stream.eventList().get(0).event.jsonPayload).isEqualTo("{\"amount\":1}");
        assertThat(stream.eventList().get(1).event.jsonPayload).isEqualTo("{\"amount\":2}");
        assertThat((CharSequence) stream.eventList().get(2).eventType()).isEqualTo(EventTypeName.of("funds-withdrawn"));
        assertThat(stream.eventList().get(2).timestamp).isEqualTo(NOW);
        assertThat(stream.latestEventOrder().longValue()).isEqualTo(2L);
    }

    @Test
    void streams_are_independent_of_each_other() {
        // When
        eventLog.appendToStream(EventStreamName.of("account-1"), List.of(SerializedEvent.of("funds-deposited", "{}")));
        eventLog.appendToStream(EventStreamName.of("account-2"), List.of(SerializedEvent.of("funds-deposited", "{}"),
                                                                         SerializedEvent.of("funds-deposited", "{}")));

        // Then
        assertThat(eventLog.fetchStream(EventStreamName.of("account-1")).get().size()).isEqualTo(1);
        assertThat(eventLog.fetchStream(EventStreamName.of("account-2")).get().size()).isEqualTo(2);
        assertThat(eventLog.streamNames()).containsExactlyInAnyOrder(EventStreamName.of("account-1"), EventStreamName.of("account-2"));
    }

    @Test
    void append_with_a_matching_expected_latest_event_order_succeeds() {
        // Given
        var streamName = EventStreamName.of("account-1");

        // When
        eventLog.appendToStream(streamName, List.of(SerializedEvent.of("funds-deposited", "{}")), Optional.of(EventOrder.NO_EVENTS_PERSISTED));
        eventLog.appendToStream(streamName, List.of(SerializedEvent.of("funds-deposited", "{}")), Optional.of(EventOrder.of(0)));

        // Then
        assertThat(eventLog.latestEventOrder(streamName).longValue()).isEqualTo(1L);
    }

    @Test
    void append_with_a_stale_expected_latest_event_order_is_rejected_and_leaves_the_stream_untouched() {
        // Given
        var streamName = EventStreamName.of("account-1");
        eventLog.appendToStream(streamName, List.of(SerializedEvent.of("funds-deposited", "{}"),
                                                    SerializedEvent.of("funds-deposited", "{}")));

        // When
        var thrown = catchThrowable(() -> eventLog.appendToStream(streamName,
                                                                  List.of(SerializedEvent.of("funds-withdrawn", "{}")),
                                                                  Optional.of(EventOrder.of(0))));

        // Then
        assertThat(thrown).isExactlyInstanceOf(OptimisticAppendToStreamException.class);
        var exception = (OptimisticAppendToStreamException) thrown;
        assertThat(exception.expectedLatestEventOrder.longValue()).isEqualTo(0L);
        assertThat(exception.actualLatestEventOrder.longValue()).isEqualTo(1L);
        assertThat(eventLog.fetchStream(streamName).get().size()).isEqualTo(2);
    }

    @Test
    void a_rejected_append_to_a_new_stream_does_not_create_the_stream() {
        // When
        assertThatThrownBy(() -> eventLog.appendToStream(EventStreamName.of("account-1"),
                                                         List.of(SerializedEvent.of("funds-deposited", "{}")),
                                                         Optional.of(EventOrder.of(5))))
                .isInstanceOf(OptimisticAppendToStreamException.class);

        // Then
        assertThat(eventLog.fetchStream(EventStreamName.of("account-1"))).isEmpty();
        assertThat(eventLog.streamNames()).isEmpty();
    }

    @Test
    void appending_an_empty_list_of_events_is_rejected() {
        assertThatThrownBy(() -> eventLog.appendToStream(EventStreamName.of("account-1"), List.of()))
                .isExactlyInstanceOf(AppendToStreamException.class);
    }

    @Test
    void concurrent_appends_to_the_same_stream_never_lose_or_duplicate_event_orders() throws Exception {
        // Given
        var streamName = EventStreamName.of("account-1");
        var executor   = Executors.newFixedThreadPool(8);
        var appends    = 200;

        // When
        try {
            var futures = IntStream.range(0, appends)
                                   .mapToObj(i -> executor.submit(() -> eventLog.appendToStream(streamName,
                                                                                                List.of(SerializedEvent.of("funds-deposited", "{\"i\":" + i + "}")))))
                                   .toList();
            for (Future<EventStream> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        var stream = eventLog.fetchStream(streamName).get();
        assertThat(stream.size()).isEqualTo(appends);
        for (int i = 0; i < appends; i++) {
            assertThat(stream.eventList().get(i).eventOrder.longValue()).isEqualTo((long) i);
        }
    }
}
