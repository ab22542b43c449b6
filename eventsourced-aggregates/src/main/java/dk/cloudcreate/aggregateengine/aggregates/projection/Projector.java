package dk.cloudcreate.aggregateengine.aggregates.projection;

import dk.cloudcreate.aggregateengine.aggregates.*;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Reconstructs the current {@link AggregateState} of an entity by performing a left fold of
 * {@link AggregateState#apply(Object)} over its event history, starting from the seed state.<br>
 * The events are applied strictly in the order they are supplied in - the projector never sorts, de-duplicates or
 * reorders them, so the caller must supply them in append order.
 *
 * @param <ID>         the entity key type
 * @param <EVENT_TYPE> the root type of the events
 * @param <STATE_TYPE> the state type
 */
public final class Projector<ID, EVENT_TYPE, STATE_TYPE extends AggregateState<ID, EVENT_TYPE, ?, ?, STATE_TYPE>> {
    private final AggregateStateFactory<ID, STATE_TYPE> stateFactory;

    public Projector(AggregateStateFactory<ID, STATE_TYPE> stateFactory) {
        this.stateFactory = requireNonNull(stateFactory, "You must supply a stateFactory");
    }

    /**
     * @param aggregateId the entity key
     * @return the state of an entity without history
     */
    public STATE_TYPE seed(ID aggregateId) {
        requireNonNull(aggregateId, "You must supply an aggregateId");
        return requireNonNull(stateFactory.seed(aggregateId), "The stateFactory returned a null seed state");
    }

    /**
     * Fold the events onto the seed state of the entity
     *
     * @param aggregateId the entity key
     * @param events      the entity's events in append order
     * @return the current state
     */
    public STATE_TYPE project(ID aggregateId, Iterable<? extends EVENT_TYPE> events) {
        return fold(seed(aggregateId), events);
    }

    /**
     * Fold the events onto the seed state of the entity
     *
     * @param aggregateId the entity key
     * @param events      the entity's events in append order
     * @return the current state
     */
    public STATE_TYPE project(ID aggregateId, Stream<? extends EVENT_TYPE> events) {
        requireNonNull(events, "You must supply an events stream");
        var state = seed(aggregateId);
        for (Iterator<? extends EVENT_TYPE> iterator = events.iterator(); iterator.hasNext(); ) {
            state = state.apply(iterator.next());
        }
        return state;
    }

    /**
     * Decode and fold the persisted events onto the seed state of the entity.<br>
     * A failure to decode any of the events propagates to the caller; a partially projected state is never returned.
     *
     * @param aggregateId     the entity key
     * @param persistedEvents the entity's persisted events in append order
     * @param decoder         converts a persisted event to a domain event
     * @param <PERSISTED>     the persisted event type
     * @return the current state
     */
    public <PERSISTED> STATE_TYPE projectPersisted(ID aggregateId,
                                                   List<PERSISTED> persistedEvents,
                                                   Function<? super PERSISTED, ? extends EVENT_TYPE> decoder) {
        requireNonNull(persistedEvents, "You must supply a persistedEvents list");
        requireNonNull(decoder, "You must supply a decoder");
        var state = seed(aggregateId);
        for (var persistedEvent : persistedEvents) {
            state = state.apply(decoder.apply(persistedEvent));
        }
        return state;
    }

    /**
     * Fold the events onto an arbitrary state, e.g. to calculate the state that results from the events of an accepted command
     *
     * @param state        the state to start from
     * @param events       the events to apply in order
     * @param <EVENT_TYPE> the root type of the events
     * @param <STATE_TYPE> the state type
     * @return the resulting state (the same <code>state</code> instance if <code>events</code> is empty)
     */
    public static <EVENT_TYPE, STATE_TYPE extends AggregateState<?, EVENT_TYPE, ?, ?, STATE_TYPE>> STATE_TYPE fold(STATE_TYPE state,
                                                                                                                   Iterable<? extends EVENT_TYPE> events) {
        requireNonNull(state, "You must supply a state");
        requireNonNull(events, "You must supply events");
        var result = state;
        for (var event : events) {
            result = result.apply(event);
        }
        return result;
    }
}
