package dk.cloudcreate.aggregateengine.aggregates;

/**
 * The current, projected view of one entity (the aggregate) together with the two operations that define its behaviour:
 * <ul>
 *     <li>{@link #apply(Object)} - the state transition for an event</li>
 *     <li>{@link #execute(Object)} - the decision whether a command is accepted (and which events it results in) or rejected</li>
 * </ul>
 * Implementations are immutable values: {@link #apply(Object)} returns a new instance and neither operation changes the
 * instance it is invoked on. The only way to obtain a state with history is to fold events onto the seed state
 * (see {@link AggregateStateFactory} and {@link dk.cloudcreate.aggregateengine.aggregates.projection.Projector}).<br>
 * Most implementations extend {@link ImmutableAggregateState}, which enforces the generation bookkeeping.
 *
 * @param <ID>           the entity key type
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 * @param <STATE_TYPE>   the concrete state type (self type)
 */
public interface AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE> {
    /**
     * @return the key of the entity this state belongs to
     */
    ID aggregateId();

    /**
     * @return the number of events applied to reach this state
     */
    Generation generation();

    /**
     * Deterministic and total state transition: every event variant has exactly one corresponding transition.
     *
     * @param event the event to apply
     * @return the new state, with a {@link #generation()} one higher than this state's
     */
    STATE_TYPE apply(EVENT_TYPE event);

    /**
     * Validate the command against this state (and only this state)
     *
     * @param command the command to validate
     * @return the accepted events or the reason the command was rejected
     */
    CommandResult<EVENT_TYPE, ERROR_TYPE> execute(COMMAND_TYPE command);
}
