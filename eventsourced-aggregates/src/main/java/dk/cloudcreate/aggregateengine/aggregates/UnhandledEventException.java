package dk.cloudcreate.aggregateengine.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * An event variant reached {@link AggregateState#apply(Object)} without a matching state transition
 */
public class UnhandledEventException extends AggregateException {
    public final Class<?> aggregateStateType;
    public final Class<?> eventType;

    public UnhandledEventException(Class<?> aggregateStateType, Class<?> eventType) {
        super(msg("'{}' doesn't define a state transition for event '{}'",
                  aggregateStateType.getName(),
                  eventType.getName()));
        this.aggregateStateType = aggregateStateType;
        this.eventType = eventType;
    }
}
