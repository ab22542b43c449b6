package dk.cloudcreate.aggregateengine.aggregates;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A command variant reached {@link AggregateState#execute(Object)} without a matching decision
 */
public class UnhandledCommandException extends AggregateException {
    public final Class<?> aggregateStateType;
    public final Class<?> commandType;

    public UnhandledCommandException(Class<?> aggregateStateType, Class<?> commandType) {
        super(msg("'{}' doesn't know how to execute command '{}'",
                  aggregateStateType.getName(),
                  commandType.getName()));
        this.aggregateStateType = aggregateStateType;
        this.commandType = commandType;
    }
}
