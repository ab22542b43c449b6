package dk.cloudcreate.aggregateengine.aggregates;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Base class for {@link AggregateState} implementations that are immutable values.<br>
 * The base class owns the {@link #aggregateId()} and the {@link #generation()} and verifies the result of every state transition,
 * so a concrete state only has to implement:
 * <ul>
 *     <li>{@link #whenApplied(Object, Generation)} - create the successor state for an event</li>
 *     <li>{@link #decide(Object)} - accept or reject a command</li>
 * </ul>
 * Example:
 * <pre>{@code
 * public final class BankAccount extends ImmutableAggregateState<AccountId, BankEvent, BankCommand, AccountError, BankAccount> {
 *     public final long balance;
 *
 *     @Override
 *     protected BankAccount whenApplied(BankEvent event, Generation nextGeneration) {
 *         if (event instanceof BankEvent.FundsDeposited) {
 *             return new BankAccount(aggregateId(), balance + ((BankEvent.FundsDeposited) event).amount(), nextGeneration);
 *         }
 *         ...
 *         throw unhandled(event);
 *     }
 * }
 * }</pre>
 * Both template methods MUST end in {@link #unhandled(Object)} / {@link #unhandledCommand(Object)} instead of silently ignoring a variant.
 *
 * @param <ID>           the entity key type
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 * @param <STATE_TYPE>   the concrete state type (self type)
 */
public abstract class ImmutableAggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends ImmutableAggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>>
        implements AggregateState<ID, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE> {
    private final ID         aggregateId;
    private final Generation generation;

    protected ImmutableAggregateState(ID aggregateId, Generation generation) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.generation = requireNonNull(generation, "You must supply a generation");
    }

    @Override
    public final ID aggregateId() {
        return aggregateId;
    }

    @Override
    public final Generation generation() {
        return generation;
    }

    @Override
    public final STATE_TYPE apply(EVENT_TYPE event) {
        requireNonNull(event, "You must supply an event");
        var nextGeneration = generation.increaseAndGet();
        var newState       = whenApplied(event, nextGeneration);
        if (newState == null) {
            throw new AggregateException(msg("'{}' returned no state when applying '{}'",
                                             getClass().getName(),
                                             event.getClass().getName()));
        }
        if (newState == this) {
            throw new AggregateException(msg("'{}' must return a new state instance when applying '{}'",
                                             getClass().getName(),
                                             event.getClass().getName()));
        }
        if (!nextGeneration.equals(newState.generation())) {
            throw new AggregateException(msg("'{}' returned generation {} when applying '{}' to generation {}. Expected generation {}",
                                             getClass().getName(),
                                             newState.generation(),
                                             event.getClass().getName(),
                                             generation,
                                             nextGeneration));
        }
        if (!Objects.equals(aggregateId, newState.aggregateId())) {
            throw new AggregateException(msg("'{}' changed the aggregateId from '{}' to '{}' when applying '{}'",
                                             getClass().getName(),
                                             aggregateId,
                                             newState.aggregateId(),
                                             event.getClass().getName()));
        }
        return newState;
    }

    @Override
    public final CommandResult<EVENT_TYPE, ERROR_TYPE> execute(COMMAND_TYPE command) {
        requireNonNull(command, "You must supply a command");
        var result = decide(command);
        if (result == null) {
            throw new AggregateException(msg("'{}' returned no result for command '{}'",
                                             getClass().getName(),
                                             command.getClass().getName()));
        }
        return result;
    }

    /**
     * Create the successor of this state for the given event
     *
     * @param event          the event to apply
     * @param nextGeneration the generation the returned state MUST have
     * @return a new state instance
     */
    protected abstract STATE_TYPE whenApplied(EVENT_TYPE event, Generation nextGeneration);

    /**
     * Validate the command against this state
     *
     * @param command the command
     * @return {@link CommandResult#accepted(Object[])} with the resulting events or {@link CommandResult#rejected(DomainError)}
     */
    protected abstract CommandResult<EVENT_TYPE, ERROR_TYPE> decide(COMMAND_TYPE command);

    protected final UnhandledEventException unhandled(EVENT_TYPE event) {
        return new UnhandledEventException(getClass(), event.getClass());
    }

    protected final UnhandledCommandException unhandledCommand(COMMAND_TYPE command) {
        return new UnhandledCommandException(getClass(), command.getClass());
    }

    /**
     * Compares the {@link #aggregateId()} and {@link #generation()} - concrete states add their own fields
     */
    protected final boolean baseEquals(ImmutableAggregateState<?, ?, ?, ?, ?> that) {
        return aggregateId.equals(that.aggregateId) && generation.equals(that.generation);
    }
}
