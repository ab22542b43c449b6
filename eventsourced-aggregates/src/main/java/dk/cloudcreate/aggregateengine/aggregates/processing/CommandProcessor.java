package dk.cloudcreate.aggregateengine.aggregates.processing;

import dk.cloudcreate.aggregateengine.aggregates.*;
import dk.cloudcreate.aggregateengine.aggregates.projection.Projector;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Validates one or more commands against an {@link AggregateState} and collects the resulting events and errors.<br>
 * The processor has no side effects: it neither touches the event log nor changes the state it's given. Encoding and
 * appending the {@link CommandBatchResult#acceptedEvents()} is up to the caller.<br>
 * A rejected command never aborts the batch - every command gets its own {@link CommandOutcome}.
 *
 * @param <EVENT_TYPE>   the root type of the events
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <ERROR_TYPE>   the root type of the domain errors
 * @param <STATE_TYPE>   the state type
 * @see BatchValidationPolicy
 */
public final class CommandProcessor<EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE extends DomainError, STATE_TYPE extends AggregateState<?, EVENT_TYPE, COMMAND_TYPE, ERROR_TYPE, STATE_TYPE>> {
    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    private final BatchValidationPolicy policy;

    public CommandProcessor(BatchValidationPolicy policy) {
        this.policy = requireNonNull(policy, "You must supply a BatchValidationPolicy");
    }

    public BatchValidationPolicy policy() {
        return policy;
    }

    /**
     * Validate a single command
     *
     * @param state   the current state
     * @param command the command
     * @return the outcome of the command
     */
    public CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE> process(STATE_TYPE state, COMMAND_TYPE command) {
        return process(state, List.of(requireNonNull(command, "You must supply a command"))).outcome(0);
    }

    /**
     * Validate the commands in order, using the configured {@link BatchValidationPolicy}
     *
     * @param state    the current state
     * @param commands the commands in the order they were submitted
     * @return one outcome per command, in the order of <code>commands</code>
     */
    public CommandBatchResult<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE> process(STATE_TYPE state, List<? extends COMMAND_TYPE> commands) {
        requireNonNull(state, "You must supply a state");
        requireNonNull(commands, "You must supply a commands list");

        var outcomes        = new ArrayList<CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE>>(commands.size());
        var validationState = state;
        for (int index = 0; index < commands.size(); index++) {
            COMMAND_TYPE command = requireNonNull(commands.get(index), "Commands cannot be null");
            var          result  = validationState.execute(command);
            outcomes.add(new CommandOutcome<>(index, command, result, validationState.generation()));

            if (result.isAccepted()) {
                if (log.isTraceEnabled()) {
                    log.trace("Command '{}' for '{}' was accepted at generation {} with {} event(s): {}",
                              command.getClass().getSimpleName(),
                              state.aggregateId(),
                              validationState.generation(),
                              result.events().size(),
                              result.events());
                } else {
                    log.debug("Command '{}' for '{}' was accepted at generation {} with {} event(s)",
                              command.getClass().getSimpleName(),
                              state.aggregateId(),
                              validationState.generation(),
                              result.events().size());
                }
                if (policy == BatchValidationPolicy.CUMULATIVE) {
                    validationState = Projector.fold(validationState, result.events());
                }
            } else {
                log.debug("Command '{}' for '{}' was rejected at generation {}: {}",
                          command.getClass().getSimpleName(),
                          state.aggregateId(),
                          validationState.generation(),
                          result.error().map(DomainError::description).orElse(""));
            }
        }
        return new CommandBatchResult<>(policy, state.generation(), outcomes);
    }

    @Override
    public String toString() {
        return "CommandProcessor{" +
                "policy=" + policy +
                '}';
    }
}
