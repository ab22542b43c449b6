package dk.cloudcreate.aggregateengine.aggregates.processing;

import dk.cloudcreate.aggregateengine.aggregates.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The outcomes of a batch of commands processed by the {@link CommandProcessor}: one {@link CommandOutcome} per command,
 * in the order the commands were supplied in
 *
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <EVENT_TYPE>   the root type of the events
 * @param <ERROR_TYPE>   the root type of the domain errors
 */
public final class CommandBatchResult<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE extends DomainError> {
    public final BatchValidationPolicy                                    policy;
    /**
     * The generation of the state the batch was started with
     */
    public final Generation                                               initialGeneration;
    private final List<CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE>> outcomes;

    public CommandBatchResult(BatchValidationPolicy policy,
                              Generation initialGeneration,
                              List<CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE>> outcomes) {
        this.policy = requireNonNull(policy, "You must supply a policy");
        this.initialGeneration = requireNonNull(initialGeneration, "You must supply the initialGeneration");
        this.outcomes = List.copyOf(requireNonNull(outcomes, "You must supply outcomes"));
    }

    public List<CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE>> outcomes() {
        return outcomes;
    }

    public CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE> outcome(int index) {
        return outcomes.get(index);
    }

    /**
     * @return the events of all accepted commands, in command order
     */
    public List<EVENT_TYPE> acceptedEvents() {
        return outcomes.stream()
                       .flatMap(outcome -> outcome.events().stream())
                       .collect(Collectors.toUnmodifiableList());
    }

    public List<CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE>> rejections() {
        return outcomes.stream()
                       .filter(CommandOutcome::isRejected)
                       .collect(Collectors.toUnmodifiableList());
    }

    public boolean hasRejections() {
        return outcomes.stream().anyMatch(CommandOutcome::isRejected);
    }

    public int size() {
        return outcomes.size();
    }

    @Override
    public String toString() {
        return "CommandBatchResult{" +
                "policy=" + policy +
                ", initialGeneration=" + initialGeneration +
                ", outcomes=" + outcomes.size() +
                ", rejections=" + outcomes.stream().filter(CommandOutcome::isRejected).count() +
                '}';
    }
}
