package dk.cloudcreate.aggregateengine.aggregates.processing;

import dk.cloudcreate.aggregateengine.aggregates.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The result of validating ONE command of a batch
 *
 * @param <COMMAND_TYPE> the root type of the commands
 * @param <EVENT_TYPE>   the root type of the events
 * @param <ERROR_TYPE>   the root type of the domain errors
 */
public final class CommandOutcome<COMMAND_TYPE, EVENT_TYPE, ERROR_TYPE extends DomainError> {
    /**
     * Zero based position of the {@link #command} in the batch
     */
    public final int                                   index;
    public final COMMAND_TYPE                          command;
    public final CommandResult<EVENT_TYPE, ERROR_TYPE> result;
    /**
     * The generation of the state the command was validated against
     */
    public final Generation                            validatedAgainst;

    public CommandOutcome(int index,
                          COMMAND_TYPE command,
                          CommandResult<EVENT_TYPE, ERROR_TYPE> result,
                          Generation validatedAgainst) {
        requireTrue(index >= 0, "index must be 0 or larger");
        this.index = index;
        this.command = requireNonNull(command, "You must supply a command");
        this.result = requireNonNull(result, "You must supply a result");
        this.validatedAgainst = requireNonNull(validatedAgainst, "You must supply the validatedAgainst generation");
    }

    public boolean isAccepted() {
        return result.isAccepted();
    }

    public boolean isRejected() {
        return result.isRejected();
    }

    public List<EVENT_TYPE> events() {
        return result.events();
    }

    public Optional<ERROR_TYPE> error() {
        return result.error();
    }

    @Override
    public String toString() {
        return "CommandOutcome{" +
                "index=" + index +
                ", command=" + command +
                ", result=" + result +
                ", validatedAgainst=" + validatedAgainst +
                '}';
    }
}
