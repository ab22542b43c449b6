package dk.cloudcreate.aggregateengine.aggregates.processing;

/**
 * Determines which state the {@link CommandProcessor} validates each command of a batch against
 */
public enum BatchValidationPolicy {
    /**
     * Every command in the batch is validated against the same state: the one the batch was started with.
     * Commands that depend on the effects of earlier commands in the same batch won't see those effects before
     * the state is projected again, e.g. two withdrawals that are each covered by the balance are both accepted
     * even though together they overdraw the account.
     */
    SNAPSHOT,
    /**
     * The events of every accepted command are applied to the validation state before the next command in the batch
     * is validated, so the batch behaves as if the commands had been submitted one at a time
     */
    CUMULATIVE
}
