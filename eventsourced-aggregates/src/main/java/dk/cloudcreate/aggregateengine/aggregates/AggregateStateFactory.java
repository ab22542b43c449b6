package dk.cloudcreate.aggregateengine.aggregates;

/**
 * Creates the seed (zero value) state for an entity that has no history, e.g. a zero balance or an empty task list
 *
 * @param <ID>         the entity key type
 * @param <STATE_TYPE> the state type
 */
@FunctionalInterface
public interface AggregateStateFactory<ID, STATE_TYPE> {
    /**
     * @param aggregateId the entity key
     * @return the seed state, with generation {@link Generation#INITIAL}
     */
    STATE_TYPE seed(ID aggregateId);
}
