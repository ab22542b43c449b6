package dk.cloudcreate.aggregateengine.aggregates;

import dk.cloudcreate.essentials.types.*;

/**
 * Name of a category of aggregates that share the same {@link AggregateState} type and event vocabulary,
 * e.g. <code>Accounts</code> or <code>TaskLists</code>.<br>
 * The aggregate type is only a name and shouldn't be confused with the Fully Qualified Class Name of the state implementation
 */
public class AggregateType extends CharSequenceType<AggregateType> implements Identifier {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
