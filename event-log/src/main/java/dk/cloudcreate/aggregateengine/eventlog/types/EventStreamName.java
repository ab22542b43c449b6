package dk.cloudcreate.aggregateengine.eventlog.types;

import dk.cloudcreate.essentials.types.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Name of the append-only log that contains all events related to ONE entity, e.g. <code>account-12345-6789-00000</code>
 */
public class EventStreamName extends CharSequenceType<EventStreamName> implements Identifier {
    public EventStreamName(CharSequence value) {
        super(value);
    }

    public static EventStreamName of(CharSequence value) {
        return new EventStreamName(value);
    }

    /**
     * Create a stream name using the <code>{prefix}-{entityKey}</code> naming convention
     *
     * @param prefix    the stream prefix, e.g. <code>account</code>
     * @param entityKey the entity key, e.g. the account id
     * @return the stream name
     */
    public static EventStreamName of(CharSequence prefix, Object entityKey) {
        requireNonNull(prefix, "You must supply a prefix");
        requireNonNull(entityKey, "You must supply an entityKey");
        return new EventStreamName(msg("{}-{}", prefix, entityKey));
    }
}
