package dk.cloudcreate.aggregateengine.common.types;

import dk.cloudcreate.essentials.types.*;

import java.util.UUID;

/**
 * Opaque token that links a command to the events or the domain error it resulted in.<br>
 * The value is carried through asynchronous boundaries (e.g. from the caller, through command processing
 * and into the event log or an error notification channel), so it must be treated as an uninterpreted string.
 */
public class CorrelationId extends CharSequenceType<CorrelationId> implements Identifier {
    public CorrelationId(CharSequence value) {
        super(value);
    }

    public static CorrelationId of(CharSequence value) {
        return new CorrelationId(value);
    }

    public static CorrelationId random() {
        return new CorrelationId(UUID.randomUUID().toString());
    }
}
