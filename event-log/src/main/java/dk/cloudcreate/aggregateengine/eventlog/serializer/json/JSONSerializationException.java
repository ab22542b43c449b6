package dk.cloudcreate.aggregateengine.eventlog.serializer.json;

import dk.cloudcreate.aggregateengine.eventlog.EventLogException;

public class JSONSerializationException extends EventLogException {
    public JSONSerializationException(String message) {
        super(message);
    }

    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
