package dk.cloudcreate.aggregateengine.eventlog.serializer.json;

import dk.cloudcreate.aggregateengine.eventlog.serializer.EventDecodingException;

public class JSONDeserializationException extends EventDecodingException {
    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
