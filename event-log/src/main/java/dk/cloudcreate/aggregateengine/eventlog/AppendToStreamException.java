package dk.cloudcreate.aggregateengine.eventlog;

public class AppendToStreamException extends EventLogException {
    public AppendToStreamException(String msg) {
        super(msg);
    }
}
