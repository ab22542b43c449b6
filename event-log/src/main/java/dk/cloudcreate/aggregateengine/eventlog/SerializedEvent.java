package dk.cloudcreate.aggregateengine.eventlog;

import dk.cloudcreate.aggregateengine.eventlog.types.EventTypeName;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The persisted representation of a domain event: a type tag plus an opaque (JSON) payload.<br>
 * Two {@link SerializedEvent}'s are equal if both the {@link #eventType} and the {@link #jsonPayload} are equal
 */
public final class SerializedEvent {
    public final EventTypeName eventType;
    public final String        jsonPayload;

    public SerializedEvent(EventTypeName eventType, String jsonPayload) {
        this.eventType = requireNonNull(eventType, "You must supply an eventType");
        this.jsonPayload = requireNonNull(jsonPayload, "You must supply a jsonPayload");
    }

    public static SerializedEvent of(CharSequence eventType, String jsonPayload) {
        return new SerializedEvent(EventTypeName.of(eventType), jsonPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SerializedEvent)) return false;
        SerializedEvent that = (SerializedEvent) o;
        return eventType.equals(that.eventType) && jsonPayload.equals(that.jsonPayload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventType, jsonPayload);
    }

    @Override
    public String toString() {
        return "SerializedEvent{" +
                "eventType=" + eventType +
                ", jsonPayload='" + jsonPayload + '\'' +
                '}';
    }
}
