package dk.cloudcreate.aggregateengine.eventlog.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.aggregateengine.eventlog.SerializedEvent;
import dk.cloudcreate.aggregateengine.eventlog.serializer.*;
import dk.cloudcreate.aggregateengine.eventlog.types.EventTypeName;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link EventCodec} that stores every event as a JSON object under an explicitly registered {@link EventTypeName}.<br>
 * Example:
 * <pre>{@code
 * EventCodec<BankEvent> codec = JacksonEventCodec.builder(BankEvent.class)
 *                                                .register("funds-deposited", BankEvent.FundsDeposited.class)
 *                                                .register("funds-withdrawn", BankEvent.FundsWithdrawn.class)
 *                                                .build();
 * }</pre>
 * If the root event type is <code>sealed</code> then {@link Builder#build()} verifies that every concrete event type
 * is registered, so adding a new event variant without giving it a type name fails when the codec is created and not
 * when the first such event is persisted.
 *
 * @param <EVENT_TYPE> the root type of the events
 */
public final class JacksonEventCodec<EVENT_TYPE> implements EventCodec<EVENT_TYPE> {
    private static final Logger log = LoggerFactory.getLogger(JacksonEventCodec.class);

    private final Class<EVENT_TYPE>                                  eventType;
    private final ObjectMapper                                       objectMapper;
    private final Map<EventTypeName, Class<? extends EVENT_TYPE>>    javaTypeByName;
    private final Map<Class<? extends EVENT_TYPE>, EventTypeName>    nameByJavaType;

    private JacksonEventCodec(Class<EVENT_TYPE> eventType,
                              ObjectMapper objectMapper,
                              Map<EventTypeName, Class<? extends EVENT_TYPE>> javaTypeByName) {
        this.eventType = eventType;
        this.objectMapper = objectMapper;
        this.javaTypeByName = Map.copyOf(javaTypeByName);
        this.nameByJavaType = javaTypeByName.entrySet()
                                            .stream()
                                            .collect(Collectors.toUnmodifiableMap(Map.Entry::getValue, Map.Entry::getKey));
    }

    /**
     * Start building a codec for the events that are subtypes of <code>eventType</code>
     *
     * @param eventType    the root type of the events
     * @param <EVENT_TYPE> the root type of the events
     * @return a new builder that uses {@link #createDefaultObjectMapper()}
     */
    public static <EVENT_TYPE> Builder<EVENT_TYPE> builder(Class<EVENT_TYPE> eventType) {
        return new Builder<>(eventType);
    }

    /**
     * The {@link ObjectMapper} used unless {@link Builder#objectMapper(ObjectMapper)} is specified:
     * <ul>
     *     <li>Unknown JSON properties are ignored, so events written by a newer schema revision can still be read</li>
     *     <li>java.time types are written as ISO-8601 strings</li>
     *     <li>events without properties are written as <code>{}</code></li>
     *     <li>essentials single value types (e.g. <code>CharSequenceType</code> and <code>LongType</code> subtypes) are written as their plain value</li>
     * </ul>
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                         .addModule(new JavaTimeModule())
                         .addModule(new EssentialTypesJacksonModule())
                         .build();
    }

    @Override
    public SerializedEvent encode(EVENT_TYPE event) {
        requireNonNull(event, "You must supply an event");
        var eventTypeName = nameByJavaType.get(event.getClass());
        if (eventTypeName == null) {
            throw new JSONSerializationException(msg("No event type name has been registered for '{}'", event.getClass().getName()));
        }
        try {
            return new SerializedEvent(eventTypeName, objectMapper.writeValueAsString(event));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize '{}' as event type '{}'", event.getClass().getName(), eventTypeName), e);
        }
    }

    @Override
    public EVENT_TYPE decode(SerializedEvent serializedEvent) {
        requireNonNull(serializedEvent, "You must supply a serializedEvent");
        var javaType = javaTypeByName.get(serializedEvent.eventType);
        if (javaType == null) {
            log.debug("Cannot decode event type '{}' - it isn't registered for '{}'", serializedEvent.eventType, eventType.getName());
            throw new UnknownEventTypeException(serializedEvent.eventType, eventType);
        }
        try {
            return objectMapper.readValue(serializedEvent.jsonPayload, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize event type '{}' into '{}'", serializedEvent.eventType, javaType.getName()), e);
        }
    }

    @Override
    public Class<EVENT_TYPE> eventType() {
        return eventType;
    }

    /**
     * @return the registered event type names and the Java type each name decodes into
     */
    public Map<EventTypeName, Class<? extends EVENT_TYPE>> registeredEventTypes() {
        return javaTypeByName;
    }

    @Override
    public String toString() {
        return "JacksonEventCodec{" +
                "eventType=" + eventType.getName() +
                ", registeredEventTypes=" + javaTypeByName.keySet() +
                '}';
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    public static final class Builder<EVENT_TYPE> {
        private final Class<EVENT_TYPE>                               eventType;
        private final Map<EventTypeName, Class<? extends EVENT_TYPE>> javaTypeByName = new LinkedHashMap<>();
        private       ObjectMapper                                    objectMapper;

        private Builder(Class<EVENT_TYPE> eventType) {
            this.eventType = requireNonNull(eventType, "You must supply an eventType");
        }

        public Builder<EVENT_TYPE> objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = requireNonNull(objectMapper, "You must supply an objectMapper");
            return this;
        }

        /**
         * Register the type name that events of the given Java type are persisted under
         *
         * @param eventTypeName the persisted type tag
         * @param javaType      the concrete event type
         * @return this builder
         */
        public Builder<EVENT_TYPE> register(CharSequence eventTypeName, Class<? extends EVENT_TYPE> javaType) {
            requireNonNull(eventTypeName, "You must supply an eventTypeName");
            requireNonNull(javaType, "You must supply a javaType");
            var name = EventTypeName.of(eventTypeName);
            if (javaTypeByName.containsKey(name)) {
                throw new IllegalArgumentException(msg("Event type name '{}' is already registered for '{}'",
                                                       name,
                                                       javaTypeByName.get(name).getName()));
            }
            if (javaTypeByName.containsValue(javaType)) {
                throw new IllegalArgumentException(msg("'{}' is already registered under another event type name", javaType.getName()));
            }
            javaTypeByName.put(name, javaType);
            return this;
        }

        public JacksonEventCodec<EVENT_TYPE> build() {
            requireTrue(!javaTypeByName.isEmpty(), msg("No event types have been registered for '{}'", eventType.getName()));
            if (eventType.isSealed()) {
                var unregistered = concreteSubtypesOf(eventType).stream()
                                                                .filter(subtype -> !javaTypeByName.containsValue(subtype))
                                                                .map(Class::getName)
                                                                .sorted()
                                                                .collect(Collectors.toList());
                if (!unregistered.isEmpty()) {
                    throw new IllegalStateException(msg("The following '{}' event types don't have a registered event type name: {}",
                                                        eventType.getName(),
                                                        unregistered));
                }
            } else {
                log.warn("'{}' isn't sealed, so it cannot be verified that all of its event types have been registered", eventType.getName());
            }
            return new JacksonEventCodec<>(eventType,
                                           objectMapper != null ? objectMapper : createDefaultObjectMapper(),
                                           javaTypeByName);
        }

        private static List<Class<?>> concreteSubtypesOf(Class<?> type) {
            var result = new ArrayList<Class<?>>();
            if (!type.isSealed()) {
                result.add(type);
                return result;
            }
            if (!type.isInterface() && !java.lang.reflect.Modifier.isAbstract(type.getModifiers())) {
                result.add(type);
            }
            for (var permittedSubclass : type.getPermittedSubclasses()) {
                result.addAll(concreteSubtypesOf(permittedSubclass));
            }
            return result;
        }
    }
}
