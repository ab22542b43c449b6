package dk.cloudcreate.aggregateengine.aggregates;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The outcome of {@link AggregateState#execute(Object)}: either the command was {@link Accepted} and resulted
 * in one or more events, or it was {@link Rejected} with exactly one {@link DomainError}.<br>
 * An accepted result without events cannot be created.
 *
 * @param <EVENT_TYPE> the type of event
 * @param <ERROR_TYPE> the type of domain error
 */
public sealed interface CommandResult<EVENT_TYPE, ERROR_TYPE extends DomainError> permits CommandResult.Accepted, CommandResult.Rejected {

    static <EVENT_TYPE, ERROR_TYPE extends DomainError> CommandResult<EVENT_TYPE, ERROR_TYPE> accepted(List<? extends EVENT_TYPE> events) {
        return new Accepted<>(events);
    }

    @SafeVarargs
    static <EVENT_TYPE, ERROR_TYPE extends DomainError> CommandResult<EVENT_TYPE, ERROR_TYPE> accepted(EVENT_TYPE... events) {
        requireNonNull(events, "You must supply events");
        return new Accepted<>(Arrays.asList(events));
    }

    static <EVENT_TYPE, ERROR_TYPE extends DomainError> CommandResult<EVENT_TYPE, ERROR_TYPE> rejected(ERROR_TYPE error) {
        return new Rejected<>(error);
    }

    boolean isAccepted();

    default boolean isRejected() {
        return !isAccepted();
    }

    /**
     * @return the events of an {@link Accepted} result (never empty) or an empty list for a {@link Rejected} result
     */
    List<EVENT_TYPE> events();

    /**
     * @return the error of a {@link Rejected} result or {@link Optional#empty()} for an {@link Accepted} result
     */
    Optional<ERROR_TYPE> error();

    /**
     * Handle both outcomes
     *
     * @param onAccepted called with the events if the command was accepted
     * @param onRejected called with the error if the command was rejected
     * @param <R>        the result type
     * @return the value returned by the called function
     */
    <R> R fold(Function<List<EVENT_TYPE>, R> onAccepted, Function<ERROR_TYPE, R> onRejected);

    final class Accepted<EVENT_TYPE, ERROR_TYPE extends DomainError> implements CommandResult<EVENT_TYPE, ERROR_TYPE> {
        private final List<EVENT_TYPE> events;

        private Accepted(List<? extends EVENT_TYPE> events) {
            requireNonNull(events, "You must supply an events list");
            requireTrue(!events.isEmpty(), "An accepted command must result in at least one event");
            events.forEach(event -> requireNonNull(event, "An accepted command cannot result in a null event"));
            this.events = List.copyOf(events);
        }

        @Override
        public boolean isAccepted() {
            return true;
        }

        @Override
        public List<EVENT_TYPE> events() {
            return events;
        }

        @Override
        public Optional<ERROR_TYPE> error() {
            return Optional.empty();
        }

        @Override
        public <R> R fold(Function<List<EVENT_TYPE>, R> onAccepted, Function<ERROR_TYPE, R> onRejected) {
            requireNonNull(onAccepted, "You must supply an onAccepted function");
            return onAccepted.apply(events);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Accepted)) return false;
            return events.equals(((Accepted<?, ?>) o).events);
        }

        @Override
        public int hashCode() {
            return events.hashCode();
        }

        @Override
        public String toString() {
            return "Accepted{" +
                    "events=" + events +
                    '}';
        }
    }

    final class Rejected<EVENT_TYPE, ERROR_TYPE extends DomainError> implements CommandResult<EVENT_TYPE, ERROR_TYPE> {
        private final ERROR_TYPE error;

        private Rejected(ERROR_TYPE error) {
            this.error = requireNonNull(error, "A rejected command must have an error");
        }

        @Override
        public boolean isAccepted() {
            return false;
        }

        @Override
        public List<EVENT_TYPE> events() {
            return List.of();
        }

        @Override
        public Optional<ERROR_TYPE> error() {
            return Optional.of(error);
        }

        @Override
        public <R> R fold(Function<List<EVENT_TYPE>, R> onAccepted, Function<ERROR_TYPE, R> onRejected) {
            requireNonNull(onRejected, "You must supply an onRejected function");
            return onRejected.apply(error);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Rejected)) return false;
            return error.equals(((Rejected<?, ?>) o).error);
        }

        @Override
        public int hashCode() {
            return error.hashCode();
        }

        @Override
        public String toString() {
            return "Rejected{" +
                    "error=" + error +
                    '}';
        }
    }
}
