package dk.cloudcreate.aggregateengine.examples.tasks;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Immutable entry in a {@link TaskList}
 */
public final class Task {
    private final TaskId         id;
    private final String         name;
    private final OffsetDateTime dueDate;
    private final boolean        complete;

    public Task(TaskId id, String name, OffsetDateTime dueDate, boolean complete) {
        this.id = requireNonNull(id, "No id provided");
        this.name = requireNonNull(name, "No name provided");
        this.dueDate = dueDate;
        this.complete = complete;
    }

    /**
     * Create a task that isn't complete
     */
    public static Task open(TaskId id, String name, OffsetDateTime dueDate) {
        return new Task(id, name, dueDate, false);
    }

    public TaskId id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Optional<OffsetDateTime> dueDate() {
        return Optional.ofNullable(dueDate);
    }

    public boolean isComplete() {
        return complete;
    }

    public Task withDueDate(OffsetDateTime dueDate) {
        return new Task(id, name, dueDate, complete);
    }

    public Task markAsComplete() {
        return new Task(id, name, dueDate, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Task)) return false;
        Task task = (Task) o;
        return complete == task.complete && id.equals(task.id) && name.equals(task.name) && Objects.equals(dueDate, task.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, dueDate, complete);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", dueDate=" + dueDate +
                ", complete=" + complete +
                '}';
    }
}
