package dk.cloudcreate.aggregateengine.examples.tasks;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Commands that can be executed against a {@link TaskList}. A <code>null</code> due date means the task has no due date
 */
public sealed interface TaskListCommand {

    record AddTask(TaskId id, String name, OffsetDateTime dueDate) implements TaskListCommand {
        public AddTask {
            requireNonNull(id, "No id provided");
            requireNonNull(name, "No name provided");
            requireTrue(!name.isBlank(), "The name cannot be blank");
        }
    }

    record RemoveTask(TaskId id) implements TaskListCommand {
        public RemoveTask {
            requireNonNull(id, "No id provided");
        }
    }

    record ClearAllTasks() implements TaskListCommand {
    }

    record CompleteTask(TaskId id) implements TaskListCommand {
        public CompleteTask {
            requireNonNull(id, "No id provided");
        }
    }

    record ChangeTaskDueDate(TaskId id, OffsetDateTime dueDate) implements TaskListCommand {
        public ChangeTaskDueDate {
            requireNonNull(id, "No id provided");
        }
    }
}
