package dk.cloudcreate.aggregateengine.examples.tasks;

import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Facts about a task list. A <code>null</code> due date means the task has no due date
 */
public sealed interface TaskListEvent {

    record TaskAdded(TaskId id, String name, OffsetDateTime dueDate) implements TaskListEvent {
        public TaskAdded {
            requireNonNull(id, "No id provided");
            requireNonNull(name, "No name provided");
        }
    }

    record TaskRemoved(TaskId id) implements TaskListEvent {
        public TaskRemoved {
            requireNonNull(id, "No id provided");
        }
    }

    record AllTasksCleared() implements TaskListEvent {
    }

    record TaskCompleted(TaskId id) implements TaskListEvent {
        public TaskCompleted {
            requireNonNull(id, "No id provided");
        }
    }

    record TaskDueDateChanged(TaskId id, OffsetDateTime dueDate) implements TaskListEvent {
        public TaskDueDateChanged {
            requireNonNull(id, "No id provided");
        }
    }
}
