package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.aggregateengine.aggregates.DomainError;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Reasons a {@link TaskList} rejects a {@link TaskListCommand}
 */
public sealed interface TaskListError extends DomainError {
    TaskListId taskListId();

    TaskId taskId();

    record TaskAlreadyExists(TaskListId taskListId, TaskId taskId) implements TaskListError {
        @Override
        public String description() {
            return msg("Task '{}' already exists in task list '{}'", taskId, taskListId);
        }
    }

    record TaskDoesNotExist(TaskListId taskListId, TaskId taskId) implements TaskListError {
        @Override
        public String description() {
            return msg("Task '{}' doesn't exist in task list '{}'", taskId, taskListId);
        }
    }

    /**
     * The task is complete and can't be changed any more
     */
    record TaskAlreadyFinished(TaskListId taskListId, TaskId taskId) implements TaskListError {
        @Override
        public String description() {
            return msg("Task '{}' in task list '{}' is already finished", taskId, taskListId);
        }
    }
}
