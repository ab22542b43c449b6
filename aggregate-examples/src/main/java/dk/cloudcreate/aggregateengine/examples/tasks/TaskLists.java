package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.aggregateengine.aggregates.AggregateType;
import dk.cloudcreate.aggregateengine.aggregates.repository.*;
import dk.cloudcreate.aggregateengine.eventlog.EventLog;
import dk.cloudcreate.aggregateengine.eventlog.serializer.json.JacksonEventCodec;
import dk.cloudcreate.aggregateengine.eventlog.types.EventStreamName;

/**
 * Wiring of the {@link TaskList} aggregate: the events of a task list are stored in a stream named after the task list id
 * (e.g. <code>tasks</code>)
 */
public final class TaskLists {
    public static final AggregateType AGGREGATE_TYPE = AggregateType.of("TaskLists");

    private TaskLists() {
    }

    public static JacksonEventCodec<TaskListEvent> codec() {
        return JacksonEventCodec.builder(TaskListEvent.class)
                                .register("task-added", TaskListEvent.TaskAdded.class)
                                .register("task-removed", TaskListEvent.TaskRemoved.class)
                                .register("all-tasks-cleared", TaskListEvent.AllTasksCleared.class)
                                .register("task-completed", TaskListEvent.TaskCompleted.class)
                                .register("task-due-date-changed", TaskListEvent.TaskDueDateChanged.class)
                                .build();
    }

    public static EventStreamName streamName(TaskListId taskListId) {
        return EventStreamName.of(taskListId);
    }

    public static AggregateTypeConfiguration<TaskListId, TaskListEvent, TaskListCommand, TaskListError, TaskList> configuration() {
        return AggregateTypeConfiguration.of(AGGREGATE_TYPE,
                                             TaskLists::streamName,
                                             TaskList::seed,
                                             codec());
    }

    public static EventSourcedAggregateRepository<TaskListId, TaskListEvent, TaskListCommand, TaskListError, TaskList> repository(EventLog eventLog) {
        return EventSourcedAggregateRepository.from(eventLog, configuration());
    }
}
