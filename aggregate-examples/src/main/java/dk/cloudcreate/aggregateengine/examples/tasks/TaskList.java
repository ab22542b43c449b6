package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.aggregateengine.aggregates.*;

import java.util.*;

/**
 * The projected state of a task list: its tasks keyed by {@link TaskId}, in the order they were added
 */
public final class TaskList extends ImmutableAggregateState<TaskListId, TaskListEvent, TaskListCommand, TaskListError, TaskList> {
    private final Map<TaskId, Task> tasks;

    private TaskList(TaskListId taskListId, Map<TaskId, Task> tasks, Generation generation) {
        super(taskListId, generation);
        this.tasks = Collections.unmodifiableMap(tasks);
    }

    /**
     * @param taskListId the task list id
     * @return a task list without history: no tasks and generation 0
     */
    public static TaskList seed(TaskListId taskListId) {
        return new TaskList(taskListId, new LinkedHashMap<>(), Generation.INITIAL);
    }

    /**
     * @return the tasks in the order they were added
     */
    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public Optional<Task> task(TaskId taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public boolean hasTask(TaskId taskId) {
        return tasks.containsKey(taskId);
    }

    public int size() {
        return tasks.size();
    }

    @Override
    protected TaskList whenApplied(TaskListEvent event, Generation nextGeneration) {
        if (event instanceof TaskListEvent.TaskAdded) {
            var taskAdded = (TaskListEvent.TaskAdded) event;
            var newTasks  = new LinkedHashMap<>(tasks);
            newTasks.put(taskAdded.id(), Task.open(taskAdded.id(), taskAdded.name(), taskAdded.dueDate()));
            return new TaskList(aggregateId(), newTasks, nextGeneration);
        }
        if (event instanceof TaskListEvent.TaskRemoved) {
            var newTasks = new LinkedHashMap<>(tasks);
            newTasks.remove(((TaskListEvent.TaskRemoved) event).id());
            return new TaskList(aggregateId(), newTasks, nextGeneration);
        }
        if (event instanceof TaskListEvent.AllTasksCleared) {
            return new TaskList(aggregateId(), new LinkedHashMap<>(), nextGeneration);
        }
        if (event instanceof TaskListEvent.TaskCompleted) {
            var newTasks = new LinkedHashMap<>(tasks);
            newTasks.computeIfPresent(((TaskListEvent.TaskCompleted) event).id(), (taskId, task) -> task.markAsComplete());
            return new TaskList(aggregateId(), newTasks, nextGeneration);
        }
        if (event instanceof TaskListEvent.TaskDueDateChanged) {
            var dueDateChanged = (TaskListEvent.TaskDueDateChanged) event;
            var newTasks       = new LinkedHashMap<>(tasks);
            newTasks.computeIfPresent(dueDateChanged.id(), (taskId, task) -> task.withDueDate(dueDateChanged.dueDate()));
            return new TaskList(aggregateId(), newTasks, nextGeneration);
        }
        throw unhandled(event);
    }

    @Override
    protected CommandResult<TaskListEvent, TaskListError> decide(TaskListCommand command) {
        if (command instanceof TaskListCommand.AddTask) {
            var addTask = (TaskListCommand.AddTask) command;
            if (hasTask(addTask.id())) {
                return CommandResult.rejected(new TaskListError.TaskAlreadyExists(aggregateId(), addTask.id()));
            }
            return CommandResult.accepted(new TaskListEvent.TaskAdded(addTask.id(), addTask.name(), addTask.dueDate()));
        }
        if (command instanceof TaskListCommand.RemoveTask) {
            var taskId = ((TaskListCommand.RemoveTask) command).id();
            if (!hasTask(taskId)) {
                return CommandResult.rejected(new TaskListError.TaskDoesNotExist(aggregateId(), taskId));
            }
            return CommandResult.accepted(new TaskListEvent.TaskRemoved(taskId));
        }
        if (command instanceof TaskListCommand.ClearAllTasks) {
            return CommandResult.accepted(new TaskListEvent.AllTasksCleared());
        }
        if (command instanceof TaskListCommand.CompleteTask) {
            var taskId = ((TaskListCommand.CompleteTask) command).id();
            return requireOpenTask(taskId).orElseGet(() -> CommandResult.accepted(new TaskListEvent.TaskCompleted(taskId)));
        }
        if (command instanceof TaskListCommand.ChangeTaskDueDate) {
            var changeTaskDueDate = (TaskListCommand.ChangeTaskDueDate) command;
            return requireOpenTask(changeTaskDueDate.id()).orElseGet(() -> CommandResult.accepted(new TaskListEvent.TaskDueDateChanged(changeTaskDueDate.id(),
                                                                                                                                        changeTaskDueDate.dueDate())));
        }
        throw unhandledCommand(command);
    }

    /**
     * @return the rejection if the task doesn't exist or is complete, otherwise {@link Optional#empty()}
     */
    private Optional<CommandResult<TaskListEvent, TaskListError>> requireOpenTask(TaskId taskId) {
        var task = tasks.get(taskId);
        if (task == null) {
            return Optional.of(CommandResult.rejected(new TaskListError.TaskDoesNotExist(aggregateId(), taskId)));
        }
        if (task.isComplete()) {
            return Optional.of(CommandResult.rejected(new TaskListError.TaskAlreadyFinished(aggregateId(), taskId)));
        }
        return Optional.empty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TaskList)) return false;
        TaskList that = (TaskList) o;
        return baseEquals(that) && tasks().equals(that.tasks());
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateId(), generation(), tasks());
    }

    @Override
    public String toString() {
        return "TaskList{" +
                "taskListId=" + aggregateId() +
                ", tasks=" + tasks.values() +
                ", generation=" + generation() +
                '}';
    }
}
