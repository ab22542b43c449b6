package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.aggregateengine.aggregates.processing.*;
import dk.cloudcreate.aggregateengine.aggregates.projection.Projector;
import dk.cloudcreate.aggregateengine.examples.tasks.TaskListCommand.*;
import dk.cloudcreate.aggregateengine.examples.tasks.TaskListEvent.*;
import dk.cloudcreate.aggregateengine.examples.tasks.TaskListError.*;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TaskListTest {
    private static final TaskListId     TASK_LIST_ID = TaskListId.of("tasks");
    private static final TaskId         TASK_42      = TaskId.of(42);
    private static final OffsetDateTime DUE_DATE     = OffsetDateTime.of(2022, 6, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private final Projector<TaskListId, TaskListEvent, TaskList> projector = new Projector<>(TaskList::seed);

    @Test
    void a_new_task_list_is_empty() {
        var taskList = TaskList.seed(TASK_LIST_ID);

        assertThat(taskList.tasks()).isEmpty();
        assertThat(taskList.generation().longValue()).isEqualTo(0L);
        assertThat(projector.project(TASK_LIST_ID, List.of())).isEqualTo(taskList);
    }

    @Test
    void add_a_task() {
        // When
        var result = TaskList.seed(TASK_LIST_ID).execute(new AddTask(TASK_42, "x", DUE_DATE));

        // Then
        assertThat(result.events()).containsExactly(new TaskAdded(TASK_42, "x", DUE_DATE));
        var taskList = Projector.fold(TaskList.seed(TASK_LIST_ID), result.events());
        assertThat(taskList.tasks()).containsExactly(new Task(TASK_42, "x", DUE_DATE, false));
        assertThat(taskList.task(TASK_42).get().dueDate()).contains(DUE_DATE);
    }

    @Test
    void adding_a_task_with_an_existing_id_is_rejected() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));

        var result = taskList.execute(new AddTask(TASK_42, "y", null));

        assertThat(result.error()).contains(new TaskAlreadyExists(TASK_LIST_ID, TASK_42));
    }

    @Test
    void tasks_are_kept_in_the_order_they_were_added() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TaskId.of(3), "c", null),
                                                               new TaskAdded(TaskId.of(1), "a", null),
                                                               new TaskAdded(TaskId.of(2), "b", null),
                                                               new TaskRemoved(TaskId.of(1))));

        assertThat(taskList.tasks()).extracting(Task::name).containsExactly("c", "b");
        assertThat(taskList.generation().longValue()).isEqualTo(4L);
    }

    @Test
    void remove_a_task() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));

        assertThat(taskList.execute(new RemoveTask(TASK_42)).events()).containsExactly(new TaskRemoved(TASK_42));
        assertThat(taskList.execute(new RemoveTask(TaskId.of(7))).error()).contains(new TaskDoesNotExist(TASK_LIST_ID, TaskId.of(7)));
    }

    @Test
    void clear_all_tasks() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null),
                                                               new TaskAdded(TaskId.of(43), "y", null)));

        var result = taskList.execute(new ClearAllTasks());

        assertThat(result.events()).containsExactly(new AllTasksCleared());
        assertThat(Projector.fold(taskList, result.events()).tasks()).isEmpty();
        assertThat(TaskList.seed(TASK_LIST_ID).execute(new ClearAllTasks()).isAccepted()).isTrue();
    }

    @Test
    void complete_a_task() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));

        var result = taskList.execute(new CompleteTask(TASK_42));

        assertThat(result.events()).containsExactly(new TaskCompleted(TASK_42));
        assertThat(Projector.fold(taskList, result.events()).task(TASK_42).get().isComplete()).isTrue();
        assertThat(taskList.execute(new CompleteTask(TaskId.of(7))).error()).contains(new TaskDoesNotExist(TASK_LIST_ID, TaskId.of(7)));
    }

    @Test
    void a_completed_task_cannot_be_changed() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null),
                                                               new TaskCompleted(TASK_42)));

        assertThat(taskList.execute(new ChangeTaskDueDate(TASK_42, DUE_DATE)).error()).contains(new TaskAlreadyFinished(TASK_LIST_ID, TASK_42));
        assertThat(taskList.execute(new CompleteTask(TASK_42)).error()).contains(new TaskAlreadyFinished(TASK_LIST_ID, TASK_42));
        assertThat(taskList.execute(new RemoveTask(TASK_42)).isAccepted()).isTrue();
    }

    @Test
    void change_and_clear_the_due_date_of_a_task() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));

        var withDueDate = Projector.fold(taskList, taskList.execute(new ChangeTaskDueDate(TASK_42, DUE_DATE)).events());
        assertThat(withDueDate.task(TASK_42).get().dueDate()).contains(DUE_DATE);

        var withoutDueDate = Projector.fold(withDueDate, withDueDate.execute(new ChangeTaskDueDate(TASK_42, null)).events());
        assertThat(withoutDueDate.task(TASK_42).get().dueDate()).isEmpty();
        assertThat(taskList.execute(new ChangeTaskDueDate(TaskId.of(7), DUE_DATE)).error()).contains(new TaskDoesNotExist(TASK_LIST_ID, TaskId.of(7)));
    }

    @Test
    void events_for_unknown_tasks_only_increase_the_generation() {
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));

        var result = Projector.fold(taskList, List.of(new TaskCompleted(TaskId.of(7)),
                                                      new TaskDueDateChanged(TaskId.of(7), DUE_DATE)));

        assertThat(result.tasks()).isEqualTo(taskList.tasks());
        assertThat(result.generation().longValue()).isEqualTo(3L);
    }

    @Test
    void adding_the_same_task_twice_in_a_batch() {
        // Given
        var taskList = TaskList.seed(TASK_LIST_ID);
        List<TaskListCommand> commands = List.of(new AddTask(TASK_42, "x", null),
                                                 new AddTask(TASK_42, "y", null));

        // When
        var snapshot   = processor(BatchValidationPolicy.SNAPSHOT).process(taskList, commands);
        var cumulative = processor(BatchValidationPolicy.CUMULATIVE).process(taskList, commands);

        // Then
        assertThat(snapshot.hasRejections()).isFalse();
        assertThat(snapshot.acceptedEvents()).containsExactly(new TaskAdded(TASK_42, "x", null),
                                                              new TaskAdded(TASK_42, "y", null));
        assertThat(Projector.fold(taskList, snapshot.acceptedEvents()).tasks()).extracting(Task::name).containsExactly("y");

        assertThat(cumulative.outcome(0).events()).containsExactly(new TaskAdded(TASK_42, "x", null));
        assertThat(cumulative.outcome(1).error()).contains(new TaskAlreadyExists(TASK_LIST_ID, TASK_42));
        assertThat(Projector.fold(taskList, cumulative.acceptedEvents()).tasks()).extracting(Task::name).containsExactly("x");
    }

    @Test
    void completing_a_task_and_changing_its_due_date_in_a_batch() {
        // Given
        var taskList = projector.project(TASK_LIST_ID, List.of(new TaskAdded(TASK_42, "x", null)));
        List<TaskListCommand> commands = List.of(new CompleteTask(TASK_42),
                                                 new ChangeTaskDueDate(TASK_42, DUE_DATE));

        // When
        var snapshot   = processor(BatchValidationPolicy.SNAPSHOT).process(taskList, commands);
        var cumulative = processor(BatchValidationPolicy.CUMULATIVE).process(taskList, commands);

        // Then
        assertThat(snapshot.acceptedEvents()).containsExactly(new TaskCompleted(TASK_42),
                                                              new TaskDueDateChanged(TASK_42, DUE_DATE));
        assertThat(cumulative.outcome(0).events()).containsExactly(new TaskCompleted(TASK_42));
        assertThat(cumulative.outcome(1).error()).contains(new TaskAlreadyFinished(TASK_LIST_ID, TASK_42));
    }

    @Test
    void a_blank_task_name_is_not_a_valid_command() {
        assertThatThrownBy(() -> new AddTask(TASK_42, " ", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static CommandProcessor<TaskListEvent, TaskListCommand, TaskListError, TaskList> processor(BatchValidationPolicy policy) {
        return new CommandProcessor<>(policy);
    }
}
