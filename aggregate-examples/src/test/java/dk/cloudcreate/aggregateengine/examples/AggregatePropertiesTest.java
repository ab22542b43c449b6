package dk.cloudcreate.aggregateengine.examples;

import dk.cloudcreate.aggregateengine.aggregates.projection.Projector;
import dk.cloudcreate.aggregateengine.common.types.CorrelationId;
import dk.cloudcreate.aggregateengine.eventlog.inmemory.InMemoryEventLog;
import dk.cloudcreate.aggregateengine.examples.bank.*;
import dk.cloudcreate.aggregateengine.examples.tasks.*;
import org.junit.jupiter.api.*;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs random command sequences against both aggregates and verifies the properties every aggregate must have
 */
class AggregatePropertiesTest {
    private static final int NUMBER_OF_COMMANDS = 500;

    private Random random;

    @BeforeEach
    void setup() {
        random = new Random(4711);
    }

    @Test
    void bank_account_properties() {
        var accountId = AccountId.of("12345-6789-00000");
        var projector = new Projector<AccountId, BankEvent, BankAccount>(BankAccount::seed);
        var history   = new ArrayList<BankEvent>();
        var account   = projector.seed(accountId);

        for (int i = 0; i < NUMBER_OF_COMMANDS; i++) {
            var amount = (long) random.nextInt(1000);
            BankCommand command = random.nextBoolean() ?
                                  new BankCommand.DepositFunds(accountId, amount, CorrelationId.random()) :
                                  new BankCommand.WithdrawFunds(accountId, amount, CorrelationId.random());
            var result = account.execute(command);

            if (result.isRejected()) {
                // a rejection produces no events and replaying the unchanged history gives the same state
                assertThat(result.events()).isEmpty();
                assertThat(result.error().get()).isInstanceOf(AccountError.InsufficientFunds.class);
                assertThat(projector.project(accountId, history)).isEqualTo(account);
                continue;
            }

            var next = Projector.fold(account, result.events());
            assertThat(next.generation().longValue()).isEqualTo(account.generation().longValue() + result.events().size());
            var expectedBalance = command instanceof BankCommand.DepositFunds ? account.balance + amount : account.balance - amount;
            assertThat(next.balance).isEqualTo(expectedBalance);
            assertThat(next.balance).isGreaterThanOrEqualTo(0L);

            history.addAll(result.events());
            account = next;
        }

        assertThat(projector.project(accountId, history)).isEqualTo(account);
        assertThat(projector.project(accountId, history)).isEqualTo(projector.project(accountId, history.stream()));
        assertThat(projector.project(accountId, List.of())).isEqualTo(BankAccount.seed(accountId));
    }

    @Test
    void task_list_properties() {
        var taskListId = TaskListId.of("tasks");
        var projector  = new Projector<TaskListId, TaskListEvent, TaskList>(TaskList::seed);
        var history    = new ArrayList<TaskListEvent>();
        var taskList   = projector.seed(taskListId);

        for (int i = 0; i < NUMBER_OF_COMMANDS; i++) {
            var command = randomTaskListCommand();
            var result  = taskList.execute(command);

            if (result.isRejected()) {
                assertThat(result.events()).isEmpty();
                assertThat(projector.project(taskListId, history)).isEqualTo(taskList);
                continue;
            }

            var next = Projector.fold(taskList, result.events());
            assertThat(next.generation().longValue()).isEqualTo(taskList.generation().longValue() + 1);
            if (command instanceof TaskListCommand.AddTask) {
                assertThat(next.hasTask(((TaskListCommand.AddTask) command).id())).isTrue();
            } else if (command instanceof TaskListCommand.RemoveTask) {
                assertThat(next.hasTask(((TaskListCommand.RemoveTask) command).id())).isFalse();
            } else if (command instanceof TaskListCommand.ClearAllTasks) {
                assertThat(next.tasks()).isEmpty();
            } else if (command instanceof TaskListCommand.CompleteTask) {
                assertThat(next.task(((TaskListCommand.CompleteTask) command).id()).get().isComplete()).isTrue();
            }

            history.addAll(result.events());
            taskList = next;
        }

        assertThat(projector.project(taskListId, history)).isEqualTo(taskList);
        assertThat(projector.project(taskListId, history)).isEqualTo(projector.project(taskListId, history));
    }

    @Test
    void the_event_log_contains_exactly_the_accepted_events() {
        // Given
        var eventLog   = new InMemoryEventLog();
        var repository = BankAccounts.repository(eventLog);
        var accountId  = AccountId.random();

        // When
        var accepted = 0;
        for (int i = 0; i < 50; i++) {
            var amount = (long) random.nextInt(100);
            var result = repository.handle(accountId, random.nextBoolean() ?
                                                      BankCommand.DepositFunds.of(accountId, amount) :
                                                      BankCommand.WithdrawFunds.of(accountId, amount));
            accepted += result.appendedEvents.size();
            assertThat(result.generationAfter.longValue()).isEqualTo(accepted);
        }

        // Then
        assertThat(eventLog.latestEventOrder(BankAccounts.streamName(accountId)).longValue()).isEqualTo(accepted - 1);
        assertThat(repository.load(accountId).generation().longValue()).isEqualTo(accepted);
    }

    private TaskListCommand randomTaskListCommand() {
        var taskId = TaskId.of(random.nextInt(10));
        switch (random.nextInt(10)) {
            case 0:
                return new TaskListCommand.ClearAllTasks();
            case 1:
            case 2:
                return new TaskListCommand.RemoveTask(taskId);
            case 3:
            case 4:
                return new TaskListCommand.CompleteTask(taskId);
            case 5:
                return new TaskListCommand.ChangeTaskDueDate(taskId, null);
            default:
                return new TaskListCommand.AddTask(taskId, "Task " + taskId, null);
        }
    }
}
