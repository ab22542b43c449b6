package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.essentials.types.*;

/**
 * Id of a {@link Task} - unique within its {@link TaskList}
 */
public class TaskId extends LongType<TaskId> implements Identifier {
    public TaskId(Long value) {
        super(value);
    }

    public static TaskId of(long value) {
        return new TaskId(value);
    }
}
