package dk.cloudcreate.aggregateengine.examples.tasks;

import dk.cloudcreate.essentials.types.*;

public class TaskListId extends CharSequenceType<TaskListId> implements Identifier {
    public TaskListId(CharSequence value) {
        super(value);
    }

    public static TaskListId of(CharSequence value) {
        return new TaskListId(value);
    }
}
