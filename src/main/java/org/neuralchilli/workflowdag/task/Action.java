package org.neuralchilli.workflowdag.task;

/**
 * A unit of work performed by a task.
 * Nothing in this project conducts actions; executors are expected to call
 * {@link #conduct(ActionInput)} layer by layer.
 */
public interface Action {

    ActionOutput conduct(ActionInput input);

    /**
     * Human readable description for logs
     */
    String describe();
}
