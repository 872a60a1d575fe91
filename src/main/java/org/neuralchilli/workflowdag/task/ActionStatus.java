package org.neuralchilli.workflowdag.task;

/**
 * Lifecycle status of an action within a task.
 */
public enum ActionStatus {
    /**
     * Action created, not yet started
     */
    QUEUED,

    /**
     * Action is currently being conducted
     */
    RUNNING,

    /**
     * Action paused on something external
     */
    WAITING,

    /**
     * Action completed successfully
     */
    FINISHED,

    /**
     * Action failed
     */
    FAILED;

    /**
     * Check if this is a terminal state (action finished)
     */
    public boolean isTerminal() {
        return this == FINISHED || this == FAILED;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
