package org.neuralchilli.workflowdag.task;

import org.neuralchilli.workflowdag.domain.Node;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A workflow task: a graph node that additionally carries the ordered
 * actions to perform. A task graph is a {@code Digraph<TaskNode>}.
 */
public record TaskNode(
        UUID id,
        List<Action> actions
) implements Node {

    public TaskNode {
        if (id == null) {
            throw new IllegalArgumentException("Task id cannot be null");
        }
        actions = actions != null ? List.copyOf(actions) : List.of();
    }

    /**
     * Create a task with a fresh identity
     */
    public static TaskNode of(List<Action> actions) {
        return new TaskNode(UUID.randomUUID(), actions);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        TaskNode that = (TaskNode) obj;
        // Identity only, so graph operations never hash the actions
        return Objects.equals(this.id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format("TaskNode[%s, actions=%d]", label(), actions.size());
    }
}
