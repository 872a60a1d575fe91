package org.neuralchilli.workflowdag.task;

import java.util.Map;
import java.util.UUID;

/**
 * Result reported by an action.
 */
public record ActionOutput(
        UUID actionId,
        ActionStatus status,
        Map<String, String> data
) {
    public ActionOutput {
        if (actionId == null) {
            throw new IllegalArgumentException("Action id cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Action status cannot be null");
        }
        data = data != null ? Map.copyOf(data) : Map.of();
    }
}
