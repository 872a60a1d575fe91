package org.neuralchilli.workflowdag.task;

import java.util.Map;

/**
 * Named string arguments handed to an action.
 */
public record ActionInput(Map<String, String> values) {

    public ActionInput {
        values = values != null ? Map.copyOf(values) : Map.of();
    }

    public static ActionInput empty() {
        return new ActionInput(Map.of());
    }
}
