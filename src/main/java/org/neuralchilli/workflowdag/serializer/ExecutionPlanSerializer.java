package org.neuralchilli.workflowdag.serializer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.workflowdag.domain.ExecutionPlan;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON form of an {@link ExecutionPlan}, the hand-off format for executors.
 */
@ApplicationScoped
public class ExecutionPlanSerializer {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String toJson(ExecutionPlan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize execution plan", e);
        }
    }

    public ExecutionPlan fromJson(String json) {
        try {
            return objectMapper.readValue(json, ExecutionPlan.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse execution plan", e);
        }
    }

    /**
     * Write the plan to a file, replacing any existing content.
     */
    public void write(ExecutionPlan plan, Path file) throws IOException {
        Files.writeString(file, toJson(plan), StandardCharsets.UTF_8);
    }
}
