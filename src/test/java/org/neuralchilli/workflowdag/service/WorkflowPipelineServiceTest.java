package org.neuralchilli.workflowdag.service;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.workflowdag.config.WorkflowDagConfig;
import org.neuralchilli.workflowdag.domain.ExecutionPlan;
import org.neuralchilli.workflowdag.export.DiagramFiles;
import org.neuralchilli.workflowdag.serializer.ExecutionPlanSerializer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs against {@code target/test-output} with rendering disabled.
 */
@QuarkusTest
class WorkflowPipelineServiceTest {

    @Inject
    WorkflowPipelineService pipeline;

    @Inject
    ExecutionPlanSerializer serializer;

    @Inject
    WorkflowDagConfig config;

    @Test
    void shouldProduceDiagramsAndPlan() throws IOException {
        PipelineResult result = pipeline.run();
        Path outputDir = Path.of(config.output().directory());

        assertThat(result.isComplete()).isTrue();
        assertThat(result.statistics().totalNodes()).isEqualTo(config.generator().nodes());
        assertThat(result.diagrams())
                .extracting(DiagramFiles::dotFile)
                .containsExactly(
                        outputDir.resolve("dag_initial.dot"),
                        outputDir.resolve("dag_final_linear.dot"),
                        outputDir.resolve("dag_final_parallel.dot"));
        assertThat(result.diagrams()).allSatisfy(files -> assertThat(files.dotFile()).exists());

        ExecutionPlan plan = result.plan().orElseThrow();
        assertThat(plan.order()).hasSize(config.generator().nodes());
        assertThat(result.planFile()).contains(outputDir.resolve("execution_plan.json"));
        assertThat(serializer.fromJson(Files.readString(result.planFile().get()))).isEqualTo(plan);
    }

    @Test
    void shouldBeRepeatableWithConfiguredSeed() throws IOException {
        ExecutionPlan first = pipeline.run().plan().orElseThrow();
        ExecutionPlan second = pipeline.run().plan().orElseThrow();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void shouldClearPreviousOutput() throws IOException {
        Path outputDir = Path.of(config.output().directory());
        Files.createDirectories(outputDir);
        Path stale = Files.writeString(outputDir.resolve("stale.dot"), "digraph G {}");

        pipeline.run();

        assertThat(stale).doesNotExist();
    }

    @Test
    void shouldSerialiseCompleteGraph() throws IOException {
        PipelineResult result = pipeline.run(5, 1.0, new Random(7));

        assertThat(result.statistics().executionLayers()).isEqualTo(5);
        assertThat(result.statistics().maxParallelism()).isEqualTo(1);
        assertThat(result.plan().orElseThrow().isParallel()).isFalse();
    }

    @Test
    void shouldKeepEveryNodeInOneLayerWithoutEdges() throws IOException {
        PipelineResult result = pipeline.run(4, 0.0, new Random(7));

        ExecutionPlan plan = result.plan().orElseThrow();
        assertThat(plan.layers()).hasSize(1);
        assertThat(plan.layers().get(0)).hasSize(4);
        assertThat(Files.readString(result.diagrams().get(2).dotFile())).contains("rank=same; // layer 0");
    }

    @Test
    void shouldHandleEmptyGraph() throws IOException {
        PipelineResult result = pipeline.run(0, 0.5, new Random(7));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.plan().orElseThrow().order()).isEmpty();
        assertThat(result.diagrams()).hasSize(3);
    }

    @Test
    void shouldRejectInvalidProbability() {
        assertThatThrownBy(() -> pipeline.run(3, 1.5, new Random(7)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Edge probability must be in [0,1]");
    }
}
