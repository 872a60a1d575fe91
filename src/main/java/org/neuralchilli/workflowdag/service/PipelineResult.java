package org.neuralchilli.workflowdag.service;

import org.neuralchilli.workflowdag.domain.DagStatistics;
import org.neuralchilli.workflowdag.domain.ExecutionPlan;
import org.neuralchilli.workflowdag.export.DiagramFiles;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * What one run of the demo pipeline produced.
 * A cyclic generated graph stops the pipeline early, leaving only the
 * initial diagram and no plan.
 */
public record PipelineResult(
        DagStatistics statistics,
        List<DiagramFiles> diagrams,
        Optional<ExecutionPlan> plan,
        Optional<Path> planFile
) {
    public PipelineResult {
        diagrams = diagrams != null ? List.copyOf(diagrams) : List.of();
        plan = plan != null ? plan : Optional.empty();
        planFile = planFile != null ? planFile : Optional.empty();
    }

    public boolean isComplete() {
        return plan.isPresent();
    }
}
