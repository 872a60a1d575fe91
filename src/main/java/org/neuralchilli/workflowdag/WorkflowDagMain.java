package org.neuralchilli.workflowdag;

import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.neuralchilli.workflowdag.export.DiagramExportException;
import org.neuralchilli.workflowdag.service.PipelineResult;
import org.neuralchilli.workflowdag.service.WorkflowPipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Command-mode entry point running the workflow DAG pipeline once.
 * Settings come from configuration ({@code workflow-dag.*}), so they can be
 * overridden with system properties or environment variables.
 */
@QuarkusMain
public class WorkflowDagMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(WorkflowDagMain.class);

    @Inject
    WorkflowPipelineService pipeline;

    @Override
    public int run(String... args) {
        try {
            PipelineResult result = pipeline.run();
            return result.isComplete() ? 0 : 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid settings: {}", e.getMessage());
            return 2;
        } catch (DiagramExportException e) {
            log.error("Saving diagram failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("Preparing output failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
