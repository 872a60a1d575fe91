package org.neuralchilli.workflowdag.export;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.workflowdag.config.WorkflowDagConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Turns DOT files into images by running the Graphviz executable.
 */
@ApplicationScoped
public class GraphvizRenderer {

    private static final Logger log = LoggerFactory.getLogger(GraphvizRenderer.class);

    @Inject
    WorkflowDagConfig config;

    /**
     * Render with the configured command, format and timeout.
     */
    public void render(Path dotFile, Path imageFile) {
        WorkflowDagConfig.Render render = config.render();
        render(render.command(), render.format(), dotFile, imageFile,
                Duration.ofSeconds(render.timeoutSeconds()));
    }

    /**
     * Run {@code <command> -T<format> <dotFile> -o <imageFile>}.
     *
     * @throws RendererException if the command cannot start, exits non-zero or times out
     */
    public void render(String command, String format, Path dotFile, Path imageFile, Duration timeout) {
        List<String> commandLine = List.of(
                command,
                "-T" + format,
                dotFile.toString(),
                "-o",
                imageFile.toString()
        );
        log.debug("Executing renderer: {}", String.join(" ", commandLine));

        Process process;
        try {
            process = new ProcessBuilder(commandLine)
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            throw new RendererException("Failed to start renderer '" + command + "': " + e.getMessage(), e);
        }

        StringBuffer output = new StringBuffer();
        Thread drainer = new Thread(() -> drain(process, output), "renderer-output");
        drainer.setDaemon(true);
        drainer.start();

        try {
            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new RendererException(
                        "Renderer '" + command + "' timed out after " + timeout.toSeconds() + " seconds");
            }

            // Output is complete once the stream reaches its end
            drainer.join(TimeUnit.SECONDS.toMillis(1));

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new RendererException(
                        "Renderer '" + command + "' exited with code " + exitCode + "\n" + output.toString().trim(),
                        exitCode);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RendererException("Renderer interrupted", e);
        }
    }

    private static void drain(Process process, StringBuffer output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
                log.debug("[RENDERER] {}", line);
            }
        } catch (IOException e) {
            // Closed when the process is destroyed on timeout
            log.debug("Stopped reading renderer output: {}", e.getMessage());
        }
    }
}
