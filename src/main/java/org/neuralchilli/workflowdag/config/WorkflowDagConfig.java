package org.neuralchilli.workflowdag.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Settings of the demo pipeline: random generation, output location and
 * diagram rendering.
 */
@ConfigMapping(prefix = "workflow-dag")
public interface WorkflowDagConfig {

    Generator generator();

    Output output();

    Render render();

    interface Generator {

        /**
         * Number of nodes to generate
         */
        @WithDefault("6")
        int nodes();

        /**
         * Probability of each allowed edge
         */
        @WithName("edge-probability")
        @WithDefault("0.3")
        double edgeProbability();

        /**
         * Random seed; a time based seed is used when absent
         */
        Optional<Long> seed();
    }

    interface Output {

        @WithDefault("example_output")
        String directory();

        /**
         * Log every edge of the generated graph
         */
        @WithName("print-edges")
        @WithDefault("false")
        boolean printEdges();
    }

    interface Render {

        /**
         * Run the external renderer after writing each DOT file
         */
        @WithDefault("true")
        boolean enabled();

        /**
         * Graphviz executable
         */
        @WithDefault("dot")
        String command();

        /**
         * Image format passed as -T
         */
        @WithDefault("png")
        String format();

        @WithName("timeout-seconds")
        @WithDefault("30")
        int timeoutSeconds();
    }
}
