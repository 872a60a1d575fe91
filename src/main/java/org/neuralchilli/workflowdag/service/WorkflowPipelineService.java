package org.neuralchilli.workflowdag.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.workflowdag.config.WorkflowDagConfig;
import org.neuralchilli.workflowdag.core.DagAnalysisService;
import org.neuralchilli.workflowdag.core.DigraphBuilders;
import org.neuralchilli.workflowdag.core.RandomDagGenerator;
import org.neuralchilli.workflowdag.core.SimpleDigraph;
import org.neuralchilli.workflowdag.domain.DagStatistics;
import org.neuralchilli.workflowdag.domain.ExecutionPlan;
import org.neuralchilli.workflowdag.domain.Node;
import org.neuralchilli.workflowdag.domain.SimpleNode;
import org.neuralchilli.workflowdag.domain.TopologicalSortResult;
import org.neuralchilli.workflowdag.export.DiagramExportService;
import org.neuralchilli.workflowdag.export.DiagramFiles;
import org.neuralchilli.workflowdag.serializer.ExecutionPlanSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Generates a random workflow DAG, analyses it and exports the initial,
 * serialised and layered forms as diagrams plus a JSON execution plan.
 */
@ApplicationScoped
public class WorkflowPipelineService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPipelineService.class);

    static final String INITIAL_DIAGRAM = "dag_initial";
    static final String LINEAR_DIAGRAM = "dag_final_linear";
    static final String PARALLEL_DIAGRAM = "dag_final_parallel";
    static final String PLAN_FILE = "execution_plan.json";

    @Inject
    WorkflowDagConfig config;

    @Inject
    RandomDagGenerator generator;

    @Inject
    DagAnalysisService analysisService;

    @Inject
    DigraphValidatorService validatorService;

    @Inject
    DiagramExportService exportService;

    @Inject
    ExecutionPlanSerializer planSerializer;

    /**
     * Run the pipeline with the configured settings.
     *
     * @throws IllegalArgumentException if the generator settings are out of range
     * @throws IOException              if the output directory cannot be prepared or the plan written
     */
    public PipelineResult run() throws IOException {
        WorkflowDagConfig.Generator settings = config.generator();
        validateSettings(settings);

        long seed = settings.seed().orElseGet(System::nanoTime);
        return run(settings.nodes(), settings.edgeProbability(), new Random(seed));
    }

    /**
     * Run the pipeline with explicit generation parameters.
     */
    public PipelineResult run(int nodeCount, double edgeProbability, Random random) throws IOException {
        Path outputDir = Path.of(config.output().directory());
        prepareOutputDirectory(outputDir);

        SimpleDigraph<SimpleNode> graph = generator.generate(nodeCount, edgeProbability, random);
        List<String> problems = validatorService.findProblems(graph);
        if (!problems.isEmpty()) {
            log.warn("Generated graph is not a well-formed DAG: {}", problems);
        }
        DagStatistics statistics = analysisService.statistics(graph);
        log.info("Generated {}", statistics);

        if (config.output().printEdges()) {
            log.info("Edges (initial DAG):");
            for (SimpleNode from : graph.allNodes()) {
                for (SimpleNode to : graph.adjacencyFrom(from)) {
                    log.info("  {} -> {}", from.label(), to.label());
                }
            }
        }

        List<DiagramFiles> diagrams = new ArrayList<>();
        diagrams.add(exportService.export(graph, outputDir.resolve(INITIAL_DIAGRAM)));

        TopologicalSortResult<SimpleNode> sorted = analysisService.topologicalSort(graph);
        if (!sorted.isAcyclic()) {
            log.error("Cycle detected in generated graph ({} nodes unplaced)", sorted.unplacedNodes());
            return new PipelineResult(statistics, diagrams, Optional.empty(), Optional.empty());
        }
        List<SimpleNode> order = sorted.order();
        log.info("Topological order: {}", labels(order, " -> "));

        List<List<SimpleNode>> layers = analysisService.computeLayers(graph);
        log.info("Execution layers:");
        for (int i = 0; i < layers.size(); i++) {
            log.info("  Layer {}: {}", i, labels(layers.get(i), " "));
        }

        SimpleDigraph<SimpleNode> linear = DigraphBuilders.linearChain(order);
        diagrams.add(exportService.export(linear, outputDir.resolve(LINEAR_DIAGRAM)));

        SimpleDigraph<SimpleNode> parallel = DigraphBuilders.layeredDag(layers);
        diagrams.add(exportService.export(parallel, outputDir.resolve(PARALLEL_DIAGRAM), layers));

        ExecutionPlan plan = ExecutionPlan.of(order, layers);
        Path planFile = outputDir.resolve(PLAN_FILE);
        planSerializer.write(plan, planFile);
        log.info("Saved execution plan as {}", planFile);

        return new PipelineResult(statistics, diagrams, Optional.of(plan), Optional.of(planFile));
    }

    private void validateSettings(WorkflowDagConfig.Generator settings) {
        if (settings.nodes() <= 0) {
            throw new IllegalArgumentException("Node count must be > 0, got: " + settings.nodes());
        }
        if (settings.edgeProbability() < 0 || settings.edgeProbability() > 1) {
            throw new IllegalArgumentException(
                    "Edge probability must be in [0,1], got: " + settings.edgeProbability());
        }
    }

    private void prepareOutputDirectory(Path outputDir) throws IOException {
        if (Files.exists(outputDir)) {
            try (Stream<Path> paths = Files.walk(outputDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
            }
        }
        Files.createDirectories(outputDir);
    }

    private static String labels(List<? extends Node> nodes, String separator) {
        return nodes.stream().map(Node::label).collect(Collectors.joining(separator));
    }
}
