package org.neuralchilli.workflowdag.service;

import jakarta.enterprise.context.ApplicationScoped;
import org.jgrapht.alg.cycle.CycleDetector;
import org.jgrapht.graph.DefaultEdge;
import org.neuralchilli.workflowdag.core.Digraph;
import org.neuralchilli.workflowdag.core.JGraphTAdapter;
import org.neuralchilli.workflowdag.domain.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Checks the preconditions the graph operations leave to the caller:
 * unique node identities, edges only between added nodes, and acyclicity.
 */
@ApplicationScoped
public class DigraphValidatorService {

    private static final Logger log = LoggerFactory.getLogger(DigraphValidatorService.class);

    /**
     * Validate a graph.
     *
     * @throws ValidationException listing every problem found
     */
    public <N extends Node> void validate(Digraph<N> graph) {
        List<String> errors = findProblems(graph);

        if (!errors.isEmpty()) {
            throw new ValidationException("Graph validation failed", errors);
        }
    }

    /**
     * Check whether a graph is a well-formed DAG.
     */
    public <N extends Node> boolean isValidDag(Digraph<N> graph) {
        return findProblems(graph).isEmpty();
    }

    /**
     * Collect every problem without throwing.
     */
    public <N extends Node> List<String> findProblems(Digraph<N> graph) {
        List<String> errors = new ArrayList<>();

        Set<UUID> known = validateUniqueNodes(graph, errors);
        validateEdgeEndpoints(graph, known, errors);
        validateNoCycles(graph, errors);

        if (!errors.isEmpty()) {
            log.debug("Graph has {} problem(s)", errors.size());
        }
        return errors;
    }

    private <N extends Node> Set<UUID> validateUniqueNodes(Digraph<N> graph, List<String> errors) {
        Set<UUID> seen = new HashSet<>();
        for (N node : graph.allNodes()) {
            if (!seen.add(node.id())) {
                errors.add("Node '" + node.label() + "' (" + node.id() + ") was added more than once");
            }
        }
        return seen;
    }

    private <N extends Node> void validateEdgeEndpoints(Digraph<N> graph, Set<UUID> known, List<String> errors) {
        for (UUID source : graph.adjacency().keySet()) {
            if (!known.contains(source)) {
                errors.add("Edges start from node " + source + " which is not in the graph");
            }
        }
        Set<UUID> checked = new HashSet<>();
        for (N from : graph.allNodes()) {
            if (!checked.add(from.id())) {
                continue;
            }
            for (N to : graph.adjacencyFrom(from)) {
                if (!known.contains(to.id())) {
                    errors.add("Node '" + from.label() + "' points to '" + to.label() +
                            "' which is not in the graph");
                }
            }
        }
    }

    private <N extends Node> void validateNoCycles(Digraph<N> graph, List<String> errors) {
        CycleDetector<N, DefaultEdge> detector = new CycleDetector<>(JGraphTAdapter.toJGraphT(graph));
        Set<N> onCycles = detector.findCycles();

        if (!onCycles.isEmpty()) {
            List<String> labels = graph.allNodes().stream()
                    .filter(onCycles::contains)
                    .map(Node::label)
                    .distinct()
                    .toList();
            errors.add("Circular dependency detected involving nodes: " + labels);
        }
    }
}
