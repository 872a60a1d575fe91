package org.neuralchilli.workflowdag.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.workflowdag.domain.SimpleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Generates random DAGs that are acyclic by construction.
 * <p>
 * A random permutation fixes a total order over the nodes and edges are only
 * ever drawn from a lower to a higher rank, so no cycle can form and the
 * permutation is itself a topological order of the result.
 */
@ApplicationScoped
public class RandomDagGenerator {

    private static final Logger log = LoggerFactory.getLogger(RandomDagGenerator.class);

    /**
     * Generate a random DAG.
     *
     * @param nodeCount       number of nodes, at least 0
     * @param edgeProbability independent inclusion probability of each allowed edge, in [0, 1]
     * @param random          source of all randomness, including node identities
     * @return a new acyclic graph
     */
    public SimpleDigraph<SimpleNode> generate(int nodeCount, double edgeProbability, Random random) {
        if (nodeCount < 0) {
            throw new IllegalArgumentException("Node count cannot be negative, got: " + nodeCount);
        }
        if (!(edgeProbability >= 0.0 && edgeProbability <= 1.0)) {
            throw new IllegalArgumentException("Edge probability must be in [0,1], got: " + edgeProbability);
        }
        if (random == null) {
            throw new IllegalArgumentException("Random source cannot be null");
        }

        SimpleDigraph<SimpleNode> graph = new SimpleDigraph<>();
        for (int i = 0; i < nodeCount; i++) {
            graph.addNode(SimpleNode.random(random));
        }

        int[] position = randomPositions(nodeCount, random);
        List<SimpleNode> nodes = graph.allNodes();

        for (int u = 0; u < nodeCount; u++) {
            for (int v = 0; v < nodeCount; v++) {
                if (u != v && position[u] < position[v] && random.nextDouble() < edgeProbability) {
                    graph.addEdge(nodes.get(u), nodes.get(v));
                }
            }
        }

        log.debug("Generated random DAG: {} nodes, {} edges (p={})",
                graph.nodeCount(), graph.edgeCount(), edgeProbability);
        return graph;
    }

    /**
     * position[i] is the rank of node i in a uniformly random permutation.
     */
    private int[] randomPositions(int nodeCount, Random random) {
        List<Integer> permutation = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            permutation.add(i);
        }
        Collections.shuffle(permutation, random);

        int[] position = new int[nodeCount];
        for (int rank = 0; rank < nodeCount; rank++) {
            position[permutation.get(rank)] = rank;
        }
        return position;
    }
}
