package org.neuralchilli.workflowdag.export;

import org.junit.jupiter.api.Test;
import org.neuralchilli.workflowdag.core.SimpleDigraph;
import org.neuralchilli.workflowdag.domain.Node;
import org.neuralchilli.workflowdag.domain.SimpleNode;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class DotWriterTest {

    private final SimpleNode a = node("aaaaaaaa-0000-4000-8000-000000000001");
    private final SimpleNode b = node("bbbbbbbb-0000-4000-8000-000000000002");
    private final SimpleNode c = node("cccccccc-0000-4000-8000-000000000003");

    @Test
    void shouldWriteNodesAndEdges() {
        SimpleDigraph<SimpleNode> graph = graph();

        assertThat(DotWriter.toDot(graph)).isEqualTo("""
                digraph G {
                  rankdir=LR;
                  node [shape=box, style=rounded, fontsize=12];
                  0 [label="aaaaaaaa"];
                  1 [label="bbbbbbbb"];
                  2 [label="cccccccc"];
                  0 -> 1;
                  0 -> 2;
                }
                """);
    }

    @Test
    void shouldWriteRankGroups() {
        SimpleDigraph<SimpleNode> graph = graph();

        assertThat(DotWriter.toDot(graph, List.of(List.of(a), List.of(b, c)))).isEqualTo("""
                digraph G {
                  rankdir=LR;
                  node [shape=box, style=rounded, fontsize=12];
                  0 [label="aaaaaaaa"];
                  1 [label="bbbbbbbb"];
                  2 [label="cccccccc"];
                  { rank=same; // layer 0
                    0;
                  }
                  { rank=same; // layer 1
                    1;
                    2;
                  }
                  0 -> 1;
                  0 -> 2;
                }
                """);
    }

    @Test
    void shouldSkipRankMembersOutsideGraph() {
        SimpleDigraph<SimpleNode> graph = graph();
        SimpleNode stranger = SimpleNode.create();

        String dot = DotWriter.toDot(graph, List.of(List.of(stranger, c)));

        assertThat(dot).contains("  { rank=same; // layer 0\n    2;\n  }\n");
    }

    @Test
    void shouldSkipEdgesToNodesOutsideGraph() {
        SimpleDigraph<SimpleNode> graph = new SimpleDigraph<>();
        graph.addNode(a);
        graph.addEdge(a, b);

        assertThat(DotWriter.toDot(graph)).doesNotContain("->");
    }

    @Test
    void shouldWriteEmptyGraph() {
        assertThat(DotWriter.toDot(new SimpleDigraph<SimpleNode>())).isEqualTo("""
                digraph G {
                  rankdir=LR;
                  node [shape=box, style=rounded, fontsize=12];
                }
                """);
    }

    @Test
    void shouldEscapeQuotesInLabels() {
        Node quoted = new Node() {
            private final UUID id = UUID.randomUUID();

            @Override
            public UUID id() {
                return id;
            }

            @Override
            public String label() {
                return "say \"hi\"";
            }
        };
        SimpleDigraph<Node> graph = new SimpleDigraph<>();
        graph.addNode(quoted);

        assertThat(DotWriter.toDot(graph)).contains("0 [label=\"say \\\"hi\\\"\"];");
    }

    private SimpleDigraph<SimpleNode> graph() {
        SimpleDigraph<SimpleNode> graph = new SimpleDigraph<>();
        graph.addNode(a);
        graph.addNode(b);
        graph.addNode(c);
        graph.addEdge(a, b);
        graph.addEdge(a, c);
        return graph;
    }

    private static SimpleNode node(String id) {
        return new SimpleNode(UUID.fromString(id));
    }
}
