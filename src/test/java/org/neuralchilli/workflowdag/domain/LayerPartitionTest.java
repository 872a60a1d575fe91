package org.neuralchilli.workflowdag.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class LayerPartitionTest {

    private final SimpleNode a = SimpleNode.create();
    private final SimpleNode b = SimpleNode.create();
    private final SimpleNode c = SimpleNode.create();

    @Test
    void shouldBeCompleteWhenEveryNodeIsPlaced() {
        LayerPartition<SimpleNode> partition = new LayerPartition<>(List.of(List.of(a, b), List.of(c)), 3);

        assertThat(partition.isComplete()).isTrue();
        assertThat(partition.placedNodes()).isEqualTo(3);
        assertThat(partition.depth()).isEqualTo(2);
        assertThat(partition.maxWidth()).isEqualTo(2);
    }

    @Test
    void shouldBeIncompleteWhenNodesAreMissing() {
        LayerPartition<SimpleNode> partition = new LayerPartition<>(List.of(List.of(a)), 3);

        assertThat(partition.isComplete()).isFalse();
        assertThat(partition.toString()).contains("placed=1/3");
    }

    @Test
    void shouldHandleEmptyGraph() {
        LayerPartition<SimpleNode> partition = new LayerPartition<>(List.of(), 0);

        assertThat(partition.isComplete()).isTrue();
        assertThat(partition.depth()).isZero();
        assertThat(partition.maxWidth()).isZero();
    }

    @Test
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new LayerPartition<SimpleNode>(null, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Layers cannot be null");
        assertThatThrownBy(() -> new LayerPartition<SimpleNode>(List.of(), -1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Total nodes cannot be negative");
    }
}
