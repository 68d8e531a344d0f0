package com.flowgraph.graph.registry;

import com.flowgraph.graph.StateGraph;
import com.flowgraph.graph.TraceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class EdgeTableTest {
    private EdgeTable<TraceState> table;

    @BeforeEach
    public void setUp() {
        table = new EdgeTable<>();
    }

    @Test
    public void testNextPrefersConditionalEdge() {
        table.addEdge("a", "b");
        table.addConditionalEdge(new ConditionalEdge<>("c", state -> state.size() > 1 ? "a" : "b", null));

        assertThat(table.next("a", TraceState.of())).isEqualTo("b");
        assertThat(table.next("c", TraceState.of("x"))).isEqualTo("b");
        assertThat(table.next("c", TraceState.of("x", "y"))).isEqualTo("a");
        // No outgoing edges ends the run
        assertThat(table.next("b", TraceState.of())).isEqualTo(StateGraph.END);
    }

    @Test
    public void testShadowedEdges() {
        table.addEdge("a", "b").addEdge("a", "c").addEdge("b", "c");

        assertThat(table.getTargets("a")).containsExactly("b", "c");
        assertThat(table.next("a", TraceState.of())).isEqualTo("b");
        assertThat(table.getShadowedEdges()).containsOnly(Map.entry("a", List.of("b", "c")));
    }

    @Test
    public void testValidateAcceptsValidTable() {
        table.addEdge("a", "b").addEdge("b", StateGraph.END);
        table.addConditionalEdge(new ConditionalEdge<>("c", state -> "a", Map.of("back", "a", "stop", StateGraph.END)));

        assertThat(table.validate(Set.of("a", "b", "c"))).isEmpty();
    }

    @Test
    public void testFrozenTableRejectsChanges() {
        table.addEdge("a", "b");
        EdgeTable<TraceState> frozen = table.freeze();

        assertThat(frozen.isFrozen()).isTrue();
        assertThat(frozen.getEdges()).containsExactly(new Edge("a", "b"));
        assertThatThrownBy(() -> frozen.addEdge("b", "a")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> frozen.addConditionalEdge(new ConditionalEdge<>("a", state -> "b", null)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testConditionalEdgeCopiesPathMap() {
        ConditionalEdge<TraceState> edge = new ConditionalEdge<>("a", state -> "b", Map.of("go", "b"));

        assertThat(edge.getPathMap()).containsEntry("go", "b");
        assertThatThrownBy(() -> edge.getPathMap().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> new ConditionalEdge<TraceState>("a", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
