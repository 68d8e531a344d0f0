package com.flowgraph.graph.registry;

import com.flowgraph.graph.TraceState;
import com.flowgraph.node.Node;
import org.junit.jupiter.api.Test;

import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class NodeRegistryTest {

    @Test
    public void testRegisterKeepsOrderAndReplaces() {
        Node<TraceState> first = Node.of(state -> TraceState.of("first"));
        Node<TraceState> second = Node.of(state -> TraceState.of("second"));
        NodeRegistry<TraceState> registry = new NodeRegistry<TraceState>()
                .register("b", first)
                .register("a", first)
                .register("b", second);

        assertThat(registry.names()).containsExactly("b", "a");
        assertThat(registry.get("b")).isSameAs(second);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    public void testUnknownNode() {
        NodeRegistry<TraceState> registry = new NodeRegistry<>();

        assertThat(registry.contains("x")).isFalse();
        assertThatThrownBy(() -> registry.get("x"))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("'x'");
    }

    @Test
    public void testFreezeIsIndependentCopy() {
        NodeRegistry<TraceState> registry = new NodeRegistry<TraceState>()
                .register("a", Node.of(state -> null));
        NodeRegistry<TraceState> frozen = registry.freeze();

        registry.register("b", Node.of(state -> null));

        assertThat(frozen.names()).containsExactly("a");
        assertThat(frozen.isFrozen()).isTrue();
        assertThatThrownBy(() -> frozen.register("c", Node.of(state -> null)))
                .isInstanceOf(IllegalStateException.class);
    }
}
