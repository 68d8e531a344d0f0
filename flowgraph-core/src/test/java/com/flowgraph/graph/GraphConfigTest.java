package com.flowgraph.graph;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class GraphConfigTest {

    @Test
    public void testFromMap() {
        // Create test data
        Map<String, Object> raw = new HashMap<>();
        raw.put("thread_id", "t-1");
        raw.put("checkpoint_id", "c-9");
        raw.put("metadata", Map.of("user", "ada"));
        raw.put("ignored", 3);

        GraphConfig config = GraphConfig.fromMap(raw);

        assertThat(config.getThreadId()).isEqualTo("t-1");
        assertThat(config.getCheckpointId()).isEqualTo("c-9");
        assertThat(config.getMetadata()).containsExactly(Map.entry("user", "ada"));
        assertThat(GraphConfig.fromMap(config.toMap())).isEqualTo(config);
    }

    @Test
    public void testEmpty() {
        GraphConfig config = GraphConfig.fromMap(null);

        assertThat(config.hasThreadId()).isFalse();
        assertThat(config).isEqualTo(GraphConfig.empty());
        assertThat(config.toMap()).isEmpty();
    }

    @Test
    public void testWithCheckpointId() {
        GraphConfig config = GraphConfig.builder().threadId("t").metadata("k", "v").build();

        GraphConfig fork = config.withCheckpointId("c");

        assertThat(fork.getThreadId()).isEqualTo("t");
        assertThat(fork.getCheckpointId()).isEqualTo("c");
        assertThat(fork.getMetadata()).containsEntry("k", "v");
        assertThat(config.getCheckpointId()).isNull();
    }

    @Test
    public void testInvalidConfig() {
        assertThatThrownBy(() -> GraphConfig.builder().threadId(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GraphConfig.builder().checkpointId("c").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("A checkpoint id requires a thread id");
    }
}
