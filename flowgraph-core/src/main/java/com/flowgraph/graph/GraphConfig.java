package com.flowgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run configuration. The thread id selects the checkpoint history a run reads and
 * writes; it is never part of the state value.
 */
public final class GraphConfig {
    public static final String THREAD_ID = "thread_id";
    public static final String CHECKPOINT_ID = "checkpoint_id";
    public static final String METADATA = "metadata";

    private static final GraphConfig EMPTY = builder().build();

    private final String threadId;
    private final String checkpointId;
    private final Map<String, Object> metadata;

    private GraphConfig(Builder builder) {
        this.threadId = builder.threadId;
        this.checkpointId = builder.checkpointId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Configuration without a thread; runs are not checkpointed.
     *
     * @return Empty configuration
     */
    public static GraphConfig empty() {
        return EMPTY;
    }

    public static GraphConfig of(String threadId) {
        return builder().threadId(threadId).build();
    }

    /**
     * Build a configuration from a loose map with the keys {@code thread_id},
     * {@code checkpoint_id} and {@code metadata}. Unknown keys are ignored.
     *
     * @param config Configuration map, may be null
     * @return The configuration
     */
    @SuppressWarnings("unchecked")
    public static GraphConfig fromMap(Map<String, Object> config) {
        Builder builder = builder();
        if (config == null) {
            return builder.build();
        }
        Object threadId = config.get(THREAD_ID);
        if (threadId != null) {
            builder.threadId(threadId.toString());
        }
        Object checkpointId = config.get(CHECKPOINT_ID);
        if (checkpointId != null) {
            builder.checkpointId(checkpointId.toString());
        }
        Object metadata = config.get(METADATA);
        if (metadata instanceof Map) {
            ((Map<Object, Object>) metadata).forEach((key, value) -> builder.metadata(String.valueOf(key), value));
        }
        return builder.build();
    }

    public String getThreadId() {
        return threadId;
    }

    /**
     * Get the checkpoint to fork from, for time travel.
     *
     * @return Checkpoint id, or null to use the latest checkpoint
     */
    public String getCheckpointId() {
        return checkpointId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean hasThreadId() {
        return threadId != null;
    }

    /**
     * Copy of this configuration pointing at a specific checkpoint.
     *
     * @param checkpointId Checkpoint to fork from
     * @return New configuration
     */
    public GraphConfig withCheckpointId(String checkpointId) {
        return builder().threadId(threadId).checkpointId(checkpointId).metadata(metadata).build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (threadId != null) {
            map.put(THREAD_ID, threadId);
        }
        if (checkpointId != null) {
            map.put(CHECKPOINT_ID, checkpointId);
        }
        if (!metadata.isEmpty()) {
            map.put(METADATA, metadata);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GraphConfig that = (GraphConfig) o;
        return Objects.equals(threadId, that.threadId)
                && Objects.equals(checkpointId, that.checkpointId)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(threadId, checkpointId, metadata);
    }

    @Override
    public String toString() {
        return "GraphConfig" + toMap();
    }

    public static final class Builder {
        private String threadId;
        private String checkpointId;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder threadId(String threadId) {
            if (threadId != null && threadId.isEmpty()) {
                throw new IllegalArgumentException("Thread id cannot be empty");
            }
            this.threadId = threadId;
            return this;
        }

        public Builder checkpointId(String checkpointId) {
            this.checkpointId = checkpointId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            if (key == null) {
                throw new IllegalArgumentException("Metadata key cannot be null");
            }
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            if (metadata != null) {
                metadata.forEach(this::metadata);
            }
            return this;
        }

        public GraphConfig build() {
            if (checkpointId != null && threadId == null) {
                throw new IllegalArgumentException("A checkpoint id requires a thread id");
            }
            return new GraphConfig(this);
        }
    }
}
