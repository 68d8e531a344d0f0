package com.flowgraph.checkpoint.base;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A persisted snapshot of a graph run: the serialized state after a node completed,
 * plus the node execution continues with on resume.
 *
 * <p>Checkpoints are immutable. A checkpoint is identified by the pair
 * {@code (threadId, checkpointId)}; the sequence number is assigned by the saver
 * when the checkpoint is first stored and gives the total order used for
 * "latest" and "history" queries within a thread.
 */
public final class Checkpoint {
    private final String threadId;
    private final String checkpointId;
    private final byte[] state;
    private final String nextNode;
    private final String parentId;
    private final Map<String, Object> metadata;
    private final long sequence;
    private final Instant timestamp;

    private Checkpoint(Builder builder) {
        this.threadId = builder.threadId;
        this.checkpointId = builder.checkpointId;
        this.state = builder.state != null ? builder.state.clone() : new byte[0];
        this.nextNode = builder.nextNode;
        this.parentId = builder.parentId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.sequence = builder.sequence;
        this.timestamp = builder.timestamp;
    }

    /**
     * Create a builder for a new checkpoint.
     *
     * @return A new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder pre-populated with this checkpoint's values.
     *
     * @return A builder that yields an equal checkpoint unless modified
     */
    public Builder toBuilder() {
        return new Builder()
                .threadId(threadId)
                .checkpointId(checkpointId)
                .state(state)
                .nextNode(nextNode)
                .parentId(parentId)
                .metadata(metadata)
                .sequence(sequence)
                .timestamp(timestamp);
    }

    /**
     * Return a copy of this checkpoint carrying the given sequence number.
     *
     * @param sequence Sequence number assigned by a saver
     * @return A new checkpoint
     */
    public Checkpoint withSequence(long sequence) {
        return toBuilder().sequence(sequence).build();
    }

    public String getThreadId() {
        return threadId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }

    /**
     * Get the serialized state.
     *
     * @return A copy of the state bytes
     */
    public byte[] getState() {
        return state.clone();
    }

    /**
     * Get the node a resumed run starts with. A completed run records the end sentinel.
     *
     * @return Next node name
     */
    public String getNextNode() {
        return nextNode;
    }

    /**
     * Get the checkpoint this one was derived from.
     *
     * @return Parent checkpoint id, or null for the first checkpoint of a thread
     */
    public String getParentId() {
        return parentId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Checkpoint that = (Checkpoint) o;
        return sequence == that.sequence
                && Objects.equals(threadId, that.threadId)
                && Objects.equals(checkpointId, that.checkpointId)
                && Arrays.equals(state, that.state)
                && Objects.equals(nextNode, that.nextNode)
                && Objects.equals(parentId, that.parentId)
                && Objects.equals(metadata, that.metadata)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(threadId, checkpointId, nextNode, parentId, metadata, sequence, timestamp);
        return 31 * result + Arrays.hashCode(state);
    }

    @Override
    public String toString() {
        return "Checkpoint{" +
                "threadId='" + threadId + '\'' +
                ", checkpointId='" + checkpointId + '\'' +
                ", nextNode='" + nextNode + '\'' +
                ", parentId='" + parentId + '\'' +
                ", sequence=" + sequence +
                ", timestamp=" + timestamp +
                ", metadata=" + metadata +
                ", stateBytes=" + state.length +
                '}';
    }

    /**
     * Builder for {@link Checkpoint}.
     */
    public static final class Builder {
        private String threadId;
        private String checkpointId;
        private byte[] state;
        private String nextNode;
        private String parentId;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private long sequence;
        private Instant timestamp;

        private Builder() {
        }

        public Builder threadId(String threadId) {
            this.threadId = threadId;
            return this;
        }

        public Builder checkpointId(String checkpointId) {
            this.checkpointId = checkpointId;
            return this;
        }

        public Builder state(byte[] state) {
            this.state = state;
            return this;
        }

        public Builder nextNode(String nextNode) {
            this.nextNode = nextNode;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        /**
         * Replace the metadata map.
         *
         * @param metadata Metadata entries, may be null
         * @return This builder
         */
        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        /**
         * Add a single metadata entry.
         *
         * @param key Metadata key
         * @param value Metadata value
         * @return This builder
         */
        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder sequence(long sequence) {
            this.sequence = sequence;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /**
         * Build the checkpoint.
         *
         * @return The checkpoint
         * @throws IllegalArgumentException If the thread id or checkpoint id is missing
         */
        public Checkpoint build() {
            if (threadId == null || threadId.isEmpty()) {
                throw new IllegalArgumentException("Checkpoint thread id cannot be null or empty");
            }
            if (checkpointId == null || checkpointId.isEmpty()) {
                throw new IllegalArgumentException("Checkpoint id cannot be null or empty");
            }
            return new Checkpoint(this);
        }
    }
}
