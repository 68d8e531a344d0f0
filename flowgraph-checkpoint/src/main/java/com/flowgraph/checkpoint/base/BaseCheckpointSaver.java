package com.flowgraph.checkpoint.base;

import java.util.List;
import java.util.Optional;

/**
 * Storage contract for checkpoints, keyed by thread.
 *
 * <p>Implementations must make {@link #put(Checkpoint)} idempotent for a repeated
 * {@code (threadId, checkpointId)}: the stored data is replaced and no second ordering
 * entry is created. Operations on different threads must not block each other.
 */
public interface BaseCheckpointSaver {
    /**
     * Store a checkpoint. A new id is appended to the thread's history with the next
     * sequence number; an existing id is replaced in place and keeps its sequence.
     *
     * @param checkpoint The checkpoint to store
     * @return The checkpoint as stored, with its sequence number assigned
     */
    Checkpoint put(Checkpoint checkpoint);

    /**
     * Get the latest checkpoint of a thread.
     *
     * @param threadId The thread ID
     * @return The checkpoint with the highest sequence, or empty if the thread has none
     */
    Optional<Checkpoint> get(String threadId);

    /**
     * Get a specific checkpoint.
     *
     * @param threadId The thread ID
     * @param checkpointId The checkpoint ID, or null for the latest
     * @return The checkpoint, or empty if not found
     */
    Optional<Checkpoint> get(String threadId, String checkpointId);

    /**
     * List the checkpoints of a thread.
     *
     * @param threadId The thread ID
     * @return Checkpoints ordered oldest to newest
     */
    List<Checkpoint> list(String threadId);

    /**
     * Delete a single checkpoint.
     *
     * @param threadId The thread ID
     * @param checkpointId The checkpoint ID
     */
    void delete(String threadId, String checkpointId);

    /**
     * Delete all checkpoints of a thread.
     *
     * @param threadId The thread ID
     */
    void clear(String threadId);
}
