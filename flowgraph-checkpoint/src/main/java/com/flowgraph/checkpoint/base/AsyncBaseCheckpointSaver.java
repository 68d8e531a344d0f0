package com.flowgraph.checkpoint.base;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking variant of {@link BaseCheckpointSaver} for backends whose storage
 * calls may block on I/O. Semantics match the synchronous contract.
 */
public interface AsyncBaseCheckpointSaver {
    /**
     * Store a checkpoint asynchronously.
     *
     * @param checkpoint The checkpoint to store
     * @return Future with the checkpoint as stored
     */
    CompletableFuture<Checkpoint> putAsync(Checkpoint checkpoint);

    /**
     * Get the latest checkpoint of a thread asynchronously.
     *
     * @param threadId The thread ID
     * @return Future with the latest checkpoint, or empty
     */
    CompletableFuture<Optional<Checkpoint>> getAsync(String threadId);

    /**
     * Get a specific checkpoint asynchronously.
     *
     * @param threadId The thread ID
     * @param checkpointId The checkpoint ID, or null for the latest
     * @return Future with the checkpoint, or empty
     */
    CompletableFuture<Optional<Checkpoint>> getAsync(String threadId, String checkpointId);

    /**
     * List the checkpoints of a thread asynchronously.
     *
     * @param threadId The thread ID
     * @return Future with checkpoints ordered oldest to newest
     */
    CompletableFuture<List<Checkpoint>> listAsync(String threadId);

    /**
     * Delete a single checkpoint asynchronously.
     *
     * @param threadId The thread ID
     * @param checkpointId The checkpoint ID
     * @return Future completed when the checkpoint is gone
     */
    CompletableFuture<Void> deleteAsync(String threadId, String checkpointId);

    /**
     * Delete all checkpoints of a thread asynchronously.
     *
     * @param threadId The thread ID
     * @return Future completed when the thread is cleared
     */
    CompletableFuture<Void> clearAsync(String threadId);
}
