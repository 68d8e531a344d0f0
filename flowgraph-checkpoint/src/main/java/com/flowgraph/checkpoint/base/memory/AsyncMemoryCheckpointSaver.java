package com.flowgraph.checkpoint.base.memory;

import com.flowgraph.checkpoint.base.AsyncBaseCheckpointSaver;
import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.checkpoint.base.Checkpoint;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Asynchronous facade over a synchronous checkpoint saver. Every call is dispatched
 * to the configured executor, so a slow backend only delays the future of the caller
 * that issued it.
 */
public class AsyncMemoryCheckpointSaver implements AsyncBaseCheckpointSaver {
    private final BaseCheckpointSaver delegate;
    private final Executor executor;

    /**
     * Create an async saver over a fresh {@link MemoryCheckpointSaver}.
     */
    public AsyncMemoryCheckpointSaver() {
        this(new MemoryCheckpointSaver());
    }

    /**
     * Create an async saver over an existing synchronous saver, using the common pool.
     *
     * @param delegate The synchronous saver to wrap
     */
    public AsyncMemoryCheckpointSaver(BaseCheckpointSaver delegate) {
        this(delegate, ForkJoinPool.commonPool());
    }

    /**
     * Create an async saver over an existing synchronous saver.
     *
     * @param delegate The synchronous saver to wrap
     * @param executor Executor that runs the storage calls
     */
    public AsyncMemoryCheckpointSaver(BaseCheckpointSaver delegate, Executor executor) {
        if (delegate == null || executor == null) {
            throw new IllegalArgumentException("Delegate saver and executor are required");
        }
        this.delegate = delegate;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Checkpoint> putAsync(Checkpoint checkpoint) {
        return CompletableFuture.supplyAsync(() -> delegate.put(checkpoint), executor);
    }

    @Override
    public CompletableFuture<Optional<Checkpoint>> getAsync(String threadId) {
        return CompletableFuture.supplyAsync(() -> delegate.get(threadId), executor);
    }

    @Override
    public CompletableFuture<Optional<Checkpoint>> getAsync(String threadId, String checkpointId) {
        return CompletableFuture.supplyAsync(() -> delegate.get(threadId, checkpointId), executor);
    }

    @Override
    public CompletableFuture<List<Checkpoint>> listAsync(String threadId) {
        return CompletableFuture.supplyAsync(() -> delegate.list(threadId), executor);
    }

    @Override
    public CompletableFuture<Void> deleteAsync(String threadId, String checkpointId) {
        return CompletableFuture.runAsync(() -> delegate.delete(threadId, checkpointId), executor);
    }

    @Override
    public CompletableFuture<Void> clearAsync(String threadId) {
        return CompletableFuture.runAsync(() -> delegate.clear(threadId), executor);
    }

    /**
     * Get the wrapped synchronous saver.
     *
     * @return The synchronous saver
     */
    public BaseCheckpointSaver getDelegate() {
        return delegate;
    }
}
