package com.flowgraph.graph;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.checkpoint.base.Checkpoint;
import com.flowgraph.checkpoint.base.CheckpointException;
import com.flowgraph.checkpoint.base.ID;
import com.flowgraph.checkpoint.serde.Serializer;
import com.flowgraph.graph.execute.ExecutionLoop;
import com.flowgraph.graph.execute.NodeCache;
import com.flowgraph.graph.registry.EdgeTable;
import com.flowgraph.graph.registry.NodeRegistry;
import com.flowgraph.state.State;
import com.flowgraph.stream.GraphStream;
import com.flowgraph.stream.StreamMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * An immutable, validated graph ready to run.
 *
 * <p>A compiled graph holds no per-run state and can be invoked from many threads at
 * once. Runs that share a thread id share a checkpoint history, so callers must not run
 * the same thread concurrently.
 *
 * @param <S> State type
 */
public class CompiledGraph<S extends State<S>> {
    private static final Logger log = LoggerFactory.getLogger(CompiledGraph.class);

    /** Maximum number of node executions in one invocation. */
    public static final int MAX_ITERATIONS = 100;

    private final NodeRegistry<S> nodes;
    private final EdgeTable<S> edges;
    private final String entryPoint;
    private final Set<String> interruptBefore;
    private final Set<String> interruptAfter;
    private final BaseCheckpointSaver checkpointer;
    private final Serializer<Object> serializer;
    private final Executor executor;
    private final NodeCache<S> nodeCache;

    CompiledGraph(
            NodeRegistry<S> nodes,
            EdgeTable<S> edges,
            String entryPoint,
            Set<String> interruptBefore,
            Set<String> interruptAfter,
            BaseCheckpointSaver checkpointer,
            Serializer<Object> serializer,
            Executor executor,
            NodeCache<S> nodeCache) {
        this.nodes = nodes;
        this.edges = edges;
        this.entryPoint = entryPoint;
        this.interruptBefore = Collections.unmodifiableSet(new LinkedHashSet<>(interruptBefore));
        this.interruptAfter = Collections.unmodifiableSet(new LinkedHashSet<>(interruptAfter));
        this.checkpointer = checkpointer;
        this.serializer = serializer;
        this.executor = executor;
        this.nodeCache = nodeCache;
    }

    /**
     * Run the graph without persistence.
     *
     * @param input Input state
     * @return Result of the run
     */
    public GraphResult<S> invoke(S input) {
        return invoke(input, GraphConfig.empty());
    }

    /**
     * Run the graph. With a thread id and a checkpointer, the run resumes the thread's
     * pending checkpoint if there is one and otherwise starts from the entry point.
     *
     * @param input Input state; ignored when the thread resumes
     * @param config Run configuration
     * @return Result of the run
     * @throws com.flowgraph.graph.execute.NodeExecutionException If a node fails
     * @throws com.flowgraph.graph.execute.RoutingException If a route names an unknown node
     * @throws com.flowgraph.graph.execute.IterationLimitExceededError If the run does not end in time
     */
    public GraphResult<S> invoke(S input, GraphConfig config) {
        return new ExecutionLoop<>(this, input, config).run();
    }

    /**
     * Continue a paused thread from its latest checkpoint.
     *
     * @param config Run configuration with a thread id
     * @return Result of the run
     */
    public GraphResult<S> resume(GraphConfig config) {
        requireThread(config);
        return invoke(null, config);
    }

    public CompletableFuture<GraphResult<S>> invokeAsync(S input) {
        return invokeAsync(input, GraphConfig.empty());
    }

    /**
     * Run the graph on the graph's executor. Cancelling the returned future stops the run
     * before its next node; the node in flight is not checkpointed.
     *
     * @param input Input state
     * @param config Run configuration
     * @return Future with the result
     */
    public CompletableFuture<GraphResult<S>> invokeAsync(S input, GraphConfig config) {
        ExecutionLoop<S> loop = new ExecutionLoop<>(this, input, config);
        CompletableFuture<GraphResult<S>> future = CompletableFuture.supplyAsync(loop::run, executor);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                loop.cancel();
            }
        });
        return future;
    }

    public GraphStream<S> stream(S input, StreamMode mode) {
        return stream(input, mode, GraphConfig.empty());
    }

    /**
     * Run the graph lazily, one node per pulled event.
     *
     * @param input Input state
     * @param mode What each event carries
     * @param config Run configuration
     * @return Single-pass event stream
     */
    public GraphStream<S> stream(S input, StreamMode mode, GraphConfig config) {
        return new GraphStream<>(new ExecutionLoop<>(this, input, config), mode);
    }

    public GraphStream<S> stream(S input, Set<StreamMode> modes) {
        return stream(input, modes, GraphConfig.empty());
    }

    /**
     * Run the graph lazily, emitting one event per requested mode for each node.
     *
     * @param input Input state
     * @param modes What the events carry, at least one mode
     * @param config Run configuration
     * @return Single-pass event stream
     * @throws IllegalArgumentException If no mode is given
     */
    public GraphStream<S> stream(S input, Set<StreamMode> modes, GraphConfig config) {
        return new GraphStream<>(new ExecutionLoop<>(this, input, config), modes);
    }

    /**
     * Get the latest checkpoint of a thread, or the one named by the configuration.
     *
     * @param config Configuration with a thread id
     * @return The snapshot, or empty if none exists or no checkpointer is configured
     */
    public Optional<StateSnapshot<S>> getState(GraphConfig config) {
        requireThread(config);
        if (checkpointer == null) {
            return Optional.empty();
        }
        return checkpointer.get(config.getThreadId(), config.getCheckpointId()).map(this::toSnapshot);
    }

    /**
     * Get every checkpoint of a thread.
     *
     * @param config Configuration with a thread id
     * @return Snapshots ordered oldest to newest
     */
    public List<StateSnapshot<S>> getStateHistory(GraphConfig config) {
        requireThread(config);
        if (checkpointer == null) {
            return Collections.emptyList();
        }
        List<StateSnapshot<S>> history = new ArrayList<>();
        for (Checkpoint checkpoint : checkpointer.list(config.getThreadId())) {
            history.add(toSnapshot(checkpoint));
        }
        return history;
    }

    /**
     * Merge an update into a thread's checkpointed state without running a node. The new
     * checkpoint keeps the node the thread continues with.
     *
     * @param config Configuration with a thread id, optionally a checkpoint id to update
     * @param update Update to merge
     * @return Snapshot of the new checkpoint
     * @throws IllegalStateException If no checkpointer is configured
     * @throws CheckpointException If the thread has no checkpoint
     */
    @SuppressWarnings("unchecked")
    public StateSnapshot<S> updateState(GraphConfig config, S update) {
        requireThread(config);
        if (checkpointer == null) {
            throw new IllegalStateException("updateState requires a checkpointer");
        }
        String threadId = config.getThreadId();
        Checkpoint base = checkpointer.get(threadId, config.getCheckpointId())
                .orElseThrow(() -> new CheckpointException("No checkpoint found for thread '" + threadId + "'"));

        S state = (S) serializer.deserialize(base.getState());
        if (update != null) {
            state = state.merge(update);
        }

        Map<String, Object> metadata = new LinkedHashMap<>(config.getMetadata());
        metadata.put(CheckpointMetadata.SOURCE, CheckpointMetadata.UPDATE_STATE);
        Object pausedAt = base.getMetadata().get(CheckpointMetadata.INTERRUPTED_BEFORE);
        if (pausedAt != null) {
            metadata.put(CheckpointMetadata.INTERRUPTED_BEFORE, pausedAt);
        }
        Checkpoint stored = checkpointer.put(Checkpoint.builder()
                .threadId(threadId)
                .checkpointId(ID.checkpointId(threadId))
                .state(serializer.serialize(state))
                .nextNode(base.getNextNode())
                .parentId(base.getCheckpointId())
                .metadata(metadata)
                .build());
        log.info("Updated state of thread '{}' (next '{}')", threadId, stored.getNextNode());
        return toSnapshot(stored);
    }

    public Set<String> getNodeNames() {
        return nodes.names();
    }

    public NodeRegistry<S> getNodes() {
        return nodes;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public EdgeTable<S> getEdgeTable() {
        return edges;
    }

    public Set<String> getInterruptBefore() {
        return interruptBefore;
    }

    public Set<String> getInterruptAfter() {
        return interruptAfter;
    }

    public Optional<BaseCheckpointSaver> getCheckpointer() {
        return Optional.ofNullable(checkpointer);
    }

    public Serializer<Object> getSerializer() {
        return serializer;
    }

    public Executor getExecutor() {
        return executor;
    }

    public NodeCache<S> getNodeCache() {
        return nodeCache;
    }

    @SuppressWarnings("unchecked")
    private StateSnapshot<S> toSnapshot(Checkpoint checkpoint) {
        return new StateSnapshot<>(
                (S) serializer.deserialize(checkpoint.getState()),
                checkpoint.getNextNode(),
                checkpoint.getCheckpointId(),
                checkpoint.getParentId(),
                checkpoint.getMetadata(),
                checkpoint.getSequence(),
                checkpoint.getTimestamp());
    }

    private static void requireThread(GraphConfig config) {
        if (config == null || !config.hasThreadId()) {
            throw new IllegalArgumentException("A thread id is required");
        }
    }
}
