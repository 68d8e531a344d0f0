package com.flowgraph.graph.execute;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.checkpoint.base.Checkpoint;
import com.flowgraph.checkpoint.base.CheckpointException;
import com.flowgraph.checkpoint.base.ID;
import com.flowgraph.graph.CheckpointMetadata;
import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.GraphConfig;
import com.flowgraph.graph.GraphResult;
import com.flowgraph.graph.StateGraph;
import com.flowgraph.node.Command;
import com.flowgraph.node.Node;
import com.flowgraph.node.NodeOutput;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State machine of a single run of a compiled graph.
 *
 * <p>Each call to {@link #step()} executes at most one node, so {@code invoke} drives the
 * loop to the end while a stream pulls one step per event. The loop owns the run's
 * state and iteration counter; it is not safe for use from several threads, except for
 * {@link #cancel()}.
 *
 * @param <S> State type
 */
public class ExecutionLoop<S extends State<S>> {
    private static final Logger log = LoggerFactory.getLogger(ExecutionLoop.class);

    private final CompiledGraph<S> graph;
    private final S input;
    private final GraphConfig config;
    private final BaseCheckpointSaver checkpointer;
    private final FanOutExecutor<S> fanOut;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private boolean started;
    private S state;
    private String current;
    private int iterations;
    private String lastCheckpointId;
    private String skipInterruptBefore;
    private GraphResult<S> result;

    /**
     * Create a loop for one run.
     *
     * @param graph The compiled graph
     * @param input Input state, may be null when resuming a thread
     * @param config Run configuration
     */
    public ExecutionLoop(CompiledGraph<S> graph, S input, GraphConfig config) {
        this.graph = graph;
        this.input = input;
        this.config = config != null ? config : GraphConfig.empty();
        this.checkpointer = this.config.hasThreadId() ? graph.getCheckpointer().orElse(null) : null;
        this.fanOut = new FanOutExecutor<>(graph.getNodes(), graph.getExecutor());
    }

    /**
     * Run until the graph completes or pauses.
     *
     * @return The result of the run
     */
    public GraphResult<S> run() {
        while (result == null) {
            step();
        }
        return result;
    }

    /**
     * Advance the run by at most one node.
     *
     * @return The executed step, or empty once the run has completed or paused
     * @throws NodeExecutionException If the node fails
     * @throws RoutingException If the next node cannot be resolved
     * @throws IterationLimitExceededError If the run exceeds the iteration limit
     * @throws CancellationException If the run was cancelled
     */
    public Optional<StepResult<S>> step() {
        if (result != null) {
            return Optional.empty();
        }
        if (!started) {
            start();
            started = true;
        }
        checkCancelled();

        if (StateGraph.END.equals(current)) {
            result = GraphResult.complete(state);
            log.info("Run completed after {} node execution(s){}", iterations, threadSuffix());
            return Optional.empty();
        }
        if (iterations >= CompiledGraph.MAX_ITERATIONS) {
            throw new IterationLimitExceededError(CompiledGraph.MAX_ITERATIONS);
        }
        if (graph.getInterruptBefore().contains(current) && !current.equals(skipInterruptBefore)) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(CheckpointMetadata.SOURCE, CheckpointMetadata.INTERRUPT_BEFORE);
            metadata.put(CheckpointMetadata.STEP, iterations);
            metadata.put(CheckpointMetadata.INTERRUPTED_BEFORE, current);
            saveCheckpoint(current, metadata);
            result = GraphResult.interrupted(state, current, null);
            log.info("Interrupted before node '{}'{}", current, threadSuffix());
            return Optional.empty();
        }
        skipInterruptBefore = null;

        String node = current;
        log.debug("Executing node '{}' (step {})", node, iterations + 1);
        long startNanos = System.nanoTime();
        NodeOutput<S> output = execute(node, graph.getNodes().get(node));
        iterations++;

        S update;
        String next;
        boolean interrupted = false;
        Object payload = null;
        if (output.isCommand()) {
            Command<S> command = (Command<S>) output;
            switch (command.getKind()) {
                case GOTO:
                    update = command.getUpdate();
                    merge(update);
                    next = checkTarget(node, command.getTarget());
                    break;
                case END:
                    update = command.getUpdate();
                    merge(update);
                    next = StateGraph.END;
                    break;
                case SEND:
                    update = mergeFanOut(node, command);
                    next = resolve(node);
                    break;
                case INTERRUPT:
                    update = command.getUpdate();
                    merge(update);
                    next = resolve(node);
                    interrupted = true;
                    payload = command.getPayload();
                    break;
                case UPDATE:
                default:
                    update = command.getUpdate();
                    merge(update);
                    next = resolve(node);
                    break;
            }
        } else {
            update = output.getUpdate();
            merge(update);
            next = resolve(node);
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        log.debug("Node '{}' finished in {} ms, next '{}'", node, duration.toMillis(), next);

        // a cancelled run keeps the previous checkpoint as its resume point
        checkCancelled();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointMetadata.SOURCE, node);
        metadata.put(CheckpointMetadata.STEP, iterations);
        if (interrupted && payload != null) {
            metadata.put(CheckpointMetadata.INTERRUPT, String.valueOf(payload));
        }
        saveCheckpoint(next, metadata);
        current = next;

        if (interrupted) {
            result = GraphResult.interrupted(state, next, payload);
            log.info("Node '{}' interrupted the run{}", node, threadSuffix());
        } else if (graph.getInterruptAfter().contains(node) && !StateGraph.END.equals(next)) {
            result = GraphResult.interrupted(state, next, null);
            log.info("Interrupted after node '{}'{}", node, threadSuffix());
        }
        return Optional.of(new StepResult<>(node, update, state, next, iterations, duration));
    }

    /**
     * Get the result once the run has completed or paused.
     *
     * @return The result, or empty while the run is still in progress
     */
    public Optional<GraphResult<S>> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * Stop the run before its next node. A node already executing finishes, but its
     * outcome is discarded and not checkpointed.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.debug("Run cancelled{}", threadSuffix());
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getIterations() {
        return iterations;
    }

    private void start() {
        if (checkpointer != null) {
            String threadId = config.getThreadId();
            if (config.getCheckpointId() != null) {
                Checkpoint fork = checkpointer.get(threadId, config.getCheckpointId())
                        .orElseThrow(() -> new CheckpointException("Checkpoint '" + config.getCheckpointId()
                                + "' not found for thread '" + threadId + "'"));
                if (input != null) {
                    log.warn("Ignoring input: thread '{}' forks from checkpoint {}", threadId, fork.getCheckpointId());
                }
                restore(fork);
                log.info("Forking thread '{}' from checkpoint {} at node '{}'", threadId, fork.getCheckpointId(), current);
                return;
            }

            Optional<Checkpoint> latest = checkpointer.get(threadId);
            if (latest.isPresent() && (!StateGraph.END.equals(latest.get().getNextNode()) || input == null)) {
                if (input != null) {
                    log.warn("Ignoring input: thread '{}' resumes at node '{}'", threadId, latest.get().getNextNode());
                }
                restore(latest.get());
                log.info("Resuming thread '{}' at node '{}'", threadId, current);
                return;
            }
            lastCheckpointId = latest.map(Checkpoint::getCheckpointId).orElse(null);
        }

        if (input == null) {
            throw new IllegalArgumentException("Input state is required to start a new run");
        }
        state = input;
        current = graph.getEntryPoint();
        log.info("Starting run at node '{}'{}", current, threadSuffix());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(CheckpointMetadata.SOURCE, CheckpointMetadata.INPUT);
        metadata.put(CheckpointMetadata.STEP, 0);
        saveCheckpoint(current, metadata);
    }

    @SuppressWarnings("unchecked")
    private void restore(Checkpoint checkpoint) {
        state = (S) graph.getSerializer().deserialize(checkpoint.getState());
        current = checkpoint.getNextNode();
        lastCheckpointId = checkpoint.getCheckpointId();
        Object pausedAt = checkpoint.getMetadata().get(CheckpointMetadata.INTERRUPTED_BEFORE);
        skipInterruptBefore = current.equals(pausedAt) ? current : null;
    }

    private NodeOutput<S> execute(String name, Node<S> node) {
        try {
            NodeOutput<S> output = graph.getNodeCache().execute(name, node, state);
            return output != null ? output : NodeOutput.empty();
        } catch (NodeExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(name, e);
        } catch (Exception e) {
            throw new NodeExecutionException(name, e);
        }
    }

    private void merge(S update) {
        if (update != null) {
            state = state.merge(update);
        }
    }

    private S mergeFanOut(String node, Command<S> command) {
        List<S> updates = fanOut.execute(node, command.getTargets(), state);
        S combined = command.getUpdate();
        merge(combined);
        for (S update : updates) {
            if (update == null) {
                continue;
            }
            merge(update);
            combined = combined == null ? update : combined.merge(update);
        }
        return combined;
    }

    private String resolve(String node) {
        String target;
        try {
            target = graph.getEdgeTable().next(node, state);
        } catch (RuntimeException e) {
            throw new RoutingException(node, "Router of node '" + node + "' failed: " + e.getMessage(), e);
        }
        return checkTarget(node, target);
    }

    private String checkTarget(String source, String target) {
        if (target == null || !(StateGraph.END.equals(target) || graph.getNodes().contains(target))) {
            throw new RoutingException(source, target);
        }
        return target;
    }

    private void saveCheckpoint(String nextNode, Map<String, Object> metadata) {
        if (checkpointer == null) {
            return;
        }
        Map<String, Object> combined = new LinkedHashMap<>(config.getMetadata());
        combined.putAll(metadata);
        Checkpoint checkpoint = Checkpoint.builder()
                .threadId(config.getThreadId())
                .checkpointId(ID.checkpointId(config.getThreadId()))
                .state(graph.getSerializer().serialize(state))
                .nextNode(nextNode)
                .parentId(lastCheckpointId)
                .metadata(combined)
                .build();
        Checkpoint stored = checkpointer.put(checkpoint);
        lastCheckpointId = stored.getCheckpointId();
        log.debug("Saved checkpoint {} of thread '{}' (next '{}')",
                stored.getCheckpointId(), stored.getThreadId(), nextNode);
    }

    private void checkCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("Run was cancelled");
        }
    }

    private String threadSuffix() {
        return config.hasThreadId() ? " on thread '" + config.getThreadId() + "'" : "";
    }
}
