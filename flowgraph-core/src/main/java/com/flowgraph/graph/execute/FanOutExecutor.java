package com.flowgraph.graph.execute;

import com.flowgraph.graph.registry.NodeRegistry;
import com.flowgraph.node.Node;
import com.flowgraph.node.NodeOutput;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the targets of a send command concurrently and joins them.
 *
 * <p>Every target sees the same state. Updates are returned in the order the targets
 * were listed, whatever order they finish in. Only updates are taken from the targets;
 * routing and interrupt instructions they return are ignored.
 *
 * <p>The joining thread runs every target the executor has not started yet itself, so a
 * send issued from a worker of a bounded executor (a single thread, or a pool saturated
 * by concurrent runs) cannot wait on tasks queued behind it.
 *
 * @param <S> State type
 */
public class FanOutExecutor<S extends State<S>> {
    private static final Logger log = LoggerFactory.getLogger(FanOutExecutor.class);

    private final NodeRegistry<S> nodes;
    private final Executor executor;

    /**
     * @param nodes Frozen node registry
     * @param executor Executor the targets run on
     */
    public FanOutExecutor(NodeRegistry<S> nodes, Executor executor) {
        if (nodes == null || executor == null) {
            throw new IllegalArgumentException("Node registry and executor are required");
        }
        this.nodes = nodes;
        this.executor = executor;
    }

    /**
     * Run the targets and wait for all of them.
     *
     * @param source Node that issued the send
     * @param targets Target node names
     * @param state State handed to every target
     * @return Updates in target order; an entry is null when its target made no change
     * @throws RoutingException If a target is not registered; no target runs in that case
     * @throws NodeExecutionException For the first failing target in listing order
     */
    public List<S> execute(String source, List<String> targets, S state) {
        for (String target : targets) {
            if (!nodes.contains(target)) {
                throw new RoutingException(source, target);
            }
        }

        log.debug("Node '{}' fanning out to {}", source, targets);
        List<FanOutTask> tasks = new ArrayList<>(targets.size());
        for (String target : targets) {
            FanOutTask task = new FanOutTask(target, nodes.get(target), state);
            tasks.add(task);
            try {
                executor.execute(task);
            } catch (RejectedExecutionException e) {
                log.debug("Executor rejected fan-out target '{}', running it on the joining thread", target);
            }
        }
        for (FanOutTask task : tasks) {
            task.run();
        }

        // join barrier; failures are read per task below
        CompletableFuture.allOf(tasks.stream().map(task -> task.result).toArray(CompletableFuture[]::new))
                .exceptionally(e -> null)
                .join();

        List<S> updates = new ArrayList<>(targets.size());
        for (FanOutTask task : tasks) {
            try {
                updates.add(task.result.join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                if (cause instanceof Error) {
                    throw (Error) cause;
                }
                throw e;
            }
        }
        return updates;
    }

    /**
     * One target, run at most once by whichever thread claims it first.
     */
    private final class FanOutTask implements Runnable {
        private final String target;
        private final Node<S> node;
        private final S state;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final CompletableFuture<S> result = new CompletableFuture<>();

        FanOutTask(String target, Node<S> node, S state) {
            this.target = target;
            this.node = node;
            this.state = state;
        }

        @Override
        public void run() {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                result.complete(FanOutExecutor.this.run(target, node, state));
            } catch (RuntimeException | Error e) {
                result.completeExceptionally(e);
            }
        }
    }

    private S run(String target, Node<S> node, S state) {
        try {
            NodeOutput<S> output = node.execute(state);
            if (output == null) {
                return null;
            }
            if (output.isCommand()) {
                log.debug("Ignoring routing of command returned by fan-out target '{}'", target);
            }
            return output.getUpdate();
        } catch (NodeExecutionException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeExecutionException(target, e);
        } catch (Exception e) {
            throw new NodeExecutionException(target, e);
        }
    }
}
