package com.flowgraph.stream;

import com.flowgraph.graph.GraphResult;
import com.flowgraph.graph.execute.ExecutionLoop;
import com.flowgraph.graph.execute.StepResult;
import com.flowgraph.state.State;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, single-pass sequence of graph events.
 *
 * <p>Nothing runs until the consumer pulls: each {@link #hasNext()} that needs a new event
 * executes exactly one node, so a slow consumer holds the run back. Node and routing
 * errors are thrown from {@link #hasNext()}. The stream cannot be iterated twice.
 *
 * <p>A stream over several modes emits, for each node, one event per mode in the
 * declaration order of {@link StreamMode}, each tagged with its mode.
 *
 * @param <S> State type
 */
public class GraphStream<S extends State<S>> implements Iterator<GraphEvent<S>>, Iterable<GraphEvent<S>> {
    private final ExecutionLoop<S> loop;
    private final Set<StreamMode> modes;
    private final Deque<GraphEvent<S>> buffered = new ArrayDeque<>();
    private boolean exhausted;
    private boolean claimed;
    private boolean cancelled;

    public GraphStream(ExecutionLoop<S> loop, StreamMode mode) {
        this(loop, EnumSet.of(mode != null ? mode : StreamMode.VALUES));
    }

    /**
     * @param loop Run to stream
     * @param modes Modes to emit, at least one
     */
    public GraphStream(ExecutionLoop<S> loop, Collection<StreamMode> modes) {
        if (modes == null || modes.isEmpty()) {
            throw new IllegalArgumentException("At least one stream mode is required");
        }
        this.loop = loop;
        this.modes = Collections.unmodifiableSet(EnumSet.copyOf(modes));
    }

    /**
     * Claim the stream for iteration.
     *
     * @return This stream
     * @throws IllegalStateException If the stream was already claimed
     */
    @Override
    public Iterator<GraphEvent<S>> iterator() {
        if (claimed) {
            throw new IllegalStateException("Graph stream can only be iterated once");
        }
        claimed = true;
        return this;
    }

    public Stream<GraphEvent<S>> toStream() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    @Override
    public boolean hasNext() {
        if (cancelled) {
            return false;
        }
        while (buffered.isEmpty()) {
            if (exhausted) {
                return false;
            }
            Optional<StepResult<S>> step = loop.step();
            if (step.isEmpty()) {
                exhausted = true;
                return false;
            }
            for (StreamMode mode : modes) {
                GraphEvent<S> event = GraphEvent.of(mode, step.get());
                if (mode != StreamMode.MESSAGES || !event.getMessages().isEmpty()) {
                    buffered.add(event);
                }
            }
        }
        return true;
    }

    @Override
    public GraphEvent<S> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Graph stream is exhausted");
        }
        return buffered.poll();
    }

    /**
     * Get the outcome of the run once the stream is exhausted.
     *
     * @return The result, or empty while the run is in progress or after cancellation
     */
    public Optional<GraphResult<S>> getResult() {
        return loop.getResult();
    }

    /**
     * Stop the run. No further node executes and {@link #hasNext()} returns false.
     */
    public void cancel() {
        cancelled = true;
        buffered.clear();
        loop.cancel();
    }

    public Set<StreamMode> getModes() {
        return modes;
    }
}
