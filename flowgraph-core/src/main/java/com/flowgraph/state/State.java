package com.flowgraph.state;

/**
 * The value threaded through a graph run.
 *
 * <p>Node outcomes are updates that the engine folds into the current state with
 * {@link #merge(State)}. The engine never inspects a state beyond merging it and
 * handing it to the configured serializer for checkpoints, so implementations should
 * be immutable values (records work well) whose merge returns a new instance.
 *
 * <p>Typical merge strategies are append-only accumulation, counters, set unions and
 * last-writer-wins; the reducers in {@code com.flowgraph.channels} cover these.
 *
 * @param <S> The concrete state type
 */
public interface State<S extends State<S>> {
    /**
     * Combine this state with an update produced by a node.
     *
     * @param update The update, never null
     * @return The combined state
     */
    S merge(S update);
}
