package com.flowgraph.node;

import com.flowgraph.state.State;

/**
 * A unit of computation in a graph.
 *
 * <p>A node receives the current state and returns either an update, which the engine
 * merges into the state before following the node's edges, or a {@link Command} that
 * overrides ordinary edge resolution. A node may be called repeatedly and from several
 * runs at once, so it must not keep per-run mutable state. Any exception aborts the
 * run; the engine does not retry.
 *
 * @param <S> State type
 */
@FunctionalInterface
public interface Node<S extends State<S>> {
    /**
     * Run the node.
     *
     * @param state Current state; must not be modified
     * @return The outcome, or null for "no update"
     * @throws Exception Any failure; reported to the caller wrapped in a node execution error
     */
    NodeOutput<S> execute(S state) throws Exception;

    /**
     * Adapt a function that only produces an update.
     *
     * @param action Function from state to update
     * @param <S> State type
     * @return A node
     */
    static <S extends State<S>> Node<S> of(NodeAction<S> action) {
        return state -> NodeOutput.update(action.apply(state));
    }
}
