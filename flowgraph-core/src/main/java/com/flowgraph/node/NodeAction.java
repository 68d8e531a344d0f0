package com.flowgraph.node;

/**
 * A node body that only produces a state update.
 *
 * @param <S> State type
 */
@FunctionalInterface
public interface NodeAction<S> {
    /**
     * @param state Current state
     * @return The update to merge, or null for no change
     * @throws Exception Any failure
     */
    S apply(S state) throws Exception;
}
