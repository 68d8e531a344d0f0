package com.flowgraph.graph;

/**
 * Chooses the next node from the state produced by a node.
 *
 * <p>Routers must be pure: the same state always yields the same target. The returned
 * name must be {@link StateGraph#END} or a registered node; this is checked when the
 * route is taken, not at compile time.
 *
 * @param <S> State type
 */
@FunctionalInterface
public interface EdgeRouter<S> {
    /**
     * @param state Merged state after the source node ran; must not be modified
     * @return Name of the next node
     */
    String route(S state);
}
