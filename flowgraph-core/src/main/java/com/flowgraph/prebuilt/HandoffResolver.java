package com.flowgraph.prebuilt;

import java.util.Optional;

/**
 * Reads the agent a state asks to hand off to.
 *
 * @param <S> State type
 */
@FunctionalInterface
public interface HandoffResolver<S> {
    /**
     * @param state State after the current agent's update was merged
     * @return Name of the requested agent, or empty when no handoff is requested
     */
    Optional<String> resolve(S state);
}
