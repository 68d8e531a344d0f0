package com.flowgraph.channels;

/**
 * A reducer for one field of a state: decides how an incoming value combines with
 * the value already held. {@link com.flowgraph.state.State#merge} implementations
 * apply one channel per field.
 *
 * @param <V> Type of the field
 */
@FunctionalInterface
public interface Channel<V> {
    /**
     * Combine the current value with an update.
     *
     * @param current Current value, may be null
     * @param update Incoming value, may be null
     * @return The new value
     */
    V update(V current, V update);
}
