package com.flowgraph.channels;

/**
 * Last writer wins. A null update leaves the current value in place, so a partial
 * update only overwrites the fields it sets.
 *
 * @param <V> Type of the field
 */
public final class LastValue<V> implements Channel<V> {
    @Override
    public V update(V current, V update) {
        return update != null ? update : current;
    }
}
