package com.flowgraph.channels;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An append-only list field.
 *
 * <p>Three flavours are available through {@link Channels}:
 * <ul>
 *   <li>plain append: every update element is added at the end;</li>
 *   <li>unique: elements already present are skipped (ordered set union);</li>
 *   <li>keyed: an element whose key is already present replaces the old element in
 *       place, other elements are appended.</li>
 * </ul>
 * All flavours return an unmodifiable list and never modify their inputs.
 *
 * @param <V> Element type
 */
public final class Topic<V> implements Channel<List<V>> {
    private final boolean unique;
    private final Function<? super V, ?> key;

    Topic(boolean unique, Function<? super V, ?> key) {
        this.unique = unique;
        this.key = key;
    }

    @Override
    public List<V> update(List<V> current, List<V> update) {
        List<V> base = current != null ? current : Collections.emptyList();
        if (update == null || update.isEmpty()) {
            return Collections.unmodifiableList(new ArrayList<>(base));
        }
        if (key != null) {
            return Collections.unmodifiableList(replaceOrAppend(base, update));
        }
        if (unique) {
            LinkedHashSet<V> union = new LinkedHashSet<>(base);
            union.addAll(update);
            return Collections.unmodifiableList(new ArrayList<>(union));
        }
        List<V> result = new ArrayList<>(base.size() + update.size());
        result.addAll(base);
        result.addAll(update);
        return Collections.unmodifiableList(result);
    }

    private List<V> replaceOrAppend(List<V> base, List<V> update) {
        List<V> result = new ArrayList<>(base);
        Map<Object, Integer> positions = new HashMap<>();
        for (int i = 0; i < result.size(); i++) {
            Object k = key.apply(result.get(i));
            if (k != null) {
                positions.put(k, i);
            }
        }
        for (V value : update) {
            Object k = key.apply(value);
            Integer position = k != null ? positions.get(k) : null;
            if (position != null) {
                result.set(position, value);
            } else {
                result.add(value);
                if (k != null) {
                    positions.put(k, result.size() - 1);
                }
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "Topic{unique=" + unique + ", keyed=" + Objects.nonNull(key) + '}';
    }
}
