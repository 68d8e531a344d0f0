package com.flowgraph.channels;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Factory methods for the common reducers.
 */
public final class Channels {
    private Channels() {
    }

    public static <V> LastValue<V> lastValue() {
        return new LastValue<>();
    }

    /**
     * Append every update element.
     *
     * @param <V> Element type
     * @return An appending list reducer
     */
    public static <V> Topic<V> topic() {
        return new Topic<>(false, null);
    }

    /**
     * Append only elements not already present, keeping first-seen order.
     *
     * @param <V> Element type
     * @return A de-duplicating list reducer
     */
    public static <V> Topic<V> uniqueTopic() {
        return new Topic<>(true, null);
    }

    /**
     * Replace elements with an existing key in place and append the rest.
     *
     * @param key Extracts the identity of an element; null keys always append
     * @param <V> Element type
     * @return A keyed list reducer
     */
    public static <V> Topic<V> keyedTopic(Function<? super V, ?> key) {
        if (key == null) {
            throw new IllegalArgumentException("Key function cannot be null");
        }
        return new Topic<>(false, key);
    }

    public static <V> BinaryOperatorChannel<V> binaryOperator(BinaryOperator<V> operator) {
        return new BinaryOperatorChannel<>(operator);
    }

    public static BinaryOperatorChannel<Integer> integerAdder() {
        return new BinaryOperatorChannel<>(Integer::sum);
    }

    public static BinaryOperatorChannel<Long> longAdder() {
        return new BinaryOperatorChannel<>(Long::sum);
    }

    public static BinaryOperatorChannel<Integer> integerMax() {
        return new BinaryOperatorChannel<>(Math::max);
    }

    /**
     * Ordered union of two sets.
     *
     * @param <V> Element type
     * @return A set-union reducer
     */
    public static <V> Channel<Set<V>> union() {
        return (current, update) -> {
            Set<V> result = new LinkedHashSet<>();
            if (current != null) {
                result.addAll(current);
            }
            if (update != null) {
                result.addAll(update);
            }
            return result;
        };
    }
}
