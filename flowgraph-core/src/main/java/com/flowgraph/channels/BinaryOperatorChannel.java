package com.flowgraph.channels;

import java.util.function.BinaryOperator;

/**
 * Folds updates into the current value with a binary operator, for sums, maxima
 * and similar aggregates. A missing side is treated as the identity.
 *
 * @param <V> Type of the field
 */
public final class BinaryOperatorChannel<V> implements Channel<V> {
    private final BinaryOperator<V> operator;

    /**
     * @param operator Associative operator applied as {@code operator(current, update)}
     */
    public BinaryOperatorChannel(BinaryOperator<V> operator) {
        if (operator == null) {
            throw new IllegalArgumentException("Operator cannot be null");
        }
        this.operator = operator;
    }

    @Override
    public V update(V current, V update) {
        if (current == null) {
            return update;
        }
        if (update == null) {
            return current;
        }
        return operator.apply(current, update);
    }
}
