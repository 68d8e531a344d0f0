package com.flowgraph.graph;

import com.flowgraph.channels.BinaryOperatorChannel;
import com.flowgraph.channels.Channels;
import com.flowgraph.state.State;

/**
 * Test state holding a counter; merge adds.
 */
public record CounterState(Integer count) implements State<CounterState> {
    private static final BinaryOperatorChannel<Integer> COUNT = Channels.integerAdder();

    public static CounterState of(int count) {
        return new CounterState(count);
    }

    @Override
    public CounterState merge(CounterState update) {
        return new CounterState(COUNT.update(count, update.count()));
    }
}
