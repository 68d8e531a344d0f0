package com.flowgraph.graph;

import com.flowgraph.channels.Channels;
import com.flowgraph.channels.Topic;
import com.flowgraph.state.State;

import java.util.Arrays;
import java.util.List;

/**
 * Test state recording the steps taken; merge appends.
 */
public record TraceState(List<String> steps) implements State<TraceState> {
    private static final Topic<String> STEPS = Channels.topic();

    public TraceState {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public static TraceState of(String... steps) {
        return new TraceState(Arrays.asList(steps));
    }

    @Override
    public TraceState merge(TraceState update) {
        return new TraceState(STEPS.update(steps, update.steps()));
    }

    public int size() {
        return steps.size();
    }

    public String last() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1);
    }
}
