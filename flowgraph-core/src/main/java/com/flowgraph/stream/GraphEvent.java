package com.flowgraph.stream;

import com.flowgraph.graph.execute.StepResult;
import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One event of a graph stream, emitted after a node completes.
 *
 * @param <S> State type
 */
public final class GraphEvent<S> {
    private final String node;
    private final StreamMode mode;
    private final S state;
    private final S update;
    private final String nextNode;
    private final int step;
    private final Duration duration;

    private GraphEvent(StreamMode mode, StepResult<S> step) {
        this.node = step.node();
        this.mode = mode;
        this.state = step.state();
        this.update = step.update();
        this.nextNode = step.nextNode();
        this.step = step.step();
        this.duration = step.duration();
    }

    static <S> GraphEvent<S> of(StreamMode mode, StepResult<S> step) {
        return new GraphEvent<>(mode, step);
    }

    public String getNode() {
        return node;
    }

    public StreamMode getMode() {
        return mode;
    }

    /**
     * Get the payload selected by the stream mode.
     *
     * @return The full state for {@link StreamMode#VALUES} and {@link StreamMode#DEBUG},
     *         the node's update for {@link StreamMode#UPDATES} and {@link StreamMode#MESSAGES}
     *         (null if it made no change)
     */
    public S getPayload() {
        return mode == StreamMode.UPDATES || mode == StreamMode.MESSAGES ? update : state;
    }

    /**
     * Get the AI messages the node added.
     *
     * @return AI messages of the update, empty when the state is not a conversation
     */
    public List<Message> getMessages() {
        if (!(update instanceof MessagesState)) {
            return Collections.emptyList();
        }
        List<Message> added = new ArrayList<>();
        for (Message message : ((MessagesState) update).messages()) {
            if (message.role() == Message.Role.AI) {
                added.add(message);
            }
        }
        return added;
    }

    public S getUpdate() {
        return update;
    }

    public String getNextNode() {
        return nextNode;
    }

    public int getStep() {
        return step;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        if (mode == StreamMode.DEBUG) {
            return "GraphEvent{node='" + node + "', step=" + step + ", next='" + nextNode
                    + "', duration=" + duration + ", update=" + update + ", state=" + state + '}';
        }
        if (mode == StreamMode.MESSAGES) {
            return "GraphEvent{node='" + node + "', messages=" + getMessages() + '}';
        }
        return "GraphEvent{node='" + node + "', " + mode.name().toLowerCase() + '=' + getPayload() + '}';
    }
}
