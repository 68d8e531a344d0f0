package com.flowgraph.graph;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one invocation: the run either completed or paused at an interrupt.
 * An interrupt is a normal result, not an error; resume it by invoking again with the
 * same thread id.
 *
 * @param <S> State type
 */
public final class GraphResult<S> {
    private final boolean interrupted;
    private final S state;
    private final String nextNode;
    private final Object interruptPayload;

    private GraphResult(boolean interrupted, S state, String nextNode, Object interruptPayload) {
        this.interrupted = interrupted;
        this.state = state;
        this.nextNode = nextNode;
        this.interruptPayload = interruptPayload;
    }

    public static <S> GraphResult<S> complete(S state) {
        return new GraphResult<>(false, state, StateGraph.END, null);
    }

    /**
     * @param state State at the pause
     * @param nextNode Node the run continues with on resume
     * @param payload Value passed to an imperative interrupt, may be null
     * @param <S> State type
     * @return Interrupted result
     */
    public static <S> GraphResult<S> interrupted(S state, String nextNode, Object payload) {
        return new GraphResult<>(true, state, nextNode, payload);
    }

    public boolean isComplete() {
        return !interrupted;
    }

    public boolean isInterrupted() {
        return interrupted;
    }

    public S getState() {
        return state;
    }

    public String getNextNode() {
        return nextNode;
    }

    public Optional<Object> getInterruptPayload() {
        return Optional.ofNullable(interruptPayload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        GraphResult<?> that = (GraphResult<?>) o;
        return interrupted == that.interrupted
                && Objects.equals(state, that.state)
                && Objects.equals(nextNode, that.nextNode)
                && Objects.equals(interruptPayload, that.interruptPayload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(interrupted, state, nextNode, interruptPayload);
    }

    @Override
    public String toString() {
        if (!interrupted) {
            return "Complete{state=" + state + '}';
        }
        return "Interrupted{state=" + state + ", nextNode='" + nextNode + "', payload=" + interruptPayload + '}';
    }
}
