package com.flowgraph.node;

/**
 * The outcome of a node: a plain update, or a {@link Command}.
 *
 * @param <S> State type
 */
public class NodeOutput<S> {
    private final S update;

    NodeOutput(S update) {
        this.update = update;
    }

    /**
     * An update followed by ordinary edge resolution.
     *
     * @param update The update, or null for no change
     * @param <S> State type
     * @return The output
     */
    public static <S> NodeOutput<S> update(S update) {
        return new NodeOutput<>(update);
    }

    /**
     * No update; continue along the node's edges.
     *
     * @param <S> State type
     * @return The output
     */
    public static <S> NodeOutput<S> empty() {
        return new NodeOutput<>(null);
    }

    /**
     * Get the update carried by this output.
     *
     * @return The update, or null if the node made no change
     */
    public S getUpdate() {
        return update;
    }

    public boolean isCommand() {
        return false;
    }

    @Override
    public String toString() {
        return "NodeOutput{update=" + update + '}';
    }
}
