package com.flowgraph.stream;

/**
 * Enum defining what each streamed event carries.
 */
public enum StreamMode {
    /**
     * The full accumulated state after each node.
     */
    VALUES,

    /**
     * Only the update produced by each node.
     */
    UPDATES,

    /**
     * The AI messages a node added to a conversation state; steps that add none emit
     * no event in this mode.
     */
    MESSAGES,

    /**
     * The full state plus the update, next node, step number and node duration.
     */
    DEBUG
}
