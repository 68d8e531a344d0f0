package com.flowgraph.graph;

/**
 * Metadata keys and values written by the engine into checkpoints.
 */
public final class CheckpointMetadata {
    /** What produced the checkpoint: a node name, {@link #INTERRUPT_BEFORE} or {@link #UPDATE_STATE}. */
    public static final String SOURCE = "source";
    /** Number of node executions in the run when the checkpoint was written. */
    public static final String STEP = "step";
    /** Node whose interrupt-before pause has already been taken. */
    public static final String INTERRUPTED_BEFORE = "interrupted_before";
    /** String form of the payload of an imperative interrupt. */
    public static final String INTERRUPT = "interrupt";

    public static final String INTERRUPT_BEFORE = "interrupt_before";
    public static final String UPDATE_STATE = "update_state";
    public static final String INPUT = "input";

    private CheckpointMetadata() {
    }
}
