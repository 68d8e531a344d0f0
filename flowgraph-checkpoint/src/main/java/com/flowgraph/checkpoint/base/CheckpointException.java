package com.flowgraph.checkpoint.base;

/**
 * Thrown when a checkpoint cannot be stored or a required checkpoint does not exist.
 */
public class CheckpointException extends RuntimeException {
    /**
     * @param message Error message
     */
    public CheckpointException(String message) {
        super(message);
    }

    /**
     * @param message Error message
     * @param cause Underlying storage failure
     */
    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
