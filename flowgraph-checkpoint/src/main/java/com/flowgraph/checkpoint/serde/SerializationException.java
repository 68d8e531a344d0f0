package com.flowgraph.checkpoint.serde;

/**
 * Thrown when a state value cannot be encoded into or decoded from checkpoint bytes.
 */
public class SerializationException extends RuntimeException {
    /**
     * @param message Error message
     */
    public SerializationException(String message) {
        super(message);
    }

    /**
     * @param message Error message
     * @param cause Underlying failure
     */
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
