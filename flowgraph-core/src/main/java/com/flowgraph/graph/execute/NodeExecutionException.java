package com.flowgraph.graph.execute;

/**
 * Thrown when a node fails. The node's own exception is the cause; the engine does
 * not interpret it and does not retry.
 */
public class NodeExecutionException extends RuntimeException {
    private final String nodeName;

    /**
     * @param nodeName Name of the failing node
     * @param cause Failure raised by the node
     */
    public NodeExecutionException(String nodeName, Throwable cause) {
        super("Node '" + nodeName + "' failed: " + cause.getMessage(), cause);
        this.nodeName = nodeName;
    }

    /**
     * @param nodeName Name of the failing node
     * @param message Error message
     * @param cause Failure raised by the node
     */
    public NodeExecutionException(String nodeName, String message, Throwable cause) {
        super(message, cause);
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
