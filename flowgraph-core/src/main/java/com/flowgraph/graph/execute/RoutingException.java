package com.flowgraph.graph.execute;

/**
 * Thrown when a router or command names a target that is neither a registered node
 * nor the end sentinel.
 */
public class RoutingException extends RuntimeException {
    private final String source;
    private final String target;

    public RoutingException(String source, String target) {
        super("Node '" + source + "' routed to unknown target '" + target + "'");
        this.source = source;
        this.target = target;
    }

    public RoutingException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.target = null;
    }

    public String getSource() {
        return source;
    }

    /**
     * Get the rejected target name.
     *
     * @return Target name, or null when the router itself failed
     */
    public String getTarget() {
        return target;
    }
}
