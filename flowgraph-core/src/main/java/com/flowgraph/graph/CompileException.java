package com.flowgraph.graph;

import java.util.List;

/**
 * Thrown by {@link StateGraph#compile()} when the graph is structurally invalid. Carries
 * every violation found, not just the first.
 */
public class CompileException extends RuntimeException {
    private final List<String> violations;

    public CompileException(List<String> violations) {
        super(format(violations));
        this.violations = List.copyOf(violations);
    }

    public CompileException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of(message);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String format(List<String> violations) {
        return "Graph validation failed with " + violations.size() + " error(s): "
                + String.join("; ", violations);
    }
}
