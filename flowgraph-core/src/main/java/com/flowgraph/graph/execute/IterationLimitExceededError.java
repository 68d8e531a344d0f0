package com.flowgraph.graph.execute;

/**
 * Thrown when a run would execute more nodes than the engine allows. This is a fixed
 * safety limit against runaway cycles, not a tunable workload setting.
 */
public class IterationLimitExceededError extends RuntimeException {
    private final int limit;

    public IterationLimitExceededError(int limit) {
        super("Iteration limit of " + limit + " node executions exceeded");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
