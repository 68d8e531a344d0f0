package com.flowgraph.graph.execute;

import java.time.Duration;

/**
 * Outcome of one node execution inside a run.
 *
 * @param node Node that ran
 * @param update Update the node produced, null if it made no change
 * @param state State after the update was merged
 * @param nextNode Node the run continues with
 * @param step Number of node executions so far, including this one
 * @param duration Time spent in the node
 * @param <S> State type
 */
public record StepResult<S>(String node, S update, S state, String nextNode, int step, Duration duration) {
}
