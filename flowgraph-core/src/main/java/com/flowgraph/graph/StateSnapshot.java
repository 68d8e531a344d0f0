package com.flowgraph.graph;

import java.time.Instant;
import java.util.Map;

/**
 * A decoded checkpoint: the state of a thread together with the node it continues with.
 *
 * @param state Decoded state
 * @param nextNode Node to run on resume, {@link StateGraph#END} when the run finished
 * @param checkpointId Id of the checkpoint
 * @param parentId Id of the previous checkpoint, null for the first one
 * @param metadata Checkpoint metadata
 * @param sequence Position in the thread's history
 * @param timestamp Time the checkpoint was written
 * @param <S> State type
 */
public record StateSnapshot<S>(S state, String nextNode, String checkpointId, String parentId,
                               Map<String, Object> metadata, long sequence, Instant timestamp) {

    public boolean isFinished() {
        return StateGraph.END.equals(nextNode);
    }

    /**
     * Configuration that forks a new run from this snapshot.
     *
     * @param threadId Thread the snapshot belongs to
     * @return Configuration carrying this checkpoint id
     */
    public GraphConfig toConfig(String threadId) {
        return GraphConfig.builder().threadId(threadId).checkpointId(checkpointId).build();
    }
}
