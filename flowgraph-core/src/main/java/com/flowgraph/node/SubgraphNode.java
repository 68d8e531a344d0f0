package com.flowgraph.node;

import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.GraphResult;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiFunction;

/**
 * Runs a compiled graph as a single node of another graph.
 *
 * <p>The sub-graph starts from the parent's current state and runs without persistence.
 * Its final state becomes the node's update, unless an update mapper derives a
 * different update from the parent state and the sub-graph's final state. When the
 * sub-graph pauses, the node pauses the parent with the same payload.
 *
 * @param <S> State type
 */
public class SubgraphNode<S extends State<S>> implements Node<S> {
    private static final Logger log = LoggerFactory.getLogger(SubgraphNode.class);

    private final CompiledGraph<S> graph;
    private final BiFunction<S, S, S> updateMapper;

    public SubgraphNode(CompiledGraph<S> graph) {
        this(graph, (parent, result) -> result);
    }

    /**
     * @param graph Sub-graph to run
     * @param updateMapper Maps (parent state, sub-graph final state) to the update
     */
    public SubgraphNode(CompiledGraph<S> graph, BiFunction<S, S, S> updateMapper) {
        if (graph == null || updateMapper == null) {
            throw new IllegalArgumentException("Sub-graph and update mapper are required");
        }
        this.graph = graph;
        this.updateMapper = updateMapper;
    }

    @Override
    public NodeOutput<S> execute(S state) {
        GraphResult<S> result = graph.invoke(state);
        S update = updateMapper.apply(state, result.getState());
        if (result.isInterrupted()) {
            log.debug("Sub-graph paused before '{}'", result.getNextNode());
            return Command.interrupt(result.getInterruptPayload().orElse(null), update);
        }
        return NodeOutput.update(update);
    }

    public CompiledGraph<S> getGraph() {
        return graph;
    }
}
