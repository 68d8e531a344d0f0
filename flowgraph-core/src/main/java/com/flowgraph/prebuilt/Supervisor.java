package com.flowgraph.prebuilt;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.StateGraph;
import com.flowgraph.node.Command;
import com.flowgraph.node.Node;
import com.flowgraph.node.NodeOutput;
import com.flowgraph.node.SubgraphNode;
import com.flowgraph.state.MessagesState;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Centralized multi-agent graph: a coordinator node delegates to agents, and every agent
 * reports back to the coordinator.
 *
 * <p>After the coordinator runs, a {@link HandoffResolver} reads the requested agent from
 * the merged state and the coordinator node jumps there with {@link Command#goTo}. No
 * handoff ends the run. A coordinator that returns its own {@link Command} is obeyed as is.
 */
public final class Supervisor {
    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    public static final String SUPERVISOR = "supervisor";

    private Supervisor() {
    }

    public static <S extends State<S>> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * Builder preconfigured for conversations: handoffs are {@code transfer_to_<agent>}
     * tool calls, answered with a tool message when the agent takes over.
     *
     * @return Builder
     */
    public static Builder<MessagesState> forMessages() {
        Builder<MessagesState> builder = new Builder<>();
        builder.resolverFactory = Handoffs::resolver;
        builder.handoffUpdate = Handoffs::acknowledge;
        return builder;
    }

    public static final class Builder<S extends State<S>> {
        private Node<S> coordinator;
        private final Map<String, Node<S>> agents = new LinkedHashMap<>();
        private Function<Collection<String>, HandoffResolver<S>> resolverFactory;
        private BiFunction<S, String, S> handoffUpdate = (state, agent) -> null;
        private BaseCheckpointSaver checkpointer;

        private Builder() {
        }

        public Builder<S> coordinator(Node<S> coordinator) {
            this.coordinator = coordinator;
            return this;
        }

        /**
         * Adds an agent backed by its own compiled graph.
         *
         * @param name Agent name
         * @param graph Agent graph, run to completion on each handoff
         * @return This builder
         */
        public Builder<S> agent(String name, CompiledGraph<S> graph) {
            return agent(name, new SubgraphNode<>(graph));
        }

        public Builder<S> agent(String name, Node<S> node) {
            if (name == null || name.isEmpty() || SUPERVISOR.equals(name)) {
                throw new IllegalArgumentException("Invalid agent name: " + name);
            }
            agents.put(name, node);
            return this;
        }

        public Builder<S> handoffResolver(HandoffResolver<S> resolver) {
            this.resolverFactory = names -> resolver;
            return this;
        }

        /**
         * Sets the update added to the state when an agent takes over.
         *
         * @param handoffUpdate Maps (merged state, agent name) to an update, may return null
         * @return This builder
         */
        public Builder<S> handoffUpdate(BiFunction<S, String, S> handoffUpdate) {
            this.handoffUpdate = handoffUpdate;
            return this;
        }

        public Builder<S> checkpointer(BaseCheckpointSaver checkpointer) {
            this.checkpointer = checkpointer;
            return this;
        }

        public CompiledGraph<S> build() {
            if (coordinator == null) {
                throw new IllegalArgumentException("supervisor requires a coordinator node");
            }
            if (agents.isEmpty()) {
                throw new IllegalArgumentException("supervisor requires at least one agent");
            }
            if (resolverFactory == null) {
                throw new IllegalArgumentException("supervisor requires a handoff resolver");
            }
            HandoffResolver<S> resolver = resolverFactory.apply(agents.keySet());
            Node<S> coordinate = coordinatorNode(coordinator, resolver, handoffUpdate);

            StateGraph<S> graph = new StateGraph<S>()
                    .addNode(SUPERVISOR, coordinate)
                    .setEntryPoint(SUPERVISOR)
                    .setCheckpointer(checkpointer);
            agents.forEach((name, node) -> graph.addNode(name, node).addEdge(name, SUPERVISOR));
            return graph.compile();
        }
    }

    private static <S extends State<S>> Node<S> coordinatorNode(
            Node<S> coordinator,
            HandoffResolver<S> resolver,
            BiFunction<S, String, S> handoffUpdate) {
        return state -> {
            NodeOutput<S> output = coordinator.execute(state);
            if (output != null && output.isCommand()) {
                return output;
            }
            S update = output != null ? output.getUpdate() : null;
            S view = update != null ? state.merge(update) : state;
            Optional<String> agent = resolver.resolve(view);
            if (agent.isEmpty()) {
                log.debug("Supervisor finished without handoff");
                return Command.goTo(StateGraph.END, update);
            }
            log.debug("Supervisor handing off to '{}'", agent.get());
            return Command.goTo(agent.get(), Handoffs.combine(update, handoffUpdate.apply(view, agent.get())));
        };
    }
}
