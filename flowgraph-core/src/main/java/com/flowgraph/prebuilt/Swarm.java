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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Decentralized multi-agent graph: peers hand the conversation to one another directly,
 * with no coordinator.
 *
 * <p>Each agent node runs its agent, then resolves a handoff to one of its peers and jumps
 * there with {@link Command#goTo}. No handoff ends the run. The run starts at the default
 * agent, or at the first agent added.
 */
public final class Swarm {
    private static final Logger log = LoggerFactory.getLogger(Swarm.class);

    private Swarm() {
    }

    public static <S extends State<S>> Builder<S> builder() {
        return new Builder<>();
    }

    /**
     * Builder preconfigured for conversations, see {@link Supervisor#forMessages()}.
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
        private final Map<String, Node<S>> agents = new LinkedHashMap<>();
        private String defaultAgent;
        private Function<Collection<String>, HandoffResolver<S>> resolverFactory;
        private BiFunction<S, String, S> handoffUpdate = (state, agent) -> null;
        private BaseCheckpointSaver checkpointer;

        private Builder() {
        }

        public Builder<S> agent(String name, CompiledGraph<S> graph) {
            return agent(name, new SubgraphNode<>(graph));
        }

        public Builder<S> agent(String name, Node<S> node) {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Agent name cannot be null or empty");
            }
            agents.put(name, node);
            return this;
        }

        public Builder<S> defaultAgent(String name) {
            this.defaultAgent = name;
            return this;
        }

        public Builder<S> handoffResolver(HandoffResolver<S> resolver) {
            this.resolverFactory = names -> resolver;
            return this;
        }

        public Builder<S> handoffUpdate(BiFunction<S, String, S> handoffUpdate) {
            this.handoffUpdate = handoffUpdate;
            return this;
        }

        public Builder<S> checkpointer(BaseCheckpointSaver checkpointer) {
            this.checkpointer = checkpointer;
            return this;
        }

        public CompiledGraph<S> build() {
            if (agents.isEmpty()) {
                throw new IllegalArgumentException("swarm requires at least one agent");
            }
            if (resolverFactory == null) {
                throw new IllegalArgumentException("swarm requires a handoff resolver");
            }
            String entry = defaultAgent != null ? defaultAgent : agents.keySet().iterator().next();

            StateGraph<S> graph = new StateGraph<S>()
                    .setEntryPoint(entry)
                    .setCheckpointer(checkpointer);
            for (Map.Entry<String, Node<S>> agent : agents.entrySet()) {
                List<String> peers = new ArrayList<>(agents.keySet());
                peers.remove(agent.getKey());
                HandoffResolver<S> resolver = resolverFactory.apply(peers);
                graph.addNode(agent.getKey(), agentNode(agent.getKey(), agent.getValue(), resolver, handoffUpdate));
            }
            return graph.compile();
        }
    }

    private static <S extends State<S>> Node<S> agentNode(
            String name,
            Node<S> agent,
            HandoffResolver<S> resolver,
            BiFunction<S, String, S> handoffUpdate) {
        return state -> {
            NodeOutput<S> output = agent.execute(state);
            if (output != null && output.isCommand()) {
                return output;
            }
            S update = output != null ? output.getUpdate() : null;
            S view = update != null ? state.merge(update) : state;
            Optional<String> peer = resolver.resolve(view).filter(target -> !target.equals(name));
            if (peer.isEmpty()) {
                log.debug("Agent '{}' finished without handoff", name);
                return Command.goTo(StateGraph.END, update);
            }
            log.debug("Agent '{}' handing off to '{}'", name, peer.get());
            return Command.goTo(peer.get(), Handoffs.combine(update, handoffUpdate.apply(view, peer.get())));
        };
    }
}
