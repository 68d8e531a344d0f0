package com.flowgraph.prebuilt;

import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.StateGraph;
import com.flowgraph.node.Command;
import com.flowgraph.node.Node;
import com.flowgraph.node.NodeOutput;
import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;
import com.flowgraph.state.State;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Two-node decide/act loop.
 *
 * <p>The {@value #AGENT} node decides; while it leaves work pending the loop runs the
 * {@value #TOOLS} node and returns to {@value #AGENT}, otherwise the run ends. The loop
 * relies on the engine's iteration limit to stop a decide node that never finishes.
 */
public final class AgentLoop {
    public static final String AGENT = "agent";
    public static final String TOOLS = "tools";

    private AgentLoop() {
    }

    public static CompiledGraph<MessagesState> create(Node<MessagesState> decide, Node<MessagesState> act) {
        return create(decide, act, AgentLoopOptions.defaults());
    }

    /**
     * Create a loop over a conversation. Work is pending while the last AI message
     * carries tool calls other than handoffs. A system prompt, if set, is prepended to the
     * conversation the decide node sees and is never stored in the state, even when the
     * decide node returns the whole conversation instead of just its new messages.
     *
     * @param decide Node producing AI messages
     * @param act Node answering tool calls
     * @param options Loop options
     * @return The compiled loop
     */
    public static CompiledGraph<MessagesState> create(
            Node<MessagesState> decide,
            Node<MessagesState> act,
            AgentLoopOptions options) {
        Node<MessagesState> agent = decide;
        String prompt = options != null ? options.getSystemPrompt() : null;
        if (decide != null && prompt != null && !prompt.isEmpty()) {
            agent = state -> {
                Message system = Message.system(prompt);
                return withoutMessage(decide.execute(withSystemPrompt(system, state)), system.id());
            };
        }
        return build(agent, act, Handoffs::hasToolWork, options);
    }

    /**
     * Create a loop over any state type.
     *
     * @param decide Deciding node
     * @param act Acting node
     * @param pendingWork Whether the acting node should run next
     * @param options Loop options; the system prompt is not used
     * @param <S> State type
     * @return The compiled loop
     */
    public static <S extends State<S>> CompiledGraph<S> create(
            Node<S> decide,
            Node<S> act,
            Predicate<S> pendingWork,
            AgentLoopOptions options) {
        return build(decide, act, pendingWork, options);
    }

    private static <S extends State<S>> CompiledGraph<S> build(
            Node<S> decide,
            Node<S> act,
            Predicate<S> pendingWork,
            AgentLoopOptions options) {
        if (decide == null || act == null || pendingWork == null) {
            throw new IllegalArgumentException("Decide node, act node and pending-work check are required");
        }
        AgentLoopOptions opts = options != null ? options : AgentLoopOptions.defaults();
        return new StateGraph<S>()
                .addNode(AGENT, decide)
                .addNode(TOOLS, act)
                .setEntryPoint(AGENT)
                .addConditionalEdges(AGENT,
                        state -> pendingWork.test(state) ? TOOLS : StateGraph.END,
                        Map.of(TOOLS, TOOLS, StateGraph.END, StateGraph.END))
                .addEdge(TOOLS, AGENT)
                .interruptBefore(opts.getInterruptBefore().toArray(new String[0]))
                .interruptAfter(opts.getInterruptAfter().toArray(new String[0]))
                .setCheckpointer(opts.getCheckpointer())
                .compile();
    }

    private static MessagesState withSystemPrompt(Message system, MessagesState state) {
        List<Message> view = new ArrayList<>(state.size() + 1);
        view.add(system);
        view.addAll(state.messages());
        return new MessagesState(view);
    }

    private static NodeOutput<MessagesState> withoutMessage(NodeOutput<MessagesState> output, String messageId) {
        MessagesState update = output != null ? output.getUpdate() : null;
        if (update == null) {
            return output;
        }
        List<Message> kept = new ArrayList<>(update.size());
        for (Message message : update.messages()) {
            if (!message.id().equals(messageId)) {
                kept.add(message);
            }
        }
        if (kept.size() == update.size()) {
            return output;
        }
        MessagesState stripped = new MessagesState(kept);
        return output.isCommand() ? ((Command<MessagesState>) output).withUpdate(stripped) : NodeOutput.update(stripped);
    }
}
