package com.flowgraph.prebuilt;

import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;
import com.flowgraph.state.State;
import com.flowgraph.state.ToolCall;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Conventions for handing a conversation from one agent to another.
 *
 * <p>An agent requests a handoff by emitting an AI message with a tool call named
 * {@code transfer_to_<agent>}. The receiving side answers the call with a tool message so
 * the conversation log stays well-formed.
 */
public final class Handoffs {
    public static final String PREFIX = "transfer_to_";

    private Handoffs() {
    }

    public static String toolName(String agent) {
        return PREFIX + agent;
    }

    public static boolean isHandoff(ToolCall call) {
        return call.name().startsWith(PREFIX);
    }

    public static ToolCall handoffCall(String agent) {
        return ToolCall.of(toolName(agent), Map.of());
    }

    /**
     * Create an AI message that requests a handoff.
     *
     * @param content Text accompanying the request
     * @param agent Agent to hand off to
     * @return An AI message carrying the handoff call
     */
    public static Message handoffMessage(String content, String agent) {
        return Message.ai(content, List.of(handoffCall(agent)));
    }

    /**
     * Whether the last message asks for tool work other than handoffs.
     *
     * @param state Conversation
     * @return True if a tool node has calls to execute
     */
    public static boolean hasToolWork(MessagesState state) {
        return state.hasPendingToolCalls()
                && state.lastMessage().get().toolCalls().stream().anyMatch(call -> !isHandoff(call));
    }

    /**
     * Build the update answering a handoff call in the last message.
     *
     * @param view Conversation containing the handoff request
     * @param agent Agent taking over
     * @return Update with one tool message, or an empty update if no matching call exists
     */
    public static MessagesState acknowledge(MessagesState view, String agent) {
        String name = toolName(agent);
        Optional<ToolCall> call = view.lastMessage()
                .flatMap(message -> message.toolCalls().stream()
                        .filter(candidate -> candidate.name().equals(name))
                        .findFirst());
        if (call.isEmpty()) {
            return MessagesState.empty();
        }
        return MessagesState.of(Message.tool(call.get().id(), "Transferring to agent '" + agent + "'."));
    }

    /**
     * Resolver reading handoff calls from the last AI message. Calls naming an agent
     * outside {@code agents} are ignored.
     *
     * @param agents Agents that may be handed off to
     * @return Resolver
     */
    public static HandoffResolver<MessagesState> resolver(Collection<String> agents) {
        Set<String> known = new LinkedHashSet<>(agents);
        return state -> state.lastMessage()
                .filter(message -> message.role() == Message.Role.AI)
                .flatMap(message -> message.toolCalls().stream()
                        .filter(Handoffs::isHandoff)
                        .map(call -> call.name().substring(PREFIX.length()))
                        .filter(known::contains)
                        .findFirst());
    }

    static <S extends State<S>> S combine(S first, S second) {
        if (first == null) {
            return second;
        }
        return second == null ? first : first.merge(second);
    }
}
