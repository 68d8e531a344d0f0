package com.flowgraph.state;

import java.util.List;
import java.util.UUID;

/**
 * One entry of a conversation log.
 *
 * <p>Every message carries an id (generated when not supplied). {@link MessagesState}
 * uses it to replace rather than duplicate a message that is merged twice, which is
 * what happens when a sub-graph hands its full log back to its parent.
 *
 * @param id Message identifier
 * @param role Author of the message
 * @param content Text content, never null
 * @param toolCalls Tool calls requested by an AI message
 * @param toolCallId For tool messages, the call being answered
 * @param name Optional author name, e.g. the agent that produced the message
 */
public record Message(String id, Role role, String content, List<ToolCall> toolCalls, String toolCallId,
                      String name) {

    public enum Role {
        SYSTEM, HUMAN, AI, TOOL
    }

    public Message {
        if (role == null) {
            throw new IllegalArgumentException("Message role cannot be null");
        }
        id = id != null ? id : UUID.randomUUID().toString();
        content = content != null ? content : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public static Message system(String content) {
        return new Message(null, Role.SYSTEM, content, null, null, null);
    }

    public static Message human(String content) {
        return new Message(null, Role.HUMAN, content, null, null, null);
    }

    public static Message ai(String content) {
        return new Message(null, Role.AI, content, null, null, null);
    }

    public static Message ai(String content, List<ToolCall> toolCalls) {
        return new Message(null, Role.AI, content, toolCalls, null, null);
    }

    /**
     * Create the answer to a tool call.
     *
     * @param toolCallId Id of the call being answered
     * @param content Tool output
     * @return A tool message
     */
    public static Message tool(String toolCallId, String content) {
        return new Message(null, Role.TOOL, content, null, toolCallId, null);
    }

    /**
     * Return a copy attributed to the given author name.
     *
     * @param name Author name
     * @return A message with the same id
     */
    public Message withName(String name) {
        return new Message(id, role, content, toolCalls, toolCallId, name);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
