package com.flowgraph.state;

import com.flowgraph.channels.Channels;
import com.flowgraph.channels.Topic;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * State holding a conversation log. Merging appends the update's messages; a message
 * whose id is already in the log replaces the existing entry in place.
 *
 * @param messages The conversation, oldest first
 */
public record MessagesState(List<Message> messages) implements State<MessagesState> {
    private static final Topic<Message> MESSAGES = Channels.keyedTopic(Message::id);

    public MessagesState {
        messages = messages != null ? List.copyOf(messages) : List.of();
    }

    public static MessagesState of(Message... messages) {
        return new MessagesState(Arrays.asList(messages));
    }

    public static MessagesState empty() {
        return new MessagesState(List.of());
    }

    @Override
    public MessagesState merge(MessagesState update) {
        return new MessagesState(MESSAGES.update(messages, update.messages()));
    }

    /**
     * Return a state with the given messages appended.
     *
     * @param more Messages to add
     * @return A new state
     */
    public MessagesState with(Message... more) {
        List<Message> combined = new ArrayList<>(messages);
        combined.addAll(Arrays.asList(more));
        return new MessagesState(combined);
    }

    public Optional<Message> lastMessage() {
        return messages.isEmpty() ? Optional.empty() : Optional.of(messages.get(messages.size() - 1));
    }

    /**
     * Whether the last message is an AI message that still asks for tool calls.
     *
     * @return True if tool work is pending
     */
    public boolean hasPendingToolCalls() {
        return lastMessage()
                .filter(message -> message.role() == Message.Role.AI)
                .map(Message::hasToolCalls)
                .orElse(false);
    }

    public int size() {
        return messages.size();
    }
}
