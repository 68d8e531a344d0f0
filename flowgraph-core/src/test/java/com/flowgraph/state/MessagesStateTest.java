package com.flowgraph.state;

import com.flowgraph.checkpoint.serde.MsgPackSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MessagesStateTest {

    @Test
    void testMergeAppends() {
        MessagesState state = MessagesState.of(Message.human("hi"));

        MessagesState merged = state.merge(MessagesState.of(Message.ai("hello")));

        assertThat(merged.messages()).extracting(Message::content).containsExactly("hi", "hello");
        // The original is untouched
        assertThat(state.size()).isEqualTo(1);
    }

    @Test
    void testMergeReplacesMessageWithSameId() {
        // Create test data
        Message question = Message.human("hi");
        Message draft = Message.ai("draft");
        MessagesState state = MessagesState.of(question, draft);
        Message revised = new Message(draft.id(), Message.Role.AI, "final", null, null, null);

        MessagesState merged = state.merge(MessagesState.of(revised, Message.ai("extra")));

        assertThat(merged.messages()).extracting(Message::content).containsExactly("hi", "final", "extra");
    }

    @Test
    void testMergingFullLogIsIdempotent() {
        MessagesState state = MessagesState.of(Message.human("a"), Message.ai("b"));

        assertThat(state.merge(state)).isEqualTo(state);
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
    void testSequentialMergeEqualsBatchMerge(long seed) {
        Random random = new Random(seed);
        MessagesState initial = MessagesState.of(Message.system("start"));
        List<MessagesState> batches = new ArrayList<>();
        List<Message> all = new ArrayList<>();
        int batchCount = 1 + random.nextInt(8);
        for (int i = 0; i < batchCount; i++) {
            List<Message> batch = new ArrayList<>();
            int size = random.nextInt(5);
            for (int j = 0; j < size; j++) {
                Message message = random.nextBoolean()
                        ? Message.human("h" + random.nextInt(100))
                        : Message.ai("a" + random.nextInt(100));
                batch.add(message);
            }
            batches.add(new MessagesState(batch));
            all.addAll(batch);
        }

        MessagesState sequential = initial;
        for (MessagesState batch : batches) {
            sequential = sequential.merge(batch);
        }
        MessagesState atOnce = initial.merge(new MessagesState(all));

        assertThat(sequential).isEqualTo(atOnce);
        assertThat(sequential.size()).isEqualTo(1 + all.size());
    }

    @Test
    void testPendingToolCalls() {
        ToolCall call = ToolCall.of("search", Map.of("q", "weather"));
        MessagesState asking = MessagesState.of(Message.human("weather?"), Message.ai("", List.of(call)));
        MessagesState answered = asking.with(Message.tool(call.id(), "sunny"));

        assertThat(asking.hasPendingToolCalls()).isTrue();
        assertThat(answered.hasPendingToolCalls()).isFalse();
        assertThat(MessagesState.empty().hasPendingToolCalls()).isFalse();
        assertThat(MessagesState.empty().lastMessage()).isEmpty();
    }

    @Test
    void testMessageDefaults() {
        Message message = new Message(null, Message.Role.HUMAN, null, null, null, null);

        assertThat(message.id()).isNotBlank();
        assertThat(message.content()).isEmpty();
        assertThat(message.toolCalls()).isEmpty();
        assertThat(message.withName("alice").id()).isEqualTo(message.id());
        assertThatThrownBy(() -> new Message("x", null, "c", null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCheckpointRoundTrip() {
        // Create test data
        MsgPackSerializer serializer = new MsgPackSerializer();
        ToolCall call = ToolCall.of("lookup", Map.of("id", 7, "exact", true));
        MessagesState state = MessagesState.of(
                Message.system("be brief"),
                Message.human("find 7").withName("user"),
                Message.ai("", List.of(call)),
                Message.tool(call.id(), "found"));

        Object restored = serializer.deserialize(serializer.serialize(state));

        assertThat(restored).isEqualTo(state);
    }
}
