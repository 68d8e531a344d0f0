package com.flowgraph.prebuilt;

import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;
import com.flowgraph.state.ToolCall;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class HandoffsTest {

    @Test
    public void testToolNames() {
        assertThat(Handoffs.toolName("billing")).isEqualTo("transfer_to_billing");
        assertThat(Handoffs.handoffCall("billing").name()).isEqualTo("transfer_to_billing");
        assertThat(Handoffs.isHandoff(ToolCall.of("search", Map.of()))).isFalse();
    }

    @Test
    public void testResolverReadsLastAiMessage() {
        HandoffResolver<MessagesState> resolver = Handoffs.resolver(List.of("billing", "support"));
        MessagesState asking = MessagesState.of(Message.human("refund"), Handoffs.handoffMessage("", "billing"));

        assertThat(resolver.resolve(asking)).contains("billing");
        // Answered calls and unknown agents do not hand off
        assertThat(resolver.resolve(asking.merge(Handoffs.acknowledge(asking, "billing")))).isEmpty();
        assertThat(resolver.resolve(MessagesState.of(Handoffs.handoffMessage("", "sales")))).isEmpty();
        assertThat(resolver.resolve(MessagesState.empty())).isEmpty();
    }

    @Test
    public void testAcknowledgeAnswersHandoffCall() {
        Message request = Handoffs.handoffMessage("passing on", "support");
        MessagesState view = MessagesState.of(Message.human("help"), request);

        MessagesState ack = Handoffs.acknowledge(view, "support");

        assertThat(ack.size()).isEqualTo(1);
        Message tool = ack.lastMessage().orElseThrow();
        assertThat(tool.role()).isEqualTo(Message.Role.TOOL);
        assertThat(tool.toolCallId()).isEqualTo(request.toolCalls().get(0).id());
        assertThat(tool.content()).isEqualTo("Transferring to agent 'support'.");
        assertThat(Handoffs.acknowledge(view, "other").size()).isZero();
    }

    @Test
    public void testToolWorkIgnoresHandoffs() {
        Message mixed = Message.ai("", List.of(Handoffs.handoffCall("a"), ToolCall.of("search", Map.of())));

        assertThat(Handoffs.hasToolWork(MessagesState.of(Handoffs.handoffMessage("", "a")))).isFalse();
        assertThat(Handoffs.hasToolWork(MessagesState.of(mixed))).isTrue();
        assertThat(Handoffs.hasToolWork(MessagesState.of(Message.ai("done")))).isFalse();
    }
}
