package com.flowgraph.prebuilt;

import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.CounterState;
import com.flowgraph.graph.GraphResult;
import com.flowgraph.graph.StateGraph;
import com.flowgraph.node.Command;
import com.flowgraph.node.Node;
import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SupervisorTest {
    private Node<MessagesState> coordinator;
    private CompiledGraph<MessagesState> researcher;
    private AtomicInteger researcherRuns;

    @BeforeEach
    public void setUp() {
        researcherRuns = new AtomicInteger();
        // Delegate a fresh question, summarize once the researcher has answered
        coordinator = Node.of(state -> {
            Message last = state.lastMessage().orElseThrow();
            if ("researcher".equals(last.name())) {
                return MessagesState.of(Message.ai("Summary: " + last.content()).withName("supervisor"));
            }
            return MessagesState.of(Handoffs.handoffMessage("Asking the researcher.", "researcher"));
        });
        researcher = AgentLoop.create(
                Node.of(state -> {
                    researcherRuns.incrementAndGet();
                    return MessagesState.of(Message.ai("found 3 papers").withName("researcher"));
                }),
                Node.of(state -> null));
    }

    @Test
    public void testDelegatesAndReturnsToSupervisor() {
        CompiledGraph<MessagesState> graph = Supervisor.forMessages()
                .coordinator(coordinator)
                .agent("researcher", researcher)
                .build();

        GraphResult<MessagesState> result = graph.invoke(MessagesState.of(Message.human("find papers")));

        assertThat(result.isComplete()).isTrue();
        assertThat(researcherRuns.get()).isEqualTo(1);
        assertThat(result.getState().messages()).extracting(Message::role).containsExactly(
                Message.Role.HUMAN, Message.Role.AI, Message.Role.TOOL, Message.Role.AI, Message.Role.AI);
        assertThat(result.getState().messages()).extracting(Message::id).doesNotHaveDuplicates();
        assertThat(result.getState().lastMessage().orElseThrow().content()).isEqualTo("Summary: found 3 papers");
    }

    @Test
    public void testGraphShape() {
        CompiledGraph<MessagesState> graph = Supervisor.forMessages()
                .coordinator(coordinator)
                .agent("researcher", researcher)
                .agent("writer", Node.of(state -> null))
                .build();

        assertThat(graph.getEntryPoint()).isEqualTo(Supervisor.SUPERVISOR);
        assertThat(graph.getNodeNames()).containsExactly(Supervisor.SUPERVISOR, "researcher", "writer");
        assertThat(graph.getEdgeTable().getTargets("researcher")).containsExactly(Supervisor.SUPERVISOR);
        assertThat(graph.getEdgeTable().getTargets("writer")).containsExactly(Supervisor.SUPERVISOR);
    }

    @Test
    public void testCoordinatorCommandIsObeyed() {
        CompiledGraph<MessagesState> graph = Supervisor.forMessages()
                .coordinator(state -> Command.goTo(StateGraph.END, MessagesState.of(Message.ai("no delegation"))))
                .agent("researcher", researcher)
                .build();

        GraphResult<MessagesState> result = graph.invoke(MessagesState.of(Message.human("hi")));

        assertThat(result.getState().size()).isEqualTo(2);
        assertThat(researcherRuns.get()).isZero();
    }

    @Test
    public void testGenericSupervisor() {
        // Delegate to the adder until the counter reaches 3
        CompiledGraph<CounterState> graph = Supervisor.<CounterState>builder()
                .coordinator(state -> null)
                .agent("adder", Node.of(state -> CounterState.of(1)))
                .handoffResolver(state -> state.count() < 3 ? Optional.of("adder") : Optional.empty())
                .build();

        assertThat(graph.invoke(CounterState.of(0)).getState().count()).isEqualTo(3);
    }

    @Test
    public void testInvalidSupervisor() {
        assertThatThrownBy(() -> Supervisor.forMessages().agent("researcher", researcher).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("coordinator");
        assertThatThrownBy(() -> Supervisor.forMessages().coordinator(coordinator).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one agent");
        assertThatThrownBy(() -> Supervisor.<CounterState>builder()
                .coordinator(state -> null)
                .agent("a", Node.of(state -> null))
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("handoff resolver");
        assertThatThrownBy(() -> Supervisor.forMessages().agent(Supervisor.SUPERVISOR, researcher))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
