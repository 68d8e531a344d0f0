package com.flowgraph.node;

import com.flowgraph.checkpoint.base.memory.MemoryCheckpointSaver;
import com.flowgraph.graph.CompiledGraph;
import com.flowgraph.graph.CounterState;
import com.flowgraph.graph.GraphConfig;
import com.flowgraph.graph.GraphResult;
import com.flowgraph.graph.StateGraph;
import com.flowgraph.graph.TraceState;
import com.flowgraph.state.Message;
import com.flowgraph.state.MessagesState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SubgraphNodeTest {

    @Test
    public void testSubgraphConversationMergesWithoutDuplicates() {
        CompiledGraph<MessagesState> inner = new StateGraph<MessagesState>()
                .addNode("reply", Node.of(state -> MessagesState.of(Message.ai("inner reply"))))
                .setEntryPoint("reply")
                .compile();
        CompiledGraph<MessagesState> outer = new StateGraph<MessagesState>()
                .addNode("inner", new SubgraphNode<>(inner))
                .setEntryPoint("inner")
                .compile();

        GraphResult<MessagesState> result = outer.invoke(MessagesState.of(Message.human("hi")));

        assertThat(result.getState().messages()).extracting(Message::content).containsExactly("hi", "inner reply");
    }

    @Test
    public void testUpdateMapper() {
        CompiledGraph<CounterState> inner = new StateGraph<CounterState>()
                .addNode("add", Node.of(state -> CounterState.of(5)))
                .setEntryPoint("add")
                .compile();
        // The counter sums, so only the sub-graph's increment is handed back
        SubgraphNode<CounterState> node = new SubgraphNode<>(inner,
                (parent, result) -> CounterState.of(result.count() - parent.count()));
        CompiledGraph<CounterState> outer = new StateGraph<CounterState>()
                .addNode("inner", node)
                .setEntryPoint("inner")
                .compile();

        assertThat(outer.invoke(CounterState.of(10)).getState().count()).isEqualTo(15);
        assertThat(node.getGraph()).isSameAs(inner);
    }

    @Test
    public void testSubgraphInterruptPausesParent() {
        CompiledGraph<TraceState> inner = new StateGraph<TraceState>()
                .addNode("ask", state -> Command.interrupt("need input", TraceState.of("asked")))
                .setEntryPoint("ask")
                .compile();
        CompiledGraph<TraceState> outer = new StateGraph<TraceState>()
                .addNode("inner", new SubgraphNode<>(inner, (parent, result) -> TraceState.of(result.last())))
                .addNode("next", Node.of(state -> TraceState.of("next")))
                .setEntryPoint("inner")
                .addEdge("inner", "next")
                .setCheckpointer(new MemoryCheckpointSaver())
                .compile();
        GraphConfig config = GraphConfig.of("nested");

        GraphResult<TraceState> paused = outer.invoke(TraceState.of("in"), config);

        assertThat(paused.isInterrupted()).isTrue();
        assertThat(paused.getInterruptPayload()).contains("need input");
        assertThat(paused.getState().steps()).containsExactly("in", "asked");
        assertThat(outer.resume(config).getState().steps()).containsExactly("in", "asked", "next");
    }
}
