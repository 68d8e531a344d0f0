package com.flowgraph.node;

import com.flowgraph.graph.StateGraph;
import com.flowgraph.graph.TraceState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CommandTest {

    @Test
    void testGoTo() {
        Command<TraceState> command = Command.goTo("next", TraceState.of("a"));

        assertThat(command.isCommand()).isTrue();
        assertThat(command.getKind()).isEqualTo(Command.Kind.GOTO);
        assertThat(command.getTarget()).isEqualTo("next");
        assertThat(command.getUpdate()).isEqualTo(TraceState.of("a"));
        assertThat(Command.<TraceState>goTo("next").getUpdate()).isNull();
    }

    @Test
    void testEnd() {
        Command<TraceState> command = Command.end();

        assertThat(command.getKind()).isEqualTo(Command.Kind.END);
        assertThat(command.getTarget()).isEqualTo(StateGraph.END);
    }

    @Test
    void testSendCopiesTargets() {
        List<String> targets = new ArrayList<>(List.of("x", "y"));
        Command<TraceState> command = Command.send(targets);
        targets.add("z");

        assertThat(command.getKind()).isEqualTo(Command.Kind.SEND);
        assertThat(command.getTargets()).containsExactly("x", "y");
    }

    @Test
    void testInvalidCommands() {
        assertThatThrownBy(() -> Command.goTo(""))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Command.send(new ArrayList<>()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Command.send("x", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testInterrupt() {
        Command<TraceState> command = Command.interrupt("approve?", TraceState.of("draft"));

        assertThat(command.getKind()).isEqualTo(Command.Kind.INTERRUPT);
        assertThat(command.getPayload()).isEqualTo("approve?");
        assertThat(command.getUpdate()).isEqualTo(TraceState.of("draft"));
    }

    @Test
    void testPlainOutput() throws Exception {
        Node<TraceState> node = Node.of(state -> TraceState.of("seen " + state.size()));

        NodeOutput<TraceState> output = node.execute(TraceState.of("a", "b"));

        assertThat(output.isCommand()).isFalse();
        assertThat(output.getUpdate()).isEqualTo(TraceState.of("seen 2"));
        assertThat(NodeOutput.<TraceState>empty().getUpdate()).isNull();
    }

    @Test
    void testEquality() {
        assertThat(Command.<TraceState>goTo("a")).isEqualTo(Command.<TraceState>goTo("a"));
        assertThat(Command.<TraceState>goTo("a")).isNotEqualTo(Command.<TraceState>goTo("b"));
        assertThat(Command.<TraceState>interrupt("p")).isNotEqualTo(Command.<TraceState>update(null));
    }
}
