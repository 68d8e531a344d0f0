package com.flowgraph.graph;

import com.flowgraph.checkpoint.base.memory.MemoryCheckpointSaver;
import com.flowgraph.node.Command;
import com.flowgraph.node.Node;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

public class InvokeAsyncTest {
    private ExecutorService executor;
    private MemoryCheckpointSaver saver;

    @BeforeEach
    public void setUp() {
        executor = Executors.newSingleThreadExecutor();
        saver = new MemoryCheckpointSaver();
    }

    @AfterEach
    public void tearDown() {
        executor.shutdownNow();
    }

    @Test
    public void testInvokeAsyncCompletes() throws Exception {
        CompiledGraph<TraceState> graph = new StateGraph<TraceState>()
                .addNode("a", Node.of(state -> TraceState.of("a")))
                .setEntryPoint("a")
                .setExecutor(executor)
                .compile();

        GraphResult<TraceState> result = graph.invokeAsync(TraceState.of("in")).get(5, TimeUnit.SECONDS);

        assertThat(result.getState().steps()).containsExactly("in", "a");
    }

    @Test
    public void testSendOnSingleThreadExecutorCompletes() throws Exception {
        // The run occupies the only worker, so fan-out targets cannot be queued behind it
        CompiledGraph<TraceState> graph = new StateGraph<TraceState>()
                .addNode("fan", state -> Command.send("x", "y"))
                .addNode("x", Node.of(state -> TraceState.of("x")))
                .addNode("y", Node.of(state -> TraceState.of("y")))
                .addNode("join", Node.of(state -> TraceState.of("join")))
                .setEntryPoint("fan")
                .addEdge("fan", "join")
                .setExecutor(executor)
                .compile();

        GraphResult<TraceState> result = graph.invokeAsync(TraceState.of()).get(5, TimeUnit.SECONDS);

        assertThat(result.getState().steps()).containsExactly("x", "y", "join");
    }

    @Test
    public void testCancellationLeavesLastCompletedCheckpoint() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean afterRan = new AtomicBoolean();
        CompiledGraph<TraceState> graph = new StateGraph<TraceState>()
                .addNode("first", Node.of(state -> TraceState.of("first")))
                .addNode("slow", Node.of(state -> {
                    entered.countDown();
                    release.await(5, TimeUnit.SECONDS);
                    return TraceState.of("slow");
                }))
                .addNode("after", Node.of(state -> {
                    afterRan.set(true);
                    return TraceState.of("after");
                }))
                .setEntryPoint("first")
                .addEdge("first", "slow")
                .addEdge("slow", "after")
                .setCheckpointer(saver)
                .setExecutor(executor)
                .compile();
        GraphConfig config = GraphConfig.of("cancel-me");

        CompletableFuture<GraphResult<TraceState>> future = graph.invokeAsync(TraceState.of(), config);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        future.cancel(true);
        release.countDown();

        // Wait for the run to wind down on the single worker thread
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(future.isCancelled()).isTrue();
        assertThat(afterRan.get()).isFalse();
        StateSnapshot<TraceState> latest = graph.getState(config).orElseThrow();
        assertThat(latest.nextNode()).isEqualTo("slow");
        assertThat(latest.state().steps()).containsExactly("first");
    }
}
