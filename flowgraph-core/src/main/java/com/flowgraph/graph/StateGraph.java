package com.flowgraph.graph;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.checkpoint.serde.MsgPackSerializer;
import com.flowgraph.checkpoint.serde.Serializer;
import com.flowgraph.graph.execute.NodeCache;
import com.flowgraph.graph.registry.ConditionalEdge;
import com.flowgraph.graph.registry.EdgeTable;
import com.flowgraph.graph.registry.NodeRegistry;
import com.flowgraph.node.Node;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * A fluent builder for state graphs.
 * Collects nodes, edges, the entry point and interrupt declarations, then validates
 * them and freezes them into an immutable {@link CompiledGraph}.
 *
 * <pre>{@code
 * CompiledGraph<MessagesState> graph = new StateGraph<MessagesState>()
 *         .addNode("agent", agent)
 *         .addNode("tools", tools)
 *         .setEntryPoint("agent")
 *         .addConditionalEdges("agent", s -> s.hasPendingToolCalls() ? "tools" : StateGraph.END)
 *         .addEdge("tools", "agent")
 *         .compile();
 * }</pre>
 *
 * @param <S> State type
 */
public class StateGraph<S extends State<S>> {
    private static final Logger log = LoggerFactory.getLogger(StateGraph.class);

    /** Virtual node before the entry point. Never registered as a node. */
    public static final String START = "__start__";
    /** Virtual node that ends a run. Never registered as a node. */
    public static final String END = "__end__";

    private final NodeRegistry<S> nodes = new NodeRegistry<>();
    private final EdgeTable<S> edges = new EdgeTable<>();
    private final Set<String> interruptBefore = new LinkedHashSet<>();
    private final Set<String> interruptAfter = new LinkedHashSet<>();
    private final List<String> reservedNames = new ArrayList<>();
    private final Map<String, CachePolicy> cachePolicies = new LinkedHashMap<>();
    private String entryPoint;
    private BaseCheckpointSaver checkpointer;
    private Serializer<Object> serializer;
    private Executor executor;
    private Clock clock;

    /**
     * Adds a node. Registering a name twice replaces the earlier node.
     *
     * @param name Node name
     * @param node Node implementation
     * @return This builder for method chaining
     */
    public StateGraph<S> addNode(String name, Node<S> node) {
        requireName(name, "Node name");
        if (START.equals(name) || END.equals(name)) {
            // reported by compile() together with any other problems
            reservedNames.add(name);
            return this;
        }
        nodes.register(name, node);
        cachePolicies.remove(name);
        return this;
    }

    /**
     * Adds a node whose outputs are cached per input state.
     *
     * @param name Node name
     * @param node Node implementation
     * @param cachePolicy How long outputs stay cached
     * @return This builder for method chaining
     */
    public StateGraph<S> addNode(String name, Node<S> node, CachePolicy cachePolicy) {
        if (cachePolicy == null) {
            throw new IllegalArgumentException("Cache policy cannot be null");
        }
        addNode(name, node);
        if (nodes.contains(name)) {
            cachePolicies.put(name, cachePolicy);
        }
        return this;
    }

    /**
     * Sets the first node to run.
     *
     * @param name Node name
     * @return This builder for method chaining
     */
    public StateGraph<S> setEntryPoint(String name) {
        requireName(name, "Entry point");
        this.entryPoint = name;
        return this;
    }

    /**
     * Adds a fixed edge. An edge from {@link #START} sets the entry point.
     *
     * @param source Source node
     * @param target Target node or {@link #END}
     * @return This builder for method chaining
     */
    public StateGraph<S> addEdge(String source, String target) {
        requireName(source, "Edge source");
        requireName(target, "Edge target");
        if (START.equals(source)) {
            return setEntryPoint(target);
        }
        edges.addEdge(source, target);
        return this;
    }

    /**
     * Adds a conditional edge-set: after {@code source} runs, the router picks the next
     * node from the merged state.
     *
     * @param source Source node
     * @param router Router returning a node name or {@link #END}
     * @return This builder for method chaining
     */
    public StateGraph<S> addConditionalEdges(String source, EdgeRouter<S> router) {
        return addConditionalEdges(source, router, null);
    }

    /**
     * Adds a conditional edge-set with a documented set of targets.
     *
     * @param source Source node
     * @param router Router returning a node name or {@link #END}
     * @param pathMap Label to target name; checked at compile time, not used for routing
     * @return This builder for method chaining
     */
    public StateGraph<S> addConditionalEdges(String source, EdgeRouter<S> router, Map<String, String> pathMap) {
        requireName(source, "Conditional edge source");
        edges.addConditionalEdge(new ConditionalEdge<>(source, router, pathMap));
        return this;
    }

    /**
     * Pauses runs before the named nodes execute.
     *
     * @param names Node names
     * @return This builder for method chaining
     */
    public StateGraph<S> interruptBefore(String... names) {
        interruptBefore.addAll(Arrays.asList(names));
        return this;
    }

    /**
     * Pauses runs after the named nodes execute.
     *
     * @param names Node names
     * @return This builder for method chaining
     */
    public StateGraph<S> interruptAfter(String... names) {
        interruptAfter.addAll(Arrays.asList(names));
        return this;
    }

    /**
     * Sets the saver that persists checkpoints for runs with a thread id.
     *
     * @param checkpointer Checkpoint saver, or null to disable persistence
     * @return This builder for method chaining
     */
    public StateGraph<S> setCheckpointer(BaseCheckpointSaver checkpointer) {
        this.checkpointer = checkpointer;
        return this;
    }

    /**
     * Sets the serializer for checkpointed state. Defaults to {@link MsgPackSerializer}.
     *
     * @param serializer State serializer
     * @return This builder for method chaining
     */
    public StateGraph<S> setSerializer(Serializer<Object> serializer) {
        this.serializer = serializer;
        return this;
    }

    /**
     * Sets the executor for asynchronous invocation and send fan-out. Defaults to the
     * common fork-join pool.
     *
     * @param executor Executor
     * @return This builder for method chaining
     */
    public StateGraph<S> setExecutor(Executor executor) {
        this.executor = executor;
        return this;
    }

    /**
     * Sets the clock that decides when cached node outputs expire. Defaults to the system
     * UTC clock.
     *
     * @param clock Clock
     * @return This builder for method chaining
     */
    public StateGraph<S> setClock(Clock clock) {
        this.clock = clock;
        return this;
    }

    /**
     * Validates the graph and freezes it. Every structural problem is reported at once.
     *
     * @return The compiled graph
     * @throws CompileException If the graph is invalid
     */
    public CompiledGraph<S> compile() {
        List<String> violations = new ArrayList<>();
        Set<String> names = nodes.names();

        if (entryPoint == null) {
            violations.add("no entry point set");
        } else if (!names.contains(entryPoint)) {
            violations.add("entry point node '" + entryPoint + "' not found");
        }
        for (String reserved : reservedNames) {
            violations.add("node name '" + reserved + "' is reserved");
        }
        violations.addAll(edges.validate(names));
        for (String name : interruptBefore) {
            if (!names.contains(name)) {
                violations.add("interrupt_before node '" + name + "' not found");
            }
        }
        for (String name : interruptAfter) {
            if (!names.contains(name)) {
                violations.add("interrupt_after node '" + name + "' not found");
            }
        }

        if (!violations.isEmpty()) {
            throw new CompileException(violations);
        }
        edges.getShadowedEdges().forEach((source, targets) ->
                log.warn("Node '{}' has fixed edges to {}; only '{}' is taken", source, targets, targets.get(0)));

        Serializer<Object> stateSerializer = serializer != null ? serializer : new MsgPackSerializer();
        CompiledGraph<S> compiled = new CompiledGraph<>(
                nodes.freeze(),
                edges.freeze(),
                entryPoint,
                interruptBefore,
                interruptAfter,
                checkpointer,
                stateSerializer,
                executor != null ? executor : ForkJoinPool.commonPool(),
                new NodeCache<>(cachePolicies, stateSerializer, clock != null ? clock : Clock.systemUTC()));
        log.debug("Compiled graph with nodes {} and entry point '{}'", names, entryPoint);
        return compiled;
    }

    private static void requireName(String name, String what) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
    }
}
