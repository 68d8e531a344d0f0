package com.flowgraph.graph.registry;

import com.flowgraph.graph.StateGraph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed and conditional transitions of a graph, keyed by source node.
 *
 * <p>A source resolves either through exactly one conditional edge-set or through its
 * fixed edges, never both; {@link #validate(Collection)} reports violations of that rule.
 * When several fixed edges leave one source, the first one registered is taken.
 *
 * @param <S> State type
 */
public class EdgeTable<S> {
    private final List<Edge> edges;
    private final List<ConditionalEdge<S>> conditionalEdges;
    private final boolean frozen;

    /**
     * Create an empty, mutable edge table.
     */
    public EdgeTable() {
        this(new ArrayList<>(), new ArrayList<>(), false);
    }

    private EdgeTable(List<Edge> edges, List<ConditionalEdge<S>> conditionalEdges, boolean frozen) {
        this.edges = edges;
        this.conditionalEdges = conditionalEdges;
        this.frozen = frozen;
    }

    /**
     * Add a fixed edge.
     *
     * @param source Source node
     * @param target Target node or {@link StateGraph#END}
     * @return This table
     */
    public EdgeTable<S> addEdge(String source, String target) {
        checkMutable();
        edges.add(new Edge(source, target));
        return this;
    }

    /**
     * Add a conditional edge-set.
     *
     * @param edge The conditional edge
     * @return This table
     */
    public EdgeTable<S> addConditionalEdge(ConditionalEdge<S> edge) {
        checkMutable();
        if (edge == null) {
            throw new IllegalArgumentException("Conditional edge cannot be null");
        }
        conditionalEdges.add(edge);
        return this;
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<ConditionalEdge<S>> getConditionalEdges() {
        return Collections.unmodifiableList(conditionalEdges);
    }

    /**
     * Get the fixed targets leaving a source, in registration order.
     *
     * @param source Source node
     * @return Targets, possibly empty
     */
    public List<String> getTargets(String source) {
        List<String> targets = new ArrayList<>();
        for (Edge edge : edges) {
            if (edge.getSource().equals(source)) {
                targets.add(edge.getTarget());
            }
        }
        return targets;
    }

    public Optional<ConditionalEdge<S>> getConditionalEdge(String source) {
        for (ConditionalEdge<S> edge : conditionalEdges) {
            if (edge.getSource().equals(source)) {
                return Optional.of(edge);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve the next node after a source has run. The router of a conditional edge is
     * called with the merged state; otherwise the first fixed edge is taken. A source
     * without outgoing edges ends the run.
     *
     * @param source Node that just ran
     * @param state Merged state
     * @return Target name, not yet checked against the registered nodes
     */
    public String next(String source, S state) {
        Optional<ConditionalEdge<S>> conditional = getConditionalEdge(source);
        if (conditional.isPresent()) {
            return conditional.get().getRouter().route(state);
        }
        for (Edge edge : edges) {
            if (edge.getSource().equals(source)) {
                return edge.getTarget();
            }
        }
        return StateGraph.END;
    }

    /**
     * Check every edge against the registered node names.
     *
     * @param nodeNames Registered node names
     * @return Violations in a stable order, empty if the table is valid
     */
    public List<String> validate(Collection<String> nodeNames) {
        List<String> violations = new ArrayList<>();

        for (Edge edge : edges) {
            String source = edge.getSource();
            String target = edge.getTarget();
            if (StateGraph.END.equals(source)) {
                violations.add("edge source cannot be " + StateGraph.END + " (target '" + target + "')");
            } else if (!nodeNames.contains(source)) {
                violations.add("edge source '" + source + "' not found");
            }
            if (StateGraph.START.equals(target)) {
                violations.add("edge target cannot be " + StateGraph.START + " (source '" + source + "')");
            } else if (!StateGraph.END.equals(target) && !nodeNames.contains(target)) {
                violations.add("edge target '" + target + "' not found");
            }
        }

        Map<String, Integer> conditionalCounts = new LinkedHashMap<>();
        for (ConditionalEdge<S> edge : conditionalEdges) {
            String source = edge.getSource();
            conditionalCounts.merge(source, 1, Integer::sum);
            if (StateGraph.START.equals(source)) {
                violations.add("conditional edges from " + StateGraph.START + " are not supported");
            } else if (!nodeNames.contains(source)) {
                violations.add("conditional edge source '" + source + "' not found");
            }
            for (Map.Entry<String, String> path : edge.getPathMap().entrySet()) {
                String target = path.getValue();
                if (!StateGraph.END.equals(target) && !nodeNames.contains(target)) {
                    violations.add("conditional edge path_map target '" + target
                            + "' (label '" + path.getKey() + "') not found");
                }
            }
        }

        for (Map.Entry<String, Integer> entry : conditionalCounts.entrySet()) {
            String source = entry.getKey();
            if (entry.getValue() > 1) {
                violations.add("node '" + source + "' has more than one conditional edge set");
            }
            if (!getTargets(source).isEmpty()) {
                violations.add("node '" + source + "' has both conditional and fixed edges");
            }
        }
        return violations;
    }

    /**
     * Sources with more than one fixed edge, mapped to their targets.
     *
     * @return Sources whose later edges are never taken
     */
    public Map<String, List<String>> getShadowedEdges() {
        Map<String, List<String>> bySource = new LinkedHashMap<>();
        for (Edge edge : edges) {
            bySource.computeIfAbsent(edge.getSource(), s -> new ArrayList<>()).add(edge.getTarget());
        }
        bySource.values().removeIf(targets -> targets.size() < 2);
        return bySource;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Create a frozen copy of this table.
     *
     * @return Frozen edge table
     */
    public EdgeTable<S> freeze() {
        return new EdgeTable<>(
                Collections.unmodifiableList(new ArrayList<>(edges)),
                Collections.unmodifiableList(new ArrayList<>(conditionalEdges)),
                true);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Edge table is frozen");
        }
    }
}
