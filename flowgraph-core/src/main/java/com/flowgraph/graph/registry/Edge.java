package com.flowgraph.graph.registry;

import java.util.Objects;

/**
 * An unconditional transition from one node to another.
 */
public final class Edge {
    private final String source;
    private final String target;

    public Edge(String source, String target) {
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("Edge source cannot be null or empty");
        }
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Edge target cannot be null or empty");
        }
        this.source = source;
        this.target = target;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Edge edge = (Edge) o;
        return source.equals(edge.source) && target.equals(edge.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return source + " -> " + target;
    }
}
