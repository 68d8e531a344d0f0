package com.flowgraph.graph.registry;

import com.flowgraph.graph.EdgeRouter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A data-dependent transition: the router picks the target when the source node has run.
 *
 * <p>The optional path map (label to node name) documents the possible targets. It is
 * checked at compile time but never consulted for routing.
 *
 * @param <S> State type
 */
public final class ConditionalEdge<S> {
    private final String source;
    private final EdgeRouter<S> router;
    private final Map<String, String> pathMap;

    public ConditionalEdge(String source, EdgeRouter<S> router, Map<String, String> pathMap) {
        if (source == null || source.isEmpty()) {
            throw new IllegalArgumentException("Conditional edge source cannot be null or empty");
        }
        if (router == null) {
            throw new IllegalArgumentException("Router for '" + source + "' cannot be null");
        }
        this.source = source;
        this.router = router;
        this.pathMap = pathMap != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(pathMap))
                : Collections.emptyMap();
    }

    public String getSource() {
        return source;
    }

    public EdgeRouter<S> getRouter() {
        return router;
    }

    public Map<String, String> getPathMap() {
        return pathMap;
    }

    @Override
    public String toString() {
        return source + " -> ?" + (pathMap.isEmpty() ? "" : " " + pathMap.values());
    }
}
