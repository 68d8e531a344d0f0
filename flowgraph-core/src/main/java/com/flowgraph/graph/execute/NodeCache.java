package com.flowgraph.graph.execute;

import com.flowgraph.checkpoint.serde.Serializer;
import com.flowgraph.graph.CachePolicy;
import com.flowgraph.node.Node;
import com.flowgraph.node.NodeOutput;
import com.flowgraph.state.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-node output cache of a compiled graph, shared by all of its runs.
 *
 * <p>Entries are keyed by node name and a SHA-256 digest of the serialized input state,
 * so two states that serialize identically share an entry. Expired entries of a node are
 * dropped whenever that node stores a new output. Nodes without a {@link CachePolicy}
 * always execute.
 *
 * @param <S> State type
 */
public class NodeCache<S extends State<S>> {
    private static final Logger log = LoggerFactory.getLogger(NodeCache.class);

    private final Map<String, CachePolicy> policies;
    private final Serializer<Object> serializer;
    private final Clock clock;
    private final Map<String, Map<String, Entry<S>>> entries = new ConcurrentHashMap<>();

    private static final class Entry<S> {
        private final NodeOutput<S> output;
        private final Instant expiresAt;

        Entry(NodeOutput<S> output, Instant expiresAt) {
            this.output = output;
            this.expiresAt = expiresAt;
        }
    }

    /**
     * @param policies Cache policy per node name
     * @param serializer Serializer used to derive cache keys from states
     * @param clock Clock deciding expiry
     */
    public NodeCache(Map<String, CachePolicy> policies, Serializer<Object> serializer, Clock clock) {
        if (policies == null || serializer == null || clock == null) {
            throw new IllegalArgumentException("Policies, serializer and clock are required");
        }
        this.policies = Collections.unmodifiableMap(new LinkedHashMap<>(policies));
        this.serializer = serializer;
        this.clock = clock;
    }

    /**
     * Execute a node, or return its cached output for an equal state.
     *
     * @param name Node name
     * @param node Node implementation
     * @param state Input state
     * @return The node's output, possibly from the cache
     * @throws Exception Whatever the node throws; failures are not cached
     */
    public NodeOutput<S> execute(String name, Node<S> node, S state) throws Exception {
        CachePolicy policy = policies.get(name);
        if (policy == null) {
            return node.execute(state);
        }
        String key = key(state);
        Map<String, Entry<S>> nodeEntries = entries.computeIfAbsent(name, n -> new ConcurrentHashMap<>());
        Entry<S> hit = nodeEntries.get(key);
        if (hit != null && clock.instant().isBefore(hit.expiresAt)) {
            log.debug("Cache hit for node '{}'", name);
            return hit.output;
        }

        NodeOutput<S> output = node.execute(state);
        Instant now = clock.instant();
        nodeEntries.values().removeIf(entry -> !now.isBefore(entry.expiresAt));
        nodeEntries.put(key, new Entry<>(output, now.plus(policy.getTtl())));
        log.debug("Cached output of node '{}' for {}", name, policy.getTtl());
        return output;
    }

    public Map<String, CachePolicy> getPolicies() {
        return policies;
    }

    /**
     * Count the live entries of a node.
     *
     * @param name Node name
     * @return Number of unexpired cached outputs
     */
    public int size(String name) {
        Map<String, Entry<S>> nodeEntries = entries.get(name);
        if (nodeEntries == null) {
            return 0;
        }
        Instant now = clock.instant();
        return (int) nodeEntries.values().stream().filter(entry -> now.isBefore(entry.expiresAt)).count();
    }

    public void clear() {
        entries.clear();
    }

    private String key(S state) {
        MessageDigest sha256;
        try {
            sha256 = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
        return Base64.getEncoder().encodeToString(sha256.digest(serializer.serialize(state)));
    }
}
