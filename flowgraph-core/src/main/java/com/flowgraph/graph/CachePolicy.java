package com.flowgraph.graph;

import java.time.Duration;
import java.util.Objects;

/**
 * Result caching for one node. While an entry is younger than the time-to-live, running
 * the node again on an equal state returns the stored output without executing it.
 */
public final class CachePolicy {
    private final Duration ttl;

    private CachePolicy(Duration ttl) {
        this.ttl = ttl;
    }

    /**
     * Create a policy.
     *
     * @param ttl How long a cached output stays valid, must be positive
     * @return The policy
     */
    public static CachePolicy of(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        return new CachePolicy(ttl);
    }

    public Duration getTtl() {
        return ttl;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return ttl.equals(((CachePolicy) o).ttl);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ttl);
    }

    @Override
    public String toString() {
        return "CachePolicy{ttl=" + ttl + '}';
    }
}
