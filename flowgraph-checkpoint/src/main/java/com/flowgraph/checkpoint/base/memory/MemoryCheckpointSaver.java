package com.flowgraph.checkpoint.base.memory;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;
import com.flowgraph.checkpoint.base.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of a checkpoint saver.
 *
 * <p>Each thread owns an ordered history guarded by its own lock, so writers on
 * different threads never contend. An optional time-to-live evicts checkpoints whose
 * timestamp is older than {@code now - ttl}; eviction happens lazily whenever the
 * thread is accessed, and a thread whose last checkpoint expired is forgotten.
 *
 * <p>A history is only unlinked from the thread map while its lock is held, and is
 * marked detached when that happens. A writer that finds a detached history starts over
 * with a fresh one.
 */
public class MemoryCheckpointSaver implements BaseCheckpointSaver {
    private static final Logger log = LoggerFactory.getLogger(MemoryCheckpointSaver.class);

    private final Map<String, ThreadHistory> threads = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    /**
     * Checkpoints of one thread, indexed by id and by sequence.
     */
    private static final class ThreadHistory {
        private final Map<String, Checkpoint> byId = new HashMap<>();
        private final TreeMap<Long, String> bySequence = new TreeMap<>();
        private long lastSequence;
        private boolean detached;
    }

    /**
     * Create a saver that keeps checkpoints until they are deleted.
     */
    public MemoryCheckpointSaver() {
        this(null, Clock.systemUTC());
    }

    /**
     * Create a saver that evicts checkpoints older than the given time-to-live.
     *
     * @param ttl Maximum checkpoint age, or null to keep checkpoints forever
     * @param clock Clock used for timestamps and eviction
     */
    public MemoryCheckpointSaver(Duration ttl, Clock clock) {
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        if (clock == null) {
            throw new IllegalArgumentException("Clock cannot be null");
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public Checkpoint put(Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("Checkpoint cannot be null");
        }
        if (checkpoint.getTimestamp() == null) {
            checkpoint = checkpoint.toBuilder().timestamp(clock.instant()).build();
        }

        while (true) {
            ThreadHistory history = threads.computeIfAbsent(checkpoint.getThreadId(), id -> new ThreadHistory());
            synchronized (history) {
                if (history.detached) {
                    continue;
                }
                evictExpired(history);
                return store(history, checkpoint);
            }
        }
    }

    private Checkpoint store(ThreadHistory history, Checkpoint checkpoint) {
        Checkpoint existing = history.byId.get(checkpoint.getCheckpointId());
        Checkpoint stored;
        if (existing != null) {
            stored = checkpoint.withSequence(existing.getSequence());
            log.debug("Replacing checkpoint {} of thread {} at sequence {}",
                    checkpoint.getCheckpointId(), checkpoint.getThreadId(), stored.getSequence());
        } else {
            stored = checkpoint.withSequence(++history.lastSequence);
            history.bySequence.put(stored.getSequence(), stored.getCheckpointId());
            log.debug("Stored checkpoint {} of thread {} at sequence {}",
                    checkpoint.getCheckpointId(), checkpoint.getThreadId(), stored.getSequence());
        }
        history.byId.put(stored.getCheckpointId(), stored);
        return stored;
    }

    @Override
    public Optional<Checkpoint> get(String threadId) {
        return get(threadId, null);
    }

    @Override
    public Optional<Checkpoint> get(String threadId, String checkpointId) {
        ThreadHistory history = threads.get(threadId);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            evictExpired(threadId, history);
            if (checkpointId == null) {
                Map.Entry<Long, String> latest = history.bySequence.lastEntry();
                return latest == null ? Optional.empty() : Optional.of(history.byId.get(latest.getValue()));
            }
            return Optional.ofNullable(history.byId.get(checkpointId));
        }
    }

    @Override
    public List<Checkpoint> list(String threadId) {
        ThreadHistory history = threads.get(threadId);
        if (history == null) {
            return Collections.emptyList();
        }
        synchronized (history) {
            evictExpired(threadId, history);
            List<Checkpoint> result = new ArrayList<>(history.bySequence.size());
            for (String id : history.bySequence.values()) {
                result.add(history.byId.get(id));
            }
            return result;
        }
    }

    @Override
    public void delete(String threadId, String checkpointId) {
        ThreadHistory history = threads.get(threadId);
        if (history == null) {
            return;
        }
        synchronized (history) {
            Checkpoint removed = history.byId.remove(checkpointId);
            if (removed != null) {
                history.bySequence.remove(removed.getSequence());
            }
        }
    }

    @Override
    public void clear(String threadId) {
        ThreadHistory history = threads.get(threadId);
        if (history == null) {
            return;
        }
        synchronized (history) {
            detach(threadId, history);
        }
    }

    /**
     * Get the ids of all threads that currently hold at least one checkpoint.
     *
     * @return Thread ids, in no particular order
     */
    public List<String> threadIds() {
        List<String> ids = new ArrayList<>();
        for (Map.Entry<String, ThreadHistory> entry : threads.entrySet()) {
            synchronized (entry.getValue()) {
                evictExpired(entry.getKey(), entry.getValue());
                if (!entry.getValue().byId.isEmpty()) {
                    ids.add(entry.getKey());
                }
            }
        }
        return ids;
    }

    int historyCount() {
        return threads.size();
    }

    private void detach(String threadId, ThreadHistory history) {
        history.detached = true;
        threads.remove(threadId, history);
    }

    /**
     * Evict expired checkpoints and forget the thread once nothing is left. Caller holds
     * the history lock.
     */
    private void evictExpired(String threadId, ThreadHistory history) {
        if (ttl == null || history.detached) {
            return;
        }
        evictExpired(history);
        if (history.byId.isEmpty()) {
            log.debug("Thread {} has no live checkpoints left", threadId);
            detach(threadId, history);
        }
    }

    private void evictExpired(ThreadHistory history) {
        if (ttl == null) {
            return;
        }
        Instant cutoff = clock.instant().minus(ttl);
        Iterator<Map.Entry<Long, String>> it = history.bySequence.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Long, String> entry = it.next();
            Checkpoint checkpoint = history.byId.get(entry.getValue());
            if (checkpoint.getTimestamp().isBefore(cutoff)) {
                log.debug("Evicting expired checkpoint {} of thread {}",
                        checkpoint.getCheckpointId(), checkpoint.getThreadId());
                history.byId.remove(entry.getValue());
                it.remove();
            }
        }
    }
}
