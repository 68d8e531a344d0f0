package com.flowgraph.checkpoint.base;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier helpers for checkpoints.
 */
public final class ID {
    private static final AtomicLong COUNTER = new AtomicLong();

    private ID() {
    }

    /**
     * Name-based UUID: the same namespace and name always give the same id.
     *
     * @param namespace The namespace for the ID
     * @param name The name within the namespace
     * @return A UUID derived from the SHA-1 of namespace and name
     */
    public static UUID uuid(String namespace, String name) {
        MessageDigest sha1;
        try {
            sha1 = MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 algorithm not available", e);
        }
        sha1.update(namespace.getBytes(StandardCharsets.UTF_8));
        sha1.update((byte) 0);
        sha1.update(name.getBytes(StandardCharsets.UTF_8));
        byte[] digest = sha1.digest();

        // version 5 (name-based, SHA-1), IETF variant
        digest[6] = (byte) ((digest[6] & 0x0F) | 0x50);
        digest[8] = (byte) ((digest[8] & 0x3F) | 0x80);

        long msb = 0;
        long lsb = 0;
        for (int i = 0; i < 8; i++) {
            msb = (msb << 8) | (digest[i] & 0xff);
            lsb = (lsb << 8) | (digest[i + 8] & 0xff);
        }
        return new UUID(msb, lsb);
    }

    /**
     * Generate a fresh checkpoint id for a thread. Ids are unique within the JVM even
     * when several checkpoints are created in the same millisecond.
     *
     * @param threadId The thread ID
     * @return A checkpoint ID
     */
    public static String checkpointId(String threadId) {
        String name = threadId + "/" + System.currentTimeMillis() + "/" + COUNTER.incrementAndGet();
        return uuid("checkpoint", name).toString();
    }
}
