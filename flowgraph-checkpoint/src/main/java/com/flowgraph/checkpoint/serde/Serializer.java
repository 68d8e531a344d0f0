package com.flowgraph.checkpoint.serde;

/**
 * Converts values to and from the byte form stored inside checkpoints.
 *
 * @param <T> Type of value handled by this serializer
 */
public interface Serializer<T> {
    /**
     * Encode a value.
     *
     * @param value The value to encode, may be null
     * @return Encoded bytes
     * @throws SerializationException If the value cannot be encoded
     */
    byte[] serialize(T value);

    /**
     * Decode a value previously produced by {@link #serialize(Object)}.
     *
     * @param data Encoded bytes
     * @return The decoded value
     * @throws SerializationException If the bytes cannot be decoded
     */
    T deserialize(byte[] data);
}
