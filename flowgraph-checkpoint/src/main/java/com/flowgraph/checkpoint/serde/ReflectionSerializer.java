package com.flowgraph.checkpoint.serde;

import java.util.function.Function;

/**
 * A serializer for arbitrary object graphs that walks records and plain objects
 * reflectively. Types that cannot be walked (value types with private state,
 * library classes) are handled through registered encoder/decoder pairs.
 */
public interface ReflectionSerializer extends Serializer<Object> {
    /**
     * Register a custom representation for a type. The encoder must produce a value
     * the serializer already understands (string, number, list, map, ...); the decoder
     * receives that value back.
     *
     * @param type Exact runtime class to match
     * @param encoder Converts an instance into its serializable representation
     * @param decoder Rebuilds an instance from the representation
     * @param <T> The registered type
     */
    <T> void registerType(Class<T> type, Function<? super T, ?> encoder, Function<Object, ? extends T> decoder);
}
