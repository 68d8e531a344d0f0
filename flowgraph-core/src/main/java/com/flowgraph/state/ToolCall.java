package com.flowgraph.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A request, embedded in an AI message, to run a named tool with arguments.
 *
 * @param id Call identifier, generated when null
 * @param name Tool name
 * @param arguments Tool arguments
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) {
    public ToolCall {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Tool call name cannot be null or empty");
        }
        id = id != null ? id : "call_" + UUID.randomUUID();
        arguments = arguments != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(arguments))
                : Collections.emptyMap();
    }

    public static ToolCall of(String name, Map<String, Object> arguments) {
        return new ToolCall(null, name, arguments);
    }
}
