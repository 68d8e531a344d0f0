package com.flowgraph.graph.registry;

import com.flowgraph.node.Node;
import com.flowgraph.state.State;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Registry of named nodes. Mutable while a graph is being built and frozen when it
 * compiles; lookups on a frozen registry need no locking.
 *
 * @param <S> State type
 */
public class NodeRegistry<S extends State<S>> {
    private final Map<String, Node<S>> nodes;
    private final boolean frozen;

    /**
     * Create an empty, mutable registry.
     */
    public NodeRegistry() {
        this(new LinkedHashMap<>(), false);
    }

    private NodeRegistry(Map<String, Node<S>> nodes, boolean frozen) {
        this.nodes = nodes;
        this.frozen = frozen;
    }

    /**
     * Register a node. A node already registered under the same name is replaced.
     *
     * @param name Node name
     * @param node Node implementation
     * @return This registry
     * @throws IllegalStateException If the registry is frozen
     */
    public NodeRegistry<S> register(String name, Node<S> node) {
        if (frozen) {
            throw new IllegalStateException("Cannot register node '" + name + "' on a frozen registry");
        }
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Node name cannot be null or empty");
        }
        if (node == null) {
            throw new IllegalArgumentException("Node '" + name + "' cannot be null");
        }
        nodes.put(name, node);
        return this;
    }

    /**
     * Get a node by name.
     *
     * @param name Name of the node to get
     * @return Node with the given name
     * @throws NoSuchElementException If no node with the given name is registered
     */
    public Node<S> get(String name) {
        Node<S> node = nodes.get(name);
        if (node == null) {
            throw new NoSuchElementException("No node registered with name '" + name + "'");
        }
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /**
     * Get the registered names in registration order.
     *
     * @return Unmodifiable set of names
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * Create a frozen copy of this registry. Later changes to this registry do not
     * affect the copy.
     *
     * @return Frozen registry
     */
    public NodeRegistry<S> freeze() {
        return new NodeRegistry<>(Collections.unmodifiableMap(new LinkedHashMap<>(nodes)), true);
    }
}
