package com.flowgraph.node;

import com.flowgraph.graph.StateGraph;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An explicit override of edge resolution, returned by a node.
 *
 * <ul>
 *   <li>{@link #goTo(String)} / {@link #goTo(String, Object)}: continue at a named node
 *       (or {@link StateGraph#END}), bypassing the node's edges;</li>
 *   <li>{@link #end()}: finish the run;</li>
 *   <li>{@link #update(Object)}: merge an update, then follow the node's edges;</li>
 *   <li>{@link #send(String...)}: run several nodes concurrently on the current state and
 *       merge their updates in the listed order, then follow the node's edges;</li>
 *   <li>{@link #interrupt(Object)}: merge an optional update, checkpoint and pause the run,
 *       returning the payload to the caller.</li>
 * </ul>
 *
 * @param <S> State type
 */
public final class Command<S> extends NodeOutput<S> {

    public enum Kind {
        GOTO, END, UPDATE, SEND, INTERRUPT
    }

    private final Kind kind;
    private final String target;
    private final List<String> targets;
    private final Object payload;

    private Command(Kind kind, S update, String target, List<String> targets, Object payload) {
        super(update);
        this.kind = kind;
        this.target = target;
        this.targets = targets;
        this.payload = payload;
    }

    public static <S> Command<S> goTo(String target) {
        return goTo(target, null);
    }

    /**
     * Merge an update, then jump to a target.
     *
     * @param target Node name or {@link StateGraph#END}
     * @param update Update to merge first, may be null
     * @param <S> State type
     * @return The command
     */
    public static <S> Command<S> goTo(String target, S update) {
        if (target == null || target.isEmpty()) {
            throw new IllegalArgumentException("Goto target cannot be null or empty");
        }
        return new Command<>(Kind.GOTO, update, target, Collections.emptyList(), null);
    }

    public static <S> Command<S> end() {
        return new Command<>(Kind.END, null, StateGraph.END, Collections.emptyList(), null);
    }

    public static <S> Command<S> update(S update) {
        return new Command<>(Kind.UPDATE, update, null, Collections.emptyList(), null);
    }

    public static <S> Command<S> send(String... targets) {
        return send(Arrays.asList(targets));
    }

    /**
     * Fan out to several nodes at once.
     *
     * @param targets Node names; their updates are merged in this order
     * @param <S> State type
     * @return The command
     */
    public static <S> Command<S> send(List<String> targets) {
        if (targets == null || targets.isEmpty()) {
            throw new IllegalArgumentException("Send requires at least one target");
        }
        for (String target : targets) {
            if (target == null || target.isEmpty()) {
                throw new IllegalArgumentException("Send targets cannot be null or empty");
            }
        }
        return new Command<>(Kind.SEND, null, null, List.copyOf(targets), null);
    }

    public static <S> Command<S> interrupt(Object payload) {
        return interrupt(payload, null);
    }

    /**
     * Pause the run after merging an update.
     *
     * @param payload Value handed back to the caller with the interrupted result
     * @param update Update to merge before pausing, may be null
     * @param <S> State type
     * @return The command
     */
    public static <S> Command<S> interrupt(Object payload, S update) {
        return new Command<>(Kind.INTERRUPT, update, null, Collections.emptyList(), payload);
    }

    /**
     * Copy this command with a different update.
     *
     * @param update Replacement update, may be null
     * @return A command of the same kind and targets
     */
    public Command<S> withUpdate(S update) {
        return new Command<>(kind, update, target, targets, payload);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Get the jump target of a goto or end command.
     *
     * @return Target node name, or null for other kinds
     */
    public String getTarget() {
        return target;
    }

    public List<String> getTargets() {
        return targets;
    }

    public Object getPayload() {
        return payload;
    }

    @Override
    public boolean isCommand() {
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Command<?> command = (Command<?>) o;
        return kind == command.kind
                && Objects.equals(getUpdate(), command.getUpdate())
                && Objects.equals(target, command.target)
                && Objects.equals(targets, command.targets)
                && Objects.equals(payload, command.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, getUpdate(), target, targets, payload);
    }

    @Override
    public String toString() {
        return "Command{" +
                "kind=" + kind +
                ", target='" + target + '\'' +
                ", targets=" + targets +
                ", update=" + getUpdate() +
                ", payload=" + payload +
                '}';
    }
}
