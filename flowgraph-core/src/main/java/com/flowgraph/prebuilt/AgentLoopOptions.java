package com.flowgraph.prebuilt;

import com.flowgraph.checkpoint.base.BaseCheckpointSaver;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Options for {@link AgentLoop}.
 */
public final class AgentLoopOptions {
    private static final AgentLoopOptions DEFAULTS = builder().build();

    private final BaseCheckpointSaver checkpointer;
    private final Set<String> interruptBefore;
    private final Set<String> interruptAfter;
    private final String systemPrompt;

    private AgentLoopOptions(Builder builder) {
        this.checkpointer = builder.checkpointer;
        this.interruptBefore = Collections.unmodifiableSet(new LinkedHashSet<>(builder.interruptBefore));
        this.interruptAfter = Collections.unmodifiableSet(new LinkedHashSet<>(builder.interruptAfter));
        this.systemPrompt = builder.systemPrompt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AgentLoopOptions defaults() {
        return DEFAULTS;
    }

    public BaseCheckpointSaver getCheckpointer() {
        return checkpointer;
    }

    public Set<String> getInterruptBefore() {
        return interruptBefore;
    }

    public Set<String> getInterruptAfter() {
        return interruptAfter;
    }

    /**
     * Get the system prompt shown to the decide node.
     *
     * @return The prompt, or null
     */
    public String getSystemPrompt() {
        return systemPrompt;
    }

    public static final class Builder {
        private BaseCheckpointSaver checkpointer;
        private final Set<String> interruptBefore = new LinkedHashSet<>();
        private final Set<String> interruptAfter = new LinkedHashSet<>();
        private String systemPrompt;

        private Builder() {
        }

        public Builder checkpointer(BaseCheckpointSaver checkpointer) {
            this.checkpointer = checkpointer;
            return this;
        }

        public Builder interruptBefore(String... nodes) {
            interruptBefore.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder interruptAfter(String... nodes) {
            interruptAfter.addAll(Arrays.asList(nodes));
            return this;
        }

        public Builder systemPrompt(String systemPrompt) {
            this.systemPrompt = systemPrompt;
            return this;
        }

        public AgentLoopOptions build() {
            return new AgentLoopOptions(this);
        }
    }
}
