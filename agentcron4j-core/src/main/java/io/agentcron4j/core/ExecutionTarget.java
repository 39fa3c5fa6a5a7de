package io.agentcron4j.core;

import java.util.Locale;
import java.util.Objects;

/**
 * What a job runs: a single agent or a team of agents, identified by name.
 */
public record ExecutionTarget(Kind kind, String name) {

    public enum Kind {
        AGENT,
        TEAM
    }

    public ExecutionTarget {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(name, "target name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("target name must not be blank");
        }
    }

    public static ExecutionTarget agent(String name) {
        return new ExecutionTarget(Kind.AGENT, name);
    }

    public static ExecutionTarget team(String name) {
        return new ExecutionTarget(Kind.TEAM, name);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + name;
    }
}
