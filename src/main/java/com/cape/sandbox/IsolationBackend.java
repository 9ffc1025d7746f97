package com.cape.sandbox;

import java.util.Locale;

/**
 * Isolation strategies a sandbox session can run under.
 */
public enum IsolationBackend {
    /** Runs registered JVM functions on a worker thread. Trusted development use only. */
    IN_PROCESS("in-process"),
    /** A fresh OS process per execution. Enforces the wall-clock timeout only. */
    PROCESS("process"),
    /** A warm container per session with memory, CPU and network limits. */
    DOCKER("docker");

    private final String configName;

    IsolationBackend(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Resolves a backend name as written in descriptors and configuration.
     *
     * @throws UnsupportedIsolationException for unknown names
     */
    public static IsolationBackend fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedIsolationException(String.valueOf(name));
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "in-process", "inprocess", "in_process", "none" -> IN_PROCESS;
            case "process", "subprocess" -> PROCESS;
            case "docker", "container" -> DOCKER;
            default -> throw new UnsupportedIsolationException(name);
        };
    }
}
