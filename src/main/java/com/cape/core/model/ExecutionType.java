package com.cape.core.model;

import java.util.Locale;

/**
 * How a capability is executed. Exactly one executor exists per value.
 */
public enum ExecutionType {
    TOOL,
    GENERATIVE,
    CODE,
    WORKFLOW,
    HYBRID;

    public static ExecutionType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Execution type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "tool" -> TOOL;
            case "generative", "llm" -> GENERATIVE;
            case "code" -> CODE;
            case "workflow" -> WORKFLOW;
            case "hybrid" -> HYBRID;
            default -> throw new IllegalArgumentException("Unknown execution type: " + value);
        };
    }
}
