package com.cape.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One step of a WORKFLOW capability.
 *
 * @param id           step identifier, reported when the step fails
 * @param capabilityId capability executed by this step
 * @param inputs       extra inputs for the step; a string value {@code "$name"} refers to
 *                     an entry of the workflow state
 */
public record WorkflowStep(String id, String capabilityId, Map<String, Object> inputs) {

    public WorkflowStep {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Workflow step id is required");
        }
        if (capabilityId == null || capabilityId.isBlank()) {
            throw new IllegalArgumentException("Workflow step '" + id + "' has no capability");
        }
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public static WorkflowStep of(String id, String capabilityId) {
        return new WorkflowStep(id, capabilityId, Map.of());
    }
}
