package com.cape.core.model;

import com.cape.core.error.ErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Uniform result of executing a capability, whatever executor or backend ran it.
 *
 * @param capabilityId  executed capability
 * @param success       whether the work completed successfully
 * @param output        structured output (parsed result file, model content, tool return value)
 * @param error         present iff {@code success} is false
 * @param elapsedMs     wall-clock time measured by the runtime
 * @param producedFiles files created by the work, name to raw bytes
 * @param traceId       correlation id of the call
 * @param stepsExecuted capability ids executed, in order; nested workflow steps included
 * @param failedStep    id of the workflow step that failed, if any
 * @param tokensUsed    model tokens consumed
 * @param metadata      backend detail such as stdout, stderr and exit code
 */
public record CapabilityResult(
    String capabilityId,
    boolean success,
    Object output,
    CapabilityError error,
    long elapsedMs,
    Map<String, byte[]> producedFiles,
    String traceId,
    List<String> stepsExecuted,
    String failedStep,
    long tokensUsed,
    Map<String, Object> metadata
) {

    public CapabilityResult {
        if (success && error != null) {
            throw new IllegalArgumentException("A successful result cannot carry an error");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("A failed result must carry an error");
        }
        producedFiles = producedFiles == null ? Map.of() : Map.copyOf(producedFiles);
        stepsExecuted = stepsExecuted == null ? List.of() : List.copyOf(stepsExecuted);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Failure produced before any executor ran (unknown id, invalid inputs).
     */
    public static CapabilityResult rejected(String capabilityId, ErrorKind kind, String message,
                                            long elapsedMs, String traceId) {
        return new CapabilityResult(capabilityId, false, null, new CapabilityError(kind, message),
                elapsedMs, Map.of(), traceId, List.of(), null, 0, Map.of());
    }

    public ErrorKind errorKind() {
        return error != null ? error.kind() : null;
    }
}
