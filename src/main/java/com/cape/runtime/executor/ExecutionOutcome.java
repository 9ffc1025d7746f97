package com.cape.runtime.executor;

import com.cape.core.error.ErrorKind;
import com.cape.core.model.CapabilityError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an executor reports back to the runtime, before timing and trace
 * information are attached.
 *
 * @param success       whether the work succeeded
 * @param output        structured output
 * @param error         present iff {@code success} is false
 * @param producedFiles files created by the work
 * @param failedStep    workflow step or hybrid phase that failed
 * @param metadata      executor-specific detail
 */
public record ExecutionOutcome(
    boolean success,
    Object output,
    CapabilityError error,
    Map<String, byte[]> producedFiles,
    String failedStep,
    Map<String, Object> metadata
) {

    public ExecutionOutcome {
        producedFiles = producedFiles == null ? Map.of() : Map.copyOf(producedFiles);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static ExecutionOutcome success(Object output) {
        return new ExecutionOutcome(true, output, null, Map.of(), null, Map.of());
    }

    public static ExecutionOutcome success(Object output, Map<String, byte[]> producedFiles,
                                           Map<String, Object> metadata) {
        return new ExecutionOutcome(true, output, null, producedFiles, null, metadata);
    }

    public static ExecutionOutcome failure(ErrorKind kind, String message) {
        return new ExecutionOutcome(false, null, new CapabilityError(kind, message), Map.of(), null, Map.of());
    }

    public static ExecutionOutcome failure(CapabilityError error) {
        return new ExecutionOutcome(false, null, error, Map.of(), null, Map.of());
    }

    public static ExecutionOutcome failure(CapabilityError error, Map<String, byte[]> producedFiles,
                                           Map<String, Object> metadata) {
        return new ExecutionOutcome(false, null, error, producedFiles, null, metadata);
    }

    public ExecutionOutcome withFailedStep(String step) {
        return new ExecutionOutcome(success, output, error, producedFiles, step, metadata);
    }
}
