package com.cape.sandbox;

import com.cape.core.error.ErrorKind;
import com.cape.core.model.CapabilityError;

import java.util.Map;

/**
 * What a sandbox reports for one execution.
 *
 * @param success       true when the work exited cleanly within its timeout
 * @param output        parsed result file, or null when the code wrote none
 * @param stdout        captured standard output
 * @param stderr        captured standard error
 * @param exitCode      process or exec exit status, null when the work never exited on its own
 * @param elapsedMs     wall-clock time spent in the backend
 * @param producedFiles new or modified files, relative name to content
 * @param error         present iff {@code success} is false
 */
public record ExecutionResponse(
    boolean success,
    Object output,
    String stdout,
    String stderr,
    Integer exitCode,
    long elapsedMs,
    Map<String, byte[]> producedFiles,
    CapabilityError error
) {

    public ExecutionResponse {
        if (success == (error != null)) {
            throw new IllegalArgumentException("error must be present iff success is false");
        }
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        producedFiles = producedFiles == null ? Map.of() : Map.copyOf(producedFiles);
    }

    public static ExecutionResponse failure(ErrorKind kind, String message, String stdout, String stderr,
                                            Integer exitCode, long elapsedMs,
                                            Map<String, byte[]> producedFiles) {
        return new ExecutionResponse(false, null, stdout, stderr, exitCode, elapsedMs, producedFiles,
                new CapabilityError(kind, message));
    }

    public static ExecutionResponse failure(ErrorKind kind, String message, long elapsedMs) {
        return failure(kind, message, "", "", null, elapsedMs, Map.of());
    }
}
