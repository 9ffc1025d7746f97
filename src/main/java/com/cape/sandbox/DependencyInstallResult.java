package com.cape.sandbox;

import java.util.List;

/**
 * Outcome of {@link Sandbox#installDependencies(List)}. Failures are soft:
 * execution is still attempted.
 *
 * @param installed packages installed by this call
 * @param skipped   packages already installed, or installed concurrently by another caller
 * @param failed    packages whose installation failed in this session
 * @param message   installer output for failures, empty otherwise
 */
public record DependencyInstallResult(
    List<String> installed,
    List<String> skipped,
    List<String> failed,
    String message
) {

    public DependencyInstallResult {
        installed = List.copyOf(installed);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
        message = message == null ? "" : message;
    }

    public static DependencyInstallResult none() {
        return new DependencyInstallResult(List.of(), List.of(), List.of(), "");
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
