package com.cape.sandbox;

import com.cape.core.error.CapeException;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * An isolated execution session. Implementations are created and owned by
 * {@link SandboxManager}; callers obtain them through
 * {@link SandboxManager#getOrCreate(String, SessionConfig)} and never call
 * {@link #setup()} or {@link #cleanup()} themselves.
 */
public interface Sandbox {

    String sessionId();

    IsolationBackend backend();

    SessionConfig config();

    SessionState state();

    /**
     * Private working area of the session, null before setup.
     */
    Path workDir();

    /**
     * Allocates the working area and the backend resource. Runs once per session.
     *
     * @throws SandboxSetupException when allocation fails
     */
    void setup();

    /**
     * Installs the packages not yet in the session's installed set. Each
     * package is attempted at most once per session, even under concurrent callers.
     *
     * @throws CapeException {@code CANCELLED} when interrupted while waiting on
     *                       another caller's install of the same package
     */
    DependencyInstallResult installDependencies(List<String> packages);

    Set<String> installedPackages();

    /**
     * Runs one request under its timeout.
     *
     * @throws SessionBusyException   when another execution is in flight
     * @throws SessionClosedException when the session is not ready
     */
    ExecutionResponse execute(ExecutionRequest request);

    /**
     * Releases the working area and the backend resource. Idempotent.
     */
    void cleanup();
}
