package com.cape.sandbox;

/**
 * Creates backend instances for {@link SandboxManager}. The returned sandbox
 * must not be set up yet.
 */
@FunctionalInterface
public interface SandboxFactory {

    Sandbox create(String sessionId, IsolationBackend backend, SessionConfig config);
}
