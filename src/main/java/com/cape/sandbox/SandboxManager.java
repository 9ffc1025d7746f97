package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.metrics.CapeMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Owns the table of live sandbox sessions.
 *
 * <p>Sessions are created lazily on the first {@link #getOrCreate} for an id
 * and live until {@link #release} is called; nothing is collected
 * automatically. The table maps each id to the future of its setup, so
 * concurrent first callers for the same id share one {@link Sandbox#setup()}
 * and a failed setup leaves no entry behind.
 */
@Service
public class SandboxManager {

    private static final Logger log = LoggerFactory.getLogger(SandboxManager.class);

    private final SandboxFactory factory;
    private final SandboxProperties properties;
    private final CapeMetrics metrics;
    private final ConcurrentHashMap<String, CompletableFuture<Sandbox>> sessions = new ConcurrentHashMap<>();

    public SandboxManager(SandboxFactory factory, SandboxProperties properties,
                          @Autowired(required = false) CapeMetrics metrics) {
        this.factory = factory;
        this.properties = properties;
        this.metrics = metrics;
        if (IsolationBackend.fromName(properties.getDefaultBackend()) == IsolationBackend.IN_PROCESS) {
            throw new IllegalStateException("cape.sandbox.default-backend must not be in-process; "
                    + "choose 'docker' or 'process'");
        }
    }

    /**
     * Name of the backend used when a capability does not request one.
     */
    public String defaultBackend() {
        return properties.getDefaultBackend();
    }

    /**
     * Returns the session for {@code sessionId}, creating and setting it up on
     * first use. An existing session is returned unchanged, whatever {@code config} says.
     *
     * @throws UnsupportedIsolationException when the backend is unknown or refused, before anything is allocated
     * @throws SandboxSetupException         when setup fails
     */
    public Sandbox getOrCreate(String sessionId, SessionConfig config) {
        CompletableFuture<Sandbox> existing = sessions.get(sessionId);
        if (existing != null) {
            return await(sessionId, existing);
        }
        IsolationBackend backend = resolveBackend(config);

        var created = new CompletableFuture<Sandbox>();
        existing = sessions.putIfAbsent(sessionId, created);
        if (existing != null) {
            return await(sessionId, existing);
        }
        try {
            Sandbox sandbox = factory.create(sessionId, backend, config);
            sandbox.setup();
            created.complete(sandbox);
            record(backend, "created");
            log.info("Created {} session '{}'", backend.configName(), sessionId);
            return sandbox;
        } catch (RuntimeException e) {
            sessions.remove(sessionId, created);
            created.completeExceptionally(e);
            record(backend, "setup_failed");
            if (e instanceof CapeException capeException) {
                throw capeException;
            }
            throw new SandboxSetupException("Could not create session '" + sessionId + "': " + e.getMessage(), e);
        }
    }

    private IsolationBackend resolveBackend(SessionConfig config) {
        String name = config.backend() != null ? config.backend() : properties.getDefaultBackend();
        IsolationBackend backend = IsolationBackend.fromName(name);
        if (backend == IsolationBackend.IN_PROCESS && config.riskLevel().exceeds(properties.getInProcessMaxRisk())) {
            throw new UnsupportedIsolationException(name, "risk level " + config.riskLevel()
                    + " exceeds the in-process limit " + properties.getInProcessMaxRisk());
        }
        return backend;
    }

    private Sandbox await(String sessionId, CompletableFuture<Sandbox> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapeException(ErrorKind.CANCELLED, "Interrupted while waiting for session '" + sessionId + "'");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CapeException capeException) {
                throw capeException;
            }
            throw new SandboxSetupException("Session '" + sessionId + "' failed to set up", e.getCause());
        }
    }

    public Optional<Sandbox> find(String sessionId) {
        CompletableFuture<Sandbox> future = sessions.get(sessionId);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    /**
     * Tears down a session. Unknown ids and repeated calls are no-ops.
     */
    public void release(String sessionId) {
        CompletableFuture<Sandbox> future = sessions.remove(sessionId);
        if (future == null) {
            log.debug("Release of unknown session '{}' ignored", sessionId);
            return;
        }
        try {
            Sandbox sandbox = future.get();
            sandbox.cleanup();
            record(sandbox.backend(), "released");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.thenAccept(Sandbox::cleanup);
        } catch (ExecutionException e) {
            log.debug("Session '{}' never finished setup, nothing to release", sessionId);
        }
    }

    @PreDestroy
    public void releaseAll() {
        var ids = new ArrayList<>(sessions.keySet());
        if (!ids.isEmpty()) {
            log.info("Releasing {} sandbox session(s)", ids.size());
        }
        for (String id : ids) {
            try {
                release(id);
            } catch (RuntimeException e) {
                log.warn("Failed to release session '{}': {}", id, e.getMessage());
            }
        }
    }

    /**
     * Sessions whose setup has completed.
     */
    public List<Sandbox> sessions() {
        var live = new ArrayList<Sandbox>();
        sessions.values().forEach(f -> {
            if (f.isDone() && !f.isCompletedExceptionally()) {
                live.add(f.join());
            }
        });
        return live;
    }

    public int sessionCount() {
        return sessions.size();
    }

    private void record(IsolationBackend backend, String event) {
        if (metrics != null) {
            metrics.recordSandboxSession(backend.configName(), event);
        }
    }
}
