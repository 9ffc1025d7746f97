package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared session behaviour for all backends.
 *
 * <p>Owns the lifecycle state, the working area, the exchange files and
 * produced-file capture. Each {@link #execute} runs in a fresh
 * {@code run-<n>} directory under the working area which is deleted once its
 * produced files have been read. Subclasses supply the backend resource
 * ({@link #doSetup()}, {@link #doCleanup()}), package installation
 * ({@link #doInstall(List)}) and the actual run ({@link #run(RunContext)}).
 */
public abstract class AbstractSandbox implements Sandbox {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    static final int MAX_ERROR_CHARS = 2_000;

    private final String sessionId;
    private final IsolationBackend backend;
    private final SessionConfig config;
    private final Path workRoot;
    protected final ObjectMapper objectMapper;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.UNINITIALIZED);
    private final AtomicBoolean setupStarted = new AtomicBoolean();
    private final AtomicInteger runCounter = new AtomicInteger();
    private final ConcurrentHashMap<String, CompletableFuture<Boolean>> installs = new ConcurrentHashMap<>();
    private volatile Path workDir;

    protected AbstractSandbox(String sessionId, IsolationBackend backend, SessionConfig config,
                              Path workRoot, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.backend = backend;
        this.config = config;
        this.workRoot = workRoot;
        this.objectMapper = objectMapper;
    }

    /**
     * What a backend reports for one run.
     *
     * @param exitCode  exit status, ignored when timed out or cancelled
     * @param timedOut  the work was killed after its timeout
     * @param cancelled the calling thread was interrupted and the work was killed
     */
    protected record RunOutcome(int exitCode, String stdout, String stderr, boolean timedOut, boolean cancelled) {

        public static RunOutcome exited(int exitCode, String stdout, String stderr) {
            return new RunOutcome(exitCode, stdout, stderr, false, false);
        }

        public static RunOutcome timedOut(String stdout, String stderr) {
            return new RunOutcome(-1, stdout, stderr, true, false);
        }

        public static RunOutcome cancelled(String stdout, String stderr) {
            return new RunOutcome(-1, stdout, stderr, false, true);
        }
    }

    /**
     * Everything a backend needs to run one request.
     *
     * @param runDir      host directory of this run, also the working directory of the code
     * @param environment ABI variables plus the request's overrides
     */
    protected record RunContext(ExecutionRequest request, Path runDir, Duration timeout,
                                Map<String, String> environment) {}

    /**
     * Outcome of installing a batch of packages.
     */
    protected record InstallOutcome(boolean success, String output) {}

    // ── Lifecycle ───────────────────────────────────────────────────────

    @Override
    public String sessionId() { return sessionId; }

    @Override
    public IsolationBackend backend() { return backend; }

    @Override
    public SessionConfig config() { return config; }

    @Override
    public SessionState state() { return state.get(); }

    @Override
    public Path workDir() { return workDir; }

    @Override
    public final void setup() {
        if (!setupStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("Session '" + sessionId + "' has already been set up");
        }
        try {
            Files.createDirectories(workRoot);
            workDir = Files.createTempDirectory(workRoot, "cape-" + backend.configName() + "-" + safeName(sessionId) + "-");
            doSetup();
            state.set(SessionState.READY);
            log.info("Sandbox session '{}' ready ({}, workDir={})", sessionId, backend.configName(), workDir);
        } catch (Exception e) {
            state.set(SessionState.TORN_DOWN);
            try {
                doCleanup();
            } catch (RuntimeException cleanupError) {
                e.addSuppressed(cleanupError);
            }
            WorkspaceFiles.deleteQuietly(workDir);
            if (e instanceof SandboxSetupException setupException) {
                throw setupException;
            }
            throw new SandboxSetupException("Could not set up " + backend.configName()
                    + " session '" + sessionId + "': " + e.getMessage(), e);
        }
    }

    @Override
    public final void cleanup() {
        SessionState previous = state.getAndSet(SessionState.TORN_DOWN);
        if (previous == SessionState.TORN_DOWN || previous == SessionState.UNINITIALIZED) {
            return;
        }
        try {
            doCleanup();
        } catch (RuntimeException e) {
            log.warn("Cleanup of session '{}' failed: {}", sessionId, e.getMessage());
        }
        WorkspaceFiles.deleteQuietly(workDir);
        log.info("Sandbox session '{}' torn down", sessionId);
    }

    // ── Dependencies ────────────────────────────────────────────────────

    @Override
    public DependencyInstallResult installDependencies(List<String> packages) {
        SessionState current = state.get();
        if (current == SessionState.UNINITIALIZED || current == SessionState.TORN_DOWN) {
            throw new SessionClosedException(sessionId, current);
        }
        var claimed = new LinkedHashMap<String, CompletableFuture<Boolean>>();
        var pending = new LinkedHashMap<String, CompletableFuture<Boolean>>();
        for (String pkg : new LinkedHashSet<>(packages)) {
            if (pkg == null || pkg.isBlank()) {
                continue;
            }
            var attempt = new CompletableFuture<Boolean>();
            CompletableFuture<Boolean> existing = installs.putIfAbsent(pkg, attempt);
            if (existing == null) {
                claimed.put(pkg, attempt);
            } else {
                pending.put(pkg, existing);
            }
        }

        var installed = new ArrayList<String>();
        var skipped = new ArrayList<String>();
        var failed = new ArrayList<String>();
        String message = "";

        if (!claimed.isEmpty()) {
            List<String> batch = List.copyOf(claimed.keySet());
            InstallOutcome outcome = null;
            try {
                outcome = doInstall(batch);
            } catch (RuntimeException e) {
                outcome = new InstallOutcome(false, e.getMessage());
            } finally {
                if (outcome == null) {
                    // doInstall threw an Error: release the claims so a later call can retry
                    claimed.forEach(installs::remove);
                }
                boolean success = outcome != null && outcome.success();
                claimed.values().forEach(attempt -> attempt.complete(success));
            }
            if (outcome.success()) {
                installed.addAll(batch);
                log.info("Installed {} in session '{}'", batch, sessionId);
            } else {
                failed.addAll(batch);
                message = truncate(outcome.output(), MAX_ERROR_CHARS);
                log.warn("Dependency install of {} failed in session '{}': {}", batch, sessionId, message);
            }
        }

        for (var entry : pending.entrySet()) {
            if (awaitInstall(entry.getKey(), entry.getValue())) {
                skipped.add(entry.getKey());
            } else {
                failed.add(entry.getKey());
            }
        }
        return new DependencyInstallResult(installed, skipped, failed, message);
    }

    @Override
    public Set<String> installedPackages() {
        var result = new LinkedHashSet<String>();
        installs.forEach((pkg, attempt) -> {
            if (attempt.isDone() && Boolean.TRUE.equals(attempt.getNow(false))) {
                result.add(pkg);
            }
        });
        return result;
    }

    /**
     * Waits for another caller's install of {@code pkg}. An interrupted waiter
     * is cancelled; the install it waited on carries on.
     */
    private boolean awaitInstall(String pkg, CompletableFuture<Boolean> attempt) {
        try {
            return attempt.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapeException(ErrorKind.CANCELLED,
                    "Interrupted while waiting for the install of " + pkg + " in session '" + sessionId + "'");
        } catch (ExecutionException e) {
            return false;
        }
    }

    // ── Execution ───────────────────────────────────────────────────────

    @Override
    public final ExecutionResponse execute(ExecutionRequest request) {
        if (!state.compareAndSet(SessionState.READY, SessionState.BUSY)) {
            SessionState current = state.get();
            if (current == SessionState.BUSY) {
                throw new SessionBusyException(sessionId);
            }
            throw new SessionClosedException(sessionId, current);
        }
        long startedAt = System.nanoTime();
        Path runDir = null;
        try {
            runDir = Files.createDirectory(workDir.resolve("run-" + runCounter.incrementAndGet()));
            WorkspaceFiles.writeInputFiles(runDir, request.files());
            ExchangeFiles.writeArgs(objectMapper, runDir, request.args());
            var before = WorkspaceFiles.snapshot(runDir);

            Duration timeout = request.timeout() != null ? request.timeout() : config.timeout();
            RunOutcome outcome = run(new RunContext(request, runDir, timeout, environment(request, runDir)));
            long elapsedMs = elapsedSince(startedAt);

            if (outcome.cancelled()) {
                return ExecutionResponse.failure(ErrorKind.CANCELLED, "Execution cancelled by caller",
                        outcome.stdout(), outcome.stderr(), null, elapsedMs, Map.of());
            }
            if (outcome.timedOut()) {
                return ExecutionResponse.failure(ErrorKind.TIMEOUT,
                        "Execution exceeded timeout of " + timeout.toSeconds() + "s",
                        outcome.stdout(), outcome.stderr(), null, elapsedMs, Map.of());
            }

            Map<String, byte[]> produced = WorkspaceFiles.collectProduced(runDir, before, request.files().keySet());
            if (outcome.exitCode() != 0) {
                String reason = ExchangeFiles.readError(objectMapper, runDir)
                        .orElseGet(() -> lastLines(outcome.stderr()));
                return ExecutionResponse.failure(ErrorKind.NON_ZERO_EXIT,
                        "Exited with code " + outcome.exitCode() + (reason.isBlank() ? "" : ": " + reason),
                        outcome.stdout(), outcome.stderr(), outcome.exitCode(), elapsedMs, produced);
            }
            Object output = ExchangeFiles.readResult(objectMapper, runDir).orElse(null);
            return new ExecutionResponse(true, output, outcome.stdout(), outcome.stderr(), 0,
                    elapsedMs, produced, null);
        } catch (CapeException e) {
            return ExecutionResponse.failure(e.getKind(), e.getDetail(), elapsedSince(startedAt));
        } catch (IOException e) {
            return ExecutionResponse.failure(ErrorKind.EXECUTION_FAILED,
                    "Could not exchange files with the " + backend.configName() + " sandbox: " + e.getMessage(),
                    elapsedSince(startedAt));
        } finally {
            if (runDir != null) {
                WorkspaceFiles.deleteQuietly(runDir);
            }
            state.compareAndSet(SessionState.BUSY, SessionState.READY);
        }
    }

    private Map<String, String> environment(ExecutionRequest request, Path runDir) {
        var env = new LinkedHashMap<String, String>(request.env());
        env.putAll(ExchangeFiles.argumentEnvironment(request.args()));
        env.put(ExchangeFiles.ENV_ABI_VERSION, String.valueOf(ExchangeFiles.ABI_VERSION));
        env.put(ExchangeFiles.ENV_ARGS_FILE, visiblePath(runDir.resolve(ExchangeFiles.ARGS_FILE)));
        env.put(ExchangeFiles.ENV_RESULT_FILE, visiblePath(runDir.resolve(ExchangeFiles.RESULT_FILE)));
        env.put(ExchangeFiles.ENV_DEPS_DIR, visiblePath(workDir.resolve(ExchangeFiles.DEPS_DIR)));
        env.put(ExchangeFiles.ENV_SESSION_ID, sessionId);
        return env;
    }

    /**
     * Writes the request's source and runner into the run directory.
     *
     * @return the runner file to hand to the interpreter
     */
    protected Path writeRunner(RunContext context) throws IOException {
        ExecutionRequest request = context.request();
        String source;
        if (request.script() != null) {
            if (!Files.isRegularFile(request.script())) {
                throw new CapeException(ErrorKind.EXECUTION_FAILED, "Script not found: " + request.script());
            }
            source = Files.readString(request.script(), StandardCharsets.UTF_8);
        } else if (request.code() != null) {
            source = request.code();
        } else {
            throw new CapeException(ErrorKind.EXECUTION_FAILED,
                    "The " + backend.configName() + " backend needs a script or inline code");
        }
        try {
            return request.language().writeRunner(context.runDir(), source, request.function());
        } catch (IllegalArgumentException e) {
            throw new CapeException(ErrorKind.EXECUTION_FAILED, e.getMessage(), e);
        }
    }

    /**
     * Path of a host file as seen by the executed code.
     */
    protected String visiblePath(Path hostPath) {
        return hostPath.toAbsolutePath().toString();
    }

    // ── Backend hooks ───────────────────────────────────────────────────

    protected abstract void doSetup() throws Exception;

    protected abstract InstallOutcome doInstall(List<String> packages);

    protected abstract RunOutcome run(RunContext context) throws IOException;

    /**
     * Releases the backend resource. Called at most once, possibly while a run is in flight.
     */
    protected abstract void doCleanup();

    // ── Helpers ─────────────────────────────────────────────────────────

    private static long elapsedSince(long startedAt) {
        return Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
    }

    static String safeName(String sessionId) {
        String name = sessionId.replaceAll("[^A-Za-z0-9_.-]", "_");
        return name.length() > 40 ? name.substring(0, 40) : name;
    }

    /**
     * Keeps the head and tail of long text so both the start of a failure and
     * its final error survive.
     */
    static String truncate(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text == null ? "" : text;
        }
        int half = maxChars / 2;
        return text.substring(0, half)
                + "\n\n... [truncated " + (text.length() - maxChars) + " chars] ...\n\n"
                + text.substring(text.length() - half);
    }

    private static String lastLines(String stderr) {
        String trimmed = stderr.strip();
        if (trimmed.length() <= MAX_ERROR_CHARS) {
            return trimmed;
        }
        return trimmed.substring(trimmed.length() - MAX_ERROR_CHARS);
    }
}
