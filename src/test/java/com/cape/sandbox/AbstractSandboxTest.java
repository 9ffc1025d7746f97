package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class AbstractSandboxTest {

    @TempDir
    Path workRoot;

    private FakeSandbox sandbox;

    @BeforeEach
    void setUp() {
        sandbox = new FakeSandbox("unit", SessionConfig.of("process"), workRoot);
    }

    // ── Lifecycle ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Lifecycle moves from UNINITIALIZED to READY to TORN_DOWN")
    void lifecycle() {
        assertEquals(SessionState.UNINITIALIZED, sandbox.state());

        sandbox.setup();
        assertEquals(SessionState.READY, sandbox.state());
        assertTrue(Files.isDirectory(sandbox.workDir()));

        sandbox.cleanup();
        assertEquals(SessionState.TORN_DOWN, sandbox.state());
        assertFalse(Files.exists(sandbox.workDir()));
    }

    @Test
    @DisplayName("setup runs once")
    void setupOnlyOnce() {
        sandbox.setup();

        assertThrows(IllegalStateException.class, sandbox::setup);
        assertEquals(1, sandbox.setups.get());
    }

    @Test
    @DisplayName("Execute before setup or after cleanup is SESSION_CLOSED")
    void executeOnClosedSession() {
        var request = ExecutionRequest.code(ScriptLanguage.SHELL, "true");
        assertThrows(SessionClosedException.class, () -> sandbox.execute(request));

        sandbox.setup();
        sandbox.cleanup();
        var e = assertThrows(SessionClosedException.class, () -> sandbox.execute(request));
        assertEquals(ErrorKind.SESSION_CLOSED, e.getKind());
    }

    // ── Dependencies ────────────────────────────────────────────────────

    @Test
    @DisplayName("A package is installed at most once under concurrent first callers")
    void installAtMostOnce() throws Exception {
        sandbox.setup();
        sandbox.installDelayMs = 100;
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        var start = new CountDownLatch(1);
        try {
            var futures = new ArrayList<Future<DependencyInstallResult>>();
            for (int i = 0; i < callers; i++) {
                futures.add(pool.submit((Callable<DependencyInstallResult>) () -> {
                    start.await();
                    return sandbox.installDependencies(List.of("pandas"));
                }));
            }
            start.countDown();
            int installed = 0;
            for (Future<DependencyInstallResult> future : futures) {
                DependencyInstallResult result = future.get(5, TimeUnit.SECONDS);
                assertFalse(result.hasFailures());
                installed += result.installed().size();
            }
            assertEquals(1, installed);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, sandbox.installCount());
        assertEquals(java.util.Set.of("pandas"), sandbox.installedPackages());
    }

    @Test
    @DisplayName("Already installed packages are skipped")
    void installedPackagesSkipped() {
        sandbox.setup();
        sandbox.installDependencies(List.of("requests"));

        DependencyInstallResult second = sandbox.installDependencies(List.of("requests", "pyyaml"));

        assertEquals(List.of("pyyaml"), second.installed());
        assertEquals(List.of("requests"), second.skipped());
        assertEquals(List.of(List.of("requests"), List.of("pyyaml")), sandbox.installBatches);
    }

    @Test
    @DisplayName("A failed install is soft and not retried")
    void failedInstallNotRetried() {
        sandbox.setup();
        sandbox.failInstall = true;

        DependencyInstallResult first = sandbox.installDependencies(List.of("not-a-package"));
        DependencyInstallResult second = sandbox.installDependencies(List.of("not-a-package"));

        assertEquals(List.of("not-a-package"), first.failed());
        assertTrue(first.message().contains("No matching distribution"));
        assertEquals(List.of("not-a-package"), second.failed());
        assertEquals(1, sandbox.installCount());
        assertTrue(sandbox.installedPackages().isEmpty());
    }

    @Test
    @DisplayName("An Error thrown by the installer releases waiters and lets a later call retry")
    void installErrorReleasesWaiters() throws Exception {
        sandbox.setup();
        sandbox.installEntered = new CountDownLatch(1);
        sandbox.installGate = new CountDownLatch(1);
        sandbox.installError.set(new Error("installer crashed"));
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<DependencyInstallResult> owner = pool.submit(() -> sandbox.installDependencies(List.of("pandas")));
            assertTrue(sandbox.installEntered.await(5, TimeUnit.SECONDS));
            Future<DependencyInstallResult> waiter = pool.submit(() -> sandbox.installDependencies(List.of("pandas")));
            Thread.sleep(100);
            sandbox.installGate.countDown();

            var ownerFailure = assertThrows(java.util.concurrent.ExecutionException.class,
                    () -> owner.get(5, TimeUnit.SECONDS));
            assertEquals("installer crashed", ownerFailure.getCause().getMessage());
            // Either woken with a failure or, arriving late, installed it itself
            DependencyInstallResult waited = waiter.get(5, TimeUnit.SECONDS);
            assertEquals(List.of("pandas"), waited.hasFailures() ? waited.failed() : waited.installed());
        } finally {
            pool.shutdownNow();
        }

        DependencyInstallResult retried = sandbox.installDependencies(List.of("pandas"));
        assertFalse(retried.hasFailures());
        assertEquals(java.util.Set.of("pandas"), sandbox.installedPackages());
    }

    @Test
    @DisplayName("An interrupted install waiter is CANCELLED while the install carries on")
    void interruptedInstallWaiter() throws Exception {
        sandbox.setup();
        sandbox.installEntered = new CountDownLatch(1);
        sandbox.installGate = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<DependencyInstallResult> owner = pool.submit(() -> sandbox.installDependencies(List.of("pandas")));
            assertTrue(sandbox.installEntered.await(5, TimeUnit.SECONDS));

            var failure = new AtomicReference<CapeException>();
            var interruptKept = new java.util.concurrent.atomic.AtomicBoolean();
            Thread waiter = new Thread(() -> {
                Thread.currentThread().interrupt();
                try {
                    sandbox.installDependencies(List.of("pandas"));
                } catch (CapeException e) {
                    failure.set(e);
                }
                interruptKept.set(Thread.currentThread().isInterrupted());
            });
            waiter.start();
            waiter.join(5_000);

            assertNotNull(failure.get());
            assertEquals(ErrorKind.CANCELLED, failure.get().getKind());
            assertTrue(failure.get().getDetail().contains("pandas"));
            assertTrue(interruptKept.get());

            sandbox.installGate.countDown();
            assertEquals(List.of("pandas"), owner.get(5, TimeUnit.SECONDS).installed());
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, sandbox.installCount());
        assertEquals(java.util.Set.of("pandas"), sandbox.installedPackages());
    }

    // ── Execution ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Run directory holds the args file and is removed afterwards")
    void runDirectoryLifecycle() {
        sandbox.setup();
        var seen = new AtomicReference<AbstractSandbox.RunContext>();
        sandbox.runner = context -> {
            seen.set(context);
            assertTrue(Files.isRegularFile(context.runDir().resolve(ExchangeFiles.ARGS_FILE)));
            return AbstractSandbox.RunOutcome.exited(0, "ok", "");
        };

        ExecutionResponse response = sandbox.execute(ExecutionRequest.code(ScriptLanguage.SHELL, "true")
                .withArgs(Map.of("name", "world")));

        assertTrue(response.success());
        assertEquals("ok", response.stdout());
        Map<String, String> env = seen.get().environment();
        assertEquals("1", env.get(ExchangeFiles.ENV_ABI_VERSION));
        assertEquals("world", env.get("CAPE_ARG_NAME"));
        assertEquals("unit", env.get(ExchangeFiles.ENV_SESSION_ID));
        assertFalse(Files.exists(seen.get().runDir()));
        assertEquals(SessionState.READY, sandbox.state());
    }

    @Test
    @DisplayName("Timed-out and cancelled runs map to their error kinds")
    void timeoutAndCancelMapping() {
        sandbox.setup();

        sandbox.runner = context -> AbstractSandbox.RunOutcome.timedOut("", "");
        ExecutionResponse timedOut = sandbox.execute(ExecutionRequest.code(ScriptLanguage.SHELL, "sleep 60"));
        assertEquals(ErrorKind.TIMEOUT, timedOut.error().kind());
        assertEquals("Execution exceeded timeout of 30s", timedOut.error().message());
        assertNull(timedOut.exitCode());

        sandbox.runner = context -> AbstractSandbox.RunOutcome.cancelled("", "");
        ExecutionResponse cancelled = sandbox.execute(ExecutionRequest.code(ScriptLanguage.SHELL, "sleep 60"));
        assertEquals(ErrorKind.CANCELLED, cancelled.error().kind());
        assertEquals(SessionState.READY, sandbox.state());
    }

    @Test
    @DisplayName("Engine faults during a run become failed responses")
    void engineFaultBecomesResponse() {
        sandbox.setup();
        sandbox.runner = context -> {
            throw new CapeException(ErrorKind.EXECUTION_FAILED, "interpreter missing");
        };

        ExecutionResponse response = sandbox.execute(ExecutionRequest.code(ScriptLanguage.SHELL, "true"));

        assertFalse(response.success());
        assertEquals(ErrorKind.EXECUTION_FAILED, response.error().kind());
        assertEquals("interpreter missing", response.error().message());
        assertEquals(SessionState.READY, sandbox.state());
    }

    @Test
    void truncateKeepsHeadAndTail() {
        String text = "a".repeat(50) + "b".repeat(50);

        String truncated = AbstractSandbox.truncate(text, 20);

        assertTrue(truncated.startsWith("aaaaaaaaaa"));
        assertTrue(truncated.endsWith("bbbbbbbbbb"));
        assertTrue(truncated.contains("truncated 80 chars"));
    }
}
