package com.cape.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Backend stand-in that records its hook calls.
 */
class FakeSandbox extends AbstractSandbox {

    final AtomicInteger setups = new AtomicInteger();
    final AtomicInteger cleanups = new AtomicInteger();
    final List<List<String>> installBatches = new CopyOnWriteArrayList<>();

    volatile boolean failSetup;
    volatile boolean failInstall;
    volatile long setupDelayMs;
    volatile long installDelayMs;
    volatile CountDownLatch installEntered = new CountDownLatch(0);
    volatile CountDownLatch installGate = new CountDownLatch(0);
    final AtomicReference<Error> installError = new AtomicReference<>();
    volatile Function<RunContext, RunOutcome> runner = context -> RunOutcome.exited(0, "", "");

    FakeSandbox(String sessionId, SessionConfig config, Path workRoot) {
        super(sessionId, IsolationBackend.PROCESS, config, workRoot, new ObjectMapper());
    }

    @Override
    protected void doSetup() throws IOException, InterruptedException {
        setups.incrementAndGet();
        if (setupDelayMs > 0) {
            Thread.sleep(setupDelayMs);
        }
        if (failSetup) {
            throw new IOException("backend unavailable");
        }
    }

    @Override
    protected InstallOutcome doInstall(List<String> packages) {
        installBatches.add(packages);
        installEntered.countDown();
        try {
            installGate.await();
            if (installDelayMs > 0) {
                Thread.sleep(installDelayMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        Error error = installError.getAndSet(null);
        if (error != null) {
            throw error;
        }
        return failInstall ? new InstallOutcome(false, "No matching distribution found")
                : new InstallOutcome(true, "");
    }

    @Override
    protected RunOutcome run(RunContext context) {
        return runner.apply(context);
    }

    @Override
    protected void doCleanup() {
        cleanups.incrementAndGet();
    }

    int installCount() {
        return installBatches.size();
    }
}
