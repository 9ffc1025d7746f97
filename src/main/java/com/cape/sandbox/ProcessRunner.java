package com.cape.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Runs an OS process under a wall-clock timeout, capturing both streams.
 *
 * <p>On timeout, or when the calling thread is interrupted, the whole process
 * tree is killed before {@link #run} returns. An interrupt is re-asserted on
 * the calling thread after the tree is gone.
 *
 * <p>Background processes the process leaves behind after a normal exit are
 * killed as well: members of its process group when it was started through
 * {@link ProcessGroups#isolate}, and any descendant seen while it was alive.
 */
final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

    static final int MAX_CAPTURE_BYTES = 1024 * 1024;
    private static final Duration KILL_GRACE = Duration.ofSeconds(2);
    private static final Duration DRAIN_GRACE = Duration.ofSeconds(1);
    private static final long POLL_MS = 50;

    /**
     * @param exitCode  exit status, -1 when the process was killed
     * @param timedOut  the timeout elapsed and the tree was killed
     * @param cancelled the caller was interrupted and the tree was killed
     */
    record Outcome(int exitCode, String stdout, String stderr, long elapsedMs,
                   boolean timedOut, boolean cancelled) {}

    private ProcessRunner() {}

    static Outcome run(ProcessBuilder builder, Duration timeout, Consumer<Process> onStart) throws IOException {
        long startedAt = System.nanoTime();
        Process process = builder.start();
        onStart.accept(process);
        ExecutorService pumps = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "cape-process-pump");
            t.setDaemon(true);
            return t;
        });
        try {
            var stdout = new CappedBuffer();
            var stderr = new CappedBuffer();
            Future<?> stdoutPump = pumps.submit(() -> pump(process.getInputStream(), stdout));
            Future<?> stderrPump = pumps.submit(() -> pump(process.getErrorStream(), stderr));

            boolean timedOut = false;
            boolean cancelled = false;
            var seen = new LinkedHashMap<Long, ProcessHandle>();
            long deadline = System.nanoTime() + timeout.toNanos();
            try {
                while (true) {
                    long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                    if (remainingMs <= 0) {
                        timedOut = true;
                        log.debug("Process {} exceeded {} ms, killing", process.pid(), timeout.toMillis());
                        destroyTree(process);
                        break;
                    }
                    if (process.waitFor(Math.min(remainingMs, POLL_MS), TimeUnit.MILLISECONDS)) {
                        break;
                    }
                    process.descendants().forEach(d -> seen.putIfAbsent(d.pid(), d));
                }
            } catch (InterruptedException e) {
                cancelled = true;
                log.debug("Interrupted while waiting for process {}, killing", process.pid());
                destroyTree(process);
            }
            reapLeftovers(process, ProcessGroups.isIsolated(builder), seen);

            awaitPump(stdoutPump);
            awaitPump(stderrPump);
            long elapsedMs = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();
            int exitCode = timedOut || cancelled ? -1 : process.exitValue();
            if (cancelled) {
                Thread.currentThread().interrupt();
            }
            return new Outcome(exitCode, stdout.text(), stderr.text(), elapsedMs, timedOut, cancelled);
        } finally {
            pumps.shutdownNow();
        }
    }

    /**
     * Kills the process, every descendant and the rest of its process group,
     * then waits briefly for them to exit.
     */
    static void destroyTree(Process process) {
        var doomed = new LinkedHashMap<Long, ProcessHandle>();
        process.descendants().forEach(d -> doomed.put(d.pid(), d));
        ProcessGroups.members(process.pid()).forEach(m -> doomed.putIfAbsent(m.pid(), m));
        doomed.remove(process.pid());
        doomed.values().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        awaitExit(process.toHandle());
        doomed.values().forEach(ProcessRunner::awaitExit);
    }

    /**
     * Kills what is still running from a finished process: its group (when it
     * has its own) and the descendants seen while it was alive. Once the
     * leader is gone its children are reparented, so {@code descendants()}
     * alone no longer finds them.
     */
    private static void reapLeftovers(Process process, boolean grouped, Map<Long, ProcessHandle> seen) {
        var leftovers = new LinkedHashMap<Long, ProcessHandle>();
        if (grouped) {
            ProcessGroups.members(process.pid()).forEach(m -> leftovers.put(m.pid(), m));
        }
        seen.forEach(leftovers::putIfAbsent);
        leftovers.values().removeIf(h -> !h.isAlive());
        if (leftovers.isEmpty()) {
            return;
        }
        log.debug("Killing {} background process(es) left by process {}", leftovers.size(), process.pid());
        leftovers.values().forEach(ProcessHandle::destroyForcibly);
        leftovers.values().forEach(ProcessRunner::awaitExit);
    }

    private static void awaitExit(ProcessHandle handle) {
        try {
            handle.onExit().get(KILL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Process {} did not exit after kill: {}", handle.pid(), e.toString());
        }
    }

    private static void pump(InputStream stream, CappedBuffer buffer) {
        byte[] chunk = new byte[8192];
        try (InputStream input = stream) {
            int read;
            while ((read = input.read(chunk)) != -1) {
                buffer.write(chunk, read);
            }
        } catch (IOException e) {
            log.debug("Output stream closed: {}", e.getMessage());
        }
    }

    private static void awaitPump(Future<?> pump) {
        try {
            pump.get(DRAIN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            // A detached grandchild may still hold the pipe open; keep what was read so far.
            log.debug("Output pump did not finish: {}", e.toString());
        }
    }

    /**
     * Keeps the first {@link #MAX_CAPTURE_BYTES} bytes and discards the rest.
     */
    private static final class CappedBuffer {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        private boolean truncated;

        synchronized void write(byte[] chunk, int length) {
            int room = MAX_CAPTURE_BYTES - bytes.size();
            if (room <= 0) {
                truncated = true;
                return;
            }
            bytes.write(chunk, 0, Math.min(room, length));
            truncated |= length > room;
        }

        synchronized String text() {
            String text = bytes.toString(StandardCharsets.UTF_8);
            return truncated ? text + "\n... [output truncated]" : text;
        }
    }
}
