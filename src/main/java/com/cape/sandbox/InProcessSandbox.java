package com.cape.sandbox;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered {@link InProcessFunction}s on a worker thread inside the
 * engine's own JVM.
 *
 * <p>No isolation: functions share memory, classpath and credentials with
 * the caller. Only use it for trusted development capabilities; the
 * {@link SandboxManager} refuses it for anything above the configured risk level.
 *
 * <p>On timeout or cancellation the worker thread is interrupted and the call
 * returns immediately. The JVM cannot forcibly stop a thread, so a function
 * that ignores interrupts keeps running in the background until it returns.
 * Inline source text is never executed by this backend.
 */
public class InProcessSandbox extends AbstractSandbox {

    private final InProcessFunctionRegistry functions;
    private volatile ExecutorService worker;

    public InProcessSandbox(String sessionId, SessionConfig config, Path workRoot,
                            ObjectMapper objectMapper, InProcessFunctionRegistry functions) {
        super(sessionId, IsolationBackend.IN_PROCESS, config, workRoot, objectMapper);
        this.functions = functions;
    }

    @Override
    protected void doSetup() {
        // A timed-out function that ignores interrupts must not block later runs.
        worker = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "cape-inprocess-" + safeName(sessionId()));
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Functions carry their own classpath, so packages are recorded as satisfied.
     */
    @Override
    protected InstallOutcome doInstall(List<String> packages) {
        log.debug("Session '{}' runs in-process; nothing to install for {}", sessionId(), packages);
        return new InstallOutcome(true, "");
    }

    @Override
    protected RunOutcome run(RunContext context) throws IOException {
        String name = functionName(context.request());
        InProcessFunction function = functions.find(name)
                .orElseThrow(() -> new CapeException(ErrorKind.EXECUTION_FAILED,
                        "No in-process function registered as '" + name + "'"));

        var out = new StringWriter();
        var err = new StringWriter();
        var invocation = new InProcessInvocation(context.request().args(), context.environment(),
                context.runDir(), new PrintWriter(out, true), new PrintWriter(err, true));

        Future<Object> future = worker.submit(() -> function.apply(invocation));
        try {
            Object result = future.get(context.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (result != null) {
                objectMapper.writeValue(context.runDir().resolve(ExchangeFiles.RESULT_FILE).toFile(), result);
            }
            return RunOutcome.exited(0, out.toString(), err.toString());
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("In-process function '{}' exceeded {}s and was interrupted; it may still be running",
                    name, context.timeout().toSeconds());
            return RunOutcome.timedOut(out.toString(), err.toString());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return RunOutcome.cancelled(out.toString(), err.toString());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            var error = new LinkedHashMap<String, String>();
            error.put("error", String.valueOf(cause.getMessage()));
            error.put("type", cause.getClass().getSimpleName());
            objectMapper.writeValue(context.runDir().resolve(ExchangeFiles.ERROR_FILE).toFile(), error);
            cause.printStackTrace(new PrintWriter(err, true));
            return RunOutcome.exited(1, out.toString(), err.toString());
        }
    }

    private static String functionName(ExecutionRequest request) {
        if (request.function() != null && !request.function().isBlank()) {
            return request.function();
        }
        if (request.script() != null) {
            String fileName = request.script().getFileName().toString();
            int dot = fileName.lastIndexOf('.');
            return dot > 0 ? fileName.substring(0, dot) : fileName;
        }
        throw new CapeException(ErrorKind.EXECUTION_FAILED,
                "The in-process backend runs registered functions only, not inline code");
    }

    @Override
    protected void doCleanup() {
        ExecutorService executor = worker;
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
