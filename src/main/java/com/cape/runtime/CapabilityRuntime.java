package com.cape.runtime;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.logging.MdcContext;
import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CapabilityError;
import com.cape.core.model.CapabilityResult;
import com.cape.core.model.ExecutionType;
import com.cape.core.registry.CapabilityRegistry;
import com.cape.runtime.executor.CapabilityExecutor;
import com.cape.runtime.executor.ExecutionOutcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single entry point for executing capabilities.
 *
 * <p>{@link #execute} never throws: unknown ids, invalid inputs and executor
 * failures all come back as a failed {@link CapabilityResult}. The elapsed time
 * covers the whole call, including validation and sandbox setup.
 */
@Service
public class CapabilityRuntime {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRuntime.class);

    private final CapabilityRegistry registry;
    private final Map<ExecutionType, CapabilityExecutor> executors = new EnumMap<>(ExecutionType.class);
    private final CapeMetrics metrics;
    private final ExecutorService workers;

    public CapabilityRuntime(CapabilityRegistry registry, List<CapabilityExecutor> executors,
                             RuntimeProperties properties, @Autowired(required = false) CapeMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
        for (CapabilityExecutor executor : executors) {
            this.executors.put(executor.type(), executor);
        }
        var counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "cape-runtime-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Capability runtime ready with executors for {}", this.executors.keySet());
    }

    public CapabilityResult execute(String capabilityId, Map<String, Object> inputs) {
        return execute(capabilityId, inputs, null, null);
    }

    /**
     * @param sessionId sandbox session to run code in, or null for a one-off session
     * @param model     model adapter name, or null for the configured default
     */
    public CapabilityResult execute(String capabilityId, Map<String, Object> inputs, String sessionId, String model) {
        ExecutionContext context = ExecutionContext.create(sessionId, model);
        MdcContext.setExecution(context.traceId(), capabilityId, sessionId);
        try {
            return run(capabilityId, inputs, context);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the call on the runtime's worker pool. Cancelling the future with
     * interruption stops sandboxed work and yields a {@link ErrorKind#CANCELLED} result.
     */
    public Future<CapabilityResult> submit(String capabilityId, Map<String, Object> inputs,
                                           String sessionId, String model) {
        return workers.submit(() -> execute(capabilityId, inputs, sessionId, model));
    }

    /**
     * Executes a workflow step within its parent's context.
     */
    public CapabilityResult executeStep(String capabilityId, Map<String, Object> inputs, ExecutionContext context) {
        String parent = MdcContext.currentCapability();
        MdcContext.setCapability(capabilityId);
        try {
            return run(capabilityId, inputs, context);
        } finally {
            if (parent != null) {
                MdcContext.setCapability(parent);
            }
        }
    }

    private CapabilityResult run(String capabilityId, Map<String, Object> rawInputs, ExecutionContext context) {
        long start = System.nanoTime();
        Map<String, Object> inputs = rawInputs != null ? rawInputs : Map.of();
        String id = capabilityId;
        String type = "unknown";
        CapabilityResult result;
        try {
            CapabilityDescriptor descriptor = registry.get(capabilityId);
            id = descriptor.id();
            type = descriptor.executionType().name().toLowerCase(Locale.ROOT);
            InputValidator.validate(descriptor.inputSchema(), inputs);

            CapabilityExecutor executor = executors.get(descriptor.executionType());
            if (executor == null) {
                throw new CapeException(ErrorKind.EXECUTION_FAILED, "No executor for " + type + " capabilities");
            }
            context.recordStep(id);
            ExecutionOutcome outcome = executor.execute(descriptor, inputs, context);
            result = toResult(id, outcome, elapsedMs(start), context);
        } catch (CapeException e) {
            log.warn("Capability '{}' rejected: {}", id, e.getMessage());
            result = failed(id, CapabilityError.of(e), start, context);
        } catch (RuntimeException e) {
            log.error("Capability '{}' failed unexpectedly", id, e);
            result = failed(id, new CapabilityError(ErrorKind.EXECUTION_FAILED,
                    "Unexpected error: " + e.getMessage()), start, context);
        }

        if (metrics != null) {
            metrics.recordExecution(type, result.success(),
                    result.errorKind() != null ? result.errorKind().name() : null, result.elapsedMs());
        }
        if (result.success()) {
            log.info("Capability '{}' succeeded in {} ms", id, result.elapsedMs());
        } else {
            log.info("Capability '{}' failed in {} ms: {} {}", id, result.elapsedMs(),
                    result.error().kind(), result.error().message());
        }
        return result;
    }

    private static CapabilityResult toResult(String id, ExecutionOutcome outcome, long elapsedMs,
                                             ExecutionContext context) {
        return new CapabilityResult(id, outcome.success(), outcome.output(), outcome.error(), elapsedMs,
                outcome.producedFiles(), context.traceId(), context.stepsExecuted(), outcome.failedStep(),
                context.tokensUsed(), outcome.metadata());
    }

    private static CapabilityResult failed(String id, CapabilityError error, long start, ExecutionContext context) {
        return new CapabilityResult(id, false, null, error, elapsedMs(start), Map.of(), context.traceId(),
                context.stepsExecuted(), null, context.tokensUsed(), Map.of());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
