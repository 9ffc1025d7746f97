package com.cape.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for capability execution.
 */
@Service
public class CapeMetrics {

    private final MeterRegistry registry;

    public CapeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String executionType, boolean success, String errorKind, long ms) {
        Counter.builder("cape.capability.executions")
                .tag("type", executionType)
                .tag("outcome", success ? "success" : "failure")
                .tag("error", errorKind != null ? errorKind : "none")
                .register(registry)
                .increment();
        Timer.builder("cape.capability.duration")
                .tag("type", executionType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSandboxSession(String backend, String event) {
        Counter.builder("cape.sandbox.sessions")
                .tag("backend", backend)
                .tag("event", event)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String backend) {
        Counter.builder("cape.sandbox.timeouts")
                .tag("backend", backend)
                .register(registry)
                .increment();
    }

    public void recordDependencyInstall(String backend, boolean success) {
        Counter.builder("cape.sandbox.dependency.installs")
                .tag("backend", backend)
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    /**
     * Records how many candidates a match query returned above its threshold.
     */
    public void recordMatch(int resultCount) {
        DistributionSummary.builder("cape.matcher.results")
                .register(registry)
                .record(resultCount);
    }

    public void recordRegistryOverwrite() {
        Counter.builder("cape.registry.overwrites")
                .description("Capabilities replaced by a registration with the same id")
                .register(registry)
                .increment();
    }

    public void recordTokens(String model, long tokens) {
        Counter.builder("cape.model.tokens")
                .tag("model", model)
                .register(registry)
                .increment(tokens);
    }
}
