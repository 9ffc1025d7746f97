package com.cape.runtime.executor;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import com.cape.runtime.tool.StubTool;
import com.cape.runtime.tool.ToolRegistry;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ToolExecutorTest {

    private final ExecutionContext context = ExecutionContext.create(null, null);

    @Test
    void callsToolNamedByDescriptor() {
        var tool = new StubTool("weather-api", args -> Map.of("forecast", "sunny in " + args.get("city")));
        var executor = new ToolExecutor(new ToolRegistry(List.of(tool)));
        var descriptor = CapabilityDescriptor.builder("weather", ExecutionType.TOOL).toolName("weather-api").build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of("city", "Oslo"), context);

        assertTrue(outcome.success());
        assertEquals(Map.of("forecast", "sunny in Oslo"), outcome.output());
        assertEquals(Map.of("tool", "weather-api"), outcome.metadata());
        assertEquals(List.of(Map.of("city", "Oslo")), tool.calls());
    }

    @Test
    void toolNameDefaultsToCapabilityId() {
        var executor = new ToolExecutor(new ToolRegistry(List.of(new StubTool("echo", args -> args))));
        var descriptor = CapabilityDescriptor.builder("echo", ExecutionType.TOOL).build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of("x", 1), context);

        assertEquals(Map.of("x", 1), outcome.output());
    }

    @Test
    void missingToolFails() {
        var executor = new ToolExecutor(new ToolRegistry(List.of()));
        var descriptor = CapabilityDescriptor.builder("echo", ExecutionType.TOOL).build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), context);

        assertEquals(ErrorKind.EXECUTION_FAILED, outcome.error().kind());
        assertEquals("No tool registered as 'echo'", outcome.error().message());
    }

    @Test
    void toolExceptionBecomesExecutionFailed() {
        var executor = new ToolExecutor(new ToolRegistry(List.of(new StubTool("flaky", args -> {
            throw new IOException("connection reset");
        }))));
        var descriptor = CapabilityDescriptor.builder("flaky", ExecutionType.TOOL).build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), context);

        assertEquals(ErrorKind.EXECUTION_FAILED, outcome.error().kind());
        assertEquals("Tool 'flaky' failed: connection reset", outcome.error().message());
    }

    @Test
    void engineExceptionKeepsItsKind() {
        var executor = new ToolExecutor(new ToolRegistry(List.of(new StubTool("strict", args -> {
            throw new CapeException(ErrorKind.VALIDATION_ERROR, "city is required");
        }))));
        var descriptor = CapabilityDescriptor.builder("strict", ExecutionType.TOOL).build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), context);

        assertEquals(ErrorKind.VALIDATION_ERROR, outcome.error().kind());
        assertEquals("city is required", outcome.error().message());
    }
}
