package com.cape.runtime.executor;

import com.cape.core.error.ErrorKind;
import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CodeBinding;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import com.cape.sandbox.DefaultSandboxFactory;
import com.cape.sandbox.DependencyInstallResult;
import com.cape.sandbox.ExecutionRequest;
import com.cape.sandbox.ExecutionResponse;
import com.cape.sandbox.InProcessFunctionRegistry;
import com.cape.sandbox.IsolationBackend;
import com.cape.sandbox.Sandbox;
import com.cape.sandbox.SandboxManager;
import com.cape.sandbox.SandboxProperties;
import com.cape.sandbox.ScriptLanguage;
import com.cape.sandbox.SessionConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CodeExecutorTest {

    @TempDir
    Path workRoot;

    @TempDir
    Path scripts;

    private SimpleMeterRegistry meterRegistry;
    private SandboxManager sandboxes;
    private CodeExecutor executor;

    @BeforeEach
    void setUp() {
        var properties = new SandboxProperties();
        properties.getSandbox().setDefaultBackend("process");
        properties.getSandbox().setWorkRoot(workRoot.toString());
        meterRegistry = new SimpleMeterRegistry();
        var metrics = new CapeMetrics(meterRegistry);
        var factory = new DefaultSandboxFactory(properties, new ObjectMapper(),
                new InProcessFunctionRegistry(List.of()), (Supplier<DockerClient>) () -> null);
        sandboxes = new SandboxManager(factory, properties, metrics);
        executor = new CodeExecutor(sandboxes, metrics);
    }

    @AfterEach
    void tearDown() {
        sandboxes.releaseAll();
    }

    private static CapabilityDescriptor shellCapability(String code) {
        return CapabilityDescriptor.builder("shell-job", ExecutionType.CODE)
                .code(CodeBinding.inline("shell", code))
                .build();
    }

    // ── Running code ────────────────────────────────────────────────────

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class WithShell {

        @Test
        @DisplayName("One-off call runs the code and releases its session")
        void oneOffSession() {
            ExecutionOutcome outcome = executor.execute(shellCapability("echo \"$CAPE_ARG_GREETING\" > hello.txt"),
                    Map.of("greeting", "hi"), ExecutionContext.create(null, null));

            assertTrue(outcome.success(), String.valueOf(outcome.error()));
            assertEquals("hi\n", new String(outcome.producedFiles().get("hello.txt"), StandardCharsets.UTF_8));
            assertEquals("process", outcome.metadata().get("backend"));
            assertEquals(0, outcome.metadata().get("exit_code"));
            assertTrue(((String) outcome.metadata().get("session_id")).startsWith("shell-job-"));
            assertEquals(0, sandboxes.sessionCount());
        }

        @Test
        @DisplayName("A named session is kept and its working area persists between calls")
        void namedSessionPersists() {
            var descriptor = shellCapability("echo x >> \"$HOME/counter\"; wc -l < \"$HOME/counter\"");
            var context = ExecutionContext.create("analysis", null);

            executor.execute(descriptor, Map.of(), context);
            ExecutionOutcome second = executor.execute(descriptor, Map.of(), context);

            assertEquals("2", ((String) second.metadata().get("stdout")).trim());
            assertEquals(1, sandboxes.sessionCount());
            assertEquals("analysis", second.metadata().get("session_id"));
        }

        @Test
        @DisplayName("Caller files are staged in the run directory")
        void callerFilesStaged() {
            ExecutionOutcome outcome = executor.execute(shellCapability("tr a-z A-Z < data.txt"),
                    Map.of(CodeExecutor.FILES_INPUT, Map.of("data.txt", "payload")),
                    ExecutionContext.create(null, null));

            assertTrue(outcome.success());
            assertEquals("PAYLOAD", outcome.metadata().get("stdout"));
            assertTrue(outcome.producedFiles().isEmpty());
        }

        @Test
        @DisplayName("Entrypoint siblings are available under scripts/")
        void entrypointWithHelpers() throws Exception {
            Files.writeString(scripts.resolve("main.sh"), ". scripts/helper.sh\ngreet\n");
            Files.writeString(scripts.resolve("helper.sh"), "greet() { echo \"hello from helper\"; }\n");
            Files.writeString(scripts.resolve("notes.txt"), "ignored");
            var descriptor = CapabilityDescriptor.builder("entry", ExecutionType.CODE)
                    .code(CodeBinding.script(scripts.resolve("main.sh")))
                    .build();

            ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

            assertTrue(outcome.success(), String.valueOf(outcome.metadata().get("stderr")));
            assertEquals("hello from helper\n", outcome.metadata().get("stdout"));
        }

        @Test
        @DisplayName("Backend-specific script is used when no other source exists")
        void backendScript() {
            var descriptor = CapabilityDescriptor.builder("per-backend", ExecutionType.CODE)
                    .code(new CodeBinding(null, null, "shell", null,
                            Map.of("process", "echo from-process", "docker", "echo from-docker")))
                    .build();

            ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

            assertEquals("from-process\n", outcome.metadata().get("stdout"));
        }

        @Test
        @DisplayName("Timeouts are reported and counted")
        void timeoutCounted() {
            var descriptor = shellCapability("sleep 10").toBuilder().timeoutSeconds(1).build();

            ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

            assertEquals(ErrorKind.TIMEOUT, outcome.error().kind());
            assertEquals(1.0, meterRegistry.find("cape.sandbox.timeouts").tag("backend", "process").counter().count());
            assertEquals(0, sandboxes.sessionCount());
        }
    }

    // ── Request building and failures ───────────────────────────────────

    @Test
    void helperScriptsMatchEntrypointLanguage() throws Exception {
        Path main = Files.writeString(scripts.resolve("main.py"), "import util");
        Files.writeString(scripts.resolve("util.py"), "X = 1");
        Files.writeString(scripts.resolve("run.sh"), "echo");

        Map<String, byte[]> helpers = CodeExecutor.helperScripts(main, ScriptLanguage.PYTHON);

        assertEquals(Set.of("scripts/util.py"), helpers.keySet());
    }

    @Test
    void missingEntrypointFails() {
        var descriptor = CapabilityDescriptor.builder("ghost", ExecutionType.CODE)
                .code(CodeBinding.script(scripts.resolve("nope.py")))
                .build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertEquals(ErrorKind.EXECUTION_FAILED, outcome.error().kind());
        assertTrue(outcome.error().message().startsWith("Entrypoint not found"));
        assertEquals(0, sandboxes.sessionCount());
    }

    @Test
    void noCodeForBackendFails() {
        var descriptor = CapabilityDescriptor.builder("docker-only", ExecutionType.CODE)
                .code(new CodeBinding(null, null, "shell", null, Map.of("docker", "echo hi")))
                .build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertEquals("Capability 'docker-only' has no code for the process backend", outcome.error().message());
    }

    @Test
    void capabilityWithoutCodeFails() {
        var descriptor = CapabilityDescriptor.builder("empty", ExecutionType.CODE).build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertEquals(ErrorKind.EXECUTION_FAILED, outcome.error().kind());
    }

    @Test
    void unknownLanguageFails() {
        var descriptor = CapabilityDescriptor.builder("ruby", ExecutionType.CODE)
                .code(CodeBinding.inline("ruby", "puts 1"))
                .build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertEquals(ErrorKind.EXECUTION_FAILED, outcome.error().kind());
        assertEquals("Unsupported script language: ruby", outcome.error().message());
    }

    @Test
    void unknownIsolationFails() {
        var descriptor = shellCapability("true").toBuilder().isolation("firecracker").build();

        ExecutionOutcome outcome = executor.execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertEquals(ErrorKind.UNSUPPORTED_ISOLATION, outcome.error().kind());
    }

    @Test
    void badFilesInputIsValidationError() {
        ExecutionOutcome outcome = executor.execute(shellCapability("true"),
                Map.of(CodeExecutor.FILES_INPUT, Map.of("data.bin", 42)), ExecutionContext.create(null, null));

        assertEquals(ErrorKind.VALIDATION_ERROR, outcome.error().kind());
    }

    @Test
    void filesInputIsNotPassedAsArgument() {
        ExecutionRequest request = executor.buildRequest(shellCapability("true"),
                Map.of("x", 1, CodeExecutor.FILES_INPUT, Map.of("a.txt", "A")), IsolationBackend.PROCESS);

        assertEquals(Map.of("x", 1), request.args());
        assertEquals(Set.of("a.txt"), request.files().keySet());
        assertEquals(Duration.ofSeconds(30), request.timeout());
    }

    @Test
    @DisplayName("A failed install is a warning and the code still runs")
    void failedInstallIsSoft() {
        var manager = mock(SandboxManager.class);
        var sandbox = mock(Sandbox.class);
        when(manager.defaultBackend()).thenReturn("process");
        when(manager.getOrCreate(anyString(), any(SessionConfig.class))).thenReturn(sandbox);
        when(sandbox.backend()).thenReturn(IsolationBackend.PROCESS);
        when(sandbox.installDependencies(List.of("not-a-real-package")))
                .thenReturn(new DependencyInstallResult(List.of(), List.of(), List.of("not-a-real-package"),
                        "No matching distribution found"));
        when(sandbox.execute(any())).thenReturn(new ExecutionResponse(true, "ok", "", "", 0, 3, Map.of(), null));
        var descriptor = shellCapability("true").toBuilder().dependencies("not-a-real-package").build();

        ExecutionOutcome outcome = new CodeExecutor(manager, new CapeMetrics(meterRegistry))
                .execute(descriptor, Map.of(), ExecutionContext.create(null, null));

        assertTrue(outcome.success());
        assertEquals("ok", outcome.output());
        assertTrue(((String) outcome.metadata().get("dependency_warnings")).contains("not-a-real-package"));
        assertEquals(1.0, meterRegistry.find("cape.sandbox.dependency.installs").tag("result", "failure")
                .counter().count());
        verify(manager).release(anyString());
    }
}
