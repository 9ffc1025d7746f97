package com.cape.runtime.executor;

import com.cape.core.error.CapeException;
import com.cape.core.error.ErrorKind;
import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.CapabilityError;
import com.cape.core.model.CodeBinding;
import com.cape.core.model.ExecutionType;
import com.cape.runtime.ExecutionContext;
import com.cape.sandbox.DependencyInstallResult;
import com.cape.sandbox.ExecutionRequest;
import com.cape.sandbox.ExecutionResponse;
import com.cape.sandbox.IsolationBackend;
import com.cape.sandbox.Sandbox;
import com.cape.sandbox.SandboxManager;
import com.cape.sandbox.ScriptLanguage;
import com.cape.sandbox.SessionConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Runs a capability's code in a sandbox session.
 *
 * <p>Calls that name a session reuse it, so installed packages and workspace
 * files persist between them. Calls without one get a one-off session that is
 * released when the call returns.
 *
 * <p>Caller files can be passed under the reserved {@value #FILES_INPUT}
 * input as a map of relative name to {@code byte[]} or {@code String}.
 */
@Component
public final class CodeExecutor implements CapabilityExecutor {

    private static final Logger log = LoggerFactory.getLogger(CodeExecutor.class);

    public static final String FILES_INPUT = "_files";
    static final String HELPER_DIR = "scripts/";

    private final SandboxManager sandboxes;
    private final CapeMetrics metrics;

    public CodeExecutor(SandboxManager sandboxes, @Autowired(required = false) CapeMetrics metrics) {
        this.sandboxes = sandboxes;
        this.metrics = metrics;
    }

    @Override
    public ExecutionType type() {
        return ExecutionType.CODE;
    }

    @Override
    public ExecutionOutcome execute(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                    ExecutionContext context) {
        if (descriptor.code() == null) {
            return ExecutionOutcome.failure(ErrorKind.EXECUTION_FAILED,
                    "Capability '" + descriptor.id() + "' declares no code");
        }
        SessionConfig config = SessionConfig.forCapability(descriptor, sandboxes.defaultBackend());
        boolean oneOff = context.sessionId() == null;
        String sessionId = oneOff
                ? descriptor.id() + "-" + UUID.randomUUID().toString().substring(0, 8)
                : context.sessionId();

        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("session_id", sessionId);
        try {
            Sandbox sandbox = sandboxes.getOrCreate(sessionId, config);
            IsolationBackend backend = sandbox.backend();
            metadata.put("backend", backend.configName());
            ExecutionRequest request = buildRequest(descriptor, inputs, backend);

            if (!descriptor.dependencies().isEmpty()) {
                installDependencies(sandbox, descriptor, metadata);
            }

            ExecutionResponse response = sandbox.execute(request);
            metadata.put("stdout", response.stdout());
            metadata.put("stderr", response.stderr());
            metadata.put("exit_code", response.exitCode());
            if (response.success()) {
                return ExecutionOutcome.success(response.output(), response.producedFiles(), metadata);
            }
            if (response.error().kind() == ErrorKind.TIMEOUT && metrics != null) {
                metrics.recordTimeout(backend.configName());
            }
            return ExecutionOutcome.failure(response.error(), response.producedFiles(), metadata);
        } catch (CapeException e) {
            log.warn("Capability '{}' could not run in session '{}': {}", descriptor.id(), sessionId, e.getMessage());
            return ExecutionOutcome.failure(CapabilityError.of(e), Map.of(), metadata);
        } finally {
            if (oneOff) {
                sandboxes.release(sessionId);
            }
        }
    }

    private void installDependencies(Sandbox sandbox, CapabilityDescriptor descriptor,
                                     Map<String, Object> metadata) {
        DependencyInstallResult install = sandbox.installDependencies(descriptor.dependencies());
        String backend = sandbox.backend().configName();
        if (install.hasFailures()) {
            log.warn("Capability '{}' is running without {}: {}", descriptor.id(), install.failed(), install.message());
            metadata.put("dependency_warnings", "Failed to install " + install.failed() + ": " + install.message());
        }
        if (metrics != null) {
            install.installed().forEach(p -> metrics.recordDependencyInstall(backend, true));
            install.failed().forEach(p -> metrics.recordDependencyInstall(backend, false));
        }
    }

    /**
     * Picks the code source for the session's backend: entrypoint, inline
     * code, then the backend-specific script.
     */
    ExecutionRequest buildRequest(CapabilityDescriptor descriptor, Map<String, Object> inputs,
                                  IsolationBackend backend) {
        CodeBinding code = descriptor.code();
        var args = new LinkedHashMap<>(inputs);
        Object callerFiles = args.remove(FILES_INPUT);
        var files = new LinkedHashMap<String, byte[]>(callerFiles(callerFiles));
        Duration timeout = Duration.ofSeconds(descriptor.timeoutSeconds());

        ScriptLanguage language;
        try {
            language = code.language() != null ? ScriptLanguage.fromName(code.language())
                    : code.entrypoint() != null ? ScriptLanguage.forPath(code.entrypoint()) : ScriptLanguage.PYTHON;
        } catch (IllegalArgumentException e) {
            throw new CapeException(ErrorKind.EXECUTION_FAILED, e.getMessage());
        }

        ExecutionRequest request;
        if (code.entrypoint() != null) {
            Path entrypoint = code.entrypoint();
            if (!Files.isRegularFile(entrypoint)) {
                throw new CapeException(ErrorKind.EXECUTION_FAILED, "Entrypoint not found: " + entrypoint);
            }
            files.putAll(helperScripts(entrypoint, language));
            request = new ExecutionRequest(language, entrypoint, null, code.function(), args, null, files, timeout);
        } else if (code.code() != null && !code.code().isBlank()) {
            request = new ExecutionRequest(language, null, code.code(), code.function(), args, null, files, timeout);
        } else if (code.backendScripts().containsKey(backend.configName())) {
            request = new ExecutionRequest(language, null, code.backendScripts().get(backend.configName()),
                    code.function(), args, null, files, timeout);
        } else if (backend == IsolationBackend.IN_PROCESS && code.function() != null) {
            request = new ExecutionRequest(language, null, null, code.function(), args, null, files, timeout);
        } else {
            throw new CapeException(ErrorKind.EXECUTION_FAILED, "Capability '" + descriptor.id()
                    + "' has no code for the " + backend.configName() + " backend");
        }
        return request;
    }

    /**
     * Sibling files of the entrypoint with the same extension, staged under {@code scripts/}.
     */
    static Map<String, byte[]> helperScripts(Path entrypoint, ScriptLanguage language) {
        Path dir = entrypoint.toAbsolutePath().getParent();
        if (dir == null) {
            return Map.of();
        }
        var helpers = new LinkedHashMap<String, byte[]>();
        try (Stream<Path> siblings = Files.list(dir)) {
            for (Path sibling : siblings.sorted().toList()) {
                String name = sibling.getFileName().toString();
                if (Files.isRegularFile(sibling) && name.endsWith(language.extension())
                        && !sibling.equals(entrypoint.toAbsolutePath())) {
                    helpers.put(HELPER_DIR + name, Files.readAllBytes(sibling));
                }
            }
        } catch (IOException e) {
            throw new CapeException(ErrorKind.SETUP_FAILED, "Could not read helper scripts next to "
                    + entrypoint + ": " + e.getMessage(), e);
        }
        return helpers;
    }

    private static Map<String, byte[]> callerFiles(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw new CapeException(ErrorKind.VALIDATION_ERROR,
                    "Input '" + FILES_INPUT + "' must map file names to contents");
        }
        var files = new LinkedHashMap<String, byte[]>();
        map.forEach((name, content) -> {
            if (content instanceof byte[] bytes) {
                files.put(String.valueOf(name), bytes);
            } else if (content instanceof CharSequence text) {
                files.put(String.valueOf(name), text.toString().getBytes(StandardCharsets.UTF_8));
            } else {
                throw new CapeException(ErrorKind.VALIDATION_ERROR,
                        "Content of input file '" + name + "' must be bytes or text");
            }
        });
        return files;
    }
}
