package com.cape.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs each execution in a fresh OS process.
 *
 * <p>The process gets the run directory as its working directory and a
 * scoped environment: the inherited environment is cleared and only
 * {@code PATH}, {@code LANG}, {@code HOME} (the working area),
 * {@code PYTHONPATH} and the exchange-file variables are set.
 *
 * <p><b>Limits.</b> The wall-clock timeout is the only limit this backend
 * enforces. Memory and CPU limits in the session's {@link SessionConfig} are
 * <em>not</em> applied: the child shares the host's resources. Use the docker
 * backend when those limits matter.
 *
 * <p>Each process leads its own process group where {@code setsid} is
 * available, and nothing it started outlives the run.
 */
public class ProcessSandbox extends AbstractSandbox {

    private final SandboxProperties properties;
    private volatile Process active;

    public ProcessSandbox(String sessionId, SessionConfig config, Path workRoot,
                          ObjectMapper objectMapper, SandboxProperties properties) {
        super(sessionId, IsolationBackend.PROCESS, config, workRoot, objectMapper);
        this.properties = properties;
    }

    @Override
    protected void doSetup() throws IOException {
        Files.createDirectories(workDir().resolve(ExchangeFiles.DEPS_DIR));
        if (!config().limits().isDefault()) {
            log.warn("Session '{}' requested {} MB / {}% CPU; the process backend does not enforce memory or CPU limits",
                    sessionId(), config().limits().memoryMb(), config().limits().cpuPercent());
        }
    }

    @Override
    protected InstallOutcome doInstall(List<String> packages) {
        var command = new ArrayList<String>();
        command.add(properties.getPythonCommand());
        command.addAll(List.of("-m", "pip", "install", "--quiet", "--disable-pip-version-check",
                "--target", workDir().resolve(ExchangeFiles.DEPS_DIR).toString()));
        command.addAll(packages);
        var builder = new ProcessBuilder(ProcessGroups.isolate(command)).directory(workDir().toFile());
        scopeEnvironment(builder.environment(), Map.of());
        try {
            ProcessRunner.Outcome outcome = ProcessRunner.run(builder,
                    Duration.ofSeconds(properties.getInstallTimeoutSeconds()), p -> active = p);
            if (outcome.timedOut()) {
                return new InstallOutcome(false, "pip install timed out after "
                        + properties.getInstallTimeoutSeconds() + "s");
            }
            return new InstallOutcome(outcome.exitCode() == 0, outcome.stderr());
        } catch (IOException e) {
            return new InstallOutcome(false, "Could not start " + properties.getPythonCommand() + ": " + e.getMessage());
        } finally {
            active = null;
        }
    }

    @Override
    protected RunOutcome run(RunContext context) throws IOException {
        Path runner = writeRunner(context);
        String interpreter = context.request().language() == ScriptLanguage.SHELL
                ? properties.getShellCommand() : properties.getPythonCommand();

        var builder = new ProcessBuilder(ProcessGroups.isolate(List.of(interpreter, runner.getFileName().toString())))
                .directory(context.runDir().toFile());
        scopeEnvironment(builder.environment(), context.environment());
        builder.environment().put("PYTHONPATH", String.join(File.pathSeparator,
                workDir().resolve(ExchangeFiles.DEPS_DIR).toString(),
                context.runDir().resolve("scripts").toString(),
                context.runDir().toString()));

        log.debug("Session '{}' running {} {}", sessionId(), interpreter, runner);
        try {
            ProcessRunner.Outcome outcome = ProcessRunner.run(builder, context.timeout(), p -> active = p);
            if (outcome.cancelled()) {
                return RunOutcome.cancelled(outcome.stdout(), outcome.stderr());
            }
            if (outcome.timedOut()) {
                log.warn("Session '{}' timed out after {}s, process tree killed",
                        sessionId(), context.timeout().toSeconds());
                return RunOutcome.timedOut(outcome.stdout(), outcome.stderr());
            }
            return RunOutcome.exited(outcome.exitCode(), outcome.stdout(), outcome.stderr());
        } finally {
            active = null;
        }
    }

    @Override
    protected void doCleanup() {
        Process running = active;
        if (running == null) {
            return;
        }
        if (running.isAlive()) {
            log.warn("Session '{}' released while a process was running, killing it", sessionId());
        }
        // The leader may have exited with its group still running
        ProcessRunner.destroyTree(running);
    }

    private void scopeEnvironment(Map<String, String> env, Map<String, String> extra) {
        String path = System.getenv("PATH");
        env.clear();
        env.put("PATH", path != null ? path : "/usr/local/bin:/usr/bin:/bin");
        env.put("LANG", "C.UTF-8");
        env.put("HOME", workDir().toString());
        env.put("PYTHONUNBUFFERED", "1");
        env.put("PYTHONDONTWRITEBYTECODE", "1");
        env.putAll(extra);
    }
}
