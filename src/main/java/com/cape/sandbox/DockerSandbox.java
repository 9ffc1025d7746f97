package com.cape.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Runs executions inside one container per session, kept warm between runs.
 *
 * <p>The container mounts the session's working area at {@code /workspace},
 * has no network unless the session's limits enable it, runs with
 * {@code no-new-privileges} and is capped at the configured memory and CPU
 * quota. Each execution is a {@code docker exec}; when it times out or the
 * caller is interrupted the container is killed, which stops every process in
 * it, and it is started again before the next execution.
 */
public class DockerSandbox extends AbstractSandbox {

    static final String CONTAINER_WORKSPACE = "/workspace";
    static final long CPU_PERIOD = 100_000L;
    private static final int MAX_CAPTURE_CHARS = ProcessRunner.MAX_CAPTURE_BYTES;
    private static final int PULL_TIMEOUT_MINUTES = 10;

    private final DockerClient dockerClient;
    private final SandboxProperties properties;
    private volatile String containerId;
    private volatile boolean restartNeeded;

    public DockerSandbox(String sessionId, SessionConfig config, Path workRoot, ObjectMapper objectMapper,
                         DockerClient dockerClient, SandboxProperties properties) {
        super(sessionId, IsolationBackend.DOCKER, config, workRoot, objectMapper);
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    String containerId() {
        return containerId;
    }

    @Override
    protected void doSetup() throws InterruptedException {
        String image = properties.getImage();
        ensureImage(image);

        var limits = config().limits();
        var hostConfig = HostConfig.newHostConfig()
                .withBinds(new Bind(workDir().toAbsolutePath().toString(), new Volume(CONTAINER_WORKSPACE), AccessMode.rw))
                .withMemory((long) limits.memoryMb() * 1024 * 1024)
                .withCpuPeriod(CPU_PERIOD)
                .withCpuQuota((long) limits.cpuPercent() * 1000)
                .withNetworkMode(limits.networkEnabled() ? "bridge" : "none")
                .withSecurityOpts(List.of("no-new-privileges:true"));

        String name = "cape-" + safeName(sessionId()) + "-" + UUID.randomUUID().toString().substring(0, 8);
        var create = dockerClient.createContainerCmd(image);
        String user = containerUser();
        if (user != null) {
            create.withUser(user);
        }
        containerId = create
                .withName(name)
                .withHostConfig(hostConfig)
                .withLabels(Map.of("cape.session", sessionId()))
                .withCmd("tail", "-f", "/dev/null")
                .withWorkingDir(CONTAINER_WORKSPACE)
                .exec()
                .getId();
        dockerClient.startContainerCmd(containerId).exec();
        log.info("Started container {} ({}) for session '{}', network={}, user={}", name, shortId(containerId),
                sessionId(), limits.networkEnabled() ? "bridge" : "none", user != null ? user : "image default");
    }

    /**
     * Files the container writes land in the host's work directory through
     * the bind mount, so the container runs as that directory's owner and the
     * engine can delete them afterwards. Null keeps the image's user.
     */
    String containerUser() {
        String configured = properties.getContainerUser();
        if (configured != null && !configured.isBlank()) {
            return configured.trim();
        }
        try {
            return Files.getAttribute(workDir(), "unix:uid") + ":" + Files.getAttribute(workDir(), "unix:gid");
        } catch (IOException | UnsupportedOperationException | IllegalArgumentException e) {
            log.warn("Cannot read the owner of {} ({}); container files may not be removable after release",
                    workDir(), e.getMessage());
            return null;
        }
    }

    private void ensureImage(String image) throws InterruptedException {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            if (!properties.isPullMissingImage()) {
                throw new SandboxSetupException("Sandbox image not found locally: " + image, e);
            }
            log.info("Pulling sandbox image {}", image);
            boolean pulled = dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!pulled) {
                throw new SandboxSetupException("Timed out pulling sandbox image " + image, null);
            }
        }
    }

    @Override
    protected InstallOutcome doInstall(List<String> packages) {
        var command = new ArrayList<String>();
        command.add(properties.getContainerPythonCommand());
        command.addAll(List.of("-m", "pip", "install", "--quiet", "--no-cache-dir", "--disable-pip-version-check",
                "--target", CONTAINER_WORKSPACE + "/" + ExchangeFiles.DEPS_DIR));
        command.addAll(packages);
        try {
            ExecOutcome outcome = runExec(command, CONTAINER_WORKSPACE, List.of(),
                    Duration.ofSeconds(properties.getInstallTimeoutSeconds()));
            if (outcome.timedOut()) {
                return new InstallOutcome(false, "pip install timed out after "
                        + properties.getInstallTimeoutSeconds() + "s");
            }
            return new InstallOutcome(outcome.exitCode() == 0, outcome.stderr());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new InstallOutcome(false, "Interrupted while installing " + packages);
        }
    }

    @Override
    protected RunOutcome run(RunContext context) throws IOException {
        Path runner = writeRunner(context);
        String runDir = visiblePath(context.runDir());
        String interpreter = context.request().language() == ScriptLanguage.SHELL
                ? properties.getShellCommand() : properties.getContainerPythonCommand();

        var env = new ArrayList<String>();
        context.environment().forEach((k, v) -> env.add(k + "=" + v));
        env.add("PYTHONPATH=" + String.join(":", CONTAINER_WORKSPACE + "/" + ExchangeFiles.DEPS_DIR,
                runDir + "/scripts", runDir));
        env.add("PYTHONUNBUFFERED=1");
        env.add("PYTHONDONTWRITEBYTECODE=1");

        try {
            ExecOutcome outcome = runExec(List.of(interpreter, runDir + "/" + runner.getFileName()),
                    runDir, env, context.timeout());
            if (outcome.timedOut()) {
                log.warn("Session '{}' timed out after {}s, container {} killed",
                        sessionId(), context.timeout().toSeconds(), shortId(containerId));
                return RunOutcome.timedOut(outcome.stdout(), outcome.stderr());
            }
            return RunOutcome.exited(outcome.exitCode(), outcome.stdout(), outcome.stderr());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunOutcome.cancelled("", "");
        }
    }

    private record ExecOutcome(int exitCode, String stdout, String stderr, boolean timedOut) {}

    private ExecOutcome runExec(List<String> command, String workingDir, List<String> env, Duration timeout)
            throws InterruptedException {
        if (restartNeeded) {
            log.info("Restarting container {} for session '{}'", shortId(containerId), sessionId());
            dockerClient.startContainerCmd(containerId).exec();
            restartNeeded = false;
        }
        var execEnv = new ArrayList<String>(env);
        // The container user may have no passwd entry and so no home
        execEnv.add("HOME=" + CONTAINER_WORKSPACE);
        String execId = dockerClient.execCreateCmd(containerId)
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withWorkingDir(workingDir)
                .withEnv(execEnv)
                .withCmd(command.toArray(new String[0]))
                .exec()
                .getId();

        var callback = new OutputCallback();
        try {
            dockerClient.execStartCmd(execId).exec(callback);
            boolean finished;
            try {
                finished = callback.awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                log.debug("Interrupted while waiting for exec {}, killing container", shortId(execId));
                killContainer();
                throw e;
            }
            if (!finished) {
                killContainer();
                return new ExecOutcome(-1, callback.stdout(), callback.stderr(), true);
            }
            Long exitCode = dockerClient.inspectExecCmd(execId).exec().getExitCodeLong();
            return new ExecOutcome(exitCode != null ? exitCode.intValue() : -1,
                    callback.stdout(), callback.stderr(), false);
        } finally {
            closeQuietly(callback);
        }
    }

    private void killContainer() {
        restartNeeded = true;
        try {
            dockerClient.killContainerCmd(containerId).exec();
        } catch (Exception e) {
            log.warn("Failed to kill container {}: {}", shortId(containerId), e.getMessage());
        }
    }

    @Override
    protected String visiblePath(Path hostPath) {
        Path relative = workDir().toAbsolutePath().relativize(hostPath.toAbsolutePath());
        String suffix = relative.toString().replace('\\', '/');
        return suffix.isEmpty() ? CONTAINER_WORKSPACE : CONTAINER_WORKSPACE + "/" + suffix;
    }

    @Override
    protected void doCleanup() {
        String id = containerId;
        if (id == null) {
            return;
        }
        try {
            dockerClient.stopContainerCmd(id).withTimeout(5).exec();
        } catch (Exception e) {
            log.debug("Failed to stop container {}: {}", shortId(id), e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(id).withForce(true).exec();
            log.debug("Removed container {}", shortId(id));
        } catch (Exception e) {
            log.warn("Failed to remove container {}: {}", shortId(id), e.getMessage());
        }
    }

    private void closeQuietly(OutputCallback callback) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("Failed to close exec stream: {}", e.getMessage());
        }
    }

    private static String shortId(String id) {
        return id != null && id.length() > 12 ? id.substring(0, 12) : String.valueOf(id);
    }

    /**
     * Collects exec output frames by stream.
     */
    static final class OutputCallback extends ResultCallback.Adapter<Frame> {
        private final StringBuilder stdout = new StringBuilder();
        private final StringBuilder stderr = new StringBuilder();

        @Override
        public void onNext(Frame frame) {
            StringBuilder target = frame.getStreamType() == StreamType.STDERR ? stderr : stdout;
            synchronized (this) {
                if (target.length() < MAX_CAPTURE_CHARS) {
                    target.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                }
            }
        }

        synchronized String stdout() {
            return stdout.toString();
        }

        synchronized String stderr() {
            return stderr.toString();
        }
    }
}
