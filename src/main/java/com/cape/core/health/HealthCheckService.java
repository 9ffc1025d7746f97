package com.cape.core.health;

import com.cape.core.registry.CapabilityRegistry;
import com.cape.runtime.model.ModelAdapterRegistry;
import com.cape.sandbox.IsolationBackend;
import com.cape.sandbox.SandboxProperties;
import com.github.dockerjava.api.DockerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final SandboxProperties sandboxProperties;
    private final CapabilityRegistry registry;
    private final ModelAdapterRegistry adapters;
    private final ObjectProvider<DockerClient> dockerClient;

    public HealthCheckService(
            SandboxProperties sandboxProperties,
            @Autowired(required = false) CapabilityRegistry registry,
            @Autowired(required = false) ModelAdapterRegistry adapters,
            ObjectProvider<DockerClient> dockerClient) {
        this.sandboxProperties = sandboxProperties;
        this.registry = registry;
        this.adapters = adapters;
        this.dockerClient = dockerClient;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSandbox());
        results.add(checkRegistry());
        results.add(checkModels());
        results.add(checkDocker());
        results.add(checkPython());
        return results;
    }

    /**
     * Name of the configured default isolation backend, as written in config.
     */
    public String defaultBackend() {
        return sandboxProperties.getDefaultBackend();
    }

    private HealthStatus checkSandbox() {
        IsolationBackend backend;
        try {
            backend = IsolationBackend.fromName(sandboxProperties.getDefaultBackend());
        } catch (RuntimeException e) {
            return HealthStatus.down("sandbox",
                    "Unknown default backend '" + sandboxProperties.getDefaultBackend() + "'");
        }
        Path workRoot = sandboxProperties.getWorkRoot().toAbsolutePath();
        Path existing = workRoot;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.isDirectory(existing) || !Files.isWritable(existing)) {
            return HealthStatus.down("sandbox", "Work root " + workRoot + " is not writable");
        }
        return HealthStatus.up("sandbox", "Default backend: " + backend.configName(),
                Map.of("backend", backend.configName(), "work_root", workRoot.toString()));
    }

    private HealthStatus checkRegistry() {
        if (registry == null) {
            return HealthStatus.down("registry", "Capability registry not available");
        }
        int size = registry.size();
        if (size == 0) {
            return new HealthStatus("registry", HealthStatus.Status.DEGRADED,
                    "No capabilities registered", Map.of("capabilities", "0"));
        }
        return new HealthStatus("registry", HealthStatus.Status.UP,
                size + " capabilities registered", Map.of("capabilities", String.valueOf(size)));
    }

    private HealthStatus checkModels() {
        if (adapters == null || adapters.names().isEmpty()) {
            return HealthStatus.degraded("models",
                    "No model adapters registered; generative capabilities will fail");
        }
        return HealthStatus.up("models", "Model adapters: " + String.join(", ", adapters.names()), Map.of());
    }

    private HealthStatus checkDocker() {
        // Docker is only required when it is the default backend
        HealthStatus.Status unavailable = isDockerDefault() ? HealthStatus.Status.DOWN : HealthStatus.Status.DEGRADED;
        DockerClient client;
        try {
            client = dockerClient.getIfAvailable();
        } catch (Exception e) {
            log.warn("Docker client could not be created: {}", e.getMessage());
            return new HealthStatus("docker", unavailable, "Docker client error: " + e.getMessage(), Map.of());
        }
        if (client == null) {
            return new HealthStatus("docker", unavailable, "No Docker client configured", Map.of());
        }
        try {
            client.pingCmd().exec();
            return HealthStatus.up("docker", "Docker daemon reachable", Map.of("image", sandboxProperties.getImage()));
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return new HealthStatus("docker", unavailable, "Docker error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPython() {
        String command = sandboxProperties.getPythonCommand();
        try {
            Process process = new ProcessBuilder(command, "--version").redirectErrorStream(true).start();
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return HealthStatus.degraded("python", command + " --version did not answer in 5s");
            }
            String version = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.exitValue() != 0) {
                return HealthStatus.degraded("python", command + " exited with " + process.exitValue());
            }
            return HealthStatus.up("python", version, Map.of("command", command));
        } catch (IOException e) {
            return HealthStatus.degraded("python", command + " not found; the process backend cannot run Python");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.degraded("python", "Interrupted");
        }
    }

    private boolean isDockerDefault() {
        try {
            return IsolationBackend.fromName(sandboxProperties.getDefaultBackend()) == IsolationBackend.DOCKER;
        } catch (RuntimeException e) {
            return false;
        }
    }
}
