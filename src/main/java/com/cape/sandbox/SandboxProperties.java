package com.cape.sandbox;

import com.cape.core.model.RiskLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "cape")
public class SandboxProperties {

    private Sandbox sandbox = new Sandbox();

    // -- Sandbox accessors (delegate to nested) --
    public String getDefaultBackend() { return sandbox.defaultBackend; }
    public int getTimeoutSeconds() { return sandbox.timeoutSeconds; }
    public int getMemoryLimitMb() { return sandbox.memoryLimitMb; }
    public int getCpuPercent() { return sandbox.cpuPercent; }
    public String getImage() { return sandbox.image; }
    public boolean isPullMissingImage() { return sandbox.pullMissingImage; }
    public String getPythonCommand() { return sandbox.pythonCommand; }
    public String getContainerPythonCommand() { return sandbox.containerPythonCommand; }
    public String getShellCommand() { return sandbox.shellCommand; }
    public int getInstallTimeoutSeconds() { return sandbox.installTimeoutSeconds; }
    public RiskLevel getInProcessMaxRisk() { return sandbox.inProcessMaxRisk; }
    public String getDockerHost() { return sandbox.dockerHost; }
    public String getContainerUser() { return sandbox.containerUser; }

    /**
     * Directory session working areas are created under. Defaults to
     * {@code <java.io.tmpdir>/cape}.
     */
    public Path getWorkRoot() {
        if (sandbox.workRoot != null && !sandbox.workRoot.isBlank()) {
            return Path.of(sandbox.workRoot);
        }
        return Path.of(System.getProperty("java.io.tmpdir"), "cape");
    }

    public Sandbox getSandbox() { return sandbox; }
    public void setSandbox(Sandbox sandbox) { this.sandbox = sandbox; }

    public static class Sandbox {
        private String defaultBackend = "docker";
        private int timeoutSeconds = 30;
        private int memoryLimitMb = 512;
        private int cpuPercent = 50;
        private String image = "cape-sandbox:latest";
        private boolean pullMissingImage = true;
        private String pythonCommand = "python3";
        private String containerPythonCommand = "python";
        private String shellCommand = "sh";
        private int installTimeoutSeconds = 120;
        private String workRoot = "";
        private RiskLevel inProcessMaxRisk = RiskLevel.LOW;
        private String dockerHost = "";
        /** uid:gid for container processes; blank means the owner of the session's work directory. */
        private String containerUser = "";

        public String getDefaultBackend() { return defaultBackend; }
        public void setDefaultBackend(String defaultBackend) { this.defaultBackend = defaultBackend; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public int getMemoryLimitMb() { return memoryLimitMb; }
        public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
        public int getCpuPercent() { return cpuPercent; }
        public void setCpuPercent(int cpuPercent) { this.cpuPercent = cpuPercent; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public boolean isPullMissingImage() { return pullMissingImage; }
        public void setPullMissingImage(boolean pullMissingImage) { this.pullMissingImage = pullMissingImage; }
        public String getPythonCommand() { return pythonCommand; }
        public void setPythonCommand(String pythonCommand) { this.pythonCommand = pythonCommand; }
        public String getContainerPythonCommand() { return containerPythonCommand; }
        public void setContainerPythonCommand(String containerPythonCommand) { this.containerPythonCommand = containerPythonCommand; }
        public String getShellCommand() { return shellCommand; }
        public void setShellCommand(String shellCommand) { this.shellCommand = shellCommand; }
        public int getInstallTimeoutSeconds() { return installTimeoutSeconds; }
        public void setInstallTimeoutSeconds(int installTimeoutSeconds) { this.installTimeoutSeconds = installTimeoutSeconds; }
        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public RiskLevel getInProcessMaxRisk() { return inProcessMaxRisk; }
        public void setInProcessMaxRisk(RiskLevel inProcessMaxRisk) { this.inProcessMaxRisk = inProcessMaxRisk; }
        public String getDockerHost() { return dockerHost; }
        public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
        public String getContainerUser() { return containerUser; }
        public void setContainerUser(String containerUser) { this.containerUser = containerUser; }
    }
}
