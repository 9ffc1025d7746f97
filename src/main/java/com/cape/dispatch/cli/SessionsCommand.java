package com.cape.dispatch.cli;

import com.cape.sandbox.Sandbox;
import com.cape.sandbox.SandboxManager;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;

/**
 * CLI command: cape sessions
 */
@Command(name = "sessions", mixinStandardHelpOptions = true, description = "List live sandbox sessions")
@Component
public class SessionsCommand implements Runnable {

    private final SandboxManager sandboxManager;

    public SessionsCommand(SandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        List<Sandbox> sessions = sandboxManager.sessions();
        ConsoleOutput.info("Default backend: " + sandboxManager.defaultBackend());
        if (sessions.isEmpty()) {
            ConsoleOutput.info("No live sessions");
            return;
        }
        for (Sandbox sandbox : sessions) {
            ConsoleOutput.sandbox(String.format("%s  %s  %s  %s", sandbox.sessionId(),
                    sandbox.backend().configName(), sandbox.state(), sandbox.workDir()));
        }
    }
}
