package com.cape.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Builds the three backends from configuration. The Docker client is only
 * resolved when a docker session is actually created, so the engine starts
 * on hosts without a Docker daemon.
 */
@Component
public class DefaultSandboxFactory implements SandboxFactory {

    private final SandboxProperties properties;
    private final ObjectMapper objectMapper;
    private final InProcessFunctionRegistry functions;
    private final Supplier<DockerClient> dockerClient;

    @Autowired
    public DefaultSandboxFactory(SandboxProperties properties, ObjectMapper objectMapper,
                                 InProcessFunctionRegistry functions, ObjectProvider<DockerClient> dockerClient) {
        this(properties, objectMapper, functions, (Supplier<DockerClient>) dockerClient::getIfAvailable);
    }

    public DefaultSandboxFactory(SandboxProperties properties, ObjectMapper objectMapper,
                                 InProcessFunctionRegistry functions, Supplier<DockerClient> dockerClient) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.functions = functions;
        this.dockerClient = dockerClient;
    }

    @Override
    public Sandbox create(String sessionId, IsolationBackend backend, SessionConfig config) {
        return switch (backend) {
            case IN_PROCESS -> new InProcessSandbox(sessionId, config, properties.getWorkRoot(), objectMapper, functions);
            case PROCESS -> new ProcessSandbox(sessionId, config, properties.getWorkRoot(), objectMapper, properties);
            case DOCKER -> {
                DockerClient client = dockerClient.get();
                if (client == null) {
                    throw new UnsupportedIsolationException(backend.configName(), "no Docker client is configured");
                }
                yield new DockerSandbox(sessionId, config, properties.getWorkRoot(), objectMapper, client, properties);
            }
        };
    }
}
