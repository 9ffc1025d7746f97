package com.cape.dispatch.cli;

import com.cape.core.model.CapabilityResult;
import com.cape.runtime.CapabilityRuntime;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

/**
 * CLI command: cape run &lt;capability-id&gt; [-i key=value]...
 * <p>
 * Executes one capability and prints the result as JSON. Input values are
 * parsed as JSON where possible, so {@code -i count=3} passes a number and
 * {@code -i name=report} a string. Exits with 1 when the capability fails.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute a capability")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Capability id")
    private String capabilityId;

    @Option(names = {"--input", "-i"}, description = "Input as key=value (repeatable)")
    private Map<String, String> inputs = new LinkedHashMap<>();

    @Option(names = {"--session", "-s"}, description = "Sandbox session to run code in")
    private String session;

    @Option(names = {"--model", "-m"}, description = "Model adapter for generative capabilities")
    private String model;

    @Option(names = {"--output-dir", "-o"}, description = "Directory to write produced files into")
    private Path outputDir;

    private final CapabilityRuntime runtime;
    private final ObjectMapper objectMapper;

    public RunCommand(CapabilityRuntime runtime, ObjectMapper objectMapper) {
        this.runtime = runtime;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Integer call() {
        var parsed = new LinkedHashMap<String, Object>();
        inputs.forEach((key, value) -> parsed.put(key, parseValue(value)));

        CapabilityResult result = runtime.execute(capabilityId, parsed, session, model);
        try {
            System.out.println(objectMapper.writeValueAsString(toView(result)));
        } catch (JsonProcessingException e) {
            ConsoleOutput.error("Could not render result: " + e.getMessage());
        }
        if (outputDir != null && !result.producedFiles().isEmpty()) {
            writeProducedFiles(result);
        }
        return result.success() ? 0 : 1;
    }

    private Object parseValue(String value) {
        try {
            return objectMapper.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            return value;
        }
    }

    private void writeProducedFiles(CapabilityResult result) {
        for (var entry : result.producedFiles().entrySet()) {
            Path target = outputDir.resolve(entry.getKey()).normalize();
            if (!target.startsWith(outputDir.normalize())) {
                ConsoleOutput.error("Skipping file outside output directory: " + entry.getKey());
                continue;
            }
            try {
                Files.createDirectories(target.getParent());
                Files.write(target, entry.getValue());
                ConsoleOutput.fileProduced(target.toString(), entry.getValue().length);
            } catch (IOException e) {
                ConsoleOutput.error("Could not write " + target + ": " + e.getMessage());
            }
        }
    }

    static Map<String, Object> toView(CapabilityResult result) {
        var view = new LinkedHashMap<String, Object>();
        view.put("capability_id", result.capabilityId());
        view.put("success", result.success());
        view.put("output", result.output());
        if (result.error() != null) {
            view.put("error", Map.of("kind", result.error().kind().name(), "message", result.error().message()));
        }
        view.put("elapsed_ms", result.elapsedMs());
        var files = new TreeMap<String, Integer>();
        result.producedFiles().forEach((name, content) -> files.put(name, content.length));
        view.put("produced_files", files);
        view.put("trace_id", result.traceId());
        view.put("steps_executed", result.stepsExecuted());
        if (result.failedStep() != null) {
            view.put("failed_step", result.failedStep());
        }
        view.put("tokens_used", result.tokensUsed());
        view.put("metadata", result.metadata());
        return view;
    }
}
