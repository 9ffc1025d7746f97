package com.cape.sandbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The file contract between the engine and executed code (ABI version 1).
 *
 * <ul>
 *   <li>{@code _args.json}: written by the engine, {@code {"abi_version":1,"args":{...}}}</li>
 *   <li>{@code _result.json}: optionally written by the code, any JSON value</li>
 *   <li>{@code _error.json}: written by the Python runner on an uncaught exception</li>
 * </ul>
 *
 * <p>Every path segment starting with {@code _}, and {@code __pycache__}, is
 * reserved and never reported as a produced file.
 */
public final class ExchangeFiles {

    private static final Logger log = LoggerFactory.getLogger(ExchangeFiles.class);

    public static final int ABI_VERSION = 1;
    public static final String ARGS_FILE = "_args.json";
    public static final String RESULT_FILE = "_result.json";
    public static final String ERROR_FILE = "_error.json";
    public static final String DEPS_DIR = "_deps";

    public static final String ENV_ABI_VERSION = "CAPE_ABI_VERSION";
    public static final String ENV_ARGS_FILE = "CAPE_ARGS_FILE";
    public static final String ENV_RESULT_FILE = "CAPE_RESULT_FILE";
    public static final String ENV_DEPS_DIR = "CAPE_DEPS_DIR";
    public static final String ENV_SESSION_ID = "CAPE_SESSION_ID";
    public static final String ENV_ARG_PREFIX = "CAPE_ARG_";

    private ExchangeFiles() {}

    public static void writeArgs(ObjectMapper mapper, Path runDir, Map<String, Object> args) throws IOException {
        var payload = new LinkedHashMap<String, Object>();
        payload.put("abi_version", ABI_VERSION);
        payload.put("args", args);
        Files.write(runDir.resolve(ARGS_FILE), mapper.writeValueAsBytes(payload));
    }

    /**
     * Reads the structured output if the code wrote one. A result file that is
     * not valid JSON is returned as raw text.
     */
    public static Optional<Object> readResult(ObjectMapper mapper, Path runDir) throws IOException {
        Path resultFile = runDir.resolve(RESULT_FILE);
        if (!Files.isRegularFile(resultFile)) {
            return Optional.empty();
        }
        String text = Files.readString(resultFile, StandardCharsets.UTF_8);
        try {
            return Optional.ofNullable(mapper.readValue(text, Object.class));
        } catch (JsonProcessingException e) {
            log.warn("{} is not valid JSON, returning it as text: {}", RESULT_FILE, e.getOriginalMessage());
            return Optional.of(text);
        }
    }

    /**
     * Reads the runner's error report as {@code "Type: message"}.
     */
    public static Optional<String> readError(ObjectMapper mapper, Path runDir) {
        Path errorFile = runDir.resolve(ERROR_FILE);
        if (!Files.isRegularFile(errorFile)) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(errorFile.toFile());
            String type = node.path("type").asText("");
            String message = node.path("error").asText("");
            return Optional.of(type.isEmpty() ? message : type + ": " + message);
        } catch (IOException e) {
            log.warn("Could not read {}: {}", ERROR_FILE, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Exposes scalar arguments as {@code CAPE_ARG_<NAME>} environment variables
     * for shell scripts. Names are upper-cased, other characters become {@code _}.
     */
    public static Map<String, String> argumentEnvironment(Map<String, Object> args) {
        var env = new LinkedHashMap<String, String>();
        args.forEach((name, value) -> {
            if (value instanceof CharSequence || value instanceof Number || value instanceof Boolean) {
                env.put(argumentVariable(name), value.toString());
            }
        });
        return env;
    }

    public static String argumentVariable(String name) {
        return ENV_ARG_PREFIX + name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }

    public static boolean isReserved(String relativePath) {
        for (String segment : relativePath.split("/")) {
            if (segment.startsWith("_")) {
                return true;
            }
        }
        return false;
    }
}
