package com.cape.sandbox;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One unit of work handed to a sandbox. Built per call by the executor.
 *
 * @param language  interpreter for {@code script} or {@code code}
 * @param script    script file to run, read at execution time
 * @param code      inline source, used when {@code script} is null
 * @param function  Python function to call, or the in-process function name
 * @param args      arguments, written to the args file
 * @param env       environment overrides
 * @param files     input files, relative name to content
 * @param timeout   wall-clock limit; the session default applies when null
 */
public record ExecutionRequest(
    ScriptLanguage language,
    Path script,
    String code,
    String function,
    Map<String, Object> args,
    Map<String, String> env,
    Map<String, byte[]> files,
    Duration timeout
) {

    public ExecutionRequest {
        if (script == null && (code == null || code.isBlank()) && (function == null || function.isBlank())) {
            throw new IllegalArgumentException("Execution request needs a script, inline code or a function");
        }
        language = language != null ? language
                : script != null ? ScriptLanguage.forPath(script) : ScriptLanguage.PYTHON;
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        env = env == null ? Map.of() : Map.copyOf(env);
        files = files == null ? Map.of() : Map.copyOf(files);
    }

    public static ExecutionRequest code(ScriptLanguage language, String code) {
        return new ExecutionRequest(language, null, code, null, null, null, null, null);
    }

    public static ExecutionRequest script(Path script) {
        return new ExecutionRequest(null, script, null, null, null, null, null, null);
    }

    public static ExecutionRequest function(String name) {
        return new ExecutionRequest(ScriptLanguage.PYTHON, null, null, name, null, null, null, null);
    }

    public ExecutionRequest withArgs(Map<String, Object> args) {
        return new ExecutionRequest(language, script, code, function, args, env, files, timeout);
    }

    public ExecutionRequest withEnv(Map<String, String> env) {
        return new ExecutionRequest(language, script, code, function, args, env, files, timeout);
    }

    public ExecutionRequest withFiles(Map<String, byte[]> files) {
        return new ExecutionRequest(language, script, code, function, args, env, files, timeout);
    }

    public ExecutionRequest withFunction(String function) {
        return new ExecutionRequest(language, script, code, function, args, env, files, timeout);
    }

    public ExecutionRequest withTimeout(Duration timeout) {
        return new ExecutionRequest(language, script, code, function, args, env, files, timeout);
    }
}
