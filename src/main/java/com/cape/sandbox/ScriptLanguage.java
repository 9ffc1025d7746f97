package com.cape.sandbox;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Languages a script-running sandbox can execute, with the runner each one
 * needs to honour the exchange-file contract.
 */
public enum ScriptLanguage {

    PYTHON(".py", "_runner.py"),
    SHELL(".sh", "_runner.sh");

    static final String MAIN_FILE = "_main.py";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String PYTHON_RUNNER = """
            import json
            import os
            import sys
            import traceback

            _here = os.path.dirname(os.path.abspath(__file__))
            for _path in (os.environ.get("CAPE_DEPS_DIR", ""), os.path.join(_here, "scripts"), _here):
                if _path and os.path.isdir(_path) and _path not in sys.path:
                    sys.path.insert(0, _path)

            with open(os.environ.get("CAPE_ARGS_FILE", "_args.json"), encoding="utf-8") as _f:
                _payload = json.load(_f)
            args = _payload.get("args", {})
            inputs = args
            _namespace = {"__name__": "__main__", "args": args, "inputs": inputs}

            try:
                with open(os.path.join(_here, "_main.py"), encoding="utf-8") as _f:
                    exec(compile(_f.read(), "_main.py", "exec"), _namespace)
                _function = %s
                if _function:
                    _namespace["result"] = _namespace[_function](**args)
                if "result" in _namespace:
                    with open(os.environ.get("CAPE_RESULT_FILE", "_result.json"), "w", encoding="utf-8") as _f:
                        json.dump(_namespace["result"], _f, default=str)
            except Exception as _e:
                with open(os.path.join(_here, "_error.json"), "w", encoding="utf-8") as _f:
                    json.dump({"error": str(_e), "type": type(_e).__name__,
                               "traceback": traceback.format_exc()}, _f)
                traceback.print_exc()
                sys.exit(1)
            """;

    private final String extension;
    private final String runnerFile;

    ScriptLanguage(String extension, String runnerFile) {
        this.extension = extension;
        this.runnerFile = runnerFile;
    }

    public String extension() {
        return extension;
    }

    public String runnerFile() {
        return runnerFile;
    }

    public static ScriptLanguage fromName(String name) {
        if (name == null || name.isBlank()) {
            return PYTHON;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "python", "python3", "py" -> PYTHON;
            case "shell", "sh", "bash" -> SHELL;
            default -> throw new IllegalArgumentException("Unsupported script language: " + name);
        };
    }

    /**
     * Infers the language from a script's extension, defaulting to Python.
     */
    public static ScriptLanguage forPath(Path script) {
        String fileName = script.getFileName().toString();
        return fileName.endsWith(SHELL.extension) ? SHELL : PYTHON;
    }

    /**
     * Writes the runner for {@code source} into {@code runDir}.
     *
     * @param function optional Python function called with the arguments as keywords
     * @return path of the file the interpreter should execute
     */
    public Path writeRunner(Path runDir, String source, String function) throws IOException {
        if (this == SHELL) {
            Path runner = runDir.resolve(runnerFile);
            Files.writeString(runner, source, StandardCharsets.UTF_8);
            return runner;
        }
        String functionLiteral = "None";
        if (function != null && !function.isBlank()) {
            if (!IDENTIFIER.matcher(function).matches()) {
                throw new IllegalArgumentException("Invalid function name: " + function);
            }
            functionLiteral = "\"" + function + "\"";
        }
        Files.writeString(runDir.resolve(MAIN_FILE), source, StandardCharsets.UTF_8);
        Path runner = runDir.resolve(runnerFile);
        Files.writeString(runner, PYTHON_RUNNER.formatted(functionLiteral), StandardCharsets.UTF_8);
        return runner;
    }
}
