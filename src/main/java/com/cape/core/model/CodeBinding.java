package com.cape.core.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * Where the code of a CODE or HYBRID capability comes from. Sources are
 * tried in order: {@code entrypoint}, then {@code code}, then the script in
 * {@code backendScripts} registered for the session's backend.
 *
 * @param entrypoint     script file on disk; sibling files with the same extension are bundled as helpers
 * @param code           inline source text
 * @param language       "python" or "shell"; inferred from the entrypoint extension when null
 * @param function       optional function the runner calls with the arguments as keywords
 * @param backendScripts fallback scripts keyed by backend name ("docker", "process", "in-process")
 */
public record CodeBinding(
    Path entrypoint,
    String code,
    String language,
    String function,
    Map<String, String> backendScripts
) {

    public CodeBinding {
        backendScripts = backendScripts == null ? Map.of() : Map.copyOf(backendScripts);
    }

    public static CodeBinding inline(String language, String code) {
        return new CodeBinding(null, code, language, null, Map.of());
    }

    public static CodeBinding script(Path entrypoint) {
        return new CodeBinding(entrypoint, null, null, null, Map.of());
    }
}
