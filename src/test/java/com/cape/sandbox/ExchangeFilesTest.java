package com.cape.sandbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeFilesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path runDir;

    @Test
    void argsFileCarriesAbiVersion() throws Exception {
        ExchangeFiles.writeArgs(mapper, runDir, Map.of("path", "data.csv"));

        var payload = mapper.readTree(runDir.resolve("_args.json").toFile());
        assertEquals(1, payload.get("abi_version").asInt());
        assertEquals("data.csv", payload.get("args").get("path").asText());
    }

    @Test
    void missingResultFileMeansNoOutput() throws Exception {
        assertTrue(ExchangeFiles.readResult(mapper, runDir).isEmpty());
    }

    @Test
    void resultFileIsParsedAsJson() throws Exception {
        Files.writeString(runDir.resolve("_result.json"), "{\"rows\": 3, \"ok\": true}");

        Object output = ExchangeFiles.readResult(mapper, runDir).orElseThrow();

        assertEquals(Map.of("rows", 3, "ok", true), output);
    }

    @Test
    void invalidResultJsonIsReturnedAsText() throws Exception {
        Files.writeString(runDir.resolve("_result.json"), "done, 3 rows");

        assertEquals("done, 3 rows", ExchangeFiles.readResult(mapper, runDir).orElseThrow());
    }

    @Test
    void errorFileIsSummarizedAsTypeAndMessage() throws Exception {
        Files.writeString(runDir.resolve("_error.json"),
                "{\"error\": \"division by zero\", \"type\": \"ZeroDivisionError\", \"traceback\": \"...\"}");

        assertEquals("ZeroDivisionError: division by zero", ExchangeFiles.readError(mapper, runDir).orElseThrow());
    }

    @Test
    void onlyScalarArgumentsBecomeEnvironmentVariables() {
        var args = new LinkedHashMap<String, Object>();
        args.put("content", "Title: Demo");
        args.put("max-rows", 10);
        args.put("dry_run", false);
        args.put("columns", List.of("a", "b"));

        Map<String, String> env = ExchangeFiles.argumentEnvironment(args);

        assertEquals(Map.of(
                "CAPE_ARG_CONTENT", "Title: Demo",
                "CAPE_ARG_MAX_ROWS", "10",
                "CAPE_ARG_DRY_RUN", "false"), env);
    }

    @Test
    void underscoreSegmentsAreReserved() {
        assertTrue(ExchangeFiles.isReserved("_result.json"));
        assertTrue(ExchangeFiles.isReserved("_deps/numpy/core.py"));
        assertTrue(ExchangeFiles.isReserved("out/_tmp.txt"));
        assertFalse(ExchangeFiles.isReserved("scripts/helper.py"));
    }
}
