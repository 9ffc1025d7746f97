package com.cape.sandbox;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;

/**
 * Arguments and I/O handed to an {@link InProcessFunction}.
 *
 * @param args   call arguments
 * @param env    environment overrides plus the exchange-file variables
 * @param runDir working directory of this execution
 * @param out    captured as stdout
 * @param err    captured as stderr
 */
public record InProcessInvocation(
    Map<String, Object> args,
    Map<String, String> env,
    Path runDir,
    PrintWriter out,
    PrintWriter err
) {}
