package com.cape.sandbox;

/**
 * A JVM function the in-process backend can run. Declared as Spring beans
 * and looked up by {@link #name()}.
 */
public interface InProcessFunction {

    String name();

    /**
     * Runs the function. The returned value becomes the structured output.
     * Files written under {@link InProcessInvocation#runDir()} are reported as
     * produced files.
     */
    Object apply(InProcessInvocation invocation) throws Exception;
}
