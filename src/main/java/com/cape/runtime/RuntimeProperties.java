package com.cape.runtime;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cape.runtime")
public class RuntimeProperties {

    /** Model adapter used when a call does not name one. */
    private String defaultModel = "openai";
    /** Threads for {@link CapabilityRuntime#submit}. */
    private int workerThreads = 4;
    private int maxWorkflowDepth = 8;

    public String getDefaultModel() { return defaultModel; }
    public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public int getMaxWorkflowDepth() { return maxWorkflowDepth; }
    public void setMaxWorkflowDepth(int maxWorkflowDepth) { this.maxWorkflowDepth = maxWorkflowDepth; }
}
