package com.cape.core.registry;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "cape.matcher")
public class MatcherProperties {

    private int topK = 5;
    private double threshold = 0.3;
    private boolean embeddingsEnabled = false;

    public int getTopK() { return topK; }
    public void setTopK(int topK) { this.topK = topK; }
    public double getThreshold() { return threshold; }
    public void setThreshold(double threshold) { this.threshold = threshold; }
    public boolean isEmbeddingsEnabled() { return embeddingsEnabled; }
    public void setEmbeddingsEnabled(boolean embeddingsEnabled) { this.embeddingsEnabled = embeddingsEnabled; }
}
