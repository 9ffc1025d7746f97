package com.cape.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cosine similarity over Spring AI embeddings. Example embeddings are cached
 * for the life of the process; query embeddings are cached too since the same
 * query is scored against every example.
 */
@Component
@ConditionalOnProperty(name = "cape.matcher.embeddings-enabled", havingValue = "true")
public class EmbeddingSimilarityScorer implements SimilarityScorer {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingSimilarityScorer.class);

    private static final int MAX_CACHED = 10_000;

    private final EmbeddingModel embeddingModel;
    private final Map<String, float[]> cache = new ConcurrentHashMap<>();

    public EmbeddingSimilarityScorer(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
        log.info("Example similarity enabled using {}", embeddingModel.getClass().getSimpleName());
    }

    @Override
    public double similarity(String query, String text) {
        float[] a = embed(query);
        float[] b = embed(text);
        return Math.max(0.0, cosine(a, b));
    }

    private float[] embed(String text) {
        float[] cached = cache.get(text);
        if (cached != null) {
            return cached;
        }
        float[] vector = embeddingModel.embed(text);
        if (cache.size() < MAX_CACHED) {
            cache.put(text, vector);
        }
        return vector;
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) {
            return 0.0;
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
