package com.cape.core.registry;

/**
 * Optional semantic signal for the matcher.
 */
public interface SimilarityScorer {

    /**
     * @return similarity of {@code query} and {@code text} in [0, 1]
     */
    double similarity(String query, String text);
}
