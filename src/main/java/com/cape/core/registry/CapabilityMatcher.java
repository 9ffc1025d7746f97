package com.cape.core.registry;

import com.cape.core.metrics.CapeMetrics;
import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores capability descriptors against free-text queries.
 *
 * <p>A query naming a capability id scores 1.0. Otherwise the score is a
 * weighted sum of three signals, each in [0, 1]:
 * <ol>
 *   <li>intent phrases (weight 0.5)</li>
 *   <li>tags, file-type tags and description keywords (weight 0.3)</li>
 *   <li>similarity to worked examples (weight 0.2), only when a
 *       {@link SimilarityScorer} is available</li>
 * </ol>
 * Without a scorer the first two weights are renormalized to 0.625 and 0.375.
 * Results are ordered by score descending, then id ascending.
 */
@Component
public class CapabilityMatcher {

    private static final Logger log = LoggerFactory.getLogger(CapabilityMatcher.class);

    static final double INTENT_WEIGHT = 0.5;
    static final double TAG_WEIGHT = 0.3;
    static final double EXAMPLE_WEIGHT = 0.2;

    private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern ID_SPLIT = Pattern.compile("[^\\p{L}\\p{N}_-]+");
    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "for", "with", "this", "that", "from", "into", "your", "you", "are", "can");

    private final MatcherProperties properties;
    private final SimilarityScorer similarityScorer;
    private final CapeMetrics metrics;

    public CapabilityMatcher(MatcherProperties properties,
                             @Autowired(required = false) SimilarityScorer similarityScorer,
                             @Autowired(required = false) CapeMetrics metrics) {
        this.properties = properties;
        this.similarityScorer = similarityScorer;
        this.metrics = metrics;
    }

    public List<MatchResult> match(Collection<CapabilityDescriptor> candidates, String query) {
        return match(candidates, query, properties.getTopK(), properties.getThreshold());
    }

    /**
     * @param topK      maximum number of results
     * @param threshold results scoring below this are dropped
     */
    public List<MatchResult> match(Collection<CapabilityDescriptor> candidates, String query,
                                   int topK, double threshold) {
        if (query == null || query.isBlank() || topK <= 0) {
            return List.of();
        }
        var prepared = new Query(query);
        var results = new ArrayList<MatchResult>();
        for (CapabilityDescriptor descriptor : candidates) {
            MatchResult result = score(descriptor, prepared);
            if (result.score() > 0 && result.score() >= threshold) {
                results.add(result);
            }
        }
        results.sort(Comparator.comparingDouble(MatchResult::score).reversed()
                .thenComparing(MatchResult::capabilityId));
        List<MatchResult> top = results.size() > topK ? List.copyOf(results.subList(0, topK)) : List.copyOf(results);
        if (metrics != null) {
            metrics.recordMatch(top.size());
        }
        log.debug("Query '{}' matched {} of {} capabilities", query, top.size(), candidates.size());
        return top;
    }

    public Optional<MatchResult> matchBest(Collection<CapabilityDescriptor> candidates, String query) {
        return match(candidates, query, 1, properties.getThreshold()).stream().findFirst();
    }

    MatchResult score(CapabilityDescriptor descriptor, Query query) {
        if (query.idTokens.contains(descriptor.id()) || query.normalized.equals(descriptor.id())) {
            return new MatchResult(descriptor.id(), 1.0, MatchResult.Kind.EXACT);
        }
        double intent = intentScore(descriptor, query);
        double tags = tagScore(descriptor, query);
        double total;
        if (similarityScorer != null) {
            total = INTENT_WEIGHT * intent + TAG_WEIGHT * tags + EXAMPLE_WEIGHT * exampleScore(descriptor, query);
        } else {
            double weights = INTENT_WEIGHT + TAG_WEIGHT;
            total = (INTENT_WEIGHT * intent + TAG_WEIGHT * tags) / weights;
        }
        total = Math.round(Math.min(1.0, total) * 10_000) / 10_000.0;
        return new MatchResult(descriptor.id(), total, intent > 0 ? MatchResult.Kind.INTENT : MatchResult.Kind.SCORED);
    }

    static double intentScore(CapabilityDescriptor descriptor, Query query) {
        double best = 0.0;
        for (String phrase : descriptor.intents()) {
            String intent = phrase.toLowerCase(Locale.ROOT).trim();
            if (intent.isEmpty()) {
                continue;
            }
            if (query.lower.contains(intent) || intent.contains(query.lower)) {
                return 1.0;
            }
            Set<String> intentWords = words(intent);
            long overlap = intentWords.stream().filter(query.words::contains).count();
            if (overlap >= 2) {
                best = Math.max(best, 0.5 + 0.5 * overlap / intentWords.size());
            } else if (query.cjk) {
                best = Math.max(best, cjkOverlap(intent, query.lower));
            }
        }
        return best;
    }

    static double tagScore(CapabilityDescriptor descriptor, Query query) {
        double score = 0.0;
        for (String raw : descriptor.tags()) {
            String tag = raw.toLowerCase(Locale.ROOT).trim();
            if (tag.isEmpty()) {
                continue;
            }
            if (tag.startsWith(".")) {
                if (query.words.contains(tag.substring(1)) || query.lower.contains(tag)) {
                    score += 0.4;
                }
            } else if (tag.length() >= 3 ? query.lower.contains(tag) : query.words.contains(tag)) {
                score += 0.4;
            }
        }
        double keywords = 0.0;
        for (String word : words(descriptor.description().toLowerCase(Locale.ROOT))) {
            if (word.length() >= 3 && !STOPWORDS.contains(word) && query.words.contains(word)) {
                keywords += 0.1;
            }
        }
        score += Math.min(keywords, 0.3);
        return Math.min(score, 1.0);
    }

    private double exampleScore(CapabilityDescriptor descriptor, Query query) {
        double best = 0.0;
        for (String example : descriptor.examples()) {
            try {
                double similarity = similarityScorer.similarity(query.original, example);
                best = Math.max(best, Math.max(0.0, Math.min(1.0, similarity)));
            } catch (RuntimeException e) {
                log.warn("Similarity scoring failed for '{}', ignoring examples: {}", descriptor.id(), e.getMessage());
                return 0.0;
            }
        }
        return best;
    }

    /**
     * Share of the intent's CJK characters that also appear in the query,
     * counted only from 0.6 upwards.
     */
    private static double cjkOverlap(String intent, String query) {
        Set<Integer> intentChars = intent.codePoints().filter(CapabilityMatcher::isCjk).boxed()
                .collect(Collectors.toSet());
        if (intentChars.isEmpty()) {
            return 0.0;
        }
        Set<Integer> queryChars = query.codePoints().boxed().collect(Collectors.toSet());
        long shared = intentChars.stream().filter(queryChars::contains).count();
        double ratio = (double) shared / intentChars.size();
        return ratio >= 0.6 ? ratio : 0.0;
    }

    private static boolean isCjk(int codePoint) {
        Character.UnicodeScript script = Character.UnicodeScript.of(codePoint);
        return script == Character.UnicodeScript.HAN
                || script == Character.UnicodeScript.HIRAGANA
                || script == Character.UnicodeScript.KATAKANA
                || script == Character.UnicodeScript.HANGUL;
    }

    private static Set<String> words(String text) {
        return Arrays.stream(WORD_SPLIT.split(text))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * A query lower-cased and tokenized once per match call.
     */
    static final class Query {
        final String original;
        final String lower;
        final String normalized;
        final Set<String> words;
        final Set<String> idTokens;
        final boolean cjk;

        Query(String query) {
            this.original = query.trim();
            this.lower = original.toLowerCase(Locale.ROOT);
            this.normalized = lower.replace('_', '-');
            this.words = words(lower);
            this.idTokens = new HashSet<>();
            for (String token : ID_SPLIT.split(normalized)) {
                if (!token.isEmpty()) {
                    idTokens.add(token);
                }
            }
            this.cjk = lower.codePoints().anyMatch(CapabilityMatcher::isCjk);
        }
    }
}
