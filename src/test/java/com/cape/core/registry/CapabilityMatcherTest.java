package com.cape.core.registry;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ExecutionType;
import com.cape.core.model.MatchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityMatcherTest {

    private CapabilityMatcher matcher;
    private List<CapabilityDescriptor> catalogue;

    @BeforeEach
    void setUp() {
        matcher = new CapabilityMatcher(new MatcherProperties(), null, null);
        catalogue = List.of(
                CapabilityDescriptor.builder("spreadsheet-analyzer", ExecutionType.CODE)
                        .description("Computes statistics for workbook sheets")
                        .intents("analyze spreadsheet", "summarize excel workbook")
                        .tags("excel", ".xlsx", ".csv")
                        .build(),
                CapabilityDescriptor.builder("pdf-extract", ExecutionType.CODE)
                        .description("Extracts text and tables from PDF documents")
                        .intents("extract text from pdf")
                        .tags("pdf", ".pdf")
                        .build(),
                CapabilityDescriptor.builder("summarize", ExecutionType.GENERATIVE)
                        .description("Summarizes long text")
                        .intents("summarize text", "write a summary")
                        .tags("text")
                        .build());
    }

    // ── Scenarios ───────────────────────────────────────────────────────

    @Test
    @DisplayName("Intent phrase embedded in a longer request ranks first")
    void spreadsheetRequestRanksAnalyzerFirst() {
        List<MatchResult> results = matcher.match(catalogue, "please analyze this spreadsheet for me");

        assertFalse(results.isEmpty());
        MatchResult top = results.get(0);
        assertEquals("spreadsheet-analyzer", top.capabilityId());
        assertTrue(top.score() > 0.3, "score was " + top.score());
        assertEquals(MatchResult.Kind.INTENT, top.kind());
    }

    @Test
    @DisplayName("Every intent phrase finds its own capability")
    void everyIntentMatchesItsDescriptor() {
        for (CapabilityDescriptor descriptor : catalogue) {
            for (String intent : descriptor.intents()) {
                List<MatchResult> results = matcher.match(catalogue, intent);
                assertTrue(results.stream().anyMatch(r -> r.capabilityId().equals(descriptor.id()) && r.score() > 0),
                        "'" + intent + "' did not match " + descriptor.id());
            }
        }
    }

    @Test
    @DisplayName("Naming a capability id is an exact match")
    void exactIdMatch() {
        List<MatchResult> results = matcher.match(catalogue, "run pdf_extract on this");

        assertEquals("pdf-extract", results.get(0).capabilityId());
        assertEquals(1.0, results.get(0).score());
        assertEquals(MatchResult.Kind.EXACT, results.get(0).kind());
    }

    @Test
    @DisplayName("Equal scores are ordered by id")
    void tieBreakById() {
        var twins = List.of(
                CapabilityDescriptor.builder("b-convert", ExecutionType.TOOL).intents("convert units").build(),
                CapabilityDescriptor.builder("a-convert", ExecutionType.TOOL).intents("convert units").build());

        List<MatchResult> results = matcher.match(twins, "convert units");

        assertEquals(List.of("a-convert", "b-convert"), results.stream().map(MatchResult::capabilityId).toList());
        assertEquals(results.get(0).score(), results.get(1).score());
    }

    @Test
    @DisplayName("Results below the threshold are dropped")
    void thresholdFiltersWeakMatches() {
        assertTrue(matcher.match(catalogue, "book a flight to lisbon").isEmpty());
        assertTrue(matcher.match(catalogue, "summarize text", 5, 0.99).isEmpty());
    }

    @Test
    @DisplayName("topK limits the number of results")
    void topKLimitsResults() {
        List<MatchResult> results = matcher.match(catalogue, "summarize text from pdf and excel", 1, 0.0);

        assertEquals(1, results.size());
    }

    @Test
    @DisplayName("Blank query matches nothing")
    void blankQuery() {
        assertTrue(matcher.match(catalogue, "   ").isEmpty());
        assertTrue(matcher.matchBest(catalogue, "").isEmpty());
    }

    // ── Signals ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("Without a similarity scorer intent weight is renormalized")
    void renormalizedWeights() {
        MatchResult result = matcher.score(catalogue.get(2), new CapabilityMatcher.Query("write a summary"));

        // intent 1.0 only: 0.5 / 0.8
        assertEquals(0.625, result.score(), 1e-9);
    }

    @Test
    @DisplayName("Extension tags match file names in the query")
    void extensionTag() {
        double score = CapabilityMatcher.tagScore(catalogue.get(0), new CapabilityMatcher.Query("open report.xlsx"));

        assertEquals(0.4, score, 1e-9);
    }

    @Test
    @DisplayName("Two or more shared words give a partial intent score")
    void partialIntentOverlap() {
        double score = CapabilityMatcher.intentScore(catalogue.get(0),
                new CapabilityMatcher.Query("summarize my excel file"));

        // 2 of 3 words of "summarize excel workbook"
        assertEquals(0.5 + 0.5 * 2 / 3, score, 1e-9);
    }

    @Test
    @DisplayName("CJK intents match by character overlap")
    void cjkIntentOverlap() {
        var descriptor = CapabilityDescriptor.builder("table-analysis", ExecutionType.CODE)
                .intents("分析表格")
                .build();

        double score = CapabilityMatcher.intentScore(descriptor, new CapabilityMatcher.Query("请帮我分析这个表格"));

        assertEquals(1.0, score, 1e-9);
    }

    @Test
    @DisplayName("Example similarity contributes a fifth of the score")
    void similarityScorerAddsExampleSignal() {
        SimilarityScorer scorer = (query, text) -> text.contains("quarterly") ? 0.9 : 0.1;
        var withScorer = new CapabilityMatcher(new MatcherProperties(), scorer, null);
        var descriptor = CapabilityDescriptor.builder("revenue-report", ExecutionType.CODE)
                .examples("build the quarterly revenue report")
                .build();

        List<MatchResult> results = withScorer.match(List.of(descriptor), "numbers for Q3", 5, 0.0);

        assertEquals(1, results.size());
        assertEquals(0.18, results.get(0).score(), 1e-9);
        assertEquals(MatchResult.Kind.SCORED, results.get(0).kind());
    }

    @Test
    @DisplayName("A failing similarity scorer is ignored")
    void failingScorerIgnored() {
        SimilarityScorer scorer = (query, text) -> {
            throw new IllegalStateException("embedding service down");
        };
        var withScorer = new CapabilityMatcher(new MatcherProperties(), scorer, null);
        var descriptor = CapabilityDescriptor.builder("revenue-report", ExecutionType.CODE)
                .intents("revenue report")
                .examples("build the quarterly revenue report")
                .build();

        List<MatchResult> results = withScorer.match(List.of(descriptor), "revenue report");

        assertEquals(0.5, results.get(0).score(), 1e-9);
    }
}
