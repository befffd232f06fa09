package com.mimecast.phishguard.signals;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    @Test
    void testEmptyInput() {
        assertEquals(SignalResult.empty(), Aggregator.combine(Collections.emptyList()));
        assertEquals(SignalResult.empty(), Aggregator.combine((List<SignalResult>) null));
    }

    @Test
    void testSumsScoresAndAveragesConfidence() {
        SignalResult combined = Aggregator.combine(
                SignalResult.of(20, List.of("urgency_keywords_found"), 0.7),
                SignalResult.of(25, List.of("suspicious_url_in_text"), 0.6),
                SignalResult.of(0, List.of(), 0.8),
                SignalResult.of(15, List.of("impersonal_greeting"), 0.5),
                SignalResult.empty()
        );

        assertEquals(60, combined.getRiskScore());
        assertEquals(RiskLevel.HIGH, combined.getRiskLevel());
        assertEquals(0.52, combined.getConfidence(), 1e-9);
        assertEquals(Set.of("urgency_keywords_found", "suspicious_url_in_text", "impersonal_greeting"), combined.getIndicators());
    }

    @Test
    void testUnionDeduplicates() {
        SignalResult combined = Aggregator.combine(
                SignalResult.of(10, List.of("brand_mentions"), 0.5),
                SignalResult.of(10, List.of("brand_mentions", "paypal_color_pattern"), 0.5)
        );

        assertEquals(Set.of("brand_mentions", "paypal_color_pattern"), combined.getIndicators());
        assertEquals(20, combined.getRiskScore());
    }

    @Test
    void testSkipsInvalidEntries() {
        SignalResult combined = Aggregator.combine(Arrays.asList(
                SignalResult.of(30, List.of("a"), 0.9),
                null,
                SignalResult.error("collaborator down")
        ));

        assertEquals(30, combined.getRiskScore());
        assertEquals(0.9, combined.getConfidence(), 1e-9);
        assertFalse(combined.hasIndicator("analysis_error"));
    }

    @Test
    void testOnlyInvalidEntries() {
        SignalResult combined = Aggregator.combine(SignalResult.error("a"), SignalResult.error("b"));

        assertEquals(0, combined.getRiskScore());
        assertEquals(0, combined.getConfidence());
        assertTrue(combined.getIndicators().isEmpty());
    }

    @Test
    void testOrderIndependent() {
        List<SignalResult> results = new ArrayList<>();
        results.add(SignalResult.of(0.1, List.of("a"), 0.1));
        results.add(SignalResult.of(0.2, List.of("b"), 0.3));
        results.add(SignalResult.of(0.3, List.of("c"), 0.7));
        results.add(SignalResult.of(12.75, List.of("a", "d"), 0.9));
        results.add(SignalResult.of(1e-3, List.of(), 0.2));

        SignalResult expected = Aggregator.combine(results);
        Random random = new Random(42);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(results, random);
            assertEquals(expected, Aggregator.combine(results));
        }
    }
}
