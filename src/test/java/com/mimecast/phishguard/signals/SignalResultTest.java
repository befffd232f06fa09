package com.mimecast.phishguard.signals;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SignalResultTest {

    @Test
    void testEmpty() {
        SignalResult result = SignalResult.empty();

        assertEquals(SignalResult.Variant.SUCCESS, result.getVariant());
        assertEquals(0, result.getRiskScore());
        assertEquals(0, result.getConfidence());
        assertTrue(result.getIndicators().isEmpty());
        assertEquals(RiskLevel.LOW, result.getRiskLevel());
        assertTrue(result.getError().isEmpty());
        assertTrue(result.hasValidScore());
    }

    @Test
    void testIndicatorsAreDeduplicated() {
        SignalResult result = SignalResult.of(25, Arrays.asList("b", "a", "b"), 0.5);

        assertEquals(Set.of("a", "b"), result.getIndicators());
        assertTrue(result.hasIndicator("a"));
        assertFalse(result.hasIndicator("c"));
        assertThrows(UnsupportedOperationException.class, () -> result.getIndicators().add("c"));
    }

    @Test
    void testInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> SignalResult.of(-1, List.of(), 0.5));
        assertThrows(IllegalArgumentException.class, () -> SignalResult.of(Double.NaN, List.of(), 0.5));
        assertThrows(IllegalArgumentException.class, () -> SignalResult.of(10, List.of(), 1.1));
        assertThrows(IllegalArgumentException.class, () -> SignalResult.of(10, List.of(), -0.1));
    }

    @Test
    void testDegraded() {
        SignalResult result = SignalResult.degraded(10, 0.3, "basic_analysis_only", "No OCR");

        assertEquals(SignalResult.Variant.DEGRADED, result.getVariant());
        assertEquals(RiskLevel.LOW, result.getRiskLevel());
        assertEquals(Set.of("basic_analysis_only"), result.getIndicators());
        assertEquals("No OCR", result.getNote().orElse(null));
        assertTrue(result.hasValidScore());
    }

    @Test
    void testError() {
        SignalResult result = SignalResult.error("Failed to load image: nope");

        assertEquals(SignalResult.Variant.ERROR, result.getVariant());
        assertEquals(Set.of("analysis_error"), result.getIndicators());
        assertEquals("Failed to load image: nope", result.getError().orElse(null));
        assertEquals(0, result.getConfidence());
        assertFalse(result.hasValidScore());
    }

    @Test
    void testEquality() {
        assertEquals(SignalResult.of(10, List.of("x", "y"), 0.4), SignalResult.of(10, List.of("y", "x"), 0.4));
        assertNotEquals(SignalResult.of(10, List.of("x"), 0.4), SignalResult.of(10, List.of("x"), 0.5));
        assertEquals(SignalResult.of(10, List.of("x"), 0.4).hashCode(), SignalResult.of(10, List.of("x"), 0.4).hashCode());
    }
}
