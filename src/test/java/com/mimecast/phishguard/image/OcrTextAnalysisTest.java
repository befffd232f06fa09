package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.signals.SignalResult;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.io.IOException;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OcrTextAnalysisTest {

    private final OcrTextAnalysis analysis = new OcrTextAnalysis(new DetectionConfig());

    private static ImageContext context(String text) {
        return new ImageContext(SyntheticImages.blank(10, 10, Color.WHITE), null, text);
    }

    @Test
    void testAllCategories() {
        SignalResult result = analysis.analyze(context(
                "Please login with your password and username. Urgent: act now! Verify your account payment. " +
                        "http://evil.tk/a and http://1.2.3.4/b"));

        assertEquals(Set.of("login_form_detected", "urgency_language", "financial_content", "credential_requests",
                "suspicious_urls_in_text"), result.getIndicators());
        assertEquals(150, result.getRiskScore());
        assertEquals(0.9, result.getConfidence());
    }

    @Test
    void testBelowThresholds() {
        SignalResult result = analysis.analyze(context("Password"));

        assertTrue(result.getIndicators().isEmpty());
        assertEquals(0, result.getRiskScore());
        assertEquals(0.2, result.getConfidence(), 1e-9);
    }

    @Test
    void testSafeUrlsIgnored() {
        SignalResult result = analysis.analyze(context("see https://example.com/docs"));

        assertFalse(result.hasIndicator("suspicious_urls_in_text"));
    }

    @Test
    void testNoText() {
        assertEquals(SignalResult.empty(), analysis.analyze(context(null)));
        assertEquals(SignalResult.empty(), analysis.analyze(context("   ")));
    }

    @Test
    void testConfiguredThreshold() throws IOException {
        OcrTextAnalysis custom = new OcrTextAnalysis(new DetectionConfig("src/test/resources/cfg/signals.json5"));

        assertEquals(Set.of("credential_requests"), custom.analyze(context("password")).getIndicators());
    }
}
