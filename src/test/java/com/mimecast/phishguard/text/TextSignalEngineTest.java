package com.mimecast.phishguard.text;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.signals.RiskLevel;
import com.mimecast.phishguard.signals.SignalResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class TextSignalEngineTest {

    private final TextSignalEngine engine = new TextSignalEngine(new DetectionConfig());

    @Test
    void testEmptyInput() {
        assertEquals(SignalResult.empty(), engine.analyze(""));
        assertEquals(SignalResult.empty(), engine.analyze(null));
        assertEquals(RiskLevel.LOW, engine.analyze("").getRiskLevel());
    }

    @Test
    void testPhishingMessage() {
        SignalResult result = engine.analyze(
                "URGENT: Your account will be suspended! Verify your password at http://secure-paypal.tk/login now!!!!");

        assertTrue(result.getIndicators().containsAll(Set.of(
                "urgency_keywords_found",
                "threat_keywords_found",
                "financial_keywords_found",
                "credential_keywords_found",
                "excessive_exclamations",
                "suspicious_url_in_text")));
        assertTrue(result.getRiskScore() >= 80);
        assertEquals(RiskLevel.CRITICAL, result.getRiskLevel());
    }

    @Test
    void testBenignMessage() {
        SignalResult result = engine.analyze("Lunch at noon on Friday? Bring the slides.");

        assertEquals(0, result.getRiskScore());
        assertTrue(result.getIndicators().isEmpty());
        assertEquals(0.52, result.getConfidence(), 1e-9);
    }

    @Test
    void testKeywordScoring() {
        SignalResult result = engine.analyzeKeywords("please verify your password for the bank account");

        assertEquals(Set.of("financial_keywords_found", "credential_keywords_found"), result.getIndicators());
        assertEquals(60, result.getRiskScore());
        assertEquals(0.7, result.getConfidence());
    }

    @Test
    void testLowRiskCategoryScoresTen() {
        SignalResult result = engine.analyzeKeywords("this is urgent, act now");

        assertEquals(Set.of("urgency_keywords_found"), result.getIndicators());
        assertEquals(20, result.getRiskScore());
    }

    @Test
    void testShoutingIsLowerCasedBeforePatterns() {
        SignalResult result = engine.analyze("HELLO WORLD THIS IS FINE");

        assertFalse(result.hasIndicator("excessive_caps"));
        assertEquals(0, result.getRiskScore());
        assertTrue(result.getIndicators().isEmpty());
    }

    @Test
    void testExclamations() {
        assertTrue(engine.analyzePatterns("wow!!!!", List.of()).hasIndicator("excessive_exclamations"));
        assertFalse(engine.analyzePatterns("wow!!!", List.of()).hasIndicator("excessive_exclamations"));
    }

    @Test
    void testSuspiciousUrlScoredOnce() {
        SignalResult result = engine.analyzePatterns("", List.of("http://10.0.0.1/a", "https://bank.tk/b"));

        assertEquals(Set.of("suspicious_url_in_text"), result.getIndicators());
        assertEquals(25, result.getRiskScore());
    }

    @Test
    void testMismatchedLinks() {
        String text = "[click here](http://evil.example.com)";
        assertTrue(engine.analyzePatterns(text, List.of()).hasIndicator("mismatched_urls"));

        String same = "[http://a.example.com](http://b.example.com)";
        assertFalse(engine.analyzePatterns(same, List.of()).hasIndicator("mismatched_urls"));
    }

    @Test
    void testLinks() {
        SignalResult result = engine.analyzeLinks(List.of("https://bit.ly/x", "https://tinyurl.com/y", "http://login-verify.example.com"));

        assertEquals(Set.of("url_shortened", "bad_url_reputation"), result.getIndicators());
        assertEquals(80, result.getRiskScore());
        assertEquals(0.8, result.getConfidence());
    }

    @Test
    void testShortenedLinkInText() {
        SignalResult result = engine.analyze("Check https://bit.ly/abc");

        assertEquals(Set.of("url_shortened"), result.getIndicators());
        assertEquals(20, result.getRiskScore());
    }

    @Test
    void testSenderFormat() {
        SignalResult result = engine.analyzeSenderFormat("dear customer, kindly reply");

        assertEquals(Set.of("impersonal_greeting", "poor_grammar"), result.getIndicators());
        assertEquals(25, result.getRiskScore());
        assertEquals(0.5, result.getConfidence());
    }

    @Test
    void testInvalidGrammarPatternSkipped() {
        Map<String, Object> text = new HashMap<>();
        text.put("poorGrammarPatterns", List.of("[unclosed", "\\bkindly\\b"));
        Map<String, Object> map = new HashMap<>();
        map.put("text", text);

        TextSignalEngine custom = new TextSignalEngine(new DetectionConfig(map));

        assertTrue(custom.analyzeSenderFormat("kindly reply").hasIndicator("poor_grammar"));
    }

    @Test
    void testGrammarPatternsIgnoreCase() throws IOException {
        TextSignalEngine custom = new TextSignalEngine(new DetectionConfig("src/test/resources/cfg/signals.json5"));

        assertTrue(custom.analyzeSenderFormat("please do the needful").hasIndicator("poor_grammar"));
    }

    @Test
    void testClassifierSpam() throws IOException {
        TextClassifier classifier = mock(TextClassifier.class);
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.getName()).thenReturn("mock");
        when(classifier.classify(anyString())).thenReturn(new ClassifierVerdict("SPAM", 0.9));

        SignalResult result = new TextSignalEngine(new DetectionConfig(), classifier).analyzeWithClassifier("win a prize");

        assertEquals(Set.of("ml_detected_spam"), result.getIndicators());
        assertEquals(45, result.getRiskScore(), 1e-9);
        assertEquals(0.9, result.getConfidence());
    }

    @Test
    void testClassifierHam() throws IOException {
        TextClassifier classifier = mock(TextClassifier.class);
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.classify(anyString())).thenReturn(new ClassifierVerdict(ClassifierVerdict.HAM, 0.8));

        SignalResult result = new TextSignalEngine(new DetectionConfig(), classifier).analyzeWithClassifier("see you at lunch");

        assertTrue(result.getIndicators().isEmpty());
        assertEquals(0, result.getRiskScore());
        assertEquals(0.8, result.getConfidence());
    }

    @Test
    void testClassifierGetsHeadOnly() throws IOException {
        TextClassifier classifier = mock(TextClassifier.class);
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.classify(anyString())).thenReturn(new ClassifierVerdict(ClassifierVerdict.HAM, 1.0));

        new TextSignalEngine(new DetectionConfig(), classifier).analyzeWithClassifier("a".repeat(600));

        verify(classifier).classify("a".repeat(512));
    }

    @Test
    void testClassifierFailureIsContained() throws IOException {
        TextClassifier classifier = mock(TextClassifier.class);
        when(classifier.isAvailable()).thenReturn(true);
        when(classifier.getName()).thenReturn("mock");
        when(classifier.classify(anyString())).thenThrow(new IOException("connection refused"));

        TextSignalEngine custom = new TextSignalEngine(new DetectionConfig(), classifier);
        SignalResult result = custom.analyze("Check https://bit.ly/abc");

        assertEquals(Set.of("url_shortened"), result.getIndicators());
        assertEquals(20, result.getRiskScore());
        assertEquals(0.52, result.getConfidence(), 1e-9);
    }

    @Test
    void testUnavailableClassifierNotCalled() throws IOException {
        TextClassifier classifier = mock(TextClassifier.class);
        when(classifier.isAvailable()).thenReturn(false);

        new TextSignalEngine(new DetectionConfig(), classifier).analyze("hello world");

        verify(classifier, never()).classify(anyString());
    }

    @Test
    void testDeterministic() {
        String text = "Dear customer, your invoice is overdue. Pay at https://bit.ly/pay!!!!";
        assertEquals(engine.analyze(text), engine.analyze(text));
    }

    @Test
    void testHealthy() {
        assertTrue(engine.isHealthy());
    }
}
