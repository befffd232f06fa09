package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.KeywordMatcher;
import com.mimecast.phishguard.signals.detect.UrlInspector;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keywords and URLs in the text found by OCR.
 *
 * <p>Unlike free text a keyword category only scores once it reaches a minimum number of hits.
 */
public class OcrTextAnalysis implements ImageSubAnalysis {

    private static final double MAX_CONFIDENCE = 0.9;
    private static final int URL_SCORE = 20;

    private final Map<String, List<String>> keywords;
    private final Map<String, Rule> rules = new LinkedHashMap<>();
    private final UrlInspector urlInspector;

    /**
     * Constructs a new OcrTextAnalysis instance.
     *
     * @param config DetectionConfig instance.
     */
    public OcrTextAnalysis(DetectionConfig config) {
        this.keywords = config.getImageKeywords();
        this.urlInspector = new UrlInspector(config.getImageSuspiciousTlds(), Collections.emptyList(), Collections.emptyList());

        addRule(config, "login_form_indicators", "login_form_detected", 2, 30);
        addRule(config, "urgency_indicators", "urgency_language", 2, 25);
        addRule(config, "financial_indicators", "financial_content", 2, 20);
        addRule(config, "credential_indicators", "credential_requests", 3, 35);
    }

    private void addRule(DetectionConfig config, String category, String indicator, int threshold, int score) {
        rules.put(category, new Rule(indicator, config.getImageThreshold(category, threshold), score));
    }

    @Override
    public String getName() {
        return "ocr_text";
    }

    @Override
    public SignalResult analyze(ImageContext context) {
        String text = context.getOcrText().orElse("");
        if (text.isBlank()) {
            return SignalResult.empty();
        }

        String lower = context.getOcrTextLowerCase();
        Set<String> indicators = new HashSet<>();
        int score = 0;
        int hits = 0;

        for (Map.Entry<String, Rule> entry : rules.entrySet()) {
            int count = KeywordMatcher.count(lower, keywords.getOrDefault(entry.getKey(), Collections.emptyList()));
            hits += count;

            Rule rule = entry.getValue();
            if (count >= rule.threshold) {
                indicators.add(rule.indicator);
                score += rule.score;
            }
        }

        int suspiciousUrls = 0;
        for (String url : UrlInspector.extractUrls(text)) {
            if (urlInspector.isSuspicious(url)) {
                suspiciousUrls++;
            }
        }
        if (suspiciousUrls > 0) {
            indicators.add("suspicious_urls_in_text");
            score += suspiciousUrls * URL_SCORE;
        }

        return SignalResult.of(score, indicators, Math.min(MAX_CONFIDENCE, hits / 10.0));
    }

    /**
     * Keyword category scoring rule.
     */
    private static final class Rule {
        private final String indicator;
        private final int threshold;
        private final int score;

        private Rule(String indicator, int threshold, int score) {
            this.indicator = indicator;
            this.threshold = threshold;
            this.score = score;
        }
    }
}
