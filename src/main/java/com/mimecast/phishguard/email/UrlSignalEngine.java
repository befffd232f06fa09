package com.mimecast.phishguard.email;

import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.text.TextSignalEngine;

import java.util.HashSet;
import java.util.Set;

/**
 * URL phishing verdicts.
 *
 * <p>The URL is analysed as text, then checked for excessive length, hyphens or dots.
 */
public class UrlSignalEngine {

    private final TextSignalEngine textEngine;

    /**
     * Constructs a new UrlSignalEngine instance.
     *
     * @param textEngine TextSignalEngine instance.
     */
    public UrlSignalEngine(TextSignalEngine textEngine) {
        this.textEngine = textEngine;
    }

    /**
     * Analyzes a URL.
     *
     * @param url URL string.
     * @return SignalResult instance.
     */
    public SignalResult analyze(String url) {
        SignalResult result = textEngine.analyze(url);
        if (url == null || !textEngine.getUrlInspector().hasSuspiciousStructure(url)) {
            return result;
        }

        Set<String> indicators = new HashSet<>(result.getIndicators());
        indicators.add("suspicious_url_structure");
        return SignalResult.of(result.getRiskScore() + 10, indicators, result.getConfidence());
    }
}
