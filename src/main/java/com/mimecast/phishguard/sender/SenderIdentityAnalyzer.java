package com.mimecast.phishguard.sender;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.signals.HealthCheck;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.KeywordMatcher;
import com.mimecast.phishguard.signals.detect.Levenshtein;
import com.mimecast.phishguard.signals.detect.UrlInspector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Sender identity spoofing checks.
 *
 * <p>Looks at the domain of a sender address and at its display name:
 * <ul>
 *     <li><b>suspicious_tld</b> - domain ends with a suspicious TLD.</li>
 *     <li><b>typosquatting</b> - domain is one or two edits away from a trusted domain.</li>
 *     <li><b>subdomain_spoof</b> - domain contains a trusted domain without being under it.</li>
 *     <li><b>display_name_spoof</b> - display name mentions a trusted brand.</li>
 * </ul>
 *
 * <p>Confidence is fixed whatever fired.
 */
public class SenderIdentityAnalyzer implements HealthCheck {
    private static final Logger log = LogManager.getLogger(SenderIdentityAnalyzer.class);

    private static final Pattern DOMAIN = Pattern.compile("@([^<>\\s]+)");
    private static final int MAX_TYPO_DISTANCE = 2;
    private static final double CONFIDENCE = 0.8;

    private final List<String> trustedDomains;
    private final List<String> displayNameBrands;
    private final UrlInspector urlInspector;

    /**
     * Constructs a new SenderIdentityAnalyzer instance.
     *
     * @param config DetectionConfig instance.
     */
    public SenderIdentityAnalyzer(DetectionConfig config) {
        this.trustedDomains = List.copyOf(config.getTrustedDomains());
        this.displayNameBrands = List.copyOf(config.getDisplayNameBrands());
        this.urlInspector = new UrlInspector(config.getSuspiciousTlds(), Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Analyzes a sender.
     * <p>Accepts a bare address or {@code Display Name <address>}.
     *
     * @param sender Sender string.
     * @return SignalResult, the empty result for null or blank input.
     */
    public SignalResult analyzeSender(String sender) {
        if (sender == null || sender.isBlank()) {
            return SignalResult.empty();
        }

        String normalized = sender.toLowerCase(Locale.ROOT).trim();
        Set<String> indicators = new HashSet<>();
        int score = 0;

        String domain = extractDomain(normalized);
        if (domain != null) {
            if (urlInspector.endsWithSuspiciousTld(domain)) {
                indicators.add("suspicious_tld");
                score += 30;
            }
            if (isTyposquatted(domain)) {
                indicators.add("typosquatting");
                score += 40;
            }
            if (isSubdomainSpoof(domain)) {
                indicators.add("subdomain_spoof");
                score += 35;
            }
        }

        if (normalized.contains("<") && normalized.contains(">")) {
            String displayName = normalized.substring(0, normalized.indexOf('<')).trim();
            if (KeywordMatcher.containsAny(displayName, displayNameBrands)) {
                indicators.add("display_name_spoof");
                score += 25;
            }
        }

        log.debug("Sender {} domain {} indicators {}", normalized, domain, indicators);
        return SignalResult.of(score, indicators, CONFIDENCE);
    }

    /**
     * Extracts the domain following {@code @}.
     *
     * @param sender Lower case sender.
     * @return Domain or null.
     */
    static String extractDomain(String sender) {
        Matcher matcher = DOMAIN.matcher(sender);
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * Close to but not equal to a trusted domain.
     */
    boolean isTyposquatted(String domain) {
        for (String trusted : trustedDomains) {
            int distance = Levenshtein.distance(domain, trusted);
            if (distance > 0 && distance <= MAX_TYPO_DISTANCE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Trusted domain present but not the registrable suffix.
     */
    boolean isSubdomainSpoof(String domain) {
        for (String trusted : trustedDomains) {
            if (domain.contains(trusted) && !domain.endsWith(trusted)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean isHealthy() {
        try {
            SignalResult result = analyzeSender("test@example.com");
            return result != null && result.hasValidScore();
        } catch (Exception e) {
            log.error("Sender analyzer health check failed: {}", e.getMessage());
            return false;
        }
    }
}
