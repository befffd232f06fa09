package com.mimecast.phishguard.text;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.signals.Aggregator;
import com.mimecast.phishguard.signals.HealthCheck;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.KeywordMatcher;
import com.mimecast.phishguard.signals.detect.UrlInspector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Free text phishing signals.
 *
 * <p>Runs five independent sub-analyses and folds them through the {@link Aggregator}:
 * <ul>
 *     <li><b>keywords</b> - one indicator per keyword category with hits.</li>
 *     <li><b>patterns</b> - shouting, exclamation marks, suspicious URLs and mismatched link labels.</li>
 *     <li><b>links</b> - URL reputation terms and URL shorteners.</li>
 *     <li><b>sender format</b> - impersonal greetings and phishing grammar.</li>
 *     <li><b>classifier</b> - the optional pretrained {@link TextClassifier}.</li>
 * </ul>
 *
 * <p>Tables are copied at construction, instances are immutable and thread safe.
 */
public class TextSignalEngine implements HealthCheck {
    private static final Logger log = LogManager.getLogger(TextSignalEngine.class);

    private static final String GREETINGS_CATEGORY = "suspicious_greetings";
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[([^\\]]+)\\]\\(([^)]+)\\)");

    private static final double KEYWORD_CONFIDENCE = 0.7;
    private static final double PATTERN_CONFIDENCE = 0.6;
    private static final double LINK_CONFIDENCE = 0.8;
    private static final double FORMAT_CONFIDENCE = 0.5;

    private static final double CAPS_RATIO = 0.3;
    private static final int MAX_EXCLAMATIONS = 3;
    private static final int HIGH_RISK_KEYWORD_SCORE = 15;
    private static final int KEYWORD_SCORE = 10;
    private static final int CLASSIFIER_SCALE = 50;

    private final Map<String, List<String>> keywords;
    private final Set<String> highRiskCategories;
    private final List<String> greetings;
    private final List<Pattern> grammarPatterns;
    private final UrlInspector urlInspector;
    private final TextClassifier classifier;
    private final int classifierMaxChars;

    /**
     * Constructs a new TextSignalEngine instance without classifier.
     *
     * @param config DetectionConfig instance.
     */
    public TextSignalEngine(DetectionConfig config) {
        this(config, new NoOpTextClassifier());
    }

    /**
     * Constructs a new TextSignalEngine instance.
     *
     * @param config     DetectionConfig instance.
     * @param classifier TextClassifier instance.
     */
    public TextSignalEngine(DetectionConfig config, TextClassifier classifier) {
        this.keywords = Collections.unmodifiableMap(new LinkedHashMap<>(config.getTextKeywords()));
        this.highRiskCategories = Set.copyOf(config.getHighRiskCategories());
        this.greetings = List.copyOf(keywords.getOrDefault(GREETINGS_CATEGORY, Collections.emptyList()));
        this.grammarPatterns = compile(config.getPoorGrammarPatterns());
        this.urlInspector = new UrlInspector(config.getSuspiciousTlds(), config.getUrlShorteners(), config.getReputationTerms());
        this.classifier = Objects.requireNonNull(classifier);
        this.classifierMaxChars = config.getClassifierMaxChars();

        log.debug("Text engine ready with {} keyword categories and classifier {}", keywords.size(), classifier.getName());
    }

    /**
     * Analyzes text.
     *
     * @param text Text to analyze.
     * @return SignalResult, the empty result for null or empty text.
     */
    public SignalResult analyze(String text) {
        if (text == null || text.isEmpty()) {
            return SignalResult.empty();
        }

        String lower = text.toLowerCase(Locale.ROOT).trim();
        List<String> urls = UrlInspector.extractUrls(lower);

        return Aggregator.combine(
                analyzeKeywords(lower),
                analyzePatterns(lower, urls),
                analyzeLinks(urls),
                analyzeSenderFormat(lower),
                analyzeWithClassifier(lower)
        );
    }

    /**
     * Gets the URL inspector built from this engine's tables.
     *
     * @return UrlInspector instance.
     */
    public UrlInspector getUrlInspector() {
        return urlInspector;
    }

    @Override
    public boolean isHealthy() {
        try {
            SignalResult result = analyze("This is a test message");
            return result != null && result.hasValidScore();
        } catch (Exception e) {
            log.error("Text engine health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Keyword categories.
     */
    SignalResult analyzeKeywords(String text) {
        Set<String> indicators = new HashSet<>();
        int score = 0;

        for (Map.Entry<String, List<String>> category : keywords.entrySet()) {
            int hits = KeywordMatcher.count(text, category.getValue());
            if (hits > 0) {
                indicators.add(category.getKey() + "_found");
                score += hits * (highRiskCategories.contains(category.getKey()) ? HIGH_RISK_KEYWORD_SCORE : KEYWORD_SCORE);
            }
        }

        return SignalResult.of(score, indicators, KEYWORD_CONFIDENCE);
    }

    /**
     * Shouting, exclamations, suspicious URLs and mismatched markdown links.
     */
    SignalResult analyzePatterns(String text, List<String> urls) {
        Set<String> indicators = new HashSet<>();
        int score = 0;

        if (capsRatio(text) > CAPS_RATIO) {
            indicators.add("excessive_caps");
            score += 10;
        }

        if (text.chars().filter(c -> c == '!').count() > MAX_EXCLAMATIONS) {
            indicators.add("excessive_exclamations");
            score += 10;
        }

        for (String url : urls) {
            if (urlInspector.isSuspicious(url)) {
                indicators.add("suspicious_url_in_text");
                score += 25;
                break;
            }
        }

        if (hasMismatchedLinks(text)) {
            indicators.add("mismatched_urls");
            score += 30;
        }

        return SignalResult.of(score, indicators, PATTERN_CONFIDENCE);
    }

    /**
     * URL reputation and shorteners, scored per URL.
     */
    SignalResult analyzeLinks(List<String> urls) {
        Set<String> indicators = new HashSet<>();
        int score = 0;

        for (String url : urls) {
            if (urlInspector.hasBadReputation(url)) {
                indicators.add("bad_url_reputation");
                score += 40;
            }
            if (urlInspector.isShortened(url)) {
                indicators.add("url_shortened");
                score += 20;
            }
        }

        return SignalResult.of(score, indicators, LINK_CONFIDENCE);
    }

    /**
     * Greeting and grammar.
     */
    SignalResult analyzeSenderFormat(String text) {
        Set<String> indicators = new HashSet<>();
        int score = 0;

        if (KeywordMatcher.containsAny(text, greetings)) {
            indicators.add("impersonal_greeting");
            score += 15;
        }

        for (Pattern pattern : grammarPatterns) {
            if (pattern.matcher(text).find()) {
                indicators.add("poor_grammar");
                score += 10;
                break;
            }
        }

        return SignalResult.of(score, indicators, FORMAT_CONFIDENCE);
    }

    /**
     * Pretrained classifier on the head of the text.
     */
    SignalResult analyzeWithClassifier(String text) {
        if (!classifier.isAvailable()) {
            return SignalResult.empty();
        }

        try {
            String head = text.length() > classifierMaxChars ? text.substring(0, classifierMaxChars) : text;
            ClassifierVerdict verdict = classifier.classify(head);
            if (verdict == null) {
                return SignalResult.empty();
            }

            double confidence = verdict.getConfidence();
            if (verdict.isSpam()) {
                return SignalResult.of(confidence * CLASSIFIER_SCALE, Collections.singleton("ml_detected_spam"), confidence);
            }
            return SignalResult.of(0, Collections.emptySet(), confidence);
        } catch (Exception e) {
            log.error("Classifier {} failed: {}", classifier.getName(), e.getMessage());
            return SignalResult.empty();
        }
    }

    private static double capsRatio(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        long upper = text.chars().filter(Character::isUpperCase).count();
        return (double) upper / text.length();
    }

    private static boolean hasMismatchedLinks(String text) {
        Matcher matcher = MARKDOWN_LINK.matcher(text);
        while (matcher.find()) {
            String label = matcher.group(1);
            String target = matcher.group(2);
            if (!label.equals(target) && !label.startsWith("http")) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(List<String> expressions) {
        List<Pattern> patterns = new ArrayList<>();
        for (String expression : expressions) {
            try {
                patterns.add(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid grammar pattern {}: {}", expression, e.getDescription());
            }
        }
        return List.copyOf(patterns);
    }
}
