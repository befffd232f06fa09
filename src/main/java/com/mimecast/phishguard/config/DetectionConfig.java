package com.mimecast.phishguard.config;

import com.mimecast.phishguard.signals.detect.Rgb;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Detection tables configuration.
 *
 * <p>This class provides type safe access to the keyword, domain, brand and colour tables used by the analyzers.
 * <br>Every table falls back to a built in default when missing from the configuration file.
 * <br>Engines copy what they need at construction, so a config instance may be discarded afterwards.
 *
 * <p>File name: {@code signals.json5}.
 */
@SuppressWarnings("unchecked")
public class DetectionConfig extends ConfigFoundation {
    private static final Logger log = LogManager.getLogger(DetectionConfig.class);

    /**
     * Configuration file name.
     */
    public static final String FILENAME = "signals.json5";

    private static final Map<String, List<String>> TEXT_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<String>> IMAGE_KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, List<Rgb>> BRAND_COLORS = new LinkedHashMap<>();
    private static final Map<String, List<Rgb>> SUSPICIOUS_COLORS = new LinkedHashMap<>();

    static {
        TEXT_KEYWORDS.put("urgency_keywords", List.of(
                "urgent", "immediate", "asap", "hurry", "limited time", "expires soon",
                "act now", "don't delay", "last chance", "final notice", "deadline"));
        TEXT_KEYWORDS.put("threat_keywords", List.of(
                "suspend", "terminate", "close", "block", "disable", "restricted",
                "violation", "security breach", "unauthorized access", "locked"));
        TEXT_KEYWORDS.put("financial_keywords", List.of(
                "payment", "invoice", "refund", "transaction", "account", "balance",
                "credit card", "bank", "wire transfer", "cryptocurrency", "bitcoin"));
        TEXT_KEYWORDS.put("credential_keywords", List.of(
                "password", "login", "verify", "authenticate", "confirm identity",
                "security question", "two-factor", "2fa", "otp"));
        TEXT_KEYWORDS.put("suspicious_greetings", List.of(
                "dear customer", "dear user", "dear valued customer", "attention user"));

        IMAGE_KEYWORDS.put("login_form_indicators", List.of(
                "password", "login", "sign in", "username", "email", "account",
                "authenticate", "verify", "security check"));
        IMAGE_KEYWORDS.put("urgency_indicators", List.of(
                "urgent", "immediate", "asap", "hurry", "limited time", "expires",
                "act now", "don't delay", "last chance", "final notice"));
        IMAGE_KEYWORDS.put("financial_indicators", List.of(
                "payment", "invoice", "refund", "transaction", "account", "balance",
                "credit card", "bank", "wire transfer", "cryptocurrency"));
        IMAGE_KEYWORDS.put("credential_indicators", List.of(
                "password", "login", "verify", "authenticate", "confirm identity",
                "security question", "two-factor", "2fa"));

        BRAND_COLORS.put("paypal", List.of(new Rgb(0, 112, 186), new Rgb(255, 255, 255)));
        BRAND_COLORS.put("facebook", List.of(new Rgb(24, 119, 242), new Rgb(255, 255, 255)));
        BRAND_COLORS.put("google", List.of(new Rgb(66, 133, 244), new Rgb(52, 168, 83), new Rgb(251, 188, 5), new Rgb(234, 67, 53)));
        BRAND_COLORS.put("microsoft", List.of(new Rgb(245, 128, 0), new Rgb(255, 255, 255)));

        SUSPICIOUS_COLORS.put("phishing_red_flags", List.of(new Rgb(255, 0, 0), new Rgb(220, 20, 60), new Rgb(178, 34, 34)));
        SUSPICIOUS_COLORS.put("warning_orange", List.of(new Rgb(255, 165, 0), new Rgb(255, 140, 0), new Rgb(255, 127, 80)));
        SUSPICIOUS_COLORS.put("danger_yellow", List.of(new Rgb(255, 255, 0), new Rgb(255, 215, 0), new Rgb(218, 165, 32)));
    }

    private static final List<String> HIGH_RISK_CATEGORIES = List.of("financial_keywords", "credential_keywords");

    private static final List<String> POOR_GRAMMAR_PATTERNS = List.of(
            "\\b(dear customer|dear user)\\b",
            "\\bkindly\\b",
            "\\bdo the needful\\b",
            "\\batm machine\\b",
            "\\bpin number\\b");

    private static final List<String> SUSPICIOUS_TLDS = List.of(
            ".tk", ".ml", ".ga", ".cf", ".top", ".work", ".date", ".wang",
            ".bid", ".download", ".stream", ".cricket", ".science");

    private static final List<String> IMAGE_SUSPICIOUS_TLDS = List.of(".tk", ".ml", ".ga", ".cf", ".top", ".work");

    private static final List<String> TRUSTED_DOMAINS = List.of(
            "google.com", "microsoft.com", "apple.com", "amazon.com",
            "paypal.com", "ebay.com", "linkedin.com", "facebook.com",
            "twitter.com", "instagram.com", "github.com", "stackoverflow.com");

    private static final List<String> DISPLAY_NAME_BRANDS = List.of("paypal", "amazon", "microsoft", "google", "apple");

    private static final List<String> URL_SHORTENERS = List.of(
            "bit.ly", "tinyurl.com", "t.co", "goo.gl", "ow.ly",
            "short.link", "tiny.cc", "is.gd", "buff.ly");

    private static final List<String> REPUTATION_TERMS = List.of(
            "phishing", "scam", "fake", "login-verify", "account-confirm",
            "security-check", "update-account");

    private static final List<String> KNOWN_BRANDS = List.of(
            "paypal", "amazon", "microsoft", "google", "apple", "facebook",
            "linkedin", "twitter", "instagram", "netflix", "spotify", "ebay");

    private static final List<String> BRAND_CONTEXTS = List.of(
            "{brand} security", "{brand} verification", "{brand} account", "{brand} login", "{brand} password");

    /**
     * Constructs a new DetectionConfig instance with built in defaults only.
     */
    public DetectionConfig() {
        super();
    }

    /**
     * Constructs a new DetectionConfig instance.
     *
     * @param map Configuration map.
     */
    public DetectionConfig(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new DetectionConfig instance from a JSON5 file.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public DetectionConfig(String path) throws IOException {
        super(path);
    }

    /**
     * Gets text keyword categories.
     * <p>Category name to keywords, in configuration order.
     *
     * @return Map of category to keywords.
     */
    public Map<String, List<String>> getTextKeywords() {
        return getCategories("text.keywords", TEXT_KEYWORDS);
    }

    /**
     * Gets the text keyword categories that score higher.
     *
     * @return List of category names.
     */
    public List<String> getHighRiskCategories() {
        return getStrings("text.highRiskCategories", HIGH_RISK_CATEGORIES);
    }

    /**
     * Gets poor grammar regular expressions.
     *
     * @return List of patterns.
     */
    public List<String> getPoorGrammarPatterns() {
        Object value = getProperty("text.poorGrammarPatterns");
        return value instanceof List ? toStrings((List<Object>) value, false) : POOR_GRAMMAR_PATTERNS;
    }

    /**
     * Gets the maximum number of characters handed to the text classifier.
     *
     * @return Character count.
     */
    public int getClassifierMaxChars() {
        return Math.toIntExact(getLongProperty("text.classifierMaxChars", 512L));
    }

    /**
     * Gets suspicious TLDs for text URLs and sender domains.
     *
     * @return List of TLDs including leading dot.
     */
    public List<String> getSuspiciousTlds() {
        return getStrings("urls.suspiciousTlds", SUSPICIOUS_TLDS);
    }

    /**
     * Gets URL shortener domains.
     *
     * @return List of domains.
     */
    public List<String> getUrlShorteners() {
        return getStrings("urls.shorteners", URL_SHORTENERS);
    }

    /**
     * Gets URL reputation terms.
     *
     * @return List of terms.
     */
    public List<String> getReputationTerms() {
        return getStrings("urls.reputationTerms", REPUTATION_TERMS);
    }

    /**
     * Gets trusted domains.
     *
     * @return List of domains.
     */
    public List<String> getTrustedDomains() {
        return getStrings("sender.trustedDomains", TRUSTED_DOMAINS);
    }

    /**
     * Gets trusted brand tokens looked for in display names.
     *
     * @return List of tokens.
     */
    public List<String> getDisplayNameBrands() {
        return getStrings("sender.displayNameBrands", DISPLAY_NAME_BRANDS);
    }

    /**
     * Gets image OCR keyword categories.
     *
     * @return Map of category to keywords.
     */
    public Map<String, List<String>> getImageKeywords() {
        return getCategories("image.keywords", IMAGE_KEYWORDS);
    }

    /**
     * Gets the minimum keyword hits for an image keyword category to score.
     *
     * @param category     Category name.
     * @param defaultValue Default threshold.
     * @return Threshold.
     */
    public int getImageThreshold(String category, int defaultValue) {
        return Math.toIntExact(getLongProperty("image.thresholds." + category, (long) defaultValue));
    }

    /**
     * Gets suspicious TLDs for URLs found in images.
     *
     * @return List of TLDs including leading dot.
     */
    public List<String> getImageSuspiciousTlds() {
        return getStrings("image.suspiciousTlds", IMAGE_SUSPICIOUS_TLDS);
    }

    /**
     * Gets known brand names.
     *
     * @return List of brands.
     */
    public List<String> getKnownBrands() {
        return getStrings("image.knownBrands", KNOWN_BRANDS);
    }

    /**
     * Gets suspicious brand context templates.
     * <p>{@code {brand}} is replaced with the brand name.
     *
     * @return List of templates.
     */
    public List<String> getBrandContexts() {
        return getStrings("image.brandContexts", BRAND_CONTEXTS);
    }

    /**
     * Gets brand colour table.
     *
     * @return Map of brand to colours.
     */
    public Map<String, List<Rgb>> getBrandColors() {
        return getPalettes("image.brandColors", BRAND_COLORS);
    }

    /**
     * Gets suspicious colour palettes.
     *
     * @return Map of palette name to colours.
     */
    public Map<String, List<Rgb>> getSuspiciousColors() {
        return getPalettes("image.suspiciousColors", SUSPICIOUS_COLORS);
    }

    /**
     * Gets colour distance threshold.
     *
     * @return Euclidean RGB distance.
     */
    public double getColorThreshold() {
        return getDoubleProperty("image.colorThreshold", 30.0);
    }

    /**
     * Gets a list of lower case strings.
     */
    private List<String> getStrings(String key, List<String> defaults) {
        Object value = getProperty(key);
        return value instanceof List ? toStrings((List<Object>) value, true) : defaults;
    }

    /**
     * Converts a configuration list to trimmed strings, skipping blanks.
     */
    private static List<String> toStrings(List<Object> values, boolean lowerCase) {
        List<String> list = new ArrayList<>();
        for (Object entry : values) {
            if (entry != null && !String.valueOf(entry).isBlank()) {
                String string = String.valueOf(entry).trim();
                list.add(lowerCase ? string.toLowerCase(Locale.ROOT) : string);
            }
        }
        return Collections.unmodifiableList(list);
    }

    /**
     * Gets a map of category to lower case strings.
     */
    private Map<String, List<String>> getCategories(String key, Map<String, List<String>> defaults) {
        Map<String, Object> value = getMapProperty(key, null);
        if (value == null) {
            return Collections.unmodifiableMap(defaults);
        }

        Map<String, List<String>> categories = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : value.entrySet()) {
            if (!(entry.getValue() instanceof List)) {
                log.warn("Ignoring keyword category {} in {}: not a list", entry.getKey(), key);
                continue;
            }
            categories.put(entry.getKey(), toStrings((List<Object>) entry.getValue(), true));
        }
        return Collections.unmodifiableMap(categories);
    }

    /**
     * Gets a map of name to colours.
     */
    private Map<String, List<Rgb>> getPalettes(String key, Map<String, List<Rgb>> defaults) {
        Map<String, Object> value = getMapProperty(key, null);
        if (value == null) {
            return Collections.unmodifiableMap(defaults);
        }

        Map<String, List<Rgb>> palettes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : value.entrySet()) {
            if (!(entry.getValue() instanceof List)) {
                log.warn("Ignoring palette {} in {}: not a list", entry.getKey(), key);
                continue;
            }

            List<Rgb> colors = new ArrayList<>();
            for (Object color : (List<Object>) entry.getValue()) {
                try {
                    colors.add(Rgb.fromList((List<?>) color));
                } catch (ClassCastException | IllegalArgumentException e) {
                    log.warn("Ignoring colour {} in palette {}: {}", color, entry.getKey(), e.getMessage());
                }
            }
            palettes.put(entry.getKey().toLowerCase(Locale.ROOT), List.copyOf(colors));
        }
        return Collections.unmodifiableMap(palettes);
    }
}
