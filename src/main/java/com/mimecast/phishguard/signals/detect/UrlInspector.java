package com.mimecast.phishguard.signals.detect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL extraction and structural checks.
 *
 * <p>Holds the immutable lists it checks against:
 * <ul>
 *     <li><b>suspicious TLDs</b> - host ends with one of them, e.g. {@code .tk}.</li>
 *     <li><b>shorteners</b> - host is or is under a URL shortening service, e.g. {@code bit.ly}.</li>
 *     <li><b>reputation terms</b> - URL contains a known bad term, e.g. {@code login-verify}.</li>
 * </ul>
 */
public class UrlInspector {

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"'()\\[\\]{}]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern SCHEME_PATTERN = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern IPV4_PATTERN = Pattern.compile("^\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}$");
    private static final String TRAILING_PUNCTUATION = ".,;:!?";

    private static final int MAX_URL_LENGTH = 100;
    private static final int MAX_HYPHENS = 5;
    private static final int MAX_DOTS = 4;

    private final List<String> suspiciousTlds;
    private final List<String> shorteners;
    private final List<String> reputationTerms;

    /**
     * Constructs a new UrlInspector instance.
     *
     * @param suspiciousTlds  Suspicious TLDs including the leading dot.
     * @param shorteners      URL shortener domains.
     * @param reputationTerms Terms marking a URL as having a bad reputation.
     */
    public UrlInspector(Collection<String> suspiciousTlds, Collection<String> shorteners, Collection<String> reputationTerms) {
        this.suspiciousTlds = lowerCase(suspiciousTlds);
        this.shorteners = lowerCase(shorteners);
        this.reputationTerms = lowerCase(reputationTerms);
    }

    /**
     * Extracts http and https URLs from text.
     *
     * @param text Text to search.
     * @return List of URLs in order of appearance.
     */
    public static List<String> extractUrls(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return urls;
        }

        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            String url = matcher.group();
            int end = url.length();
            while (end > 0 && TRAILING_PUNCTUATION.indexOf(url.charAt(end - 1)) >= 0) {
                end--;
            }
            url = url.substring(0, end);
            if (SCHEME_PATTERN.matcher(url).replaceFirst("").length() > 0) {
                urls.add(url);
            }
        }
        return urls;
    }

    /**
     * Gets the host of a URL.
     * <p>Strips scheme, user info, port, path, query and fragment.
     *
     * @param url URL string.
     * @return Lower case host, empty if none.
     */
    public static String host(String url) {
        if (url == null) {
            return "";
        }

        String rest = SCHEME_PATTERN.matcher(url.trim()).replaceFirst("");
        int cut = rest.length();
        for (char c : new char[]{'/', '?', '#'}) {
            int index = rest.indexOf(c);
            if (index >= 0 && index < cut) {
                cut = index;
            }
        }

        String authority = rest.substring(0, cut);
        int at = authority.lastIndexOf('@');
        if (at >= 0) {
            authority = authority.substring(at + 1);
        }
        int colon = authority.indexOf(':');
        if (colon >= 0) {
            authority = authority.substring(0, colon);
        }
        return authority.toLowerCase(Locale.ROOT);
    }

    /**
     * Checks if the URL host is an IPv4 literal.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean isIpHost(String url) {
        return IPV4_PATTERN.matcher(host(url)).matches();
    }

    /**
     * Checks if the URL host ends with a suspicious TLD.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean hasSuspiciousTld(String url) {
        return endsWithSuspiciousTld(host(url));
    }

    /**
     * Checks if a domain ends with a suspicious TLD.
     *
     * @param domain Domain name.
     * @return Boolean.
     */
    public boolean endsWithSuspiciousTld(String domain) {
        if (domain == null || domain.isEmpty()) {
            return false;
        }

        String lower = domain.toLowerCase(Locale.ROOT);
        for (String tld : suspiciousTlds) {
            if (lower.endsWith(tld)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the URL is suspicious.
     * <p>Either an IP literal host or a suspicious TLD.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean isSuspicious(String url) {
        return isIpHost(url) || hasSuspiciousTld(url);
    }

    /**
     * Checks if the URL uses a shortening service.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean isShortened(String url) {
        String host = host(url);
        for (String service : shorteners) {
            if (host.equals(service) || host.endsWith("." + service)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks if the URL contains a bad reputation term.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean hasBadReputation(String url) {
        return url != null && KeywordMatcher.containsAny(url.toLowerCase(Locale.ROOT), reputationTerms);
    }

    /**
     * Checks if the URL has a suspicious structure.
     * <p>Too long, too many hyphens or too many dots.
     *
     * @param url URL string.
     * @return Boolean.
     */
    public boolean hasSuspiciousStructure(String url) {
        if (url == null) {
            return false;
        }
        return url.length() > MAX_URL_LENGTH ||
                count(url, '-') > MAX_HYPHENS ||
                count(url, '.') > MAX_DOTS;
    }

    private static int count(String value, char c) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == c) count++;
        }
        return count;
    }

    private static List<String> lowerCase(Collection<String> values) {
        List<String> list = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    list.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return List.copyOf(list);
    }
}
