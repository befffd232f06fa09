package com.mimecast.phishguard.signals.detect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Keyword set membership checks.
 *
 * <p>Matching is plain substring containment, the caller is expected to have normalised case.
 */
public final class KeywordMatcher {

    /**
     * Private constructor.
     */
    private KeywordMatcher() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Gets the keywords found in text.
     *
     * @param text     Text to search.
     * @param keywords Keywords to look for.
     * @return List of found keywords in keyword order.
     */
    public static List<String> matches(String text, Collection<String> keywords) {
        List<String> found = new ArrayList<>();
        if (text == null || text.isEmpty() || keywords == null) {
            return found;
        }

        for (String keyword : keywords) {
            if (keyword != null && !keyword.isEmpty() && text.contains(keyword)) {
                found.add(keyword);
            }
        }
        return found;
    }

    /**
     * Counts the keywords found in text.
     *
     * @param text     Text to search.
     * @param keywords Keywords to look for.
     * @return Number of distinct keywords found.
     */
    public static int count(String text, Collection<String> keywords) {
        return matches(text, keywords).size();
    }

    /**
     * Checks if any keyword is found in text.
     *
     * @param text     Text to search.
     * @param keywords Keywords to look for.
     * @return Boolean.
     */
    public static boolean containsAny(String text, Collection<String> keywords) {
        if (text == null || text.isEmpty() || keywords == null) {
            return false;
        }

        for (String keyword : keywords) {
            if (keyword != null && !keyword.isEmpty() && text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
