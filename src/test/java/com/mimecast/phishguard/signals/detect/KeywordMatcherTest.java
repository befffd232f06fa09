package com.mimecast.phishguard.signals.detect;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KeywordMatcherTest {

    private static final List<String> KEYWORDS = List.of("urgent", "act now", "password");

    @Test
    void testMatches() {
        assertEquals(List.of("urgent", "password"), KeywordMatcher.matches("urgent: reset your password", KEYWORDS));
        assertEquals(2, KeywordMatcher.count("urgent: reset your password", KEYWORDS));
    }

    @Test
    void testSubstringMatch() {
        assertTrue(KeywordMatcher.containsAny("passwords expire", KEYWORDS));
    }

    @Test
    void testRepeatedKeywordCountsOnce() {
        assertEquals(1, KeywordMatcher.count("urgent urgent urgent", KEYWORDS));
    }

    @Test
    void testNoMatch() {
        assertFalse(KeywordMatcher.containsAny("lunch at noon?", KEYWORDS));
        assertTrue(KeywordMatcher.matches("", KEYWORDS).isEmpty());
        assertTrue(KeywordMatcher.matches(null, KEYWORDS).isEmpty());
        assertFalse(KeywordMatcher.containsAny("anything", null));
    }

    @Test
    void testBlankKeywordsIgnored() {
        assertEquals(0, KeywordMatcher.count("anything", Arrays.asList("", null)));
    }
}
