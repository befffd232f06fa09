package com.mimecast.phishguard.main;

import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.text.NoOpTextClassifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnginesTest {

    @BeforeEach
    void setUp() {
        // Keeps tests off the network when services enable Rspamd.
        Factories.setTextClassifier(NoOpTextClassifier::new);
    }

    @AfterEach
    void tearDown() {
        Factories.reset();
    }

    @Test
    void testDefaults() throws IOException {
        try (Engines engines = Engines.load(null)) {
            assertNotNull(engines.getTextEngine());
            assertNotNull(engines.getSenderAnalyzer());
            assertNotNull(engines.getImageEngine());
            assertNotNull(engines.getEmailEngine());
            assertNotNull(engines.getUrlEngine());

            assertTrue(engines.getSenderAnalyzer().analyzeSender("bob@paypa1.com").hasIndicator("typosquatting"));
        }
    }

    @Test
    void testHealth() throws IOException {
        try (Engines engines = Engines.load(null)) {
            Map<String, Boolean> health = engines.health();

            assertEquals(3, health.size());
            assertTrue(health.get("text"));
            assertTrue(health.get("sender"));
            assertTrue(health.get("image"));
        }
    }

    @Test
    void testLoadDirectory() throws IOException {
        try (Engines engines = Engines.load(Paths.get("src/test/resources/cfg"))) {
            SignalResult result = engines.getSenderAnalyzer().analyzeSender("bob@exampel.org");
            assertTrue(result.hasIndicator("typosquatting"));

            assertFalse(engines.getSenderAnalyzer().analyzeSender("bob@paypa1.com").hasIndicator("typosquatting"));
            assertTrue(engines.health().get("image"));
        }
    }

    @Test
    void testDefaultDirectory() throws IOException {
        Path dir = Paths.get(Engines.DEFAULT_DIR);
        assertTrue(Files.isRegularFile(dir.resolve("signals.json5")));
        assertTrue(Files.isRegularFile(dir.resolve("services.json5")));

        try (Engines engines = Engines.load(dir)) {
            assertTrue(engines.getSenderAnalyzer().analyzeSender("bob@paypa1.com").hasIndicator("typosquatting"));
            assertTrue(engines.health().get("text"));
        }
    }

    @Test
    void testMissingFilesUseDefaults(@TempDir Path dir) throws IOException {
        try (Engines engines = Engines.load(dir)) {
            assertTrue(engines.getSenderAnalyzer().analyzeSender("bob@paypa1.com").hasIndicator("typosquatting"));
        }
    }
}
