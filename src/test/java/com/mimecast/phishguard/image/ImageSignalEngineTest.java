package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.http.ImageFetcher;
import com.mimecast.phishguard.image.ocr.NoOpOcrEngine;
import com.mimecast.phishguard.image.ocr.OcrEngine;
import com.mimecast.phishguard.image.vision.NoOpVision;
import com.mimecast.phishguard.image.vision.RasterVision;
import com.mimecast.phishguard.signals.RiskLevel;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.Rgb;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImageSignalEngineTest {

    private final DetectionConfig config = new DetectionConfig();
    private final ImageFetcher fetcher = mock(ImageFetcher.class);

    private ImageSignalEngine engine(OcrEngine ocr) {
        return new ImageSignalEngine(config, ocr, new RasterVision(), fetcher);
    }

    @Test
    void testDegradedMode() throws IOException {
        ImageSignalEngine engine = new ImageSignalEngine(config, new NoOpOcrEngine(), new NoOpVision(), fetcher);

        for (String input : List.of("anything", "", "data:image/png;base64,AAAA", "http://example.com/a.png")) {
            SignalResult result = engine.analyze(input);

            assertEquals(SignalResult.Variant.DEGRADED, result.getVariant());
            assertEquals(RiskLevel.LOW, result.getRiskLevel());
            assertEquals(10, result.getRiskScore());
            assertEquals(0.3, result.getConfidence());
            assertEquals(Set.of("basic_analysis_only"), result.getIndicators());
        }
        assertTrue(engine.isDegraded());
        assertTrue(engine.isHealthy());
        verify(fetcher, never()).fetch(any());
    }

    @Test
    void testMissingFile() {
        SignalResult result = engine(new NoOpOcrEngine()).analyze("/nonexistent/image.png");

        assertEquals(SignalResult.Variant.ERROR, result.getVariant());
        assertEquals(RiskLevel.ERROR, result.getRiskLevel());
        assertEquals(Set.of("analysis_error"), result.getIndicators());
        assertTrue(result.getError().orElse("").startsWith("Failed to load image"));
    }

    @Test
    void testCorruptDataUri() {
        SignalResult result = engine(new NoOpOcrEngine()).analyze("data:image/png;base64,AAAA");

        assertEquals(SignalResult.Variant.ERROR, result.getVariant());
        assertTrue(result.getError().orElse("").startsWith("Failed to load image"));
    }

    @Test
    void testNullImage() {
        assertEquals(SignalResult.Variant.ERROR, engine(new NoOpOcrEngine()).analyze((BufferedImage) null).getVariant());
    }

    @Test
    void testDataUri() throws IOException {
        SignalResult result = engine(new NoOpOcrEngine()).analyze(SyntheticImages.dataUri(SyntheticImages.dialog()));

        assertEquals(SignalResult.Variant.SUCCESS, result.getVariant());
        assertTrue(result.hasIndicator("popup_overlay_detected"));
    }

    @Test
    void testRemoteUrl() throws IOException {
        when(fetcher.fetch("https://cdn.example.com/dialog.png")).thenReturn(SyntheticImages.png(SyntheticImages.dialog()));

        SignalResult result = engine(new NoOpOcrEngine()).analyze("https://cdn.example.com/dialog.png");

        assertTrue(result.hasIndicator("popup_overlay_detected"));
        verify(fetcher).fetch("https://cdn.example.com/dialog.png");
    }

    @Test
    void testRemoteUrlFailure() throws IOException {
        when(fetcher.fetch(any())).thenThrow(new IOException("Image download failed with status: 404"));

        SignalResult result = engine(new NoOpOcrEngine()).analyze("https://cdn.example.com/missing.png");

        assertEquals("Failed to load image: Image download failed with status: 404", result.getError().orElse(null));
    }

    @Test
    void testLocalFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("form.png");
        Files.write(file, SyntheticImages.png(SyntheticImages.formFields()));

        SignalResult result = engine(new NoOpOcrEngine()).analyze(file.toString());

        assertTrue(result.hasIndicator("multiple_form_fields"));
    }

    @Test
    void testOcrText() {
        OcrEngine ocr = image -> "Verify your PayPal account password and login now";
        ImageSignalEngine engine = new ImageSignalEngine(config, ocr, new NoOpVision(), fetcher);

        SignalResult result = engine.analyze(SyntheticImages.blank(100, 100, Color.WHITE));

        assertFalse(engine.isDegraded());
        assertTrue(result.getIndicators().containsAll(Set.of(
                "login_form_detected", "credential_requests", "brand_mentions", "suspicious_paypal_context")));
        assertEquals(RiskLevel.CRITICAL, result.getRiskLevel());
    }

    @Test
    void testOcrFailureIsContained() throws IOException {
        OcrEngine ocr = mock(OcrEngine.class);
        when(ocr.isAvailable()).thenReturn(true);
        when(ocr.extractText(any())).thenThrow(new IOException("tessdata missing"));

        SignalResult result = engine(ocr).analyze(SyntheticImages.dialog());

        assertEquals(SignalResult.Variant.SUCCESS, result.getVariant());
        assertTrue(result.hasIndicator("popup_overlay_detected"));
        verify(ocr).extractText(any());
    }

    @Test
    void testFailingSubAnalysisIsContained() {
        RasterVision failingColors = new RasterVision() {
            @Override
            public List<Rgb> dominantColors(BufferedImage image, int k) {
                throw new IllegalStateException("clustering failed");
            }
        };
        ImageSignalEngine engine = new ImageSignalEngine(config, new NoOpOcrEngine(), failingColors, fetcher);

        SignalResult result = engine.analyze(SyntheticImages.dialog());

        assertEquals(SignalResult.Variant.SUCCESS, result.getVariant());
        assertTrue(result.hasIndicator("popup_overlay_detected"));
        assertFalse(result.hasIndicator("high_contrast_warning"));
    }

    @Test
    void testParallelMatchesSequential() {
        OcrEngine ocr = image -> "Urgent: confirm your amazon login password immediately";
        BufferedImage image = SyntheticImages.formFields();
        SyntheticImages.fill(image, Color.RED, 300, 20, 60, 60);

        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            SignalResult sequential = new ImageSignalEngine(config, ocr, new RasterVision(), fetcher).analyze(image);
            SignalResult parallel = new ImageSignalEngine(config, ocr, new RasterVision(), fetcher, executor).analyze(image);

            assertEquals(sequential, parallel);
            assertTrue(sequential.getRiskScore() > 0);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testDeterministic() {
        ImageSignalEngine engine = engine(new NoOpOcrEngine());
        BufferedImage image = SyntheticImages.formFields();

        assertEquals(engine.analyze(image), engine.analyze(image));
    }

    @Test
    void testHealthy() {
        assertTrue(engine(new NoOpOcrEngine()).isHealthy());
    }
}
