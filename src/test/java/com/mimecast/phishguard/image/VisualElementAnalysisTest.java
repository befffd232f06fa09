package com.mimecast.phishguard.image;

import com.mimecast.phishguard.image.vision.NoOpVision;
import com.mimecast.phishguard.image.vision.RasterVision;
import com.mimecast.phishguard.signals.SignalResult;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VisualElementAnalysisTest {

    private final RasterVision vision = new RasterVision();
    private final VisualElementAnalysis analysis = new VisualElementAnalysis(vision);

    private ImageContext context(BufferedImage image) {
        return new ImageContext(image, vision.grayscale(image), null);
    }

    @Test
    void testMultipleFormFields() {
        SignalResult result = analysis.analyze(context(SyntheticImages.formFields()));

        assertEquals(Set.of("multiple_form_fields"), result.getIndicators());
        assertEquals(15, result.getRiskScore());
        assertEquals(0.2, result.getConfidence(), 1e-9);
    }

    @Test
    void testSecurityIcon() {
        BufferedImage image = SyntheticImages.blank(300, 300, Color.BLACK);
        SyntheticImages.fill(image, Color.WHITE, 100, 100, 40, 40);

        SignalResult result = analysis.analyze(context(image));

        assertEquals(Set.of("security_icon_detected"), result.getIndicators());
        assertEquals(10, result.getRiskScore());
    }

    @Test
    void testPopupOverlay() {
        SignalResult result = analysis.analyze(context(SyntheticImages.dialog()));

        assertEquals(Set.of("popup_overlay_detected"), result.getIndicators());
        assertEquals(20, result.getRiskScore());
    }

    @Test
    void testBlankImage() {
        SignalResult result = analysis.analyze(context(SyntheticImages.blank(200, 200, Color.WHITE)));

        assertTrue(result.getIndicators().isEmpty());
        assertEquals(0, result.getConfidence());
    }

    @Test
    void testWithoutVision() {
        BufferedImage image = SyntheticImages.formFields();

        assertEquals(SignalResult.empty(), new VisualElementAnalysis(new NoOpVision()).analyze(new ImageContext(image, null, null)));
        assertEquals(SignalResult.empty(), analysis.analyze(new ImageContext(image, null, null)));
    }
}
