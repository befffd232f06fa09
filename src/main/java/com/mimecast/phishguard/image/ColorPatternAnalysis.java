package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.image.vision.HsvImage;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.ColorMatcher;
import com.mimecast.phishguard.signals.detect.Rgb;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Warning colours.
 *
 * <p>Dominant colours close to a suspicious palette and large areas of saturated bright colour.
 */
public class ColorPatternAnalysis implements ImageSubAnalysis {

    private static final int DOMINANT_COLORS = 5;
    private static final int MIN_SATURATION = 150;
    private static final int MIN_VALUE = 200;
    private static final double BRIGHT_SHARE = 0.1;
    private static final double MAX_CONFIDENCE = 0.7;

    private final VisionToolkit vision;
    private final Map<String, List<Rgb>> palettes;
    private final double threshold;

    /**
     * Constructs a new ColorPatternAnalysis instance.
     *
     * @param config DetectionConfig instance.
     * @param vision VisionToolkit instance.
     */
    public ColorPatternAnalysis(DetectionConfig config, VisionToolkit vision) {
        this.vision = vision;
        this.palettes = config.getSuspiciousColors();
        this.threshold = config.getColorThreshold();
    }

    @Override
    public String getName() {
        return "color_patterns";
    }

    @Override
    public SignalResult analyze(ImageContext context) {
        if (!vision.isAvailable()) {
            return SignalResult.empty();
        }

        Set<String> indicators = new HashSet<>();
        int score = 0;

        List<Rgb> colors = vision.dominantColors(context.getImage(), DOMINANT_COLORS);
        for (Map.Entry<String, List<Rgb>> palette : palettes.entrySet()) {
            if (ColorMatcher.anyMatches(colors, palette.getValue(), threshold)) {
                indicators.add(palette.getKey() + "_detected");
                score += 15;
            }
        }

        HsvImage hsv = vision.toHsv(context.getImage());
        if (hsv.size() > 0 && (double) hsv.countBright(MIN_SATURATION, MIN_VALUE) / hsv.size() > BRIGHT_SHARE) {
            indicators.add("high_contrast_warning");
            score += 20;
        }

        return SignalResult.of(score, indicators, Math.min(MAX_CONFIDENCE, indicators.size() / 3.0));
    }
}
