package com.mimecast.phishguard.image;

import com.mimecast.phishguard.config.DetectionConfig;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.signals.detect.ColorMatcher;
import com.mimecast.phishguard.signals.detect.KeywordMatcher;
import com.mimecast.phishguard.signals.detect.Rgb;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Brand impersonation.
 *
 * <p>Brand names in the OCR text, brand names next to account vocabulary and brand colour schemes.
 */
public class BrandImpersonationAnalysis implements ImageSubAnalysis {

    private static final int DOMINANT_COLORS = 3;
    private static final double MAX_CONFIDENCE = 0.85;

    private final VisionToolkit vision;
    private final List<String> brands;
    private final List<String> contexts;
    private final Map<String, List<Rgb>> brandColors;
    private final double threshold;

    /**
     * Constructs a new BrandImpersonationAnalysis instance.
     *
     * @param config DetectionConfig instance.
     * @param vision VisionToolkit instance.
     */
    public BrandImpersonationAnalysis(DetectionConfig config, VisionToolkit vision) {
        this.vision = vision;
        this.brands = config.getKnownBrands();
        this.contexts = config.getBrandContexts();
        this.brandColors = config.getBrandColors();
        this.threshold = config.getColorThreshold();
    }

    @Override
    public String getName() {
        return "brand_impersonation";
    }

    @Override
    public SignalResult analyze(ImageContext context) {
        String text = context.getOcrTextLowerCase();
        Set<String> indicators = new HashSet<>();
        int score = 0;

        List<String> mentions = KeywordMatcher.matches(text, brands);
        if (!mentions.isEmpty()) {
            indicators.add("brand_mentions");
            score += mentions.size() * 15;

            for (String brand : mentions) {
                if (KeywordMatcher.containsAny(text, contextsFor(brand))) {
                    indicators.add("suspicious_" + brand + "_context");
                    score += 25;
                }
            }
        }

        if (vision.isAvailable()) {
            List<Rgb> colors = vision.dominantColors(context.getImage(), DOMINANT_COLORS);
            for (Map.Entry<String, List<Rgb>> brand : brandColors.entrySet()) {
                if (ColorMatcher.anyMatches(colors, brand.getValue(), threshold)) {
                    indicators.add(brand.getKey() + "_color_pattern");
                    score += 10;
                }
            }
        }

        double confidence = Math.min(MAX_CONFIDENCE, mentions.size() * 0.3 + indicators.size() * 0.2);
        return SignalResult.of(score, indicators, confidence);
    }

    private List<String> contextsFor(String brand) {
        List<String> phrases = new ArrayList<>();
        for (String template : contexts) {
            phrases.add(template.replace("{brand}", brand));
        }
        return phrases;
    }
}
