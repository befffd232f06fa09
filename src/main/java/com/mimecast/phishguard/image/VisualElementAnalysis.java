package com.mimecast.phishguard.image;

import com.mimecast.phishguard.image.vision.Bounds;
import com.mimecast.phishguard.image.vision.Contour;
import com.mimecast.phishguard.image.vision.GrayImage;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.signals.SignalResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Shapes typical of credential harvesting pages.
 *
 * <p>Edge contours are classified as form fields, padlock like icons and large overlays.
 */
public class VisualElementAnalysis implements ImageSubAnalysis {

    static final double CANNY_LOW = 50;
    static final double CANNY_HIGH = 150;
    static final double APPROX_FRACTION = 0.02;

    private static final int MIN_FORM_FIELDS = 3;
    private static final double MAX_CONFIDENCE = 0.8;

    private final VisionToolkit vision;

    /**
     * Constructs a new VisualElementAnalysis instance.
     *
     * @param vision VisionToolkit instance.
     */
    public VisualElementAnalysis(VisionToolkit vision) {
        this.vision = vision;
    }

    @Override
    public String getName() {
        return "visual_elements";
    }

    @Override
    public SignalResult analyze(ImageContext context) {
        if (!vision.isAvailable() || context.getGray().isEmpty()) {
            return SignalResult.empty();
        }

        GrayImage gray = context.getGray().get();
        List<Contour> contours = vision.edgeContours(gray, CANNY_LOW, CANNY_HIGH);

        int formFields = 0;
        boolean securityIcon = false;
        boolean overlay = false;
        for (Contour contour : contours) {
            double area = contour.area();
            boolean rectangle = vision.vertexCount(contour, APPROX_FRACTION) == 4;

            if (rectangle && area > 1000 && area < 50000) {
                formFields++;
            }
            if (rectangle && area > 10000) {
                overlay = true;
            }
            if (!securityIcon && area > 500 && area < 5000) {
                Bounds bounds = contour.bounds();
                double ratio = bounds.getAspectRatio();
                securityIcon = ratio > 0.7 && ratio < 1.3 && bounds.getHeight() > bounds.getWidth() * 0.8;
            }
        }

        Set<String> indicators = new HashSet<>();
        int score = 0;
        if (formFields >= MIN_FORM_FIELDS) {
            indicators.add("multiple_form_fields");
            score += 15;
        }
        if (securityIcon) {
            indicators.add("security_icon_detected");
            score += 10;
        }
        if (overlay) {
            indicators.add("popup_overlay_detected");
            score += 20;
        }

        return SignalResult.of(score, indicators, Math.min(MAX_CONFIDENCE, indicators.size() / 5.0));
    }
}
