package com.mimecast.phishguard.image;

import com.mimecast.phishguard.image.vision.Bounds;
import com.mimecast.phishguard.image.vision.Contour;
import com.mimecast.phishguard.image.vision.GrayImage;
import com.mimecast.phishguard.image.vision.VisionToolkit;
import com.mimecast.phishguard.signals.SignalResult;

import java.util.HashSet;
import java.util.Set;

import static com.mimecast.phishguard.image.VisualElementAnalysis.APPROX_FRACTION;
import static com.mimecast.phishguard.image.VisualElementAnalysis.CANNY_HIGH;
import static com.mimecast.phishguard.image.VisualElementAnalysis.CANNY_LOW;

/**
 * Page layouts typical of phishing.
 *
 * <p>Looks at regions of the image:
 * <ul>
 *     <li><b>centre half</b> - two or more form sized rectangles make a centred login form.</li>
 *     <li><b>centre two thirds</b> - a rectangle covering over 30% of the whole image makes a popup.</li>
 *     <li><b>whole image</b> - over 30% mid gray pixels make an overlay.</li>
 *     <li><b>top eighth</b> - a wide thin rectangle makes a fake address bar.</li>
 * </ul>
 */
public class LayoutPatternAnalysis implements ImageSubAnalysis {

    private static final double MAX_CONFIDENCE = 0.75;

    private final VisionToolkit vision;

    /**
     * Constructs a new LayoutPatternAnalysis instance.
     *
     * @param vision VisionToolkit instance.
     */
    public LayoutPatternAnalysis(VisionToolkit vision) {
        this.vision = vision;
    }

    @Override
    public String getName() {
        return "layout_patterns";
    }

    @Override
    public SignalResult analyze(ImageContext context) {
        if (!vision.isAvailable() || context.getGray().isEmpty()) {
            return SignalResult.empty();
        }

        GrayImage gray = context.getGray().get();
        Set<String> indicators = new HashSet<>();
        int score = 0;

        if (isCenteredLoginForm(gray)) {
            indicators.add("centered_login_form");
            score += 20;
        }
        if (isPopupLayout(gray)) {
            indicators.add("popup_layout");
            score += 25;
        }
        if (hasOverlayPattern(gray)) {
            indicators.add("overlay_pattern");
            score += 15;
        }
        if (hasFakeBrowserChrome(gray)) {
            indicators.add("fake_browser_chrome");
            score += 30;
        }

        return SignalResult.of(score, indicators, Math.min(MAX_CONFIDENCE, indicators.size() / 4.0));
    }

    boolean isCenteredLoginForm(GrayImage gray) {
        int width = gray.getWidth();
        int height = gray.getHeight();
        GrayImage center = gray.crop(width / 4, height / 4, 3 * width / 4 - width / 4, 3 * height / 4 - height / 4);

        int formElements = 0;
        for (Contour contour : vision.edgeContours(center, CANNY_LOW, CANNY_HIGH)) {
            double area = contour.area();
            if (area > 1000 && area < 20000 && vision.vertexCount(contour, APPROX_FRACTION) == 4) {
                formElements++;
            }
        }
        return formElements >= 2;
    }

    boolean isPopupLayout(GrayImage gray) {
        int width = gray.getWidth();
        int height = gray.getHeight();
        GrayImage center = gray.crop(width / 6, height / 6, 5 * width / 6 - width / 6, 5 * height / 6 - height / 6);
        GrayImage binary = vision.threshold(center, 127);

        double minArea = (double) width * height * 0.3;
        for (Contour contour : vision.edgeContours(binary, CANNY_LOW, CANNY_HIGH)) {
            if (contour.area() > minArea && vision.vertexCount(contour, APPROX_FRACTION) == 4) {
                return true;
            }
        }
        return false;
    }

    boolean hasOverlayPattern(GrayImage gray) {
        if (gray.size() == 0) {
            return false;
        }
        return (double) gray.countBetween(100, 200) / gray.size() > 0.3;
    }

    boolean hasFakeBrowserChrome(GrayImage gray) {
        int width = gray.getWidth();
        GrayImage top = gray.crop(0, 0, width, gray.getHeight() / 8);

        for (Contour contour : vision.edgeContours(top, CANNY_LOW, CANNY_HIGH)) {
            if (vision.vertexCount(contour, APPROX_FRACTION) == 4) {
                Bounds bounds = contour.bounds();
                if (bounds.getWidth() > width * 0.6 && bounds.getHeight() < 50) {
                    return true;
                }
            }
        }
        return false;
    }
}
