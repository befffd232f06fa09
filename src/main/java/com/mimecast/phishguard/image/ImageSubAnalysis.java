package com.mimecast.phishguard.image;

import com.mimecast.phishguard.signals.SignalResult;

/**
 * Image sub-analysis interface.
 *
 * <p>Each sub-analysis is independent of its siblings and may run concurrently with them.
 */
public interface ImageSubAnalysis {

    /**
     * Gets name.
     *
     * @return String.
     */
    String getName();

    /**
     * Analyzes an image.
     *
     * @param context ImageContext instance.
     * @return SignalResult instance.
     */
    SignalResult analyze(ImageContext context);
}
