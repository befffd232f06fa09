package com.mimecast.phishguard.text;

import java.io.IOException;

/**
 * Pretrained text classifier collaborator.
 *
 * <p>Implementations must be thread safe as a single instance is shared by all callers of an engine.
 */
public interface TextClassifier {

    /**
     * Classifies text.
     *
     * @param text Text, already truncated by the caller.
     * @return ClassifierVerdict instance.
     * @throws IOException Unable to reach or read the classifier.
     */
    ClassifierVerdict classify(String text) throws IOException;

    /**
     * Checks if the classifier is configured.
     *
     * @return Boolean.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Gets name.
     *
     * @return String.
     */
    String getName();
}
