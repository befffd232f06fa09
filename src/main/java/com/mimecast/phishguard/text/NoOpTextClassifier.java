package com.mimecast.phishguard.text;

/**
 * Stand in used when no classifier is configured.
 * <p>Never available, the text engine skips the classifier signal.
 */
public class NoOpTextClassifier implements TextClassifier {

    @Override
    public ClassifierVerdict classify(String text) {
        return new ClassifierVerdict(ClassifierVerdict.HAM, 0);
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String getName() {
        return "none";
    }
}
