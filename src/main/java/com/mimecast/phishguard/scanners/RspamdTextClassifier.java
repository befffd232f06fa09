package com.mimecast.phishguard.scanners;

import com.mimecast.phishguard.text.ClassifierVerdict;
import com.mimecast.phishguard.text.TextClassifier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;

/**
 * Text classifier backed by Rspamd.
 * <p>
 * Texts flagged by Rspamd or scoring at or above the reject threshold are labelled spam.
 * <br>Confidence is the score relative to the threshold, clamped to [0, 1], and its complement for ham.
 */
public class RspamdTextClassifier implements TextClassifier {
    private static final Logger log = LogManager.getLogger(RspamdTextClassifier.class);

    private final RspamdClient client;
    private final double rejectThreshold;

    /**
     * Constructs a new RspamdTextClassifier instance.
     *
     * @param client          RspamdClient instance.
     * @param rejectThreshold Score at which text is spam, must be positive.
     */
    public RspamdTextClassifier(RspamdClient client, double rejectThreshold) {
        if (!(rejectThreshold > 0)) {
            throw new IllegalArgumentException("Reject threshold must be positive: " + rejectThreshold);
        }
        this.client = client;
        this.rejectThreshold = rejectThreshold;
    }

    @Override
    public ClassifierVerdict classify(String text) throws IOException {
        Map<String, Object> result = client.scanText(text);
        if (result.isEmpty()) {
            throw new IOException("Empty Rspamd response");
        }

        double score = RspamdClient.getScore(result);
        double ratio = Math.max(0.0, Math.min(1.0, score / rejectThreshold));
        boolean spam = RspamdClient.isFlagged(result) || score >= rejectThreshold;
        log.debug("Rspamd scored text {} against threshold {}", score, rejectThreshold);

        return spam ?
                new ClassifierVerdict(ClassifierVerdict.SPAM, ratio) :
                new ClassifierVerdict(ClassifierVerdict.HAM, 1.0 - ratio);
    }

    @Override
    public String getName() {
        return "rspamd";
    }
}
