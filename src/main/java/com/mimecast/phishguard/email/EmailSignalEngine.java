package com.mimecast.phishguard.email;

import com.mimecast.phishguard.sender.SenderIdentityAnalyzer;
import com.mimecast.phishguard.signals.SignalResult;
import com.mimecast.phishguard.text.TextSignalEngine;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Email phishing verdicts.
 *
 * <p>Subject and body go through the {@link TextSignalEngine}, the sender through the {@link SenderIdentityAnalyzer}.
 * <br>The two are not summed: the combined score is the larger of the two, indicators are merged and
 * confidence is their mean.
 */
public class EmailSignalEngine {
    private static final Logger log = LogManager.getLogger(EmailSignalEngine.class);

    private final TextSignalEngine textEngine;
    private final SenderIdentityAnalyzer senderAnalyzer;

    /**
     * Constructs a new EmailSignalEngine instance.
     *
     * @param textEngine     TextSignalEngine instance.
     * @param senderAnalyzer SenderIdentityAnalyzer instance.
     */
    public EmailSignalEngine(TextSignalEngine textEngine, SenderIdentityAnalyzer senderAnalyzer) {
        this.textEngine = textEngine;
        this.senderAnalyzer = senderAnalyzer;
    }

    /**
     * Analyzes an email.
     *
     * @param subject         Subject, may be null.
     * @param body            Body, may be null.
     * @param sender          Sender, may be null.
     * @param attachmentCount Number of attachments.
     * @return EmailVerdict instance.
     */
    public EmailVerdict analyze(String subject, String body, String sender, int attachmentCount) {
        String text = (Objects.toString(subject, "") + " " + Objects.toString(body, "")).trim();
        log.debug("Analyzing email of {} characters with {} attachments", text.length(), attachmentCount);
        return verdict(text, sender, attachmentCount > 0);
    }

    /**
     * Analyzes text with an optional sender.
     *
     * @param text   Text.
     * @param sender Sender, may be null.
     * @return EmailVerdict instance.
     */
    public EmailVerdict analyze(String text, String sender) {
        return verdict(text, sender, false);
    }

    private EmailVerdict verdict(String text, String sender, boolean attachmentWarning) {
        SignalResult textResult = textEngine.analyze(text);
        if (StringUtils.isBlank(sender)) {
            return new EmailVerdict(textResult, textResult, null, attachmentWarning);
        }

        SignalResult senderResult = senderAnalyzer.analyzeSender(sender);
        Set<String> indicators = new HashSet<>(textResult.getIndicators());
        indicators.addAll(senderResult.getIndicators());

        SignalResult combined = SignalResult.of(
                Math.max(textResult.getRiskScore(), senderResult.getRiskScore()),
                indicators,
                (textResult.getConfidence() + senderResult.getConfidence()) / 2);
        return new EmailVerdict(combined, textResult, senderResult, attachmentWarning);
    }
}
