package com.mimecast.phishguard.email;

import com.mimecast.phishguard.signals.RiskLevel;
import com.mimecast.phishguard.signals.SignalResult;

import java.util.Optional;

/**
 * Verdict on an email.
 *
 * <p>Carries the combined result together with the text and sender results it was built from.
 */
public class EmailVerdict {
    private final SignalResult combined;
    private final SignalResult textResult;
    private final SignalResult senderResult;
    private final boolean attachmentWarning;

    /**
     * Constructs a new EmailVerdict instance.
     *
     * @param combined          Combined result.
     * @param textResult        Subject and body result.
     * @param senderResult      Sender result or null when no sender was given.
     * @param attachmentWarning Whether the email carries attachments.
     */
    public EmailVerdict(SignalResult combined, SignalResult textResult, SignalResult senderResult, boolean attachmentWarning) {
        this.combined = combined;
        this.textResult = textResult;
        this.senderResult = senderResult;
        this.attachmentWarning = attachmentWarning;
    }

    /**
     * Gets combined result.
     *
     * @return SignalResult instance.
     */
    public SignalResult getCombined() {
        return combined;
    }

    /**
     * Gets subject and body result.
     *
     * @return SignalResult instance.
     */
    public SignalResult getTextResult() {
        return textResult;
    }

    /**
     * Gets sender result.
     *
     * @return Optional of SignalResult.
     */
    public Optional<SignalResult> getSenderResult() {
        return Optional.ofNullable(senderResult);
    }

    /**
     * Is attachment warning.
     *
     * @return Boolean.
     */
    public boolean isAttachmentWarning() {
        return attachmentWarning;
    }

    /**
     * Gets combined risk level.
     *
     * @return RiskLevel.
     */
    public RiskLevel getRiskLevel() {
        return combined.getRiskLevel();
    }
}
