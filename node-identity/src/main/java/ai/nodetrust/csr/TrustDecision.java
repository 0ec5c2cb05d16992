// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.nodetrust.csr;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestCondition;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestConditionBuilder;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * The outcome of evaluating a certificate signing request: approve, deny, or an error which
 * leaves the request pending.
 */
public class TrustDecision {

    public enum Outcome { APPROVE, DENY, ERROR }

    private final Outcome outcome;
    private final String reason;
    private final String message;
    private final RuntimeException error;

    private TrustDecision(Outcome outcome, String reason, String message, RuntimeException error) {
        this.outcome = outcome;
        this.reason = reason;
        this.message = message;
        this.error = error;
    }

    public static TrustDecision approve(String message) {
        return new TrustDecision(Outcome.APPROVE, "AutoApproved", message, null);
    }

    public static TrustDecision deny(String reason, String message) {
        return new TrustDecision(Outcome.DENY, reason, message, null);
    }

    public static TrustDecision error(RuntimeException cause) {
        Objects.requireNonNull(cause);
        return new TrustDecision(Outcome.ERROR, "EvaluationFailed", cause.getMessage(), cause);
    }

    public Outcome outcome() { return outcome; }

    public boolean isApproved() { return outcome == Outcome.APPROVE; }

    /** A machine readable reason, in CamelCase */
    public String reason() { return reason; }

    public String message() { return message; }

    /** Returns the failure which prevented a decision, if this is an error */
    public Optional<RuntimeException> error() { return Optional.ofNullable(error); }

    /**
     * Returns the condition recording this decision on the signing request object.
     * Errors have no condition: the request stays pending.
     */
    public Optional<CertificateSigningRequestCondition> toCondition(Instant now) {
        if (outcome == Outcome.ERROR) return Optional.empty();
        return Optional.of(new CertificateSigningRequestConditionBuilder()
                                   .withType(outcome == Outcome.APPROVE ? "Approved" : "Denied")
                                   .withStatus("True")
                                   .withReason(reason)
                                   .withMessage(message)
                                   .withLastUpdateTime(now.toString())
                                   .build());
    }

    @Override
    public String toString() {
        return outcome + " (" + reason + "): " + message;
    }

}
