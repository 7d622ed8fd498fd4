package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The result of evaluating a request against an access control policy.
 */
public final class AccessDecision {

    public enum Outcome {
        GRANTED,
        FORBIDDEN,
        REQUIRES_SECONDARY_AUTH
    }

    private final Outcome outcome;
    private final String reason;

    private AccessDecision(Outcome outcome, String reason) {
        this.outcome = Preconditions.checkNotNull(outcome);
        this.reason = Preconditions.checkNotNull(reason);
    }

    public static AccessDecision granted(String reason) {
        return new AccessDecision(Outcome.GRANTED, reason);
    }

    public static AccessDecision forbidden(String reason) {
        return new AccessDecision(Outcome.FORBIDDEN, reason);
    }

    public static AccessDecision requiresSecondaryAuth(String reason) {
        return new AccessDecision(Outcome.REQUIRES_SECONDARY_AUTH, reason);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getReason() {
        return reason;
    }

    public boolean isGranted() {
        return outcome == Outcome.GRANTED;
    }

    public boolean isRequiresSecondaryAuth() {
        return outcome == Outcome.REQUIRES_SECONDARY_AUTH;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("outcome", outcome)
                .add("reason", reason)
                .toString();
    }
}
