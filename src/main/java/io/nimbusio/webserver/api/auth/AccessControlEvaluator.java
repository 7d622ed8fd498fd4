package io.nimbusio.webserver.api.auth;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Decides whether a request may access a collection.
 *
 * Rules are evaluated first-match in a fixed order:
 * <ol>
 * <li>IP rules, matched against the requester address;</li>
 * <li>referer rules, matched against the referer host (skipped when the request has no referer);</li>
 * <li>the password-required setting of the policy;</li>
 * <li>otherwise access is forbidden.</li>
 * </ol>
 * Only rules covering the required access level are considered. When the request path falls under one of the
 * policy's locations, the location's policy is used instead of the collection's.
 *
 * The evaluator has no state and may be shared freely.
 */
public final class AccessControlEvaluator {

    public AccessDecision evaluate(AccessLevel requiredLevel,
                                   AccessControlPolicy collectionPolicy,
                                   AccessRequestContext context) {
        Preconditions.checkNotNull(requiredLevel);
        if (requiredLevel == AccessLevel.NO_ACCESS) {
            return AccessDecision.granted("no access required");
        }

        final AccessControlPolicy policy = collectionPolicy.policyFor(context.getResourcePath());

        for (IpRule rule : policy.getIpRules()) {
            if (rule.appliesTo(requiredLevel) && rule.matches(context.getRequesterAddress())) {
                return decide(rule, "ip rule " + rule);
            }
        }

        final Optional<String> refererHost = context.getRefererHost();
        if (refererHost.isPresent()) {
            for (RefererRule rule : policy.getRefererRules()) {
                if (rule.appliesTo(requiredLevel) && rule.matches(refererHost.get())) {
                    return decide(rule, "referer rule " + rule);
                }
            }
        }

        if (policy.isPasswordRequired()) {
            return AccessDecision.requiresSecondaryAuth("password required");
        }

        return AccessDecision.forbidden("no rule grants " + requiredLevel.documentName());
    }

    private static AccessDecision decide(AccessRule rule, String reason) {
        switch (rule.getEffect()) {
            case ALLOW:
                return AccessDecision.granted(reason);
            case DENY:
                return AccessDecision.forbidden(reason);
            case PASSWORD:
                return AccessDecision.requiresSecondaryAuth(reason);
            default:
                throw new IllegalStateException("Unknown rule effect " + rule.getEffect());
        }
    }
}
