package io.nimbusio.webserver.api.auth;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Map;

/**
 * The access control policy of a collection.
 *
 * A policy holds ordered IP rules, ordered referer rules and a password-required fallback. It may also hold location
 * policies: the policy of the first location whose prefix matches the request path replaces the collection policy
 * for that request.
 */
public final class AccessControlPolicy {

    /**
     * The policy of a collection without an access control document: every request must present credentials.
     */
    public static final AccessControlPolicy DEFAULT = new AccessControlPolicy(
            ImmutableList.of(), ImmutableList.of(), true, ImmutableList.of());

    private final ImmutableList<IpRule> ipRules;
    private final ImmutableList<RefererRule> refererRules;
    private final boolean passwordRequired;
    private final ImmutableList<Map.Entry<String, AccessControlPolicy>> locations;

    public AccessControlPolicy(List<IpRule> ipRules,
                               List<RefererRule> refererRules,
                               boolean passwordRequired,
                               List<Map.Entry<String, AccessControlPolicy>> locations) {
        this.ipRules = ImmutableList.copyOf(ipRules);
        this.refererRules = ImmutableList.copyOf(refererRules);
        this.passwordRequired = passwordRequired;
        this.locations = ImmutableList.copyOf(locations);
    }

    public List<IpRule> getIpRules() {
        return ipRules;
    }

    public List<RefererRule> getRefererRules() {
        return refererRules;
    }

    public boolean isPasswordRequired() {
        return passwordRequired;
    }

    public List<Map.Entry<String, AccessControlPolicy>> getLocations() {
        return locations;
    }

    /**
     * The policy that governs a request for {@code resourcePath}.
     */
    public AccessControlPolicy policyFor(String resourcePath) {
        Preconditions.checkNotNull(resourcePath);
        for (Map.Entry<String, AccessControlPolicy> location : locations) {
            if (resourcePath.startsWith(location.getKey())) {
                return location.getValue();
            }
        }
        return this;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ipRules", ipRules)
                .add("refererRules", refererRules)
                .add("passwordRequired", passwordRequired)
                .add("locations", locations.size())
                .toString();
    }
}
