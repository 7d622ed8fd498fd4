package io.nimbusio.webserver.api.auth;

import java.net.InetAddress;
import java.util.Set;

/**
 * A rule matching requests whose source address is inside a network.
 */
public final class IpRule extends AccessRule {

    private final CidrBlock cidr;

    public IpRule(CidrBlock cidr, RuleEffect effect, Set<AccessLevel> levels) {
        super(effect, levels);
        this.cidr = cidr;
    }

    public boolean matches(InetAddress address) {
        return cidr.contains(address);
    }

    @Override
    public String toString() {
        return "ip " + cidr + " " + getEffect() + " " + getLevels();
    }
}
