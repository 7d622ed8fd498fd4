package io.nimbusio.webserver.api.auth;

import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;

import java.net.InetAddress;

/**
 * An IPv4 or IPv6 network in CIDR notation. A bare address is a network with a full-length prefix.
 */
public final class CidrBlock {

    private final String text;
    private final byte[] network;
    private final int prefixLength;

    private CidrBlock(String text, byte[] network, int prefixLength) {
        this.text = text;
        this.network = network;
        this.prefixLength = prefixLength;
    }

    /**
     * @throws IllegalArgumentException if the text is not an address or an address/prefix pair
     */
    public static CidrBlock parse(String text) {
        Preconditions.checkNotNull(text);
        final int slash = text.indexOf('/');
        final InetAddress address = InetAddresses.forString(slash < 0 ? text : text.substring(0, slash));
        final byte[] bytes = address.getAddress();
        final int maxPrefix = bytes.length * 8;
        final int prefixLength;
        if (slash < 0) {
            prefixLength = maxPrefix;
        } else {
            try {
                prefixLength = Integer.parseInt(text.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in " + text, e);
            }
            Preconditions.checkArgument(prefixLength >= 0 && prefixLength <= maxPrefix,
                    "Prefix length out of range in %s", text);
        }
        return new CidrBlock(text, bytes, prefixLength);
    }

    public boolean contains(InetAddress address) {
        final byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }
        int remaining = prefixLength;
        for (int i = 0; i < network.length && remaining > 0; i++) {
            final int bits = Math.min(remaining, 8);
            final int mask = (0xff << (8 - bits)) & 0xff;
            if ((candidate[i] & mask) != (network[i] & mask)) {
                return false;
            }
            remaining -= bits;
        }
        return true;
    }

    @Override
    public String toString() {
        return text;
    }
}
