package io.nimbusio.webserver.api.auth;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class CidrBlockTest {

    @Test
    void containsAddressesInTheNetwork() {
        final CidrBlock block = CidrBlock.parse("10.1.0.0/16");
        Assertions.assertTrue(block.contains(InetAddresses.forString("10.1.200.3")));
        Assertions.assertFalse(block.contains(InetAddresses.forString("10.2.0.1")));
    }

    @Test
    void prefixesNotOnAByteBoundary() {
        final CidrBlock block = CidrBlock.parse("192.168.0.0/20");
        Assertions.assertTrue(block.contains(InetAddresses.forString("192.168.15.255")));
        Assertions.assertFalse(block.contains(InetAddresses.forString("192.168.16.0")));
    }

    @Test
    void bareAddressMatchesOnlyItself() {
        final CidrBlock block = CidrBlock.parse("::1");
        Assertions.assertTrue(block.contains(InetAddresses.forString("::1")));
        Assertions.assertFalse(block.contains(InetAddresses.forString("::2")));
    }

    @Test
    void familiesDoNotMix() {
        Assertions.assertFalse(CidrBlock.parse("0.0.0.0/0").contains(InetAddresses.forString("::1")));
        Assertions.assertTrue(CidrBlock.parse("::/0").contains(InetAddresses.forString("2001:db8::1")));
    }

    @Test
    void invalidBlocksAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("10.0.0.0/33"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("10.0.0.0/x"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> CidrBlock.parse("example.com/8"));
    }
}
