package io.nimbusio.webserver.api.auth;

import com.google.common.net.InetAddresses;
import io.nimbusio.webserver.api.common.ErrorCode;
import io.nimbusio.webserver.api.common.HttpException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AccessRequestTest {

    @Test
    void missingForwardedForIsABadRequest() {
        for (String forwardedFor : new String[]{null, "", "  "}) {
            final HttpException ex = Assertions.assertThrows(HttpException.class,
                    () -> AccessRequest.parseRequesterAddress(forwardedFor, "/c/a/data/k"));
            Assertions.assertEquals(ErrorCode.INVALID_REQUESTER_ADDRESS, ex.getErrorCode());
        }
    }

    /**
     * The original client is the first entry of X-Forwarded-For, with or without a port.
     */
    @Test
    void requesterIsTheFirstForwardedForEntry() {
        Assertions.assertEquals(InetAddresses.forString("10.0.0.1"),
                AccessRequest.parseRequesterAddress("10.0.0.1, 172.16.0.1", "/"));
        Assertions.assertEquals(InetAddresses.forString("10.0.0.1"),
                AccessRequest.parseRequesterAddress("10.0.0.1:5555", "/"));
        Assertions.assertEquals(InetAddresses.forString("2001:db8::1"),
                AccessRequest.parseRequesterAddress("[2001:db8::1]:443", "/"));
    }

    @Test
    void malformedForwardedForIsABadRequest() {
        final HttpException ex = Assertions.assertThrows(HttpException.class,
                () -> AccessRequest.parseRequesterAddress("not-an-address", "/"));
        Assertions.assertEquals(ErrorCode.INVALID_REQUESTER_ADDRESS, ex.getErrorCode());
    }

    @Test
    void refererHostIsLowercased() {
        Assertions.assertEquals("www.example.com",
                AccessRequest.parseRefererHost("https://WWW.Example.com/page?q=1", "/"));
        Assertions.assertNull(AccessRequest.parseRefererHost(null, "/"));
        Assertions.assertNull(AccessRequest.parseRefererHost("", "/"));
    }

    @Test
    void refererMustBeAnAbsoluteHttpUrl() {
        for (String referer : new String[]{"/relative/path", "ftp://example.com/", "http://", "ht tp://x"}) {
            final HttpException ex = Assertions.assertThrows(HttpException.class,
                    () -> AccessRequest.parseRefererHost(referer, "/"), referer);
            Assertions.assertEquals(ErrorCode.INVALID_REFERER, ex.getErrorCode());
        }
    }

    @Test
    void timestampIsOptionalButMustBeNumeric() {
        Assertions.assertNull(AccessRequest.parseTimestamp(null, "/"));
        Assertions.assertEquals(Long.valueOf(1614834367L), AccessRequest.parseTimestamp(" 1614834367 ", "/"));
        final HttpException ex = Assertions.assertThrows(HttpException.class,
                () -> AccessRequest.parseTimestamp("yesterday", "/"));
        Assertions.assertEquals(ErrorCode.INVALID_PARAMETER, ex.getErrorCode());
    }
}
