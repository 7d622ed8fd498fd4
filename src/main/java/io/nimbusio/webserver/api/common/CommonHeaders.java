package io.nimbusio.webserver.api.common;

/**
 * Names of the non-standard headers used by the web servers.
 */
public final class CommonHeaders {

    public static final String REQUEST_ID = "x-nimbus-io-request-id";
    public static final String VERSION_IDENTIFIER = "x-nimbus-io-version-identifier";
    public static final String TIMESTAMP = "x-nimbus-io-timestamp";
    public static final String X_FORWARDED_FOR = "x-forwarded-for";

    private CommonHeaders() {

    }
}
