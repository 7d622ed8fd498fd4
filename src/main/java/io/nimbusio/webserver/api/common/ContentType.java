package io.nimbusio.webserver.api.common;

public final class ContentType {

    public static final String APPLICATION_JSON = "application/json";
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";
    public static final String TEXT_PLAIN = "text/plain";

    private ContentType() {

    }
}
