package io.nimbusio.webserver.api.backend;

import com.google.common.base.MoreObjects;
import io.nimbusio.webserver.api.model.exceptions.InvalidTimestampException;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * The If-Modified-Since and If-Unmodified-Since headers of a request, kept unparsed until they are evaluated against
 * the object they apply to.
 */
public final class ConditionalHeaders {

    public static final ConditionalHeaders NONE = new ConditionalHeaders(null, null);

    public enum Outcome {
        PROCEED,
        NOT_MODIFIED,
        PRECONDITION_FAILED
    }

    @Nullable
    private final String ifModifiedSince;
    @Nullable
    private final String ifUnmodifiedSince;

    public ConditionalHeaders(@Nullable String ifModifiedSince, @Nullable String ifUnmodifiedSince) {
        this.ifModifiedSince = StringUtils.trimToNull(ifModifiedSince);
        this.ifUnmodifiedSince = StringUtils.trimToNull(ifUnmodifiedSince);
    }

    /**
     * Evaluate the headers against the last modification time of an object. Times are compared to the second. Both
     * headers are parsed before either is compared.
     *
     * @throws InvalidTimestampException if either header is not an RFC 1123 date
     */
    public Outcome evaluate(Instant lastModified) {
        final Instant unmodifiedSince = parse(ifUnmodifiedSince);
        final Instant modifiedSince = parse(ifModifiedSince);
        final Instant stored = lastModified.truncatedTo(ChronoUnit.SECONDS);
        if (unmodifiedSince != null && stored.isAfter(unmodifiedSince)) {
            return Outcome.PRECONDITION_FAILED;
        }
        if (modifiedSince != null && stored.isBefore(modifiedSince)) {
            return Outcome.NOT_MODIFIED;
        }
        return Outcome.PROCEED;
    }

    @Nullable
    static Instant parse(@Nullable String httpDate) {
        if (httpDate == null) {
            return null;
        }
        try {
            return ZonedDateTime.parse(httpDate, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidTimestampException("Invalid HTTP date: " + httpDate, e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("ifModifiedSince", ifModifiedSince)
                .add("ifUnmodifiedSince", ifUnmodifiedSince)
                .toString();
    }
}
