package io.nimbusio.webserver.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class ThrowableUtil {

    private ThrowableUtil() {

    }

    /**
     * Strip the CompletionException and ExecutionException wrappers added by futures.
     */
    public static Throwable getUnderlyingThrowable(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) &&
                current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
