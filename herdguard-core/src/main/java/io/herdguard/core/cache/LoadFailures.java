package io.herdguard.core.cache;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Recovers the loader's own exception from future completions.
 */
final class LoadFailures {

    private LoadFailures() {
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrows the loader's exception as-is. Only a checked exception, which a
     * {@code Function} can only raise by sneaky throwing, gets wrapped.
     */
    static RuntimeException rethrow(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        throw new CompletionException(cause);
    }
}
