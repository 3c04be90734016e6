package br.edu.ifba.hybridrag.utils;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for callers that need a synchronous view of the async services.
 */
public final class AsyncUtil {

    private AsyncUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Waits for a future and rethrows its failure as the original unchecked exception,
     * so exception mappers see the domain exception rather than a CompletionException.
     */
    public static <T> T await(@NotNull CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    /**
     * Strips CompletionException and ExecutionException wrappers.
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
