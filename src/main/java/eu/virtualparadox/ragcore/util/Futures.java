package eu.virtualparadox.ragcore.util;

import eu.virtualparadox.ragcore.exception.OperationCancelledException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {

    private Futures() {
        // prevent instantiation
    }

    /**
     * Waits for {@code future} and rethrows its failure unwrapped.
     * <p>An interrupt of the waiting thread fires {@code cancellation}, so the asynchronous work is
     * aborted too.</p>
     *
     * @throws OperationCancelledException if the wait was interrupted or the future was cancelled
     */
    public static <T> T await(final CompletableFuture<T> future, final CancellationSignal cancellation) {
        try {
            return future.get();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            cancellation.cancel();
            throw new OperationCancelledException("Interrupted while waiting", e);
        } catch (final CancellationException e) {
            throw new OperationCancelledException("Operation cancelled", e);
        } catch (final ExecutionException e) {
            throw propagate(e.getCause());
        }
    }

    /**
     * Strips {@link CompletionException} / {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(final Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static RuntimeException propagate(final Throwable cause) {
        final Throwable unwrapped = unwrap(cause);
        if (unwrapped instanceof RuntimeException runtime) {
            return runtime;
        }
        if (unwrapped instanceof Error error) {
            throw error;
        }
        return new CompletionException(unwrapped);
    }
}
