package eu.virtualparadox.ragcore.rag.embed.retry;

import eu.virtualparadox.ragcore.rag.embed.provider.EProviderError;

import java.time.Duration;

/**
 * Mutable retry bookkeeping for one batch call: attempts made, the next backoff and the last
 * classified failure. Confined to a single call, so it is not thread-safe.
 */
public final class RetryState {

    private final int maxAttempts;
    private Duration nextBackoff;
    private int attempts;
    private ERetryPhase phase = ERetryPhase.ATTEMPTING;
    private EProviderError lastError;
    private Throwable lastFailure;

    /**
     * @param maxAttempts    total number of provider calls allowed ({@code >= 1})
     * @param initialBackoff delay before the first retry, doubled for every following one
     */
    public RetryState(final int maxAttempts, final Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.nextBackoff = initialBackoff;
    }

    /**
     * Records the start of a provider call.
     */
    public void beginAttempt() {
        attempts++;
        phase = ERetryPhase.ATTEMPTING;
    }

    public void succeeded() {
        phase = ERetryPhase.SUCCEEDED;
    }

    /**
     * Records a non-retryable failure; the call ends here.
     */
    public void failed(final EProviderError error, final Throwable failure) {
        record(error, failure);
        phase = ERetryPhase.FAILED;
    }

    /**
     * Records a retryable failure and decides whether another attempt is allowed.
     *
     * @return the delay to wait before the next attempt, or {@code null} when attempts are exhausted
     */
    public Duration retryableFailure(final EProviderError error, final Throwable failure) {
        record(error, failure);
        if (attempts >= maxAttempts) {
            phase = ERetryPhase.EXHAUSTED;
            return null;
        }
        phase = ERetryPhase.RETRYING;
        final Duration delay = nextBackoff;
        nextBackoff = nextBackoff.multipliedBy(2);
        return delay;
    }

    private void record(final EProviderError error, final Throwable failure) {
        this.lastError = error;
        this.lastFailure = failure;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public ERetryPhase getPhase() {
        return phase;
    }

    public EProviderError getLastError() {
        return lastError;
    }

    public Throwable getLastFailure() {
        return lastFailure;
    }
}
