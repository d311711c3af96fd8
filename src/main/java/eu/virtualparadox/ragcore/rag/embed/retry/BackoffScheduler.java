package eu.virtualparadox.ragcore.rag.embed.retry;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking delay source for retry backoff.
 */
public interface BackoffScheduler {

    /**
     * @param delay time to wait
     * @return a future completing once {@code delay} has elapsed; cancelling it drops the pending timer
     */
    CompletableFuture<Void> delay(Duration delay);
}
