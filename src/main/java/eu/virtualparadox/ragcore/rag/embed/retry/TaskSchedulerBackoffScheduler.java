package eu.virtualparadox.ragcore.rag.embed.retry;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link BackoffScheduler} backed by a Spring {@link TaskScheduler}; waiting requests hold no thread.
 */
@RequiredArgsConstructor
public final class TaskSchedulerBackoffScheduler implements BackoffScheduler {

    private final TaskScheduler taskScheduler;

    @Override
    public CompletableFuture<Void> delay(final Duration delay) {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final ScheduledFuture<?> timer = taskScheduler.schedule(() -> future.complete(null), Instant.now().plus(delay));
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                timer.cancel(false);
            }
        });
        return future;
    }
}
