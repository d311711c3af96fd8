package eu.virtualparadox.ragcore.rag.embed.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TaskSchedulerBackoffSchedulerTest {

    private ThreadPoolTaskScheduler taskScheduler;
    private TaskSchedulerBackoffScheduler backoffScheduler;

    @BeforeEach
    void setUp() {
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(1);
        taskScheduler.setThreadNamePrefix("test-backoff-");
        taskScheduler.setRemoveOnCancelPolicy(true);
        taskScheduler.initialize();
        backoffScheduler = new TaskSchedulerBackoffScheduler(taskScheduler);
    }

    @AfterEach
    void tearDown() {
        taskScheduler.shutdown();
    }

    @Test
    @DisplayName("The delay future completes after the requested time")
    void delay_completes() throws Exception {
        final long start = System.nanoTime();

        backoffScheduler.delay(Duration.ofMillis(50)).get(5, TimeUnit.SECONDS);

        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(40);
    }

    @Test
    @DisplayName("Cancelling the delay future removes the timer")
    void delay_cancel_removesTimer() {
        final CompletableFuture<Void> delay = backoffScheduler.delay(Duration.ofMinutes(10));
        assertThat(taskScheduler.getScheduledThreadPoolExecutor().getQueue()).hasSize(1);

        delay.cancel(false);

        assertThat(delay).isCancelled();
        assertThat(taskScheduler.getScheduledThreadPoolExecutor().getQueue()).isEmpty();
    }
}
