package eu.virtualparadox.ragcore.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class ExecutorConfig {

    /**
     * Timers for embedding retry backoff and call deadlines. Tasks only hand the next attempt
     * to the HTTP client, so two threads are plenty.
     */
    @Bean
    public ThreadPoolTaskScheduler embeddingBackoffScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("embedding-backoff-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
