package io.github.drompincen.repowatch.gateway.config;

import io.github.drompincen.repowatch.runtime.config.RepoWatchProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    /** Drives the periodic tick; one thread so ticks never overlap within this process. */
    @Bean
    ThreadPoolTaskScheduler taskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("repo-tick-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    /** Worker pool executing monitor task bodies. A full queue rejects new submissions. */
    @Bean
    ThreadPoolTaskExecutor monitorTaskExecutor(RepoWatchProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorker().getPoolSize());
        executor.setMaxPoolSize(properties.getWorker().getPoolSize());
        executor.setQueueCapacity(properties.getWorker().getQueueCapacity());
        executor.setThreadNamePrefix("repo-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        return executor;
    }
}
