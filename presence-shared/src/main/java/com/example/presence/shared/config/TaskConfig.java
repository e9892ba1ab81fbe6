package com.example.presence.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

@Configuration
public class TaskConfig {

    /**
     * Thread pool for @Async methods.
     */
    @Bean
    @Primary
    public AsyncTaskExecutor asyncTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(10);
        executor.setThreadNamePrefix("async-task-");
        executor.initialize();
        return executor;
    }

    /**
     * Thread pool for @Scheduled methods. Retry, cleanup, retention and outbox polling
     * each get their own thread so a long cleanup never delays the outbox.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Blocking JDBC calls made from reactive pipelines (WebSocket handler, broadcaster)
     * are shifted onto this scheduler instead of the Netty event loop.
     */
    @Bean
    public Scheduler jdbcScheduler() {
        return Schedulers.newBoundedElastic(50, 100_000, "jdbc-io-");
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
