package com.tradecontrol.config;

import com.tradecontrol.engine.MonotonicClock;
import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the engine.
 *
 * <ul>
 *   <li>{@code engineScheduler}: control loop, heartbeat and phase timers. Three threads so a
 *       stalled loop tick never starves the heartbeat.</li>
 *   <li>{@code venueExecutor}: venue and account calls, so the caller can bound them with a timeout.</li>
 * </ul>
 */
@Configuration
public class SchedulingConfig {

    @Bean("engineScheduler")
    public ThreadPoolTaskScheduler engineScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("engine-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean("venueExecutor")
    public ThreadPoolTaskExecutor venueExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("venue-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonotonicClock monotonicClock() {
        return System::nanoTime;
    }
}
