package com.example.cardclash.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler for turn, grace and join timers. Threads are daemons named {@code match-clock-N};
 * cancelled tasks are removed from the queue straight away since every action cancels one.
 */
@Configuration
public class SchedulerConfig {

    public static final String MATCH_CLOCK_SCHEDULER = "matchClockScheduler";

    @Bean(name = MATCH_CLOCK_SCHEDULER)
    public ThreadPoolTaskScheduler matchClockScheduler(CardClashProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("match-clock-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
