package com.tribrid.studio.config;

import com.tribrid.studio.telemetry.FrameScheduler;
import com.tribrid.studio.telemetry.StudioLoop;
import com.tribrid.studio.telemetry.TaskSchedulerFrameScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

/**
 * Threading for the telemetry pipeline.
 *
 * A single scheduler thread is the studio loop: it runs every pipeline
 * mutation and the coalesced flushes, so pipeline state needs no locking.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class LoopConfig {

    private final TelemetryConfig telemetryConfig;

    @Bean(name = "studioLoopScheduler", destroyMethod = "shutdown")
    public ThreadPoolTaskScheduler studioLoopScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("studio-loop-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        log.info("Initializing studio loop with frame interval {}ms", telemetryConfig.getFrameIntervalMs());
        return scheduler;
    }

    @Bean
    public StudioLoop studioLoop(ThreadPoolTaskScheduler studioLoopScheduler) {
        return new StudioLoop(studioLoopScheduler);
    }

    @Bean
    public FrameScheduler frameScheduler(ThreadPoolTaskScheduler studioLoopScheduler) {
        return new TaskSchedulerFrameScheduler(
                studioLoopScheduler,
                Duration.ofMillis(telemetryConfig.getFrameIntervalMs())
        );
    }
}
