package com.z254.gridpulse.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Worker pool for blocking capability calls.
 */
@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "dispose")
    public Scheduler blockingScheduler(GridPulseProperties properties) {
        GridPulseProperties.PipelineProperties pipeline = properties.getPipeline();
        return Schedulers.newBoundedElastic(
                pipeline.getBlockingPoolSize(),
                pipeline.getBlockingQueueSize(),
                "gridpulse-blocking");
    }
}
