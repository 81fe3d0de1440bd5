package com.z254.gridpulse.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for GRIDPULSE service.
 * Event and capability meters are tagged and registered where they are recorded.
 */
@Configuration
public class MetricsConfig {

    // ==================== Task Metrics ====================

    @Bean
    public Counter tasksStartedCounter(MeterRegistry registry) {
        return Counter.builder("gridpulse.tasks.started")
                .description("Total pipeline runs started")
                .register(registry);
    }

    @Bean
    public Counter tasksCompletedCounter(MeterRegistry registry) {
        return Counter.builder("gridpulse.tasks.completed")
                .description("Total pipeline runs completed")
                .register(registry);
    }

    @Bean
    public Counter tasksFailedCounter(MeterRegistry registry) {
        return Counter.builder("gridpulse.tasks.failed")
                .description("Total pipeline runs ended in error")
                .register(registry);
    }

    @Bean
    public Timer taskDurationTimer(MeterRegistry registry) {
        return Timer.builder("gridpulse.task.duration")
                .description("Pipeline run duration")
                .register(registry);
    }
}
