package com.z254.gridpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * GRIDPULSE - streaming analysis of regional power demand.
 *
 * <p>GRIDPULSE provides:
 * <ul>
 *   <li>Pipeline Orchestrator - step templates for forecast, retrieval, news and dialogue queries</li>
 *   <li>Durable Sessions - Redis-backed task state with TTL and follow-up resets</li>
 *   <li>Event Bus - live broadcast plus a bounded, replayable event log</li>
 *   <li>Signal Engine - change-point detection and adaptive anomaly zones</li>
 *   <li>Influence Analyzer - correlation ranking of weather, season and structure factors</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class GridPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(GridPulseApplication.class, args);
    }
}
