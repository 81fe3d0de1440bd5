package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.RegionInfo;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Source of the target metric. Required by the forecast flow.
 */
public interface MetricFetcher {

    /**
     * Fetch daily observations for a region, inclusive of both ends.
     */
    Mono<MetricSeries> fetch(RegionInfo region, LocalDate start, LocalDate end);
}
