package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.ContextFetcher;
import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.RegionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Context fetcher used when news search is not configured. Always empty.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.search", name = "enabled", havingValue = "false", matchIfMissing = true)
@Slf4j
public class DisabledContextFetcher implements ContextFetcher {

    public DisabledContextFetcher() {
        log.info("News search disabled; context records will be empty");
    }

    @Override
    public Mono<List<ContextRecord>> fetch(String query, RegionInfo region, int days) {
        return Mono.just(List.of());
    }
}
