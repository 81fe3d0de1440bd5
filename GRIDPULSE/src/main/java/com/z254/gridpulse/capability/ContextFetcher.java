package com.z254.gridpulse.capability;

import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.RegionInfo;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Source of dated external records (news, notices). Optional.
 */
public interface ContextFetcher {

    /**
     * Search recent records.
     *
     * @param query  search text
     * @param region region to focus on, may be null
     * @param days   how far back to search
     */
    Mono<List<ContextRecord>> fetch(String query, RegionInfo region, int days);
}
