package com.z254.gridpulse.capability.impl;

import com.z254.gridpulse.capability.ContextFetcher;
import com.z254.gridpulse.client.NewsSearchClient;
import com.z254.gridpulse.domain.model.ContextRecord;
import com.z254.gridpulse.domain.model.RegionInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Context records from web news search.
 */
@Component
@ConditionalOnProperty(prefix = "gridpulse.search", name = "enabled", havingValue = "true")
@Slf4j
public class SearchContextFetcher implements ContextFetcher {

    private final NewsSearchClient searchClient;

    public SearchContextFetcher(NewsSearchClient searchClient) {
        this.searchClient = searchClient;
    }

    @Override
    public Mono<List<ContextRecord>> fetch(String query, RegionInfo region, int days) {
        String searchText = region != null
                ? region.getName() + " electricity power demand " + region.getLocalName() + " 用电 供电"
                : query;
        return searchClient.search(searchText, days)
                .map(records -> records.stream()
                        .sorted(Comparator.comparing(ContextRecord::getPublishedDate,
                                Comparator.nullsLast(Comparator.reverseOrder())))
                        .toList());
    }
}
