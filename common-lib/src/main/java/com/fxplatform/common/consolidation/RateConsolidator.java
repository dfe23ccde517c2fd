package com.fxplatform.common.consolidation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;
import com.fxplatform.common.model.RawQuote;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strategy contract for merging one ingestion cycle's quotes for a pair into a single rate.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b> (safe to call concurrently)</li>
 *   <li><b>Pure</b>: no logging, no reactive types, no side effects</li>
 *   <li><b>Non-null</b>: always return a {@link ConsolidatedRate} for a non-empty input</li>
 * </ul>
 *
 * <p>Current implementation: {@link ReliabilityWeightedConsolidator}.
 * Register as a Spring {@code @Bean} in the ingestion configuration to swap strategies.
 */
public interface RateConsolidator {

    /**
     * @param pair   the pair all quotes belong to
     * @param quotes non-null, non-empty
     */
    ConsolidatedRate consolidate(PairKey pair, List<RawQuote> quotes);

    /**
     * Groups a cycle's quotes by pair (first-seen order) and consolidates each group.
     */
    default Map<PairKey, ConsolidatedRate> consolidateAll(List<RawQuote> quotes) {
        Map<PairKey, List<RawQuote>> byPair = new LinkedHashMap<>();
        for (RawQuote q : quotes) {
            byPair.computeIfAbsent(q.pair(), k -> new ArrayList<>()).add(q);
        }
        Map<PairKey, ConsolidatedRate> result = new LinkedHashMap<>();
        byPair.forEach((pair, group) -> result.put(pair, consolidate(pair, group)));
        return result;
    }
}
