package com.fxplatform.common.validation;

import com.fxplatform.common.model.ConsolidatedRate;
import com.fxplatform.common.model.PairKey;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scans every currency triple (i &lt; j &lt; k) in a set of rates for triangular inconsistency:
 * <pre>
 *   implied   = r(c1→c2) × r(c2→c3) × r(c3→c1)
 *   deviation = |implied − 1|
 * </pre>
 * Each leg is taken directly or as the reciprocal of the stored inverse pair; triples with a
 * missing leg are skipped. A deviation above the tolerance is reported with its profit
 * potential in basis points.
 */
public class ArbitrageDetector {

    private final double tolerance;
    private final Clock clock;

    public ArbitrageDetector(double tolerance, Clock clock) {
        this.tolerance = tolerance;
        this.clock     = clock;
    }

    public ArbitrageDetector(double tolerance) {
        this(tolerance, Clock.systemUTC());
    }

    public List<ArbitrageOpportunity> detect(Collection<ConsolidatedRate> rates) {
        Map<PairKey, Double> byPair = new HashMap<>();
        Set<String> currencySet = new LinkedHashSet<>();
        for (ConsolidatedRate r : rates) {
            byPair.put(r.pair(), r.rate());
            currencySet.add(r.pair().base());
            currencySet.add(r.pair().quote());
        }
        List<String> currencies = new ArrayList<>(currencySet);

        List<ArbitrageOpportunity> found = new ArrayList<>();
        for (int i = 0; i < currencies.size(); i++) {
            for (int j = i + 1; j < currencies.size(); j++) {
                for (int k = j + 1; k < currencies.size(); k++) {
                    String c1 = currencies.get(i), c2 = currencies.get(j), c3 = currencies.get(k);
                    Double r12 = find(byPair, c1, c2);
                    Double r23 = find(byPair, c2, c3);
                    Double r31 = find(byPair, c3, c1);
                    if (r12 == null || r23 == null || r31 == null) continue;

                    double implied   = r12 * r23 * r31;
                    double deviation = Math.abs(implied - 1.0);
                    if (deviation > tolerance) {
                        found.add(new ArbitrageOpportunity(List.of(c1, c2, c3), r12, r23, r31,
                            implied, deviation, deviation * 10_000, clock.instant()));
                    }
                }
            }
        }
        return found;
    }

    static Double find(Map<PairKey, Double> byPair, String from, String to) {
        Double direct = byPair.get(PairKey.of(from, to));
        if (direct != null) return direct;
        Double inverse = byPair.get(PairKey.of(to, from));
        if (inverse != null && inverse != 0.0) return 1.0 / inverse;
        return null;
    }
}
