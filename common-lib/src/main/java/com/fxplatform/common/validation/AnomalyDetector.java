package com.fxplatform.common.validation;

import com.fxplatform.common.model.PairKey;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling z-score detector.
 *
 * <p>Keeps a bounded per-pair window of the last {@code windowSize} observed rates. Each call
 * scores the new rate against the window <em>before</em> it is appended, then appends it:
 * <pre>
 *   z            = |rate − mean| / stddev      (population stddev)
 *   anomalyScore = min(z / 3, 1)
 * </pre>
 * Returns a zero score until {@code minHistory} observations exist. With zero stddev a rate equal
 * to the mean scores 0 and any other rate scores 1.
 *
 * <p>No Spring dependency. Thread-safe via per-pair synchronized blocks.
 */
public class AnomalyDetector {

    private static final double Z_NORMALIZER = 3.0;

    private final int windowSize;
    private final int minHistory;

    private final ConcurrentHashMap<PairKey, Deque<Double>> windows = new ConcurrentHashMap<>();

    public AnomalyDetector(int windowSize, int minHistory) {
        if (windowSize < 1 || minHistory < 1) {
            throw new IllegalArgumentException("windowSize and minHistory must be positive");
        }
        this.windowSize = windowSize;
        this.minHistory = minHistory;
    }

    public AnomalyAssessment observe(PairKey pair, double rate) {
        Deque<Double> window = windows.computeIfAbsent(pair, k -> new ArrayDeque<>(windowSize));
        synchronized (window) {
            AnomalyAssessment assessment = window.size() < minHistory
                ? AnomalyAssessment.insufficientHistory(window.size())
                : score(window, rate);
            window.addLast(rate);
            if (window.size() > windowSize) window.pollFirst();
            return assessment;
        }
    }

    private AnomalyAssessment score(Deque<Double> window, double rate) {
        int n = window.size();
        double mean = 0.0;
        for (double r : window) mean += r;
        mean /= n;

        double variance = 0.0;
        for (double r : window) variance += (r - mean) * (r - mean);
        double stdDev = Math.sqrt(variance / n);

        double z;
        if (stdDev == 0.0) {
            z = rate == mean ? 0.0 : Double.POSITIVE_INFINITY;
        } else {
            z = Math.abs(rate - mean) / stdDev;
        }
        double anomalyScore = Math.min(z / Z_NORMALIZER, 1.0);
        return new AnomalyAssessment(z, anomalyScore, mean, stdDev, n, true);
    }

    public int historySize(PairKey pair) {
        Deque<Double> window = windows.get(pair);
        if (window == null) return 0;
        synchronized (window) {
            return window.size();
        }
    }

    public int trackedPairs() {
        return windows.size();
    }

    public void clear(PairKey pair) {
        windows.remove(pair);
    }

    public void clearAll() {
        windows.clear();
    }
}
