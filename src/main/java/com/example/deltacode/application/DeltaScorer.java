package com.example.deltacode.application;

import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.ScoringConfig;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Weighted sum of a delta's factors, summed in factor order and rounded to
 * four decimals so equal inputs always print the same score.
 */
@Component
public class DeltaScorer {
    private static final double SCALE = 10_000.0;

    public Delta score(Delta delta, ScoringConfig config) {
        return delta.withScore(scoreOf(delta.getFactors(), config));
    }

    public double scoreOf(Map<String, Long> factors, ScoringConfig config) {
        double total = 0.0;
        for (Map.Entry<String, Long> factor : factors.entrySet()) {
            total += config.weightFor(factor.getKey()) * factor.getValue();
        }
        return Math.round(total * SCALE) / SCALE;
    }
}
