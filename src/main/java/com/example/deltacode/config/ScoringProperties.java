package com.example.deltacode.config;

import com.example.deltacode.domain.ScoringConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Application defaults for scoring, bound from {@code deltacode.scoring}:
 * <pre>
 * deltacode.scoring.weights[size_delta]=0.001
 * deltacode.scoring.weights[license_changed]=10.0
 * deltacode.scoring.default-attribute-weight=5.0
 * deltacode.scoring.tracked-attributes=license,copyright
 * deltacode.scoring.similarity-threshold=0.0
 * deltacode.scoring.parallel-matching=false
 * </pre>
 * Weights given here override the built-in table entry by entry.
 */
@Data
@ConfigurationProperties(prefix = "deltacode.scoring")
public class ScoringProperties {
    private Map<String, Double> weights = new LinkedHashMap<>();
    private double defaultAttributeWeight = ScoringConfig.DEFAULT_ATTRIBUTE_WEIGHT;
    private List<String> trackedAttributes = new ArrayList<>(ScoringConfig.DEFAULT_TRACKED_ATTRIBUTES);
    private double similarityThreshold;
    private boolean parallelMatching;

    public ScoringConfig toScoringConfig() {
        Map<String, Double> merged = new LinkedHashMap<>(ScoringConfig.DEFAULT_WEIGHTS);
        merged.putAll(weights);
        return ScoringConfig.builder()
                .weights(merged)
                .defaultAttributeWeight(defaultAttributeWeight)
                .trackedAttributes(trackedAttributes)
                .similarityThreshold(similarityThreshold)
                .parallelMatching(parallelMatching)
                .build();
    }
}
