package com.example.deltacode.domain;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weight table and matching options for one comparison.
 *
 * <p>Default weights:
 *
 * <ul>
 *   <li>{@code size_delta}: 0.001 per byte
 *   <li>{@code path_delta}: 1.0 per path segment edit
 *   <li>{@code license_changed}: 10.0
 *   <li>{@code copyright_changed}: 5.0
 *   <li>any other {@code <attribute>_changed}: {@link #DEFAULT_ATTRIBUTE_WEIGHT}
 * </ul>
 *
 * Tracked attributes default to {@code license} and {@code copyright}. A
 * similarity threshold of 0 disables name based rename detection.
 */
@Builder(toBuilder = true)
public record ScoringConfig(
        Map<String, Double> weights,
        double defaultAttributeWeight,
        List<String> trackedAttributes,
        double similarityThreshold,
        boolean parallelMatching) {

    public static final double DEFAULT_ATTRIBUTE_WEIGHT = 5.0;
    public static final List<String> DEFAULT_TRACKED_ATTRIBUTES = List.of("license", "copyright");
    public static final Map<String, Double> DEFAULT_WEIGHTS = defaultWeights();

    public ScoringConfig {
        weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights != null ? weights : Map.of()));
        trackedAttributes =
                trackedAttributes != null
                        ? trackedAttributes.stream().distinct().toList()
                        : List.of();
        if (similarityThreshold < 0 || similarityThreshold > 1) {
            throw new IllegalArgumentException(
                    "Similarity threshold must be between 0 and 1: " + similarityThreshold);
        }
    }

    public static ScoringConfig defaults() {
        return new ScoringConfig(
                DEFAULT_WEIGHTS, DEFAULT_ATTRIBUTE_WEIGHT, DEFAULT_TRACKED_ATTRIBUTES, 0.0, false);
    }

    /** Weight for a factor; unlisted attribute factors use the default attribute weight, others 0. */
    public double weightFor(String factorName) {
        Double weight = weights.get(factorName);
        if (weight != null) {
            return weight;
        }
        return Factors.isAttributeFactor(factorName) ? defaultAttributeWeight : 0.0;
    }

    public boolean similarityRenamesEnabled() {
        return similarityThreshold > 0;
    }

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(Factors.SIZE_DELTA, 0.001);
        weights.put(Factors.PATH_DELTA, 1.0);
        weights.put(Factors.attributeFactor("license"), 10.0);
        weights.put(Factors.attributeFactor("copyright"), 5.0);
        return Collections.unmodifiableMap(weights);
    }
}
