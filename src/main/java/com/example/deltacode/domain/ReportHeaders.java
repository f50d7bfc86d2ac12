package com.example.deltacode.domain;

import lombok.Getter;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run metadata written ahead of the deltas.
 */
@Getter
public class ReportHeaders {
    public static final String TOOL_VERSION = "1.0.0";

    private final String version;
    private final Map<String, Object> options;
    private final List<String> errors;
    private final int deltasCount;
    private final Map<DeltaKind, Integer> stats;

    public ReportHeaders(
            String version,
            Map<String, Object> options,
            List<String> errors,
            int deltasCount,
            Map<DeltaKind, Integer> stats) {
        this.version = version;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(options));
        this.errors = List.copyOf(errors);
        this.deltasCount = deltasCount;
        Map<DeltaKind, Integer> counts = new EnumMap<>(DeltaKind.class);
        for (DeltaKind kind : DeltaKind.values()) {
            counts.put(kind, stats.getOrDefault(kind, 0));
        }
        this.stats = Collections.unmodifiableMap(counts);
    }
}
