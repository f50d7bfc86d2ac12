package com.example.deltacode.domain;

import java.util.Objects;

public record ComparisonRequest(
        Snapshot oldSnapshot,
        Snapshot newSnapshot,
        ScoringConfig scoring,
        boolean includeUnmodified,
        boolean explain,
        int contextSize) {
    public ComparisonRequest {
        Objects.requireNonNull(oldSnapshot, "oldSnapshot");
        Objects.requireNonNull(newSnapshot, "newSnapshot");
        Objects.requireNonNull(scoring, "scoring");
    }

    public static ComparisonRequest of(Snapshot oldSnapshot, Snapshot newSnapshot, ScoringConfig scoring) {
        return new ComparisonRequest(oldSnapshot, newSnapshot, scoring, true, false, 0);
    }
}
