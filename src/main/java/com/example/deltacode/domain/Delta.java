package com.example.deltacode.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.With;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single classified change between two snapshots. The records are borrowed
 * from the snapshots that produced the delta.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Delta {
    private final DeltaKind kind;
    private final FileRecord oldRecord;
    private final FileRecord newRecord;
    private final Map<String, Long> factors;
    @With private final double score;
    @With private final String diff;

    public Delta(
            DeltaKind kind,
            FileRecord oldRecord,
            FileRecord newRecord,
            Map<String, Long> factors,
            double score,
            String diff) {
        this.kind = Objects.requireNonNull(kind, "kind");
        if (oldRecord == null && newRecord == null) {
            throw new IllegalArgumentException("A delta needs at least one record");
        }
        this.oldRecord = oldRecord;
        this.newRecord = newRecord;
        this.factors = Collections.unmodifiableMap(new LinkedHashMap<>(factors));
        this.score = score;
        this.diff = diff;
    }

    public Delta(DeltaKind kind, FileRecord oldRecord, FileRecord newRecord, Map<String, Long> factors) {
        this(kind, oldRecord, newRecord, factors, 0.0, null);
    }

    /** Path used for ordering: the new path when present, else the old one. */
    public List<String> primaryPath() {
        return newRecord != null ? newRecord.path() : oldRecord.path();
    }

    public String pathString() {
        return String.join("/", primaryPath());
    }

    public long factor(String name) {
        return factors.getOrDefault(name, 0L);
    }
}
