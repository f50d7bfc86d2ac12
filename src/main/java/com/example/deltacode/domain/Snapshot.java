package com.example.deltacode.domain;

import java.util.List;
import java.util.Objects;

/**
 * One full file inventory at a point in time. Paths are expected to be unique;
 * the check runs when the snapshot is indexed.
 */
public record Snapshot(String label, List<FileRecord> records) {
    public Snapshot {
        label = label != null ? label : "";
        records = List.copyOf(Objects.requireNonNull(records, "records"));
    }

    public static Snapshot of(String label, FileRecord... records) {
        return new Snapshot(label, List.of(records));
    }

    public int size() {
        return records.size();
    }
}
