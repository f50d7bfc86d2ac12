package com.example.deltacode.application;

import com.example.deltacode.domain.DuplicatePathException;
import com.example.deltacode.domain.FileRecord;
import com.example.deltacode.domain.Snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookups over one snapshot, by content fingerprint and by path.
 */
public final class FingerprintIndex {
    private final Snapshot snapshot;
    private final Map<String, List<FileRecord>> byFingerprint;
    private final Map<List<String>, FileRecord> byPath;

    private FingerprintIndex(
            Snapshot snapshot,
            Map<String, List<FileRecord>> byFingerprint,
            Map<List<String>, FileRecord> byPath) {
        this.snapshot = snapshot;
        this.byFingerprint = byFingerprint;
        this.byPath = byPath;
    }

    /**
     * Indexes {@code snapshot}.
     *
     * @throws DuplicatePathException if two records share a path
     */
    public static FingerprintIndex of(Snapshot snapshot) {
        Map<String, List<FileRecord>> byFingerprint = new LinkedHashMap<>();
        Map<List<String>, FileRecord> byPath = new HashMap<>();
        for (FileRecord record : snapshot.records()) {
            if (byPath.putIfAbsent(record.path(), record) != null) {
                throw new DuplicatePathException(snapshot.label(), record.pathString());
            }
            byFingerprint.computeIfAbsent(record.fingerprint(), fp -> new ArrayList<>()).add(record);
        }
        Map<String, List<FileRecord>> frozen = new LinkedHashMap<>();
        byFingerprint.forEach((fp, records) -> frozen.put(fp, List.copyOf(records)));
        return new FingerprintIndex(
                snapshot, Collections.unmodifiableMap(frozen), Collections.unmodifiableMap(byPath));
    }

    public String label() {
        return snapshot.label();
    }

    public List<FileRecord> records() {
        return snapshot.records();
    }

    public Set<String> fingerprints() {
        return byFingerprint.keySet();
    }

    public List<FileRecord> withFingerprint(String fingerprint) {
        return byFingerprint.getOrDefault(fingerprint, List.of());
    }

    public Optional<FileRecord> atPath(List<String> path) {
        return Optional.ofNullable(byPath.get(path));
    }
}
