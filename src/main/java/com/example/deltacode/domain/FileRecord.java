package com.example.deltacode.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One file of a snapshot: its path segments, size, content fingerprint and the
 * attributes detected upstream (license, copyright, ...).
 */
public record FileRecord(
        List<String> path, long size, String fingerprint, Map<String, String> attributes) {

    public FileRecord {
        if (path == null || path.isEmpty()) {
            throw new MalformedRecordException("File record is missing its path");
        }
        for (String segment : path) {
            if (segment == null || segment.isEmpty()) {
                throw new MalformedRecordException("File record path has an empty segment: " + path);
            }
        }
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new MalformedRecordException(
                    "File record '" + String.join("/", path) + "' is missing its fingerprint");
        }
        if (size < 0) {
            throw new MalformedRecordException(
                    "File record '" + String.join("/", path) + "' has a negative size: " + size);
        }
        path = List.copyOf(path);
        Map<String, String> copy = new LinkedHashMap<>();
        if (attributes != null) {
            attributes.forEach(
                    (name, value) -> {
                        if (name != null && value != null) {
                            copy.put(name, value);
                        }
                    });
        }
        attributes = Collections.unmodifiableMap(copy);
    }

    public static FileRecord of(String path, long size, String fingerprint) {
        return of(path, size, fingerprint, Map.of());
    }

    public static FileRecord of(
            String path, long size, String fingerprint, Map<String, String> attributes) {
        return new FileRecord(splitPath(path), size, fingerprint, attributes);
    }

    /** Splits a slash separated path, dropping empty segments. */
    public static List<String> splitPath(String path) {
        if (path == null) {
            return List.of();
        }
        List<String> segments = new ArrayList<>();
        for (String segment : path.replace('\\', '/').split("/")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    public String pathString() {
        return String.join("/", path);
    }

    public String fileName() {
        return path.get(path.size() - 1);
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    /** Segment by segment ordering; a path sorts before any longer path it prefixes. */
    public static int comparePaths(List<String> left, List<String> right) {
        int common = Math.min(left.size(), right.size());
        for (int i = 0; i < common; i++) {
            int cmp = left.get(i).compareTo(right.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(left.size(), right.size());
    }
}
