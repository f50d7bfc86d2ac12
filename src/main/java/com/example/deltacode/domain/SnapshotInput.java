package com.example.deltacode.domain;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * A serialized inventory waiting to be read, tagged with the label of the
 * snapshot it becomes ({@code old} or {@code new}).
 */
public record SnapshotInput(String label, String source, Content content) {

    public SnapshotInput {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Snapshot label must not be blank");
        }
        source = source == null || source.isBlank() ? label + " inventory" : source;
        Objects.requireNonNull(content, "content");
    }

    public InputStream openStream() throws IOException {
        return content.open();
    }

    /** For messages: {@code "'scan.json' (old snapshot)"}. */
    public String describe() {
        return "'" + source + "' (" + label + " snapshot)";
    }

    @FunctionalInterface
    public interface Content {
        InputStream open() throws IOException;
    }
}
