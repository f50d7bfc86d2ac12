package com.example.deltacode.application;

import com.example.deltacode.domain.DeltaKind;
import com.example.deltacode.domain.FileRecord;

import java.util.Objects;

/**
 * Matcher output: an old and/or new record and the kind of match that joined them.
 */
public record FilePair(FileRecord oldRecord, FileRecord newRecord, DeltaKind kind) {
    public FilePair {
        Objects.requireNonNull(kind, "kind");
        if (oldRecord == null && newRecord == null) {
            throw new IllegalArgumentException("A pair needs at least one record");
        }
    }

    static FilePair unmodified(FileRecord oldRecord, FileRecord newRecord) {
        return new FilePair(oldRecord, newRecord, DeltaKind.UNMODIFIED);
    }

    static FilePair moved(FileRecord oldRecord, FileRecord newRecord) {
        return new FilePair(oldRecord, newRecord, DeltaKind.MOVED);
    }

    static FilePair modified(FileRecord oldRecord, FileRecord newRecord) {
        return new FilePair(oldRecord, newRecord, DeltaKind.MODIFIED);
    }

    static FilePair removed(FileRecord oldRecord) {
        return new FilePair(oldRecord, null, DeltaKind.REMOVED);
    }

    static FilePair added(FileRecord newRecord) {
        return new FilePair(null, newRecord, DeltaKind.ADDED);
    }
}
