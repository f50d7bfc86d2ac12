package com.example.deltacode.domain;

import lombok.Getter;

/**
 * Raised when a snapshot holds two records with the same path.
 */
@Getter
public class DuplicatePathException extends InventoryException {
    private final String snapshotLabel;
    private final String path;

    public DuplicatePathException(String snapshotLabel, String path) {
        super(String.format("Duplicate path '%s' in %s snapshot", path, snapshotLabel));
        this.snapshotLabel = snapshotLabel;
        this.path = path;
    }
}
