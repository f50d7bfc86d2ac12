package com.example.deltacode.application;

import com.example.deltacode.domain.Snapshot;
import com.example.deltacode.domain.SnapshotInput;

import java.io.IOException;

public interface InventoryReader {
    /** Reads {@code input} into a snapshot carrying the input's label. */
    Snapshot read(SnapshotInput input) throws IOException;
}
