package com.example.deltacode.domain;

import java.util.Locale;

public enum DeltaKind {
    ADDED,
    REMOVED,
    MODIFIED,
    MOVED,
    UNMODIFIED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
