package com.example.deltacode.domain;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Ranked outcome of a snapshot comparison.
 */
@Getter
public class Report {
    private final ReportHeaders headers;
    private final List<Delta> deltas;

    public Report(ReportHeaders headers, List<Delta> deltas) {
        this.headers = Objects.requireNonNull(headers, "headers");
        this.deltas = List.copyOf(deltas);
    }
}
