package com.example.deltacode.application;

import com.example.deltacode.domain.ComparisonRequest;
import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.DeltaKind;
import com.example.deltacode.domain.Report;
import com.example.deltacode.domain.ReportHeaders;
import com.example.deltacode.domain.ScoringConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class DeltaComparisonUseCase {
    private static final Logger log = LogManager.getLogger(DeltaComparisonUseCase.class);

    private final FileMatcher fileMatcher;
    private final DeltaClassifier deltaClassifier;
    private final DeltaScorer deltaScorer;
    private final DeltaRanker deltaRanker;
    private final DeltaRenderer deltaRenderer;

    public DeltaComparisonUseCase(
            FileMatcher fileMatcher,
            DeltaClassifier deltaClassifier,
            DeltaScorer deltaScorer,
            DeltaRanker deltaRanker,
            DeltaRenderer deltaRenderer) {
        this.fileMatcher = fileMatcher;
        this.deltaClassifier = deltaClassifier;
        this.deltaScorer = deltaScorer;
        this.deltaRanker = deltaRanker;
        this.deltaRenderer = deltaRenderer;
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    /**
     * Compares the two snapshots of {@code request} and returns the ranked report.
     *
     * @throws com.example.deltacode.domain.DuplicatePathException if either snapshot repeats a path
     */
    public Report compare(ComparisonRequest request) {
        ScoringConfig scoring = request.scoring();
        long overallStart = System.nanoTime();

        long indexStart = System.nanoTime();
        FingerprintIndex oldIndex = FingerprintIndex.of(request.oldSnapshot());
        FingerprintIndex newIndex = FingerprintIndex.of(request.newSnapshot());
        log.info(
                "Indexed {} old and {} new records in {}s",
                request.oldSnapshot().size(),
                request.newSnapshot().size(),
                secondsSince(indexStart));

        long matchStart = System.nanoTime();
        List<FilePair> pairs = fileMatcher.match(oldIndex, newIndex, scoring);
        log.info("Matched {} file pairs in {}s", pairs.size(), secondsSince(matchStart));

        long scoreStart = System.nanoTime();
        List<Delta> scored = new ArrayList<>(pairs.size());
        for (FilePair pair : pairs) {
            Delta delta = deltaClassifier.classify(pair, scoring.trackedAttributes());
            scored.add(deltaScorer.score(delta, scoring));
        }
        List<Delta> ranked = deltaRanker.rank(scored);
        log.info("Classified and ranked {} deltas in {}s", ranked.size(), secondsSince(scoreStart));

        Map<DeltaKind, Integer> stats = new EnumMap<>(DeltaKind.class);
        for (Delta delta : ranked) {
            stats.merge(delta.getKind(), 1, Integer::sum);
        }

        List<Delta> deltas = new ArrayList<>(ranked.size());
        for (Delta delta : ranked) {
            if (!request.includeUnmodified() && delta.getKind() == DeltaKind.UNMODIFIED) {
                continue;
            }
            if (request.explain()) {
                delta = delta.withDiff(deltaRenderer.render(delta, Math.max(0, request.contextSize())));
            }
            deltas.add(delta);
        }

        ReportHeaders headers =
                new ReportHeaders(
                        ReportHeaders.TOOL_VERSION, describeOptions(request), List.of(), deltas.size(), stats);
        log.info("Compared snapshots in {}s: {}", secondsSince(overallStart), stats);
        return new Report(headers, deltas);
    }

    private Map<String, Object> describeOptions(ComparisonRequest request) {
        ScoringConfig scoring = request.scoring();
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("old", request.oldSnapshot().label());
        options.put("new", request.newSnapshot().label());
        options.put("weights", scoring.weights());
        options.put("default_attribute_weight", scoring.defaultAttributeWeight());
        options.put("tracked_attributes", scoring.trackedAttributes());
        options.put("similarity_threshold", scoring.similarityThreshold());
        options.put("parallel_matching", scoring.parallelMatching());
        options.put("include_unmodified", request.includeUnmodified());
        options.put("explain", request.explain());
        return options;
    }
}
