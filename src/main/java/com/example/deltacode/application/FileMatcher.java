package com.example.deltacode.application;

import com.example.deltacode.domain.FileRecord;
import com.example.deltacode.domain.ScoringConfig;
import com.github.difflib.DiffUtils;
import com.github.difflib.patch.Patch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;

/**
 * Pairs the records of two snapshots. Every record ends up in exactly one pair:
 * identical files first, then same content under another path, then same path
 * with other content, then (when enabled) similar names, and finally the
 * leftovers as removed or added.
 */
@Component
public class FileMatcher {
    private static final Logger log = LogManager.getLogger(FileMatcher.class);

    private static final double SIZE_TOLERANCE = 0.2;

    /** Orders candidates by their paths without regard to which side each path came from. */
    private static final Comparator<Candidate> SYMMETRIC_PATH_ORDER =
            (left, right) -> {
                int cmp = FileRecord.comparePaths(left.lowerPath(), right.lowerPath());
                if (cmp != 0) {
                    return cmp;
                }
                return FileRecord.comparePaths(left.upperPath(), right.upperPath());
            };

    private static final Comparator<Candidate> CLOSEST_PATH_FIRST =
            Comparator.comparingDouble(Candidate::rank).thenComparing(SYMMETRIC_PATH_ORDER);

    private static final Comparator<Candidate> MOST_SIMILAR_FIRST =
            Comparator.comparingDouble(Candidate::rank).reversed().thenComparing(SYMMETRIC_PATH_ORDER);

    public List<FilePair> match(
            FingerprintIndex oldIndex, FingerprintIndex newIndex, ScoringConfig config) {
        Set<FileRecord> remainingOld = new LinkedHashSet<>(oldIndex.records());
        Set<FileRecord> remainingNew = new LinkedHashSet<>(newIndex.records());
        List<FilePair> pairs = new ArrayList<>(remainingOld.size() + remainingNew.size());

        take(pairs, matchIdentical(newIndex, remainingOld), remainingOld, remainingNew);
        int unmodified = pairs.size();

        take(
                pairs,
                matchContent(oldIndex, newIndex, remainingOld, remainingNew, config.parallelMatching()),
                remainingOld,
                remainingNew);
        int moved = pairs.size() - unmodified;

        take(pairs, matchPaths(newIndex, remainingOld, remainingNew), remainingOld, remainingNew);

        if (config.similarityRenamesEnabled()) {
            take(
                    pairs,
                    matchSimilarNames(remainingOld, remainingNew, config.similarityThreshold()),
                    remainingOld,
                    remainingNew);
        }

        for (FileRecord oldRecord : remainingOld) {
            pairs.add(FilePair.removed(oldRecord));
        }
        for (FileRecord newRecord : remainingNew) {
            pairs.add(FilePair.added(newRecord));
        }
        log.debug(
                "Matched {} pairs ({} identical, {} by content) from {} old and {} new records",
                pairs.size(),
                unmodified,
                moved,
                oldIndex.records().size(),
                newIndex.records().size());
        return pairs;
    }

    private List<FilePair> matchIdentical(FingerprintIndex newIndex, Set<FileRecord> remainingOld) {
        List<FilePair> result = new ArrayList<>();
        for (FileRecord oldRecord : remainingOld) {
            newIndex.atPath(oldRecord.path())
                    .filter(newRecord -> newRecord.fingerprint().equals(oldRecord.fingerprint()))
                    .ifPresent(newRecord -> result.add(FilePair.unmodified(oldRecord, newRecord)));
        }
        return result;
    }

    private List<FilePair> matchContent(
            FingerprintIndex oldIndex,
            FingerprintIndex newIndex,
            Set<FileRecord> remainingOld,
            Set<FileRecord> remainingNew,
            boolean parallel) {
        List<Bucket> buckets = new ArrayList<>();
        for (String fingerprint : new TreeSet<>(oldIndex.fingerprints())) {
            List<FileRecord> olds =
                    oldIndex.withFingerprint(fingerprint).stream().filter(remainingOld::contains).toList();
            if (olds.isEmpty()) {
                continue;
            }
            List<FileRecord> news =
                    newIndex.withFingerprint(fingerprint).stream().filter(remainingNew::contains).toList();
            if (!news.isEmpty()) {
                buckets.add(new Bucket(olds, news));
            }
        }

        List<FilePair> result = new ArrayList<>();
        if (!parallel || buckets.size() < 2) {
            buckets.forEach(bucket -> result.addAll(pairBucket(bucket)));
            return result;
        }
        List<CompletableFuture<List<FilePair>>> futures =
                buckets.stream()
                        .map(bucket -> CompletableFuture.supplyAsync(() -> pairBucket(bucket)))
                        .toList();
        // joined in bucket order so the outcome matches the sequential run
        for (CompletableFuture<List<FilePair>> future : futures) {
            result.addAll(future.join());
        }
        return result;
    }

    private static List<FilePair> pairBucket(Bucket bucket) {
        List<Candidate> candidates = new ArrayList<>(bucket.olds().size() * bucket.news().size());
        for (FileRecord oldRecord : bucket.olds()) {
            for (FileRecord newRecord : bucket.news()) {
                int distance = PathDistance.between(oldRecord.path(), newRecord.path());
                candidates.add(new Candidate(oldRecord, newRecord, distance));
            }
        }
        candidates.sort(CLOSEST_PATH_FIRST);
        return pickGreedily(candidates);
    }

    private List<FilePair> matchPaths(
            FingerprintIndex newIndex, Set<FileRecord> remainingOld, Set<FileRecord> remainingNew) {
        List<FilePair> result = new ArrayList<>();
        for (FileRecord oldRecord : remainingOld) {
            newIndex.atPath(oldRecord.path())
                    .filter(remainingNew::contains)
                    .ifPresent(newRecord -> result.add(FilePair.modified(oldRecord, newRecord)));
        }
        return result;
    }

    private List<FilePair> matchSimilarNames(
            Set<FileRecord> remainingOld, Set<FileRecord> remainingNew, double threshold) {
        List<Candidate> candidates = new ArrayList<>();
        for (FileRecord oldRecord : remainingOld) {
            for (FileRecord newRecord : remainingNew) {
                if (!isRenameCandidate(oldRecord, newRecord)) {
                    continue;
                }
                double score = nameSimilarity(oldRecord.fileName(), newRecord.fileName());
                if (score >= threshold) {
                    candidates.add(new Candidate(oldRecord, newRecord, score));
                }
            }
        }
        candidates.sort(MOST_SIMILAR_FIRST);
        return pickGreedily(candidates);
    }

    private static List<FilePair> pickGreedily(List<Candidate> sortedCandidates) {
        Set<FileRecord> usedOld = new HashSet<>();
        Set<FileRecord> usedNew = new HashSet<>();
        List<FilePair> result = new ArrayList<>();
        for (Candidate candidate : sortedCandidates) {
            if (usedOld.contains(candidate.oldRecord()) || usedNew.contains(candidate.newRecord())) {
                continue;
            }
            usedOld.add(candidate.oldRecord());
            usedNew.add(candidate.newRecord());
            result.add(FilePair.moved(candidate.oldRecord(), candidate.newRecord()));
        }
        return result;
    }

    private static void take(
            List<FilePair> pairs,
            Collection<FilePair> matched,
            Set<FileRecord> remainingOld,
            Set<FileRecord> remainingNew) {
        for (FilePair pair : matched) {
            pairs.add(pair);
            remainingOld.remove(pair.oldRecord());
            remainingNew.remove(pair.newRecord());
        }
    }

    private boolean isRenameCandidate(FileRecord oldRecord, FileRecord newRecord) {
        if (!Objects.equals(getExtension(oldRecord.fileName()), getExtension(newRecord.fileName()))) {
            return false;
        }
        return hasSimilarSize(oldRecord.size(), newRecord.size());
    }

    private String getExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot > 0) {
            return fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    private boolean hasSimilarSize(long leftSize, long rightSize) {
        long maxSize = Math.max(leftSize, rightSize);
        if (maxSize == 0) {
            return true;
        }
        return Math.abs(leftSize - rightSize) <= maxSize * SIZE_TOLERANCE;
    }

    /**
     * Share of characters the two names have in common, {@code 2 * common / (|left| + |right|)}.
     * Taken as the better of both diff directions so the measure does not depend on
     * which snapshot a name came from.
     */
    static double nameSimilarity(String left, String right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        return Math.max(commonRatio(left, right), commonRatio(right, left));
    }

    private static double commonRatio(String from, String to) {
        List<Character> fromChars = from.chars().mapToObj(c -> (char) c).toList();
        List<Character> toChars = to.chars().mapToObj(c -> (char) c).toList();
        Patch<Character> patch = DiffUtils.diff(fromChars, toChars);
        int removed = patch.getDeltas().stream().mapToInt(d -> d.getSource().size()).sum();
        int common = fromChars.size() - removed;
        return 2.0 * common / (fromChars.size() + toChars.size());
    }

    private record Bucket(List<FileRecord> olds, List<FileRecord> news) {}

    private record Candidate(FileRecord oldRecord, FileRecord newRecord, double rank) {
        List<String> lowerPath() {
            return FileRecord.comparePaths(oldRecord.path(), newRecord.path()) <= 0
                    ? oldRecord.path()
                    : newRecord.path();
        }

        List<String> upperPath() {
            return FileRecord.comparePaths(oldRecord.path(), newRecord.path()) <= 0
                    ? newRecord.path()
                    : oldRecord.path();
        }
    }
}
