package com.example.deltacode.application;

import com.example.deltacode.domain.DeltaKind;
import com.example.deltacode.domain.FileRecord;
import com.example.deltacode.domain.ScoringConfig;
import com.example.deltacode.domain.Snapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class FileMatcherTest {

    private final FileMatcher matcher = new FileMatcher();

    @Test
    void identicalPathAndContentIsUnmodified() {
        FileRecord oldRecord = FileRecord.of("a.txt", 10, "X");
        FileRecord newRecord = FileRecord.of("a.txt", 10, "X");

        List<FilePair> pairs = match(Snapshot.of("old", oldRecord), Snapshot.of("new", newRecord));

        assertThat(pairs).containsExactly(new FilePair(oldRecord, newRecord, DeltaKind.UNMODIFIED));
    }

    @Test
    void sameContentUnderAnotherPathIsMoved() {
        FileRecord oldRecord = FileRecord.of("a/b.txt", 10, "X");
        FileRecord newRecord = FileRecord.of("a/c.txt", 10, "X");

        List<FilePair> pairs = match(Snapshot.of("old", oldRecord), Snapshot.of("new", newRecord));

        assertThat(pairs).containsExactly(new FilePair(oldRecord, newRecord, DeltaKind.MOVED));
    }

    @Test
    void samePathWithOtherContentIsModified() {
        FileRecord oldRecord = FileRecord.of("a.txt", 10, "X");
        FileRecord newRecord = FileRecord.of("a.txt", 20, "Y");

        List<FilePair> pairs = match(Snapshot.of("old", oldRecord), Snapshot.of("new", newRecord));

        assertThat(pairs).containsExactly(new FilePair(oldRecord, newRecord, DeltaKind.MODIFIED));
    }

    @Test
    void leftoversAreRemovedAndAdded() {
        FileRecord gone = FileRecord.of("gone.txt", 1, "X");
        FileRecord fresh = FileRecord.of("fresh.txt", 2, "Y");

        List<FilePair> pairs = match(Snapshot.of("old", gone), Snapshot.of("new", fresh));

        assertThat(pairs)
                .containsExactly(
                        new FilePair(gone, null, DeltaKind.REMOVED),
                        new FilePair(null, fresh, DeltaKind.ADDED));
    }

    @Test
    void contentMatchTakesPriorityOverPathMatch() {
        FileRecord oldA = FileRecord.of("a.txt", 1, "X");
        FileRecord oldB = FileRecord.of("b.txt", 1, "Y");
        FileRecord newA = FileRecord.of("a.txt", 1, "Y");

        List<FilePair> pairs = match(Snapshot.of("old", oldA, oldB), Snapshot.of("new", newA));

        assertThat(pairs)
                .containsExactlyInAnyOrder(
                        new FilePair(oldB, newA, DeltaKind.MOVED),
                        new FilePair(oldA, null, DeltaKind.REMOVED));
    }

    @Test
    void duplicatedContentPairsByClosestPath() {
        FileRecord oldDocs = FileRecord.of("docs/readme.txt", 5, "X");
        FileRecord oldSrc = FileRecord.of("src/readme.txt", 5, "X");
        FileRecord newSrc = FileRecord.of("src/main/readme.txt", 5, "X");
        FileRecord newDocs = FileRecord.of("docs/v2/readme.txt", 5, "X");

        List<FilePair> pairs =
                match(Snapshot.of("old", oldDocs, oldSrc), Snapshot.of("new", newSrc, newDocs));

        assertThat(pairs)
                .containsExactlyInAnyOrder(
                        new FilePair(oldDocs, newDocs, DeltaKind.MOVED),
                        new FilePair(oldSrc, newSrc, DeltaKind.MOVED));
    }

    @Test
    void equalDistanceTiesBreakOnPathOrder() {
        FileRecord oldRecord = FileRecord.of("x/file.txt", 5, "X");
        FileRecord newB = FileRecord.of("b/file.txt", 5, "X");
        FileRecord newA = FileRecord.of("a/file.txt", 5, "X");

        List<FilePair> pairs = match(Snapshot.of("old", oldRecord), Snapshot.of("new", newB, newA));

        assertThat(pairs)
                .containsExactly(
                        new FilePair(oldRecord, newA, DeltaKind.MOVED),
                        new FilePair(null, newB, DeltaKind.ADDED));
    }

    @Test
    void surplusCopiesFallThroughToLaterSteps() {
        FileRecord oldA = FileRecord.of("a.txt", 5, "X");
        FileRecord oldB = FileRecord.of("b.txt", 5, "X");
        FileRecord newC = FileRecord.of("c.txt", 5, "X");
        FileRecord newB = FileRecord.of("b.txt", 9, "Z");

        List<FilePair> pairs = match(Snapshot.of("old", oldA, oldB), Snapshot.of("new", newC, newB));

        assertThat(pairs)
                .containsExactlyInAnyOrder(
                        new FilePair(oldA, newC, DeltaKind.MOVED),
                        new FilePair(oldB, newB, DeltaKind.MODIFIED));
    }

    @Test
    void everyRecordIsPairedExactlyOnce() {
        Snapshot oldSnapshot = generated("old", 0);
        Snapshot newSnapshot = generated("new", 3);

        List<FilePair> pairs = match(oldSnapshot, newSnapshot);

        List<FileRecord> seenOld = new ArrayList<>();
        List<FileRecord> seenNew = new ArrayList<>();
        for (FilePair pair : pairs) {
            if (pair.oldRecord() != null) {
                seenOld.add(pair.oldRecord());
            }
            if (pair.newRecord() != null) {
                seenNew.add(pair.newRecord());
            }
        }
        assertThat(seenOld).hasSameSizeAs(new HashSet<>(seenOld));
        assertThat(seenNew).hasSameSizeAs(new HashSet<>(seenNew));
        assertThat(seenOld).containsExactlyInAnyOrderElementsOf(oldSnapshot.records());
        assertThat(seenNew).containsExactlyInAnyOrderElementsOf(newSnapshot.records());
    }

    @Test
    void parallelMatchingGivesTheSequentialResult() {
        Snapshot oldSnapshot = generated("old", 0);
        Snapshot newSnapshot = generated("new", 7);
        ScoringConfig parallel = ScoringConfig.defaults().toBuilder().parallelMatching(true).build();

        List<FilePair> sequential = match(oldSnapshot, newSnapshot);
        for (int run = 0; run < 5; run++) {
            List<FilePair> concurrent =
                    matcher.match(FingerprintIndex.of(oldSnapshot), FingerprintIndex.of(newSnapshot), parallel);
            assertThat(concurrent).containsExactlyElementsOf(sequential);
        }
    }

    @Test
    void swappingSidesMirrorsThePairing() {
        Snapshot oldSnapshot = generated("old", 0);
        Snapshot newSnapshot = generated("new", 5);

        Set<String> forward = describe(match(oldSnapshot, newSnapshot), false);
        Set<String> backward = describe(match(newSnapshot, oldSnapshot), true);

        assertThat(backward).isEqualTo(forward);
    }

    @Test
    void similarNamesAreOnlyPairedWhenEnabled() {
        FileRecord oldRecord = FileRecord.of("src/ParserUtil.java", 1000, "X");
        FileRecord newRecord = FileRecord.of("src/ParserUtils.java", 1050, "Y");
        FileRecord unrelated = FileRecord.of("src/Main.java", 1000, "Z");
        Snapshot oldSnapshot = Snapshot.of("old", oldRecord);
        Snapshot newSnapshot = Snapshot.of("new", unrelated, newRecord);

        assertThat(match(oldSnapshot, newSnapshot)).extracting(FilePair::kind)
                .containsExactly(DeltaKind.REMOVED, DeltaKind.ADDED, DeltaKind.ADDED);

        ScoringConfig similarity = ScoringConfig.defaults().toBuilder().similarityThreshold(0.8).build();
        List<FilePair> pairs =
                matcher.match(FingerprintIndex.of(oldSnapshot), FingerprintIndex.of(newSnapshot), similarity);

        assertThat(pairs)
                .containsExactlyInAnyOrder(
                        new FilePair(oldRecord, newRecord, DeltaKind.MOVED),
                        new FilePair(null, unrelated, DeltaKind.ADDED));
    }

    @Test
    void similarityRequiresSameExtensionAndComparableSize() {
        FileRecord oldRecord = FileRecord.of("notes.txt", 100, "X");
        FileRecord otherExtension = FileRecord.of("notes.md", 100, "Y");
        FileRecord muchLarger = FileRecord.of("notes1.txt", 500, "Z");
        ScoringConfig similarity = ScoringConfig.defaults().toBuilder().similarityThreshold(0.5).build();

        List<FilePair> pairs =
                matcher.match(
                        FingerprintIndex.of(Snapshot.of("old", oldRecord)),
                        FingerprintIndex.of(Snapshot.of("new", otherExtension, muchLarger)),
                        similarity);

        assertThat(pairs).extracting(FilePair::kind).doesNotContain(DeltaKind.MOVED);
    }

    @Test
    void nameSimilarityIsOneForEqualNames() {
        assertThat(FileMatcher.nameSimilarity("a.txt", "a.txt")).isEqualTo(1.0);
        assertThat(FileMatcher.nameSimilarity("abcd", "abce")).isEqualTo(0.75);
        assertThat(FileMatcher.nameSimilarity("", "")).isEqualTo(1.0);
        assertThat(FileMatcher.nameSimilarity("abc", "")).isZero();
    }

    @Test
    void nameSimilarityDoesNotDependOnArgumentOrder() {
        String[][] names = {
            {"xyzabc", "abcxyz1"},
            {"ParserUtil.java", "UtilParser.java"},
            {"report.txt", "report_final_v2.txt"},
            {"aab", "abaa"}
        };
        for (String[] pair : names) {
            double forward = FileMatcher.nameSimilarity(pair[0], pair[1]);
            assertThat(FileMatcher.nameSimilarity(pair[1], pair[0])).as("%s / %s", pair[0], pair[1]).isEqualTo(forward);
            assertThat(forward).isGreaterThan(0.0).isLessThan(1.0);
        }
    }

    @Test
    void swappingSnapshotsGivesTheSameSimilarityRenames() {
        Snapshot oldSnapshot =
                Snapshot.of(
                        "old",
                        FileRecord.of("docs/report.txt", 100, "A"),
                        FileRecord.of("docs/xyzabc.txt", 100, "B"),
                        FileRecord.of("docs/notes.txt", 100, "C"));
        Snapshot newSnapshot =
                Snapshot.of(
                        "new",
                        FileRecord.of("docs/reports.txt", 100, "D"),
                        FileRecord.of("docs/abcxyz1.txt", 105, "E"),
                        FileRecord.of("docs/report_v2.txt", 100, "F"),
                        FileRecord.of("docs/note.txt", 95, "G"));
        ScoringConfig similarity = ScoringConfig.defaults().toBuilder().similarityThreshold(0.3).build();

        List<FilePair> forwardPairs =
                matcher.match(FingerprintIndex.of(oldSnapshot), FingerprintIndex.of(newSnapshot), similarity);
        List<FilePair> backwardPairs =
                matcher.match(FingerprintIndex.of(newSnapshot), FingerprintIndex.of(oldSnapshot), similarity);

        assertThat(forwardPairs).extracting(FilePair::kind).contains(DeltaKind.MOVED);
        assertThat(describe(backwardPairs, true)).isEqualTo(describe(forwardPairs, false));
    }

    private List<FilePair> match(Snapshot oldSnapshot, Snapshot newSnapshot) {
        return matcher.match(
                FingerprintIndex.of(oldSnapshot), FingerprintIndex.of(newSnapshot), ScoringConfig.defaults());
    }

    private static Set<String> describe(List<FilePair> pairs, boolean swapped) {
        Set<String> result = new HashSet<>();
        for (FilePair pair : pairs) {
            FileRecord left = swapped ? pair.newRecord() : pair.oldRecord();
            FileRecord right = swapped ? pair.oldRecord() : pair.newRecord();
            result.add(
                    (left != null ? left.pathString() : "-") + " -> " + (right != null ? right.pathString() : "-"));
        }
        return result;
    }

    /** A tree with shared content, moved copies and edits; {@code shift} varies the layout. */
    private static Snapshot generated(String label, int shift) {
        List<FileRecord> records = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            String fingerprint = "fp" + (i % 9);
            String directory = "dir" + ((i + shift) % 6);
            long size = 10L + (i * shift) % 13;
            records.add(FileRecord.of(directory + "/sub" + (i % 3) + "/file" + i + ".txt", size, fingerprint));
        }
        return new Snapshot(label, records);
    }
}
