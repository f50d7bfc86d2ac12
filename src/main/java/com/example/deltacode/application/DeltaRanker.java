package com.example.deltacode.application;

import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.FileRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Total order over deltas: score descending, then the factors compared as a
 * name-sorted list of entries, then new-or-old path, then old path, then kind.
 */
@Component
public class DeltaRanker {
    public static final Comparator<Delta> ORDER =
            Comparator.comparingDouble(Delta::getScore)
                    .reversed()
                    .thenComparing(Delta::getFactors, DeltaRanker::compareFactors)
                    .thenComparing(Delta::primaryPath, FileRecord::comparePaths)
                    .thenComparing(DeltaRanker::compareOldPaths)
                    .thenComparing(Delta::getKind);

    public List<Delta> rank(Collection<Delta> deltas) {
        List<Delta> ranked = new ArrayList<>(deltas);
        ranked.sort(ORDER);
        return ranked;
    }

    static int compareFactors(Map<String, Long> left, Map<String, Long> right) {
        List<Map.Entry<String, Long>> leftEntries = sortedEntries(left);
        List<Map.Entry<String, Long>> rightEntries = sortedEntries(right);
        int common = Math.min(leftEntries.size(), rightEntries.size());
        for (int i = 0; i < common; i++) {
            int cmp = leftEntries.get(i).getKey().compareTo(rightEntries.get(i).getKey());
            if (cmp != 0) {
                return cmp;
            }
            cmp = Long.compare(leftEntries.get(i).getValue(), rightEntries.get(i).getValue());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(leftEntries.size(), rightEntries.size());
    }

    private static List<Map.Entry<String, Long>> sortedEntries(Map<String, Long> factors) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(factors.entrySet());
        entries.sort(Map.Entry.comparingByKey());
        return entries;
    }

    private static int compareOldPaths(Delta left, Delta right) {
        FileRecord leftOld = left.getOldRecord();
        FileRecord rightOld = right.getOldRecord();
        if (leftOld == null || rightOld == null) {
            return Boolean.compare(leftOld != null, rightOld != null);
        }
        return FileRecord.comparePaths(leftOld.path(), rightOld.path());
    }
}
