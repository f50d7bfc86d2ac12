package com.example.deltacode.application;

import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.DeltaKind;
import com.example.deltacode.domain.Factors;
import com.example.deltacode.domain.FileRecord;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns matched pairs into deltas carrying their factor values. Scores are left
 * at zero for {@link DeltaScorer}.
 */
@Component
public class DeltaClassifier {

    public Delta classify(FilePair pair, List<String> trackedAttributes) {
        FileRecord oldRecord = pair.oldRecord();
        FileRecord newRecord = pair.newRecord();

        Map<String, Long> factors = new LinkedHashMap<>();
        if (pair.kind() == DeltaKind.UNMODIFIED) {
            // same path and content: attribute drift alone is not a change
            factors.put(Factors.SIZE_DELTA, 0L);
            factors.put(Factors.PATH_DELTA, 0L);
            for (String attribute : trackedAttributes) {
                factors.put(Factors.attributeFactor(attribute), 0L);
            }
            return new Delta(pair.kind(), oldRecord, newRecord, factors);
        }
        factors.put(Factors.SIZE_DELTA, sizeDelta(oldRecord, newRecord));
        factors.put(
                Factors.PATH_DELTA,
                pair.kind() == DeltaKind.MOVED
                        ? (long) PathDistance.between(oldRecord.path(), newRecord.path())
                        : 0L);
        for (String attribute : trackedAttributes) {
            String oldValue = oldRecord != null ? oldRecord.attribute(attribute) : null;
            String newValue = newRecord != null ? newRecord.attribute(attribute) : null;
            factors.put(Factors.attributeFactor(attribute), Objects.equals(oldValue, newValue) ? 0L : 1L);
        }
        return new Delta(pair.kind(), oldRecord, newRecord, factors);
    }

    private long sizeDelta(FileRecord oldRecord, FileRecord newRecord) {
        if (oldRecord == null) {
            return newRecord.size();
        }
        if (newRecord == null) {
            return oldRecord.size();
        }
        return Math.abs(newRecord.size() - oldRecord.size());
    }
}
