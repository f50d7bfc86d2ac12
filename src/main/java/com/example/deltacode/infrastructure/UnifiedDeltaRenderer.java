package com.example.deltacode.infrastructure;

import com.example.deltacode.application.DeltaRenderer;
import com.example.deltacode.domain.Delta;
import com.example.deltacode.domain.FileRecord;
import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains a delta as a unified diff of the old and new record descriptions.
 */
@Component
public class UnifiedDeltaRenderer implements DeltaRenderer {
    private static final String NO_DIFFERENCES_MESSAGE = "No differences between the two records.";
    private static final String MISSING_SIDE = "/dev/null";

    @Override
    public String render(Delta delta, int contextSize) {
        List<String> originalLines = describe(delta.getOldRecord());
        List<String> revisedLines = describe(delta.getNewRecord());
        String originalName =
                delta.getOldRecord() != null ? "a/" + delta.getOldRecord().pathString() : MISSING_SIDE;
        String revisedName =
                delta.getNewRecord() != null ? "b/" + delta.getNewRecord().pathString() : MISSING_SIDE;

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        List<String> unified =
                UnifiedDiffUtils.generateUnifiedDiff(
                        originalName, revisedName, originalLines, patch, Math.max(0, contextSize));
        if (unified.isEmpty()) {
            unified =
                    List.of(
                            "--- " + originalName,
                            "+++ " + revisedName,
                            "@@ -0,0 +0,0 @@",
                            " " + NO_DIFFERENCES_MESSAGE);
        }
        return String.join("\n", unified) + "\n";
    }

    static List<String> describe(FileRecord record) {
        if (record == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        lines.add("path: " + record.pathString());
        lines.add("size: " + record.size());
        lines.add("fingerprint: " + record.fingerprint());
        record.attributes().forEach((name, value) -> lines.add(name + ": " + value));
        return lines;
    }
}
