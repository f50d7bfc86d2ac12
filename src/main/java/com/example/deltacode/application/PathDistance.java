package com.example.deltacode.application;

import java.util.List;

/**
 * Levenshtein distance over path segments: {@code a/b.txt} to {@code a/c.txt} is 1.
 */
public final class PathDistance {
    private PathDistance() {}

    public static int between(List<String> left, List<String> right) {
        if (left.equals(right)) {
            return 0;
        }
        int[] previous = new int[right.size() + 1];
        int[] current = new int[right.size() + 1];
        for (int j = 0; j <= right.size(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.size(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.size(); j++) {
                int substitution = left.get(i - 1).equals(right.get(j - 1)) ? 0 : 1;
                current[j] =
                        Math.min(
                                Math.min(current[j - 1] + 1, previous[j] + 1),
                                previous[j - 1] + substitution);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.size()];
    }
}
