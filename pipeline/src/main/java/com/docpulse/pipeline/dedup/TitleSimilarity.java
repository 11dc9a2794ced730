package com.docpulse.pipeline.dedup;

import java.util.Locale;

/**
 * Title normalization and fuzzy comparison.
 */
public final class TitleSimilarity {

    private TitleSimilarity() {
    }

    /**
     * Lowercases, replaces punctuation with spaces and collapses whitespace.
     */
    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        return title.toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }

    /**
     * Similarity ratio {@code 2 * LCS / (|a| + |b|)} in [0, 1], where LCS is
     * the longest common character subsequence. Two empty strings are identical.
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(a, b) / total;
    }

    static int longestCommonSubsequence(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
