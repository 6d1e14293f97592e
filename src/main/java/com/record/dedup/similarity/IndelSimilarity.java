package com.record.dedup.similarity;

/**
 * Normalized insert/delete edit similarity.
 * Computes {@code 2 * lcs / (|s1| + |s2|)}, where {@code lcs} is the length of the
 * longest common subsequence; equivalently {@code 1 - indelDistance / (|s1| + |s2|)}.
 */
public class IndelSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        String a = s1 != null ? s1 : "";
        String b = s2 != null ? s2 : "";
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int lcs = longestCommonSubsequence(a, b);
        return (2.0 * lcs) / (a.length() + b.length());
    }

    @Override
    public String getName() {
        return "Indel";
    }

    /**
     * Computes the LCS length with two rolling rows of O(min(m,n)) space.
     */
    private int longestCommonSubsequence(String s1, String s2) {
        if (s1.length() > s2.length()) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }

        int m = s1.length();
        int n = s2.length();

        int[] previousRow = new int[m + 1];
        int[] currentRow = new int[m + 1];

        for (int j = 1; j <= n; j++) {
            currentRow[0] = 0;
            for (int i = 1; i <= m; i++) {
                if (s1.charAt(i - 1) == s2.charAt(j - 1)) {
                    currentRow[i] = previousRow[i - 1] + 1;
                } else {
                    currentRow[i] = Math.max(currentRow[i - 1], previousRow[i]);
                }
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }
}
