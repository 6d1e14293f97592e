package com.record.dedup.similarity;

/**
 * Jaro-Winkler similarity algorithm.
 * Gives higher scores to strings that match from the beginning and tolerates
 * transposed characters.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    public static final double DEFAULT_SCALING_FACTOR = 0.1;
    public static final int DEFAULT_MAX_PREFIX_LENGTH = 4;

    private final double scalingFactor;
    private final int maxPrefixLength;

    public JaroWinklerSimilarity() {
        this(DEFAULT_SCALING_FACTOR, DEFAULT_MAX_PREFIX_LENGTH);
    }

    public JaroWinklerSimilarity(double scalingFactor) {
        this(scalingFactor, DEFAULT_MAX_PREFIX_LENGTH);
    }

    public JaroWinklerSimilarity(double scalingFactor, int maxPrefixLength) {
        if (scalingFactor < 0 || scalingFactor > 0.25) {
            throw new IllegalArgumentException("Scaling factor must be between 0 and 0.25");
        }
        // prefix * factor must stay <= 1 to keep scores bounded
        if (maxPrefixLength < 0 || maxPrefixLength * scalingFactor > 1.0) {
            throw new IllegalArgumentException(
                    "maxPrefixLength must be >= 0 and maxPrefixLength * scalingFactor <= 1");
        }
        this.scalingFactor = scalingFactor;
        this.maxPrefixLength = maxPrefixLength;
    }

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

        double jaroSimilarity = computeJaro(a, b);
        if (jaroSimilarity == 0.0) {
            return 0.0;
        }

        int prefixLength = 0;
        int limit = Math.min(maxPrefixLength, Math.min(a.length(), b.length()));
        while (prefixLength < limit && a.charAt(prefixLength) == b.charAt(prefixLength)) {
            prefixLength++;
        }

        // jw = jaro + (prefix * scalingFactor * (1 - jaro))
        double score = jaroSimilarity + (prefixLength * scalingFactor * (1.0 - jaroSimilarity));
        return Math.min(1.0, score);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    public double getScalingFactor() {
        return scalingFactor;
    }

    public int getMaxPrefixLength() {
        return maxPrefixLength;
    }

    /**
     * Computes the Jaro similarity between two non-empty strings.
     * The result does not depend on argument order.
     */
    double computeJaro(String s1, String s2) {
        // Scan from the shorter string so that greedy matching is order independent
        if (s1.length() > s2.length() || (s1.length() == s2.length() && s1.compareTo(s2) > 0)) {
            String temp = s1;
            s1 = s2;
            s2 = temp;
        }
        int s1Length = s1.length();
        int s2Length = s2.length();

        int matchWindow = Math.max(0, Math.max(s1Length, s2Length) / 2 - 1);

        boolean[] s1Matches = new boolean[s1Length];
        boolean[] s2Matches = new boolean[s2Length];

        int matches = 0;
        int transpositions = 0;

        for (int i = 0; i < s1Length; i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, s2Length);

            for (int j = start; j < end; j++) {
                if (s2Matches[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }

        if (matches == 0) {
            return 0.0;
        }

        int k = 0;
        for (int i = 0; i < s1Length; i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        // (m/|s1| + m/|s2| + (m-t/2)/m) / 3
        double m = matches;
        double t = transpositions / 2.0;
        return ((m / s1Length) + (m / s2Length) + ((m - t) / m)) / 3.0;
    }
}
