package com.record.dedup.similarity;

import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set similarity.
 * Compares the sorted shared tokens of both strings against each side's sorted
 * shared-plus-remaining tokens and keeps the best {@link IndelSimilarity} ratio.
 * Word order and repeated words do not affect the score.
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IndelSimilarity ratio = new IndelSimilarity();

    @Override
    public double compute(String s1, String s2) {
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);

        if (tokens1.isEmpty() && tokens2.isEmpty()) {
            return 1.0;
        }
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        TreeSet<String> diff1to2 = new TreeSet<>(tokens1);
        diff1to2.removeAll(tokens2);
        TreeSet<String> diff2to1 = new TreeSet<>(tokens2);
        diff2to1.removeAll(tokens1);

        // One token set contains the other
        if (!intersection.isEmpty() && (diff1to2.isEmpty() || diff2to1.isEmpty())) {
            return 1.0;
        }

        String sorted = String.join(" ", intersection);
        String combined1to2 = join(sorted, String.join(" ", diff1to2));
        String combined2to1 = join(sorted, String.join(" ", diff2to1));

        double best = ratio.compute(combined1to2, combined2to1);
        if (!sorted.isEmpty()) {
            best = Math.max(best, ratio.compute(sorted, combined1to2));
            best = Math.max(best, ratio.compute(sorted, combined2to1));
        }
        return best;
    }

    @Override
    public String getName() {
        return "Token-Set";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new TreeSet<>();
        if (s == null || s.isEmpty()) {
            return tokens;
        }
        String cleaned = NON_ALPHANUMERIC.matcher(s.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return tokens;
        }
        for (String token : WHITESPACE.split(cleaned)) {
            tokens.add(token);
        }
        return tokens;
    }

    private static String join(String head, String tail) {
        if (head.isEmpty()) {
            return tail;
        }
        return tail.isEmpty() ? head : head + " " + tail;
    }
}
