package com.account.relationship.similarity;

import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set ratio: insensitive to word order and to extra words on one side.
 *
 * <p>Both strings are split into sorted token sets. With {@code I} the sorted intersection
 * and {@code D1}, {@code D2} the sorted differences, the score is the best
 * {@link IndelRatioSimilarity} among {@code (I, I+D1)}, {@code (I, I+D2)} and
 * {@code (I+D1, I+D2)}. "acme corp" vs "corp acme" scores 1.0; so does "acme" vs "acme west".</p>
 */
public class TokenSetSimilarity implements SimilarityAlgorithm {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IndelRatioSimilarity ratio;

    public TokenSetSimilarity() {
        this(new IndelRatioSimilarity());
    }

    public TokenSetSimilarity(IndelRatioSimilarity ratio) {
        this.ratio = ratio;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        Set<String> tokens1 = tokenize(s1);
        Set<String> tokens2 = tokenize(s2);
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }

        TreeSet<String> intersection = new TreeSet<>(tokens1);
        intersection.retainAll(tokens2);
        TreeSet<String> diff1 = new TreeSet<>(tokens1);
        diff1.removeAll(tokens2);
        TreeSet<String> diff2 = new TreeSet<>(tokens2);
        diff2.removeAll(tokens1);

        String common = String.join(" ", intersection);
        String combined1 = join(common, String.join(" ", diff1));
        String combined2 = join(common, String.join(" ", diff2));

        double best = ratio.compute(combined1, combined2);
        if (!common.isEmpty()) {
            best = Math.max(best, ratio.compute(common, combined1));
            best = Math.max(best, ratio.compute(common, combined2));
        }
        return best;
    }

    @Override
    public String getName() {
        return "TokenSet";
    }

    private Set<String> tokenize(String s) {
        Set<String> tokens = new TreeSet<>();
        for (String token : WHITESPACE.split(s.trim())) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String join(String left, String right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        return left + " " + right;
    }
}
