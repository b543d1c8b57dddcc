package com.cgi.schemasense.pattern;

import java.util.List;

/**
 * Similarity measures used by fuzzy matching. All scores are in [0,1].
 */
public final class StringSimilarity {
    /**
     * Shorter strings are too easy to confuse by edit distance ("name" vs "game").
     * Edit distance is also only applied to names sharing their first letter, so
     * "description" never scores against "prescription".
     */
    private static final int MIN_EDIT_LENGTH = 6;
    private static final int MIN_PREFIX_LENGTH = 3;

    private StringSimilarity() {
    }

    /**
     * Best of token-set similarity and edit-distance similarity between two normalized names.
     */
    public static double similarity(String left, String right) {
        if (left.equals(right)) {
            return 1.0;
        }
        double tokenScore = tokenSetSimilarity(NameNormalizer.tokens(left), NameNormalizer.tokens(right));
        String compactLeft = left.replace("_", "");
        String compactRight = right.replace("_", "");
        double editScore = 0.0;
        if (compactLeft.length() >= MIN_EDIT_LENGTH && compactRight.length() >= MIN_EDIT_LENGTH
                && compactLeft.charAt(0) == compactRight.charAt(0)) {
            editScore = editSimilarity(compactLeft, compactRight);
        }
        return Math.max(tokenScore, editScore);
    }

    /**
     * Dice coefficient over token sets where abbreviations count as matches
     * ("addr" matches "address").
     */
    public static double tokenSetSimilarity(List<String> left, List<String> right) {
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int matched = 0;
        boolean[] used = new boolean[right.size()];
        for (String token : left) {
            for (int i = 0; i < right.size(); i++) {
                if (!used[i] && tokensMatch(token, right.get(i))) {
                    used[i] = true;
                    matched++;
                    break;
                }
            }
        }
        return 2.0 * matched / (left.size() + right.size());
    }

    public static double editSimilarity(String left, String right) {
        int longest = Math.max(left.length(), right.length());
        if (longest == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshtein(left, right) / longest;
    }

    static int levenshtein(String left, String right) {
        int[] previous = new int[right.length() + 1];
        int[] current = new int[right.length() + 1];
        for (int j = 0; j <= right.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= left.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= right.length(); j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[right.length()];
    }

    private static boolean tokensMatch(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;
        return shorter.length() >= MIN_PREFIX_LENGTH && longer.startsWith(shorter);
    }
}
