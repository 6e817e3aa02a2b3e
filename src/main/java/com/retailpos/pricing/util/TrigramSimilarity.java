package com.retailpos.pricing.util;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Trigram similarity with the same semantics as PostgreSQL's pg_trgm {@code similarity()}:
 * words are lower-cased, padded with two leading blanks and one trailing blank, and the
 * score is the size of the shared trigram set over the size of the union.
 */
public final class TrigramSimilarity {

    private TrigramSimilarity() {
    }

    public static double similarity(String a, String b) {
        if (a == null || b == null) {
            return 0.0;
        }
        Set<String> left = trigrams(a);
        Set<String> right = trigrams(b);
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String t : left) {
            if (right.contains(t)) {
                common++;
            }
        }
        int union = left.size() + right.size() - common;
        return (double) common / union;
    }

    static Set<String> trigrams(String text) {
        Set<String> result = new HashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (word.isEmpty()) {
                continue;
            }
            String padded = "  " + word + " ";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                result.add(padded.substring(i, i + 3));
            }
        }
        return result;
    }
}
