package com.simscan.scan;

import org.springframework.stereotype.Component;

/**
 * Normalized edit distance: {@code 1 - levenshtein(a, b) / max(|a|, |b|)}.
 * An empty side always scores 0, two empty strings included.
 */
@Component
public class LevenshteinSimilarity implements SimilarityMetric {

    @Override
    public double similarity(String a, String b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int maxLength = Math.max(a.length(), b.length());
        return 1.0 - (double) distance(a, b) / maxLength;
    }

    /**
     * Classic insert/delete/substitute distance over two rolling rows sized to the shorter input.
     */
    public static int distance(CharSequence a, CharSequence b) {
        CharSequence longer = a.length() >= b.length() ? a : b;
        CharSequence shorter = longer == a ? b : a;
        int n = shorter.length();
        if (n == 0) {
            return longer.length();
        }

        int[] prev = new int[n + 1];
        int[] curr = new int[n + 1];
        for (int j = 0; j <= n; j++) {
            prev[j] = j;
        }

        for (int i = 1; i <= longer.length(); i++) {
            char c = longer.charAt(i - 1);
            curr[0] = i;
            for (int j = 1; j <= n; j++) {
                int cost = c == shorter.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[n];
    }
}
