package com.phillippitts.scantomack.service.combine;

import java.util.List;
import java.util.Locale;

/**
 * Edit-distance based text agreement.
 *
 * <p>Similarity of two texts is {@code 1 - lev(a, b) / max(|a|, |b|)} computed on lower-cased,
 * trimmed input. Two empty texts are identical (1.0).
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    public static double similarity(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        int max = Math.max(x.length(), y.length());
        if (max == 0) {
            return 1.0;
        }
        return 1.0 - levenshtein(x, y) / (double) max;
    }

    /**
     * Mean pairwise similarity over all unordered pairs; 1.0 for fewer than two texts.
     */
    public static double agreement(List<String> texts) {
        if (texts.size() < 2) {
            return 1.0;
        }
        double sum = 0.0;
        int pairs = 0;
        for (int i = 0; i < texts.size(); i++) {
            for (int j = i + 1; j < texts.size(); j++) {
                sum += similarity(texts.get(i), texts.get(j));
                pairs++;
            }
        }
        return sum / pairs;
    }

    /**
     * Classic dynamic-programming edit distance, two rows at a time.
     */
    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(prev[j] + 1, curr[j - 1] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
