package com.dispatchplatform.common.text;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/** Word-set similarity used to link incidents with overlapping descriptions. */
public final class TextSimilarity {

    private TextSimilarity() {}

    /**
     * Jaccard similarity of the lowercased word sets of {@code a} and {@code b},
     * splitting on non-word characters. Returns 0 when either text is empty.
     */
    public static double jaccard(String a, String b) {
        Set<String> left  = words(a);
        Set<String> right = words(b);
        if (left.isEmpty() || right.isEmpty()) return 0.0;
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }

    static Set<String> words(String text) {
        if (text == null || text.isBlank()) return Set.of();
        Set<String> words = new HashSet<>(Arrays.asList(text.toLowerCase(Locale.ROOT).split("\\W+")));
        words.remove("");
        return words;
    }
}
