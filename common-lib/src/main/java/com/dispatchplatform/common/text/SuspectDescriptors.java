package com.dispatchplatform.common.text;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts suspect description keywords (colors, clothing, physical traits) from free text.
 * Two descriptions are treated as the same suspect when they share at least
 * {@link #MIN_SHARED_FOR_MATCH} keywords.
 */
public final class SuspectDescriptors {

    public static final int MIN_SHARED_FOR_MATCH = 2;

    private static final List<String> COLORS = List.of(
        "black", "white", "red", "blue", "green", "gray", "grey", "brown", "yellow", "orange", "purple", "pink");
    private static final List<String> ITEMS = List.of(
        "hoodie", "jacket", "coat", "hat", "cap", "jeans", "pants", "sneakers", "boots", "backpack", "bag", "mask");
    private static final List<String> PHYSICAL = List.of(
        "male", "female", "tall", "short", "heavy", "slim", "beard", "glasses");

    private SuspectDescriptors() {}

    public static Set<String> extract(String text) {
        Set<String> words = TextSimilarity.words(text == null ? "" : text.toLowerCase(Locale.ROOT));
        Set<String> found = new LinkedHashSet<>();
        for (List<String> vocabulary : List.of(COLORS, ITEMS, PHYSICAL)) {
            for (String term : vocabulary) {
                if (words.contains(term)) found.add(term);
            }
        }
        return found;
    }

    public static int sharedCount(Set<String> a, Set<String> b) {
        return (int) a.stream().filter(b::contains).count();
    }

    public static boolean sameSuspect(Set<String> a, Set<String> b) {
        return sharedCount(a, b) >= MIN_SHARED_FOR_MATCH;
    }
}
