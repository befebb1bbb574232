package com.dispatchplatform.common.filter;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Rejects transcripts that are not dispatch traffic before they reach extraction.
 *
 * <p>Checks run in a fixed order: prompt leakage, stock filler, short sign-offs, advertisements,
 * garbage boilerplate, repetitive text. The last two also mark the source connection for
 * replacement, since a feed producing them is usually looping or off the air.
 */
public final class TranscriptFilter {

    public static final int STREAM_MIN_LENGTH = 10;
    public static final int CALL_MIN_LENGTH   = 15;

    static final int SIGN_OFF_MAX_LENGTH      = 50;
    static final int REPETITIVE_MIN_WORDS     = 20;
    static final double REPETITIVE_UNIQUE_RATIO = 0.3;

    private static final List<String> PROMPT_LEAKAGE = List.of(
        "addresses like", "intersections like", "landmarks like",
        "nypd police radio dispatch",
        "10-4, 10-13, 10-85",
        "forthwith, precinct, sector, central",
        "k, forthwith, precinct",
        "42nd and lex", "times square, penn station",
        "minneapolis police and fire radio dispatch",
        "locations like lake street"
    );

    private static final Set<String> FILLER = Set.of(
        "thank you", "thanks for watching", "subscribe", "you", "bye", "music", "you.", "bye."
    );

    private static final List<String> SIGN_OFFS = List.of(
        "have a good night", "have a good evening", "have a good one",
        "good night", "good evening", "see you", "take care",
        "10-4", "10-7", "10-8", "10-41", "10-42",
        "copy that", "roger", "affirmative",
        "going off duty", "end of shift", "signing off",
        "every night", "every evening"
    );

    private static final List<String> GARBAGE = List.of(
        "un.org", "un videos", "united nations",
        "test broadcast", "this is a test",
        "lorem ipsum", "placeholder",
        "stream offline", "feed offline",
        "no audio", "audio unavailable"
    );

    private TranscriptFilter() {}

    public static FilterVerdict classify(String text, int minLength) {
        if (text == null || text.trim().length() < minLength) {
            return FilterVerdict.reject(RejectReason.TOO_SHORT);
        }
        String lower = text.trim().toLowerCase(Locale.ROOT);

        if (PROMPT_LEAKAGE.stream().anyMatch(lower::contains)) {
            return FilterVerdict.reject(RejectReason.PROMPT_LEAKAGE);
        }
        if (FILLER.contains(lower) || FILLER.contains(lower.replaceAll("[.,!?]", ""))) {
            return FilterVerdict.reject(RejectReason.FILLER);
        }
        if (lower.length() < SIGN_OFF_MAX_LENGTH && SIGN_OFFS.stream().anyMatch(lower::contains)) {
            return FilterVerdict.reject(RejectReason.SIGN_OFF);
        }
        if (isAdvertisement(lower)) {
            return FilterVerdict.reject(RejectReason.ADVERTISEMENT);
        }
        if (GARBAGE.stream().anyMatch(lower::contains)) {
            return FilterVerdict.rejectAndDrop(RejectReason.GARBAGE);
        }
        if (isRepetitive(lower)) {
            return FilterVerdict.rejectAndDrop(RejectReason.REPETITIVE);
        }
        return FilterVerdict.accept();
    }

    private static boolean isAdvertisement(String lower) {
        return (lower.contains("broadcastify") && lower.contains("premium"))
            || lower.contains("fema.gov")
            || lower.contains("support this feed");
    }

    private static boolean isRepetitive(String lower) {
        String[] words = lower.split("\\s+");
        if (words.length <= REPETITIVE_MIN_WORDS) return false;
        Set<String> unique = new HashSet<>(Arrays.asList(words));
        return unique.size() < words.length * REPETITIVE_UNIQUE_RATIO;
    }
}
