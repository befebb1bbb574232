package com.dispatchplatform.common.dedup;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Locale;

/**
 * Bounded, insertion-ordered set of recently seen keys. When the cap is exceeded the oldest
 * key is evicted. Best-effort: contents are not persisted.
 *
 * <p>Not thread-safe. Each instance has exactly one writer (one poller, or one city's
 * serialized ingestion path).
 */
public class DedupCache {

    private final int capacity;
    private final LinkedHashSet<String> keys = new LinkedHashSet<>();

    public DedupCache(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    public boolean seen(String key) {
        return keys.contains(key);
    }

    public void remember(String key) {
        if (!keys.add(key)) return;
        if (keys.size() > capacity) {
            Iterator<String> oldest = keys.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    /**
     * Remembers {@code key} and reports whether it had already been seen.
     *
     * @return {@code true} when the key is a repeat and the unit must not be reprocessed
     */
    public boolean checkAndRemember(String key) {
        if (seen(key)) return true;
        remember(key);
        return false;
    }

    public int size() {
        return keys.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Key for a call: feed or talkgroup id plus the call timestamp. */
    public static String callKey(String groupId, long callTimestamp) {
        return groupId + "-" + callTimestamp;
    }

    /** Content fingerprint: first 50 characters, lowercased, alphanumerics only. */
    public static String transcriptFingerprint(String text) {
        String head = text.length() > 50 ? text.substring(0, 50) : text;
        return head.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
    }
}
