package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.dedup.DedupCache;
import com.dispatchplatform.common.model.SourceFeed;

import java.time.Instant;

/**
 * One call listed by a call-log source.
 *
 * @param groupId        call group or talkgroup id, unique per source together with the timestamp
 * @param talkgroupLabel human-readable talkgroup, used as the transcript source label
 * @param audioUrl       clip location when the listing carries it, else {@code null}
 */
public record CallRecord(
    String source,
    String groupId,
    Instant timestamp,
    String talkgroupLabel,
    String audioUrl,
    String city
) {
    public String dedupKey() {
        return DedupCache.callKey(groupId, timestamp.getEpochSecond());
    }

    public boolean hasAudioUrl() {
        return audioUrl != null && !audioUrl.isBlank();
    }

    public CallRecord withAudioUrl(String url) {
        return new CallRecord(source, groupId, timestamp, talkgroupLabel, url, city);
    }

    public SourceFeed asFeed() {
        return SourceFeed.poll(groupId, source + ": " + talkgroupLabel, city);
    }
}
