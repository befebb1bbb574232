package com.dispatchplatform.common.filter;

/**
 * Outcome of {@link TranscriptFilter#classify}.
 *
 * @param dropConnection the originating stream is producing garbage and should be replaced
 */
public record FilterVerdict(boolean accepted, RejectReason reason, boolean dropConnection) {

    private static final FilterVerdict ACCEPT = new FilterVerdict(true, null, false);

    public static FilterVerdict accept() {
        return ACCEPT;
    }

    public static FilterVerdict reject(RejectReason reason) {
        return new FilterVerdict(false, reason, false);
    }

    public static FilterVerdict rejectAndDrop(RejectReason reason) {
        return new FilterVerdict(false, reason, true);
    }
}
