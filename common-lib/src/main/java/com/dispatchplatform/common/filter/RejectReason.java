package com.dispatchplatform.common.filter;

public enum RejectReason {
    TOO_SHORT,
    PROMPT_LEAKAGE,
    FILLER,
    SIGN_OFF,
    ADVERTISEMENT,
    GARBAGE,
    REPETITIVE
}
