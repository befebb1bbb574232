package com.dispatchplatform.common.model;

public enum PatternStatus {
    ACTIVE,
    EXPIRED
}
