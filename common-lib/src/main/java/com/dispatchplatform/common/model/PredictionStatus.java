package com.dispatchplatform.common.model;

/** Lifecycle of a prediction. HIT and EXPIRED are terminal. */
public enum PredictionStatus {
    PENDING,
    HIT,
    EXPIRED
}
