package com.chicu.aiforecast.ml.tuning;

public enum TrialStatus {
    PENDING,
    RUNNING,
    SCORED,
    FAILED
}
