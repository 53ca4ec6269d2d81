package com.chicu.aiforecast.ml.monitor;

public enum PerformanceTrend {
    IMPROVING,
    STABLE,
    DEGRADING
}
