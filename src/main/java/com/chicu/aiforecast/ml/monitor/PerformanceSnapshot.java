package com.chicu.aiforecast.ml.monitor;

import lombok.Builder;

import java.time.Instant;

/**
 * Снимок качества модели на конкретных данных. Неизменяемый.
 */
@Builder
public record PerformanceSnapshot(
        double mse,
        double mae,
        double rmse,
        double r2,
        Instant measuredAt
) {

    /**
     * Сентинел для неудачной оценки: mse/mae/rmse = +inf, r2 = 0.
     */
    public static PerformanceSnapshot failed(Instant at) {
        return PerformanceSnapshot.builder()
                .mse(Double.POSITIVE_INFINITY)
                .mae(Double.POSITIVE_INFINITY)
                .rmse(Double.POSITIVE_INFINITY)
                .r2(0.0)
                .measuredAt(at)
                .build();
    }

    public boolean isFailed() {
        return !Double.isFinite(mse);
    }
}
