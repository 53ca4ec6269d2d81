package com.chicu.aiforecast.ml.monitor;

import lombok.Builder;

@Builder
public record TrendReport(
        PerformanceTrend trend,
        double improvementRate,   // (mse раньше - mse сейчас) / mse раньше; > 0 — стало лучше
        double volatility,        // коэф. вариации mse в последнем окне
        int samples
) {
    public static TrendReport insufficient(int samples) {
        return TrendReport.builder()
                .trend(PerformanceTrend.STABLE)
                .improvementRate(0.0)
                .volatility(0.0)
                .samples(samples)
                .build();
    }
}
