package com.chicu.aiforecast.ml.monitor;

import lombok.Builder;

import java.time.Instant;

@Builder
public record ModelHealth(
        PerformanceSnapshot currentPerformance,  // последний снимок в истории
        TrendReport trend,
        boolean degraded,                        // current против снимка на момент продвижения
        Instant lastPromotedAt
) {}
