package com.chicu.aiforecast.ml.monitor;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record MonitoringReport(
        Map<String, ModelHealth> models,
        Instant monitoredAt
) {
    public MonitoringReport {
        models = models == null ? Map.of() : Map.copyOf(models);
    }
}
