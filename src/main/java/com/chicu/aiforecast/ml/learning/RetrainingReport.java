package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record RetrainingReport(
        List<String> retrainedNames,

        // оценка каждой зарегистрированной модели на новой пачке (до ретрейна)
        Map<String, PerformanceSnapshot> performanceByName,

        // только по деградировавшим
        List<RetrainingOutcome> outcomes,

        boolean ensemblesRefreshed,
        Instant completedAt
) {
    public RetrainingReport {
        retrainedNames = retrainedNames == null ? List.of() : List.copyOf(retrainedNames);
        performanceByName = performanceByName == null ? Map.of() : Map.copyOf(performanceByName);
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}
