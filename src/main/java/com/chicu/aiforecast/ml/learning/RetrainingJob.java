package com.chicu.aiforecast.ml.learning;

import java.time.Instant;

/**
 * Ретрейн одной модели. RUNNING на одно имя — не больше одного одновременно.
 */
public record RetrainingJob(
        String modelName,
        Instant triggeredAt,
        RetrainingStatus status
) {
    public RetrainingJob withStatus(RetrainingStatus next) {
        return new RetrainingJob(modelName, triggeredAt, next);
    }
}
