package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import lombok.Builder;

/**
 * Что случилось с одной деградировавшей моделью в рамках learn().
 */
@Builder
public record RetrainingOutcome(
        String name,
        RetrainingStatus status,
        String reason,

        PerformanceSnapshot before,   // оценка старой модели на новых данных
        PerformanceSnapshot after,    // снимок новой модели (null, если не продвинули)

        String previousVersion,
        String newVersion
) {
    public boolean retrained() {
        return status == RetrainingStatus.COMPLETED;
    }
}
