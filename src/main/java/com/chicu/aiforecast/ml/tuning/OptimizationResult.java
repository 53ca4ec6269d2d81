package com.chicu.aiforecast.ml.tuning;

import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder(toBuilder = true)
public record OptimizationResult(
        boolean ok,                      // есть ли что продвигать
        String reason,                   // почему нет / чем закончился прогон

        String name,
        ModelFamily family,
        SearchSpace searchSpace,

        Map<String, Object> bestParams,
        double bestScore,
        PerformanceSnapshot performance, // метрики финальной модели на всём датасете
        TrainableModel model,            // финальная модель, обученная на всём датасете

        int trialCount,
        int failedTrials,
        List<Trial> trials,              // в порядке завершения
        List<Double> bestScoreHistory,   // кумулятивный минимум в том же порядке

        Instant startedAt,
        Instant finishedAt,
        Instant promotedAt               // null, если не продвигали
) {
    public boolean promoted() {
        return promotedAt != null;
    }
}
