package com.chicu.aiforecast.ml.tuning.eval;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ai.ml.model.TrainableModelFactory;
import lombok.Builder;

import java.util.Map;

/**
 * Всё, что нужно одному триалу. Неизменяемо: параметры копируются,
 * Dataset сам по себе не меняется.
 */
@Builder
public record EvaluationContext(
        TrainableModelFactory factory,
        Map<String, Object> params,
        Dataset dataset,
        int folds
) {
    public EvaluationContext {
        if (factory == null) throw new IllegalArgumentException("factory is null");
        if (dataset == null) throw new IllegalArgumentException("dataset is null");
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
