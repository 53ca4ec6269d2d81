package com.chicu.aiforecast.ml.tuning;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.Builder;

@Builder
public record OptimizationRequest(
        String name,
        ModelFamily family,
        Dataset dataset,

        // null -> пространство по умолчанию у семейства
        SearchSpace searchSpace,

        TuningBudget budget,

        // null -> ml.tuning.seed
        Long seed,

        // зачем вызвали (manual/retrain) — только для логов
        String reason
) {}
