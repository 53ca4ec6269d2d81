package com.chicu.aiforecast.ml.tuning.candidates;

import com.chicu.aiforecast.ml.tuning.space.SearchSpace;

import java.util.Map;
import java.util.Random;

public interface ParamSampler {

    /**
     * Одна точка пространства. Не зависит от прогресса поиска:
     * всё состояние — в переданном {@code rnd}.
     */
    Map<String, Object> sample(SearchSpace space, Random rnd);
}
