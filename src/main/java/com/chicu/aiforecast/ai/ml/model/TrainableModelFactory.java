package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;

import java.util.Map;

public interface TrainableModelFactory {

    ModelFamily getFamily();

    /**
     * Пространство гиперпараметров по умолчанию для семейства.
     */
    SearchSpace defaultSpace();

    /**
     * Новый необученный экземпляр с заданными гиперпараметрами.
     */
    TrainableModel create(Map<String, Object> params);

    /**
     * Восстановление обученной модели из {@link TrainableModel#exportState()}.
     */
    TrainableModel restore(byte[] state);
}
