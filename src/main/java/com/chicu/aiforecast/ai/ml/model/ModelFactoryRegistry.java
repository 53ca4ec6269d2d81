package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.common.enums.ModelFamily;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Slf4j
@Component
public class ModelFactoryRegistry {

    private final Map<ModelFamily, TrainableModelFactory> factories = new EnumMap<>(ModelFamily.class);

    public ModelFactoryRegistry(List<TrainableModelFactory> factoryList) {
        for (TrainableModelFactory f : factoryList) {
            ModelFamily family = f.getFamily();
            if (family == null) continue;

            TrainableModelFactory prev = factories.put(family, f);
            if (prev != null) {
                log.warn("⚠️ Найдено 2 фабрики для {}: {} и {}. Использую последнюю.",
                        family, prev.getClass().getSimpleName(), f.getClass().getSimpleName());
            }
        }

        log.info("🧠 ModelFactoryRegistry поднят. Семейств зарегистрировано: {}", factories.size());
    }

    public TrainableModelFactory get(ModelFamily family) {
        if (family == null) {
            throw new IllegalArgumentException("model family не задан");
        }
        TrainableModelFactory f = factories.get(family);
        if (f == null) {
            throw new IllegalArgumentException("Фабрика для " + family + " не зарегистрирована");
        }
        return f;
    }

    public Set<ModelFamily> families() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
