package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Живая запись реестра на одно имя модели.
 * Меняется только целиком (promote), частичных обновлений нет.
 */
@Builder(toBuilder = true)
public record ModelRecord(
        String name,
        ModelFamily family,
        TrainableModel model,
        Map<String, Object> hyperparams,
        double score,

        // снимок на момент продвижения — он же baseline для детекта деградации
        PerformanceSnapshot performance,

        Instant promotedAt,

        // пространство, в котором модель искали (нужно для ретрейна)
        SearchSpace searchSpace,

        // версия артефакта, например: "load-forecast-2026-10-19T08-30-00Z-3f9a1c"
        String version
) {
    public ModelRecord {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("ModelRecord: name пустой");
        if (family == null) throw new IllegalArgumentException("ModelRecord: family не задан для " + name);
        if (model == null) throw new IllegalArgumentException("ModelRecord: model = null для " + name);
        if (performance == null) throw new IllegalArgumentException("ModelRecord: performance = null для " + name);
        if (promotedAt == null) throw new IllegalArgumentException("ModelRecord: promotedAt = null для " + name);
        if (version == null || version.isBlank()) throw new IllegalArgumentException("ModelRecord: version пустой для " + name);
        hyperparams = hyperparams == null ? Map.of() : Map.copyOf(hyperparams);
    }

    public ModelDescriptor describe() {
        return ModelDescriptor.builder()
                .name(name)
                .family(family)
                .hyperparams(hyperparams)
                .score(score)
                .performance(performance)
                .promotedAt(promotedAt)
                .searchSpace(searchSpace)
                .version(version)
                .build();
    }
}
