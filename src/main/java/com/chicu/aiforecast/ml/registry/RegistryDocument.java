package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.tuning.space.ParamSpaceItem;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON-индекс реестра на диске. Модели лежат отдельными артефактами,
 * здесь только ссылка на них (modelArtifactRef, путь относительно индекса).
 */
@Builder
public record RegistryDocument(
        int formatVersion,
        Instant savedAt,
        Map<String, Entry> models
) {
    static final int FORMAT_VERSION = 1;

    @Builder
    public record Entry(
            ModelFamily family,
            Map<String, Object> hyperparams,
            double score,
            PerformanceSnapshot performance,
            Instant promotedAt,
            String version,
            String modelArtifactRef,
            List<ParamSpaceItem> searchSpace
    ) {}
}
