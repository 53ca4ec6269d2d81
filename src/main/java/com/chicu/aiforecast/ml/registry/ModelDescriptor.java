package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Содержимое записи реестра без самой модели (для сравнения, логов и отчётов).
 */
@Builder
public record ModelDescriptor(
        String name,
        ModelFamily family,
        Map<String, Object> hyperparams,
        double score,
        PerformanceSnapshot performance,
        Instant promotedAt,
        SearchSpace searchSpace,
        String version
) {}
