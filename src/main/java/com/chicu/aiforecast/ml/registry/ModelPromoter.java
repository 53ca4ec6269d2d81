package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.ml.monitor.PerformanceMonitor;
import com.chicu.aiforecast.ml.tuning.OptimizationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Результат поиска -> новая запись реестра (целиком) + стартовый снимок в историю мониторинга.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelPromoter {

    private final ModelRegistry registry;
    private final PerformanceMonitor monitor;
    private final Clock clock;

    public ModelRecord promote(OptimizationResult result) {
        if (result == null) throw new IllegalArgumentException("result = null");
        if (!result.ok() || result.model() == null) {
            throw new IllegalStateException("нечего продвигать для " + result.name() + ": " + result.reason());
        }

        Instant now = clock.instant();

        ModelRecord record = ModelRecord.builder()
                .name(result.name())
                .family(result.family())
                .model(result.model())
                .hyperparams(result.bestParams())
                .score(result.bestScore())
                .performance(result.performance())
                .promotedAt(now)
                .searchSpace(result.searchSpace())
                .version(versionOf(result.name(), now))
                .build();

        registry.promote(record);
        monitor.record(record.name(), record.performance());
        return record;
    }

    private static String versionOf(String name, Instant at) {
        // например: load-forecast-2026-10-19T08-30-00Z-3f9a1c
        String ts = DateTimeFormatter.ISO_INSTANT.format(at.truncatedTo(ChronoUnit.SECONDS)).replace(':', '-');
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
        return name + "-" + ts + "-" + suffix;
    }
}
