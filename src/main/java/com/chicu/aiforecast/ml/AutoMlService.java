package com.chicu.aiforecast.ml;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.learning.ContinuousLearningController;
import com.chicu.aiforecast.ml.learning.EnsembleService;
import com.chicu.aiforecast.ml.learning.RetrainingReport;
import com.chicu.aiforecast.ml.monitor.ModelHealth;
import com.chicu.aiforecast.ml.monitor.MonitoringReport;
import com.chicu.aiforecast.ml.monitor.PerformanceMonitor;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.registry.ModelPromoter;
import com.chicu.aiforecast.ml.registry.ModelRecord;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.ml.registry.RegistryProperties;
import com.chicu.aiforecast.ml.tuning.OptimizationRequest;
import com.chicu.aiforecast.ml.tuning.OptimizationResult;
import com.chicu.aiforecast.ml.tuning.SearchOrchestrator;
import com.chicu.aiforecast.ml.tuning.TuningBudget;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Точка входа AutoML: поиск + продвижение, дообучение, мониторинг, сохранение реестра.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AutoMlService {

    private final SearchOrchestrator orchestrator;
    private final ModelPromoter promoter;
    private final ModelRegistry registry;
    private final PerformanceMonitor monitor;
    private final ContinuousLearningController learning;
    private final EnsembleService ensembles;
    private final RegistryProperties registryProps;
    private final Clock clock;

    public OptimizationResult optimize(String name,
                                       ModelFamily family,
                                       Dataset dataset,
                                       SearchSpace searchSpace,
                                       TuningBudget budget) {
        return optimize(OptimizationRequest.builder()
                .name(name)
                .family(family)
                .dataset(dataset)
                .searchSpace(searchSpace)
                .budget(budget)
                .reason("manual")
                .build());
    }

    /**
     * Поиск и, если он дал модель, продвижение в реестр под {@code request.name()}.
     */
    public OptimizationResult optimize(OptimizationRequest request) {
        OptimizationResult result = orchestrator.run(request);
        if (!result.ok()) {
            return result;
        }

        ModelRecord record = promoter.promote(result);
        ensembles.refresh();

        return result.toBuilder()
                .promotedAt(record.promotedAt())
                .build();
    }

    public RetrainingReport learn(Dataset newData) {
        return learning.learn(newData);
    }

    public MonitoringReport monitor() {
        Map<String, ModelHealth> models = new LinkedHashMap<>();

        for (ModelRecord record : registry.snapshot().values()) {
            String name = record.name();
            PerformanceSnapshot current = monitor.latest(name).orElse(record.performance());

            models.put(name, ModelHealth.builder()
                    .currentPerformance(current)
                    .trend(monitor.trend(name))
                    .degraded(monitor.isDegraded(name, current, record.performance()))
                    .lastPromotedAt(record.promotedAt())
                    .build());
        }

        return MonitoringReport.builder()
                .models(models)
                .monitoredAt(clock.instant())
                .build();
    }

    public void saveRegistry() {
        saveRegistry(Path.of(registryProps.getPath()));
    }

    public void saveRegistry(Path path) {
        registry.save(path);
    }

    public void loadRegistry() {
        loadRegistry(Path.of(registryProps.getPath()));
    }

    /**
     * После загрузки история мониторинга начинается заново: по одному снимку
     * (на момент продвижения) на каждую загруженную модель.
     */
    public void loadRegistry(Path path) {
        registry.load(path);

        monitor.clear();
        for (ModelRecord record : registry.snapshot().values()) {
            monitor.record(record.name(), record.performance());
        }
        ensembles.refresh();

        log.info("📂 MONITOR RESEEDED models={}", registry.size());
    }
}
