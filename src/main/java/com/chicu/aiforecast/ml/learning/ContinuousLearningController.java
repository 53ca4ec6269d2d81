package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ml.monitor.PerformanceMonitor;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.registry.ModelPromoter;
import com.chicu.aiforecast.ml.registry.ModelRecord;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.ml.tuning.OptimizationRequest;
import com.chicu.aiforecast.ml.tuning.OptimizationResult;
import com.chicu.aiforecast.ml.tuning.SearchOrchestrator;
import com.chicu.aiforecast.ml.tuning.TuningBudget;
import com.chicu.aiforecast.ml.tuning.eval.ObjectiveEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Новая пачка данных -> оценка всех моделей реестра -> ретрейн деградировавших.
 *
 * На одно имя одновременно идёт не больше одного ретрейна; повторный триггер
 * возвращает SKIPPED. Если ретрейн не удался, в реестре остаётся старая запись.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContinuousLearningController {

    private final ModelRegistry registry;
    private final ObjectiveEvaluator evaluator;
    private final PerformanceMonitor monitor;
    private final SearchOrchestrator orchestrator;
    private final ModelPromoter promoter;
    private final EnsembleService ensembles;
    private final LearningProperties props;
    private final Clock clock;

    /**
     * ✅ Защита от дублей: одно имя модели — один ретрейн одновременно.
     */
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private final Map<String, RetrainingJob> jobs = new ConcurrentHashMap<>();

    public RetrainingReport learn(Dataset newData) {
        if (newData == null) {
            throw new IllegalArgumentException("newData = null");
        }

        Map<String, ModelRecord> snapshot = registry.snapshot();
        log.info("🔁 LEARN START models={} samples={} dataset={}", snapshot.size(), newData.size(), newData.datasetId());

        Map<String, PerformanceSnapshot> performance = new LinkedHashMap<>();
        List<RetrainingOutcome> outcomes = new ArrayList<>();
        List<String> retrained = new ArrayList<>();

        for (ModelRecord record : snapshot.values()) {
            String name = record.name();

            PerformanceSnapshot current = evaluator.fullEvaluate(record.model(), newData);
            monitor.record(name, current);
            performance.put(name, current);

            if (!monitor.isDegraded(name, current, record.performance())) {
                log.debug("🔁 LEARN OK name={} mse={} baseline={}", name, current.mse(), record.performance().mse());
                continue;
            }

            RetrainingOutcome outcome = retrain(record, current, newData);
            outcomes.add(outcome);
            if (outcome.retrained()) {
                retrained.add(name);
            }
        }

        boolean refreshed = false;
        if (!retrained.isEmpty()) {
            ensembles.refresh();
            refreshed = true;
        }

        log.info("✅ LEARN DONE evaluated={} degraded={} retrained={}", performance.size(), outcomes.size(), retrained);

        return RetrainingReport.builder()
                .retrainedNames(retrained)
                .performanceByName(performance)
                .outcomes(outcomes)
                .ensemblesRefreshed(refreshed)
                .completedAt(clock.instant())
                .build();
    }

    /**
     * Последний известный статус ретрейна по каждому имени.
     */
    public Map<String, RetrainingJob> jobs() {
        return Collections.unmodifiableMap(new TreeMap<>(jobs));
    }

    public boolean isRetraining(String name) {
        return name != null && inFlight.contains(name);
    }

    // =========================================================
    // retrain
    // =========================================================

    private RetrainingOutcome retrain(ModelRecord record, PerformanceSnapshot before, Dataset newData) {
        String name = record.name();

        if (!inFlight.add(name)) {
            log.info("🔁 RETRAIN SKIP name={}: ретрейн уже выполняется", name);
            return RetrainingOutcome.builder()
                    .name(name)
                    .status(RetrainingStatus.SKIPPED)
                    .reason("Ретрейн уже выполняется")
                    .before(before)
                    .previousVersion(record.version())
                    .build();
        }

        // снимок мог устареть: запись уже заменил другой learn или optimize
        if (isStale(record)) {
            inFlight.remove(name);
            log.info("🔁 RETRAIN SKIP name={}: version={} уже заменена", name, record.version());
            return RetrainingOutcome.builder()
                    .name(name)
                    .status(RetrainingStatus.SKIPPED)
                    .reason("Запись уже заменена")
                    .before(before)
                    .previousVersion(record.version())
                    .build();
        }

        RetrainingJob job = new RetrainingJob(name, clock.instant(), RetrainingStatus.RUNNING);
        jobs.put(name, job);
        long started = System.currentTimeMillis();

        try {
            log.info("🔁 RETRAIN START name={} family={} mse={} baseline={}",
                    name, record.family(), before.mse(), record.performance().mse());

            OptimizationResult result = orchestrator.run(OptimizationRequest.builder()
                    .name(name)
                    .family(record.family())
                    .dataset(newData)
                    .searchSpace(record.searchSpace())
                    .budget(budget())
                    .reason("retrain")
                    .build());

            if (!result.ok()) {
                jobs.put(name, job.withStatus(RetrainingStatus.FAILED));
                log.warn("⚠️ RETRAIN FAILED name={} reason={} (остаётся version={})",
                        name, result.reason(), record.version());
                return failed(record, before, result.reason());
            }

            if (isStale(record)) {
                jobs.put(name, job.withStatus(RetrainingStatus.SKIPPED));
                log.info("🔁 RETRAIN DISCARD name={}: version={} заменена во время ретрейна", name, record.version());
                return RetrainingOutcome.builder()
                        .name(name)
                        .status(RetrainingStatus.SKIPPED)
                        .reason("Запись заменена во время ретрейна")
                        .before(before)
                        .previousVersion(record.version())
                        .build();
            }

            ModelRecord promoted = promoter.promote(result);
            jobs.put(name, job.withStatus(RetrainingStatus.COMPLETED));

            log.info("✅ RETRAIN DONE name={} version={} mse={} tookMs={}",
                    name, promoted.version(), promoted.performance().mse(), System.currentTimeMillis() - started);

            return RetrainingOutcome.builder()
                    .name(name)
                    .status(RetrainingStatus.COMPLETED)
                    .reason(result.reason())
                    .before(before)
                    .after(promoted.performance())
                    .previousVersion(record.version())
                    .newVersion(promoted.version())
                    .build();

        } catch (Exception e) {
            jobs.put(name, job.withStatus(RetrainingStatus.FAILED));
            log.error("❌ RETRAIN FAILED name={} tookMs={}: {}", name, System.currentTimeMillis() - started, e.getMessage(), e);
            return failed(record, before, "Ошибка ретрейна: " + e.getMessage());

        } finally {
            inFlight.remove(name);
        }
    }

    private boolean isStale(ModelRecord record) {
        ModelRecord live = registry.get(record.name()).orElse(null);
        return live == null || !live.version().equals(record.version());
    }

    private TuningBudget budget() {
        int trials = Math.max(1, props.getBudgetMaxTrials());
        long wallMs = props.getBudgetMaxWallClockMs();
        return wallMs > 0
                ? TuningBudget.of(trials, Duration.ofMillis(wallMs))
                : TuningBudget.trials(trials);
    }

    private static RetrainingOutcome failed(ModelRecord record, PerformanceSnapshot before, String reason) {
        return RetrainingOutcome.builder()
                .name(record.name())
                .status(RetrainingStatus.FAILED)
                .reason(reason)
                .before(before)
                .previousVersion(record.version())
                .build();
    }
}
