package com.chicu.aiforecast.ml.tuning;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ai.ml.model.ModelFactoryRegistry;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.TrainableModelFactory;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.tuning.candidates.ParamSampler;
import com.chicu.aiforecast.ml.tuning.eval.EvaluationContext;
import com.chicu.aiforecast.ml.tuning.eval.ObjectiveEvaluator;
import com.chicu.aiforecast.ml.tuning.eval.TrialScore;
import com.chicu.aiforecast.ml.tuning.eval.WalkForwardSplitter;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Бюджетированный поиск гиперпараметров:
 * sample -> evaluate (walk-forward) -> лучший триал -> финальная модель на всём датасете.
 *
 * До {@code ml.tuning.workers} триалов выполняются параллельно. Провал триала
 * (исключение, NaN, таймаут) — это score = +inf, прогон продолжается.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SearchOrchestrator {

    private final ModelFactoryRegistry factories;
    private final ParamSampler sampler;
    private final ObjectiveEvaluator evaluator;
    private final MlTuningProperties props;
    private final Clock clock;

    public OptimizationResult run(OptimizationRequest request) {

        // ==========================
        // ✅ Валидация (ошибки конфигурации — синхронно вызывающему)
        // ==========================
        if (request == null) {
            throw new IllegalArgumentException("request = null");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw new IllegalArgumentException("name не задан");
        }
        if (request.dataset() == null) {
            throw new IllegalArgumentException("dataset не задан");
        }
        final String name = request.name().trim();
        final Dataset dataset = request.dataset();
        // без явного бюджета — ml.tuning.maxTrials / maxWallClockMs
        final TuningBudget budget = request.budget() != null ? request.budget() : defaultBudget();
        final int folds = props.getFolds();

        WalkForwardSplitter.validate(dataset.size(), folds);

        final TrainableModelFactory factory = factories.get(request.family());
        final SearchSpace space = request.searchSpace() != null ? request.searchSpace() : factory.defaultSpace();
        final long seed = request.seed() != null ? request.seed() : props.getSeed();
        final int workers = Math.max(1, props.getWorkers());
        final long trialTimeoutMs = Math.max(0L, props.getTrialTimeoutMs());
        final int maxTrials = budget.maxTrials() != null ? budget.maxTrials() : Integer.MAX_VALUE;

        final Instant startedAt = clock.instant();
        final long startNanos = System.nanoTime();
        final long deadlineNanos = budget.maxWallClock() != null
                ? startNanos + budget.maxWallClock().toNanos()
                : Long.MAX_VALUE;

        log.info("🧠 TUNE START name={} family={} samples={} space={} maxTrials={} maxWallClock={} workers={} seed={} reason={}",
                name, factory.getFamily(), dataset.size(), space, budget.maxTrials(), budget.maxWallClock(),
                workers, seed, safe(request.reason()));

        BestTrialTracker tracker = new BestTrialTracker();
        List<PendingTrial> pending = new ArrayList<>();
        Semaphore slots = new Semaphore(workers);
        // параллелизм ограничивает semaphore; пул растёт, чтобы зависший после таймаута поток не занимал место нового триала
        ExecutorService pool = Executors.newCachedThreadPool(trialThreadFactory(name));
        // независимые seed'ы триалов из одного генератора, в порядке подачи
        Random seeds = new Random(seed);

        String stopReason = "maxTrials";
        boolean interrupted = false;

        try {
            // ==========================
            // ✅ Подача триалов (пока есть бюджет)
            // ==========================
            try {
                for (int id = 0; id < maxTrials; id++) {
                    long remaining = deadlineNanos - System.nanoTime();
                    if (remaining <= 0) {
                        stopReason = "maxWallClock";
                        break;
                    }
                    if (!acquire(slots, remaining, deadlineNanos)) {
                        stopReason = "maxWallClock";
                        break;
                    }
                    pending.add(submit(id, factory, space, dataset, folds, seeds.nextLong(), trialTimeoutMs, pool, slots, tracker));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                stopReason = "interrupted";
            }

            // ==========================
            // ✅ Ожидание in-flight (не дольше дедлайна)
            // ==========================
            if (!interrupted) {
                interrupted = awaitInFlight(pending, deadlineNanos);
                if (interrupted) stopReason = "interrupted";
            }
            abandonUnfinished(pending, interrupted ? "abandoned (interrupted)" : "abandoned (maxWallClock)");

        } finally {
            pool.shutdownNow();
        }

        List<Trial> trials = tracker.completed();
        Trial best = tracker.best();

        long tookMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        log.info("🧠 TUNE TRIALS DONE name={} trials={} failed={} bestScore={} stop={} tookMs={}",
                name, trials.size(), tracker.failedCount(), best != null ? best.score() : null, stopReason, tookMs);

        OptimizationResult.OptimizationResultBuilder result = OptimizationResult.builder()
                .name(name)
                .family(factory.getFamily())
                .searchSpace(space)
                .bestScore(best != null ? best.score() : TrialScore.FAILED_SCORE)
                .bestParams(best != null ? best.params() : null)
                .trialCount(trials.size())
                .failedTrials(tracker.failedCount())
                .trials(trials)
                .bestScoreHistory(tracker.bestHistory())
                .startedAt(startedAt);

        if (best == null) {
            log.warn("⚠️ TUNE NO RESULT name={}: нет ни одного успешного триала (stop={})", name, stopReason);
            return result
                    .ok(false)
                    .reason("Нет успешных триалов (stop=" + stopReason + ")")
                    .finishedAt(clock.instant())
                    .build();
        }

        // ==========================
        // ✅ Финальная модель на ВСЁМ датасете
        // ==========================
        TrainableModel model;
        try {
            model = factory.create(best.params());
            model.fit(dataset.x(), dataset.y());
        } catch (Exception e) {
            log.error("❌ TUNE FINAL FIT FAILED name={} params={}: {}", name, best.params(), e.getMessage(), e);
            return result
                    .ok(false)
                    .reason("Финальное обучение упало: " + safe(e.getMessage()))
                    .finishedAt(clock.instant())
                    .build();
        }

        PerformanceSnapshot performance = evaluator.fullEvaluate(model, dataset);
        if (performance.isFailed()) {
            log.warn("⚠️ TUNE FINAL EVAL FAILED name={} params={}", name, best.params());
            return result
                    .ok(false)
                    .reason("Финальная модель не прошла оценку")
                    .performance(performance)
                    .finishedAt(clock.instant())
                    .build();
        }

        log.info("✅ TUNE DONE name={} family={} bestScore={} params={} mse={} r2={} trials={} stop={}",
                name, factory.getFamily(), best.score(), best.params(), performance.mse(), performance.r2(),
                trials.size(), stopReason);

        return result
                .ok(true)
                .reason("stop=" + stopReason)
                .model(model)
                .performance(performance)
                .finishedAt(clock.instant())
                .build();
    }

    // =========================================================
    // trials
    // =========================================================

    private PendingTrial submit(int id,
                                TrainableModelFactory factory,
                                SearchSpace space,
                                Dataset dataset,
                                int folds,
                                long trialSeed,
                                long trialTimeoutMs,
                                ExecutorService pool,
                                Semaphore slots,
                                BestTrialTracker tracker) {

        Map<String, Object> params;
        try {
            params = Map.copyOf(sampler.sample(space, new Random(trialSeed)));
        } catch (RuntimeException e) {
            slots.release();
            log.warn("⚠️ TRIAL {} sample failed: {}", id, e.getMessage());
            CompletableFuture<Trial> done = CompletableFuture.completedFuture(
                    Trial.failed(id, Map.of(), "sample failed: " + e.getMessage()));
            return new PendingTrial(id, Map.of(), done, done.thenApply(t -> record(tracker, t)));
        }

        EvaluationContext ctx = EvaluationContext.builder()
                .factory(factory)
                .params(params)
                .dataset(dataset)
                .folds(folds)
                .build();

        CompletableFuture<Trial> bounded = new CompletableFuture<>();
        Future<?> task = pool.submit(() -> {
            try {
                bounded.complete(runTrial(id, ctx));
            } catch (Throwable e) {
                bounded.completeExceptionally(e);
            }
        });
        if (trialTimeoutMs > 0) {
            bounded.completeOnTimeout(
                    Trial.failed(id, params, "timeout after " + trialTimeoutMs + "ms"),
                    trialTimeoutMs,
                    TimeUnit.MILLISECONDS);
        }
        // триал записан (готов, таймаут или брошен) -> слот свободен, воркер прерывается
        bounded.whenComplete((t, e) -> {
            slots.release();
            task.cancel(true);
        });

        CompletableFuture<Trial> recorded = bounded
                .exceptionally(e -> Trial.failed(id, params, "unexpected: " + e.getMessage()))
                .thenApply(t -> record(tracker, t));

        return new PendingTrial(id, params, bounded, recorded);
    }

    private Trial runTrial(int id, EvaluationContext ctx) {
        long t0 = System.nanoTime();
        TrialScore score;
        try {
            score = evaluator.evaluate(ctx);
        } catch (RuntimeException e) {
            score = TrialScore.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        long took = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        return Trial.of(id, ctx.params(), score, took);
    }

    private static Trial record(BestTrialTracker tracker, Trial t) {
        if (t.scored()) {
            log.debug("🧪 TRIAL {} score={} params={} tookMs={}", t.id(), t.score(), t.params(), t.durationMs());
        } else {
            log.warn("⚠️ TRIAL {} FAILED params={} reason={}", t.id(), t.params(), t.error());
        }
        tracker.offer(t);
        return t;
    }

    private static boolean acquire(Semaphore slots, long remainingNanos, long deadlineNanos) throws InterruptedException {
        if (deadlineNanos == Long.MAX_VALUE) {
            slots.acquire();
            return true;
        }
        return slots.tryAcquire(remainingNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @return true, если ожидание прервали
     */
    private static boolean awaitInFlight(List<PendingTrial> pending, long deadlineNanos) {
        CompletableFuture<?>[] all = pending.stream()
                .map(PendingTrial::recorded)
                .toArray(CompletableFuture[]::new);
        CompletableFuture<Void> done = CompletableFuture.allOf(all);

        try {
            if (deadlineNanos == Long.MAX_VALUE) {
                done.get();
            } else {
                long remaining = deadlineNanos - System.nanoTime();
                done.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            }
        } catch (TimeoutException e) {
            log.info("⏳ maxWallClock истёк, незавершённые триалы будут брошены");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            log.error("❌ Неожиданная ошибка ожидания триалов: {}", e.getMessage(), e);
        }
        return false;
    }

    private static void abandonUnfinished(List<PendingTrial> pending, String reason) {
        for (PendingTrial p : pending) {
            // complete() сработает только если триал ещё не завершился — запись ровно одна
            p.bounded().complete(Trial.failed(p.id(), p.params(), reason));
        }
        // запись в tracker могла уйти в поток воркера — дожидаемся её
        for (PendingTrial p : pending) {
            p.recorded().join();
        }
    }

    private static ThreadFactory trialThreadFactory(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "automl-trial-" + name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private TuningBudget defaultBudget() {
        return new TuningBudget(
                props.getMaxTrials() > 0 ? props.getMaxTrials() : null,
                props.getMaxWallClockMs() > 0 ? Duration.ofMillis(props.getMaxWallClockMs()) : null);
    }

    private static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }

    private record PendingTrial(
            int id,
            Map<String, Object> params,
            CompletableFuture<Trial> bounded,
            CompletableFuture<Trial> recorded
    ) {}
}
