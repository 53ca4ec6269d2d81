package com.chicu.aiforecast.ml.tuning;

import com.chicu.aiforecast.ai.ml.model.ModelFactoryRegistry;
import com.chicu.aiforecast.ai.ml.model.ModelParams;
import com.chicu.aiforecast.ai.ml.model.ModelTrainingException;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.TrainableModelFactory;
import com.chicu.aiforecast.ai.ml.model.ridge.RidgeModelFactory;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.candidates.ParamSampler;
import com.chicu.aiforecast.ml.tuning.candidates.RandomParamSampler;
import com.chicu.aiforecast.ml.tuning.eval.ObjectiveEvaluator;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import com.chicu.aiforecast.support.MlFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SearchOrchestratorTest {

    private static final String MODE = "mode";

    private final ObjectiveEvaluator evaluator = new ObjectiveEvaluator(MlFixtures.CLOCK);

    @Test
    void scenarioA_seasonalHourlySeries_shouldFindFiniteBestWithinBudget() {
        SearchOrchestrator orchestrator = orchestrator(MlFixtures.factories(), new RandomParamSampler(),
                MlFixtures.tuningProps(5, 4));

        OptimizationResult result = orchestrator.run(OptimizationRequest.builder()
                .name("load-forecast")
                .family(ModelFamily.RIDGE)
                .dataset(MlFixtures.seasonalHourly(1000, 11))
                .budget(TuningBudget.trials(5))
                .build());

        assertTrue(result.ok(), "reason: " + result.reason());
        assertTrue(result.trialCount() <= 5);
        assertEquals(result.trialCount(), result.trials().size());
        assertTrue(Double.isFinite(result.bestScore()));
        assertNotNull(result.bestParams());
        assertTrue(result.bestParams().containsKey(RidgeModelFactory.ALPHA));
        assertNotNull(result.model());
        assertFalse(result.performance().isFailed());
        assertEquals(new RidgeModelFactory().defaultSpace(), result.searchSpace(), "пространство по умолчанию");
        assertFalse(result.promoted(), "продвижение — не забота оркестратора");
    }

    @Test
    void bestScoreHistory_shouldBeNonIncreasing_andEndAtBestScore() {
        SearchOrchestrator orchestrator = orchestrator(MlFixtures.factories(), new RandomParamSampler(),
                MlFixtures.tuningProps(3, 3));

        OptimizationResult result = orchestrator.run(OptimizationRequest.builder()
                .name("knn")
                .family(ModelFamily.KNN)
                .dataset(MlFixtures.seasonalHourly(300, 3))
                .budget(TuningBudget.trials(12))
                .build());

        List<Double> history = result.bestScoreHistory();
        assertEquals(12, history.size());
        for (int i = 1; i < history.size(); i++) {
            assertTrue(history.get(i) <= history.get(i - 1), "history выросла на шаге " + i + ": " + history);
        }
        assertEquals(result.bestScore(), history.get(history.size() - 1));

        double minTrial = result.trials().stream().mapToDouble(Trial::score).min().orElseThrow();
        assertEquals(minTrial, result.bestScore());
    }

    @Test
    void scenarioC_failingTrial_shouldBeRecordedAndNotAbortRun() {
        // триалы 0,2,4 — нормальные, 1,3 — падают
        AtomicInteger calls = new AtomicInteger();
        ParamSampler alternating = (space, rnd) ->
                Map.of(MODE, calls.getAndIncrement() % 2 == 0 ? "ok" : "boom");

        SearchOrchestrator orchestrator = orchestrator(registryOf(new ModeFactory(0)), alternating,
                MlFixtures.tuningProps(3, 2));

        OptimizationResult result = orchestrator.run(request(TuningBudget.trials(5)));

        assertTrue(result.ok(), "reason: " + result.reason());
        assertEquals(5, result.trialCount());
        assertEquals(2, result.failedTrials());
        assertEquals("ok", result.bestParams().get(MODE));

        List<Trial> failed = result.trials().stream().filter(t -> !t.scored()).toList();
        assertEquals(2, failed.size());
        for (Trial t : failed) {
            assertEquals(TrialStatus.FAILED, t.status());
            assertEquals(Double.POSITIVE_INFINITY, t.score());
            assertTrue(t.error().contains("boom"), "причина: " + t.error());
        }
    }

    @Test
    void allTrialsFailing_shouldReturnNotOk_withoutModel() {
        ParamSampler boom = (space, rnd) -> Map.of(MODE, "boom");
        SearchOrchestrator orchestrator = orchestrator(registryOf(new ModeFactory(0)), boom,
                MlFixtures.tuningProps(3, 2));

        OptimizationResult result = orchestrator.run(request(TuningBudget.trials(3)));

        assertFalse(result.ok());
        assertNull(result.model());
        assertEquals(3, result.failedTrials());
        assertEquals(Double.POSITIVE_INFINITY, result.bestScore());
        assertNotNull(result.reason());
    }

    @Test
    void maxWallClock_shouldStopSubmittingTrials() {
        ParamSampler slowOk = (space, rnd) -> Map.of(MODE, "ok");
        SearchOrchestrator orchestrator = orchestrator(registryOf(new ModeFactory(40)), slowOk,
                MlFixtures.tuningProps(3, 2));

        long t0 = System.nanoTime();
        OptimizationResult result = orchestrator.run(request(TuningBudget.wallClock(Duration.ofMillis(400))));
        long tookMs = Duration.ofNanos(System.nanoTime() - t0).toMillis();

        assertTrue(result.trialCount() > 0);
        assertTrue(tookMs < 5_000, "прогон должен закончиться вскоре после дедлайна, tookMs=" + tookMs);
        assertTrue(result.reason().contains("maxWallClock"), "reason: " + result.reason());
    }

    @Test
    void trialTimeout_shouldMarkSlowTrialsFailed() {
        ParamSampler slow = (space, rnd) -> Map.of(MODE, "ok");
        MlTuningProperties props = MlFixtures.tuningProps(3, 2);
        props.setTrialTimeoutMs(100);

        SearchOrchestrator orchestrator = orchestrator(registryOf(new ModeFactory(5_000)), slow, props);

        long t0 = System.nanoTime();
        OptimizationResult result = orchestrator.run(request(TuningBudget.trials(2)));
        long tookMs = Duration.ofNanos(System.nanoTime() - t0).toMillis();

        assertFalse(result.ok());
        assertEquals(2, result.trialCount());
        assertEquals(2, result.failedTrials());
        assertTrue(result.trials().get(0).error().contains("timeout"));
        assertTrue(tookMs < 4_000, "таймаут триала не сработал, tookMs=" + tookMs);
    }

    @Test
    void trialTimeout_hungFitIgnoringInterrupts_shouldNotBlockNextTrials() {
        ParamSampler slow = (space, rnd) -> Map.of(MODE, "ok");
        MlTuningProperties props = MlFixtures.tuningProps(3, 1);
        props.setTrialTimeoutMs(100);

        // fit крутится 2 с и не реагирует на interrupt
        SearchOrchestrator orchestrator = orchestrator(registryOf(new ModeFactory(2_000, true)), slow, props);

        long t0 = System.nanoTime();
        OptimizationResult result = orchestrator.run(request(TuningBudget.trials(3)));
        long tookMs = Duration.ofNanos(System.nanoTime() - t0).toMillis();

        assertEquals(3, result.trialCount());
        assertEquals(3, result.failedTrials());
        assertTrue(result.trials().stream().allMatch(t -> t.error().contains("timeout")));
        assertTrue(tookMs < 1_500, "зависший триал держит слот, tookMs=" + tookMs);
    }

    @Test
    void sampledFloatParams_shouldSpreadAcrossRange() {
        MlTuningProperties props = MlFixtures.tuningProps(3, 4);

        OptimizationResult result = orchestrator(MlFixtures.factories(), new RandomParamSampler(), props)
                .run(OptimizationRequest.builder()
                        .name("ridge")
                        .family(ModelFamily.RIDGE)
                        .dataset(MlFixtures.seasonalHourly(200, 5))
                        .budget(TuningBudget.trials(50))
                        .seed(42L)
                        .build());

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Trial t : result.trials()) {
            double alpha = ((Number) t.params().get(RidgeModelFactory.ALPHA)).doubleValue();
            min = Math.min(min, alpha);
            max = Math.max(max, alpha);
        }
        assertEquals(50, result.trialCount());
        // alpha в [0.0001, 10): 50 независимых выборок покрывают большую часть диапазона
        assertTrue(max - min > 5.0, "alpha min=" + min + " max=" + max);
    }

    @Test
    void sameSeed_shouldGiveSameBestParams() {
        MlTuningProperties props = MlFixtures.tuningProps(3, 3);

        OptimizationRequest req = OptimizationRequest.builder()
                .name("ridge")
                .family(ModelFamily.RIDGE)
                .dataset(MlFixtures.seasonalHourly(200, 5))
                .budget(TuningBudget.trials(6))
                .seed(123L)
                .build();

        OptimizationResult a = orchestrator(MlFixtures.factories(), new RandomParamSampler(), props).run(req);
        OptimizationResult b = orchestrator(MlFixtures.factories(), new RandomParamSampler(), props).run(req);

        assertEquals(a.bestParams(), b.bestParams());
        assertEquals(a.bestScore(), b.bestScore());
    }

    @Test
    void configurationErrors_shouldBeThrownSynchronously() {
        SearchOrchestrator orchestrator = orchestrator(MlFixtures.factories(), new RandomParamSampler(),
                MlFixtures.tuningProps(5, 2));

        assertThrows(IllegalArgumentException.class, () -> orchestrator.run(null));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.run(OptimizationRequest.builder()
                .name("tiny")
                .family(ModelFamily.RIDGE)
                .dataset(MlFixtures.constant(4, 1.0))
                .budget(TuningBudget.trials(2))
                .build()), "folds больше датасета");
        assertThrows(IllegalArgumentException.class, () -> orchestrator.run(OptimizationRequest.builder()
                .name("no-family")
                .dataset(MlFixtures.constant(40, 1.0))
                .budget(TuningBudget.trials(2))
                .build()));
        assertThrows(IllegalArgumentException.class, () -> TuningBudget.trials(0));
        assertThrows(IllegalArgumentException.class, () -> new TuningBudget(null, null));
    }

    // =========================================================
    // helpers
    // =========================================================

    private SearchOrchestrator orchestrator(ModelFactoryRegistry factories, ParamSampler sampler, MlTuningProperties props) {
        return new SearchOrchestrator(factories, sampler, evaluator, props, MlFixtures.CLOCK);
    }

    private static ModelFactoryRegistry registryOf(TrainableModelFactory f) {
        return new ModelFactoryRegistry(List.of(f));
    }

    private static OptimizationRequest request(TuningBudget budget) {
        return OptimizationRequest.builder()
                .name("fake")
                .family(ModelFamily.RIDGE)
                .dataset(MlFixtures.constant(40, 1.0))
                .budget(budget)
                .build();
    }

    /**
     * mode=ok -> константа 1.0 (на константном ряду mse = 0), mode=boom -> fit падает.
     * fitDelayMs имитирует долгое обучение.
     */
    private static final class ModeFactory implements TrainableModelFactory {

        private final long fitDelayMs;
        private final boolean ignoreInterrupts;

        ModeFactory(long fitDelayMs) {
            this(fitDelayMs, false);
        }

        ModeFactory(long fitDelayMs, boolean ignoreInterrupts) {
            this.fitDelayMs = fitDelayMs;
            this.ignoreInterrupts = ignoreInterrupts;
        }

        @Override
        public ModelFamily getFamily() {
            return ModelFamily.RIDGE;
        }

        @Override
        public SearchSpace defaultSpace() {
            return SearchSpace.builder().categorical(MODE, "ok", "boom").build();
        }

        @Override
        public TrainableModel create(Map<String, Object> params) {
            String mode = ModelParams.getString(params, MODE, "ok");
            return new MlFixtures.ConstantModel(1.0) {
                @Override
                public void fit(double[][] x, double[] y) {
                    if (fitDelayMs > 0 && ignoreInterrupts) {
                        long until = System.nanoTime() + fitDelayMs * 1_000_000L;
                        while (System.nanoTime() < until) {
                            Thread.onSpinWait();
                        }
                    } else if (fitDelayMs > 0) {
                        try {
                            Thread.sleep(fitDelayMs);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                            throw new ModelTrainingException("interrupted");
                        }
                    }
                    if ("boom".equals(mode)) {
                        throw new ModelTrainingException("boom: numeric divergence");
                    }
                }
            };
        }

        @Override
        public TrainableModel restore(byte[] state) {
            throw new UnsupportedOperationException();
        }
    }
}
