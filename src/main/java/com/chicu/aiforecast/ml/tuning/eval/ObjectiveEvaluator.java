package com.chicu.aiforecast.ml.tuning.eval;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Оценка кандидатов:
 * - {@link #evaluate} — walk-forward CV, средний MSE по фолдам (меньше = лучше);
 * - {@link #fullEvaluate} — полный набор метрик для продвижения и мониторинга.
 *
 * Ни один из методов не бросает из-за модели: провал возвращается как данные.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ObjectiveEvaluator {

    private final Clock clock;

    public TrialScore evaluate(EvaluationContext ctx) {
        Dataset ds = ctx.dataset();
        List<Fold> folds;
        try {
            folds = WalkForwardSplitter.split(ds.size(), ctx.folds());
        } catch (IllegalArgumentException e) {
            return TrialScore.failed("bad folds: " + e.getMessage());
        }

        double sum = 0.0;

        for (Fold fold : folds) {
            try {
                TrainableModel model = ctx.factory().create(ctx.params());
                model.fit(ds.xRange(0, fold.trainEnd()), ds.yRange(0, fold.trainEnd()));

                double[] actual = ds.yRange(fold.testStart(), fold.testEnd());
                double[] predicted = model.predict(ds.xRange(fold.testStart(), fold.testEnd()));

                if (predicted == null || predicted.length != actual.length) {
                    return TrialScore.failed("fold " + fold.index() + ": prediction size mismatch");
                }

                double loss = RegressionMetrics.mse(actual, predicted);
                if (!Double.isFinite(loss)) {
                    return TrialScore.failed("fold " + fold.index() + ": non-finite loss " + loss);
                }

                log.debug("🧪 fold={} train={} test={} mse={}", fold.index(), fold.trainSize(), fold.testSize(), loss);
                sum += loss;

            } catch (Exception e) {
                return TrialScore.failed("fold " + fold.index() + ": "
                        + e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }

        return TrialScore.ok(sum / folds.size());
    }

    public PerformanceSnapshot fullEvaluate(TrainableModel model, Dataset dataset) {
        Instant now = clock.instant();
        if (model == null || dataset == null) {
            log.warn("⚠️ fullEvaluate: model/dataset is null");
            return PerformanceSnapshot.failed(now);
        }

        try {
            double[] actual = dataset.y();
            double[] predicted = model.predict(dataset.x());

            if (predicted == null || predicted.length != actual.length) {
                log.warn("⚠️ fullEvaluate: prediction size mismatch family={} dataset={}", model.family(), dataset);
                return PerformanceSnapshot.failed(now);
            }

            double mse = RegressionMetrics.mse(actual, predicted);
            double mae = RegressionMetrics.mae(actual, predicted);
            double r2 = RegressionMetrics.r2(actual, predicted);

            if (!Double.isFinite(mse) || !Double.isFinite(mae) || !Double.isFinite(r2)) {
                log.warn("⚠️ fullEvaluate: non-finite metrics mse={} mae={} r2={}", mse, mae, r2);
                return PerformanceSnapshot.failed(now);
            }

            return PerformanceSnapshot.builder()
                    .mse(mse)
                    .mae(mae)
                    .rmse(Math.sqrt(mse))
                    .r2(r2)
                    .measuredAt(now)
                    .build();

        } catch (Exception e) {
            log.error("❌ Model evaluation failed family={} dataset={}: {}", model.family(), dataset, e.getMessage(), e);
            return PerformanceSnapshot.failed(now);
        }
    }
}
