package com.chicu.aiforecast.ai.ml.model.knn;

import com.chicu.aiforecast.ai.ml.model.ModelTrainingException;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.weka.WekaInstances;
import com.chicu.aiforecast.common.enums.ModelFamily;
import weka.classifiers.lazy.IBk;
import weka.core.Instances;
import weka.core.SelectedTag;

/**
 * k ближайших соседей поверх Weka {@link IBk}: среднее или взвешенное 1/d по таргетам соседей.
 * Если k больше обучающей выборки — берутся все точки.
 */
public class KnnRegressionModel implements TrainableModel {

    public enum Weighting { UNIFORM, DISTANCE }

    private final int k;
    private final Weighting weighting;

    private IBk knn;
    private Instances header;

    public KnnRegressionModel(int k, Weighting weighting) {
        if (k < 1) throw new ModelTrainingException("k must be >= 1: " + k);
        if (weighting == null) throw new ModelTrainingException("weighting is null");
        this.k = k;
        this.weighting = weighting;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.KNN;
    }

    public int k() {
        return k;
    }

    public Weighting weighting() {
        return weighting;
    }

    @Override
    public synchronized void fit(double[][] x, double[] y) {
        Instances data = WekaInstances.training(x, y);

        IBk ibk = new IBk(Math.min(k, data.numInstances()));
        ibk.setDistanceWeighting(new SelectedTag(
                weighting == Weighting.DISTANCE ? IBk.WEIGHT_INVERSE : IBk.WEIGHT_NONE,
                IBk.TAGS_WEIGHTING));
        try {
            ibk.buildClassifier(data);
        } catch (Exception e) {
            throw new ModelTrainingException("knn fit failed: " + e.getMessage(), e);
        }

        this.knn = ibk;
        this.header = WekaInstances.emptyHeader(data);
    }

    /**
     * IBk на каждом запросе расширяет диапазоны нормализации расстояния — вызовы сериализуются.
     */
    @Override
    public synchronized double[] predict(double[][] x) {
        return WekaInstances.predict(knn, header, x);
    }

    @Override
    public synchronized byte[] exportState() {
        if (knn == null) throw new ModelTrainingException("model is not fitted");
        return WekaInstances.serialize(knn, header, k, weighting.name());
    }

    static KnnRegressionModel fromState(byte[] state) {
        Object[] parts = WekaInstances.deserialize(state, 4);
        try {
            KnnRegressionModel m = new KnnRegressionModel((Integer) parts[2], Weighting.valueOf((String) parts[3]));
            m.knn = (IBk) parts[0];
            m.header = (Instances) parts[1];
            return m;
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ModelTrainingException("not a knn state", e);
        }
    }
}
