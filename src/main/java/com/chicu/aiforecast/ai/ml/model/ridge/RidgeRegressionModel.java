package com.chicu.aiforecast.ai.ml.model.ridge;

import com.chicu.aiforecast.ai.ml.model.ModelTrainingException;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.weka.WekaInstances;
import com.chicu.aiforecast.common.enums.ModelFamily;
import weka.classifiers.functions.LinearRegression;
import weka.core.Instances;
import weka.core.SelectedTag;

/**
 * Ridge-регрессия поверх Weka {@link LinearRegression}: штраф alpha, без отбора признаков.
 */
public class RidgeRegressionModel implements TrainableModel {

    private final double alpha;
    private final boolean eliminateColinear;

    private LinearRegression regression;
    private Instances header;

    public RidgeRegressionModel(double alpha, boolean eliminateColinear) {
        if (!Double.isFinite(alpha) || alpha < 0) {
            throw new ModelTrainingException("alpha must be finite and >= 0: " + alpha);
        }
        this.alpha = alpha;
        this.eliminateColinear = eliminateColinear;
    }

    @Override
    public ModelFamily family() {
        return ModelFamily.RIDGE;
    }

    public double alpha() {
        return alpha;
    }

    public boolean eliminateColinear() {
        return eliminateColinear;
    }

    @Override
    public void fit(double[][] x, double[] y) {
        Instances data = WekaInstances.training(x, y);

        LinearRegression lr = new LinearRegression();
        lr.setRidge(alpha);
        lr.setAttributeSelectionMethod(new SelectedTag(LinearRegression.SELECTION_NONE, LinearRegression.TAGS_SELECTION));
        lr.setEliminateColinearAttributes(eliminateColinear);
        try {
            lr.buildClassifier(data);
        } catch (Exception e) {
            throw new ModelTrainingException("ridge fit failed: " + e.getMessage(), e);
        }

        // последний элемент — свободный член, элемент на месте таргета — 0
        for (double c : lr.coefficients()) {
            if (!Double.isFinite(c)) throw new ModelTrainingException("ridge diverged: non-finite coefficient");
        }

        this.regression = lr;
        this.header = WekaInstances.emptyHeader(data);
    }

    @Override
    public double[] predict(double[][] x) {
        return WekaInstances.predict(regression, header, x);
    }

    @Override
    public byte[] exportState() {
        if (regression == null) throw new ModelTrainingException("model is not fitted");
        return WekaInstances.serialize(regression, header, alpha, eliminateColinear);
    }

    static RidgeRegressionModel fromState(byte[] state) {
        Object[] parts = WekaInstances.deserialize(state, 4);
        try {
            RidgeRegressionModel m = new RidgeRegressionModel((Double) parts[2], (Boolean) parts[3]);
            m.regression = (LinearRegression) parts[0];
            m.header = (Instances) parts[1];
            return m;
        } catch (ClassCastException e) {
            throw new ModelTrainingException("not a ridge state", e);
        }
    }
}
