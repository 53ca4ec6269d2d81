package com.chicu.aiforecast.ai.ml.model;

import com.chicu.aiforecast.common.enums.ModelFamily;

/**
 * Обучаемая модель (внешняя способность для AutoML).
 * Конкретная архитектура и формат состояния — на стороне семейства.
 */
public interface TrainableModel {

    ModelFamily family();

    /**
     * Обучение на x/y. Бросает {@link ModelTrainingException} при невалидном входе
     * или численной расходимости.
     */
    void fit(double[][] x, double[] y);

    double[] predict(double[][] x);

    /**
     * Сериализованное состояние обученной модели (формат владеет семейство).
     */
    byte[] exportState();
}
