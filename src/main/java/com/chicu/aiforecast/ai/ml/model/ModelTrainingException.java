package com.chicu.aiforecast.ai.ml.model;

/**
 * Ошибка обучения/предсказания модели: невалидный вход, вырожденная матрица, NaN и т.п.
 */
public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
