package com.chicu.aiforecast.common.enums;

/** Семейства обучаемых моделей, которые умеет тюнить AutoML */
public enum ModelFamily {
    RIDGE,
    KNN
}
