package com.chicu.aiforecast.ml.tuning.space;

public enum ParamValueType {
    CATEGORICAL,
    INT,
    FLOAT
}
