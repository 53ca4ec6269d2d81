package com.chicu.aiforecast.ml.learning;

public enum RetrainingStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    // повторный триггер, пока по имени уже идёт ретрейн
    SKIPPED
}
