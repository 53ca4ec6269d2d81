package com.chicu.aiforecast.ml.tuning.eval;

/**
 * Один walk-forward сплит: train = [0, trainEnd), test = [testStart, testEnd).
 * trainEnd == testStart — train всегда строго раньше test.
 */
public record Fold(
        int index,
        int trainEnd,
        int testStart,
        int testEnd
) {
    public int trainSize() {
        return trainEnd;
    }

    public int testSize() {
        return testEnd - testStart;
    }
}
