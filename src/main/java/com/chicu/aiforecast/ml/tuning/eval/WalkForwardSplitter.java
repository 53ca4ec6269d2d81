package com.chicu.aiforecast.ml.tuning.eval;

import java.util.ArrayList;
import java.util.List;

/**
 * Walk-forward разбиение (как TimeSeriesSplit):
 * test-блоки одинаковой длины {@code size / (folds + 1)} идут подряд в конце ряда,
 * train каждого фолда — всё, что раньше его test-блока.
 */
public final class WalkForwardSplitter {

    public static final int MIN_FOLDS = 2;

    private WalkForwardSplitter() {}

    public static List<Fold> split(int size, int folds) {
        validate(size, folds);

        int testSize = size / (folds + 1);
        int firstTestStart = size - folds * testSize;

        List<Fold> out = new ArrayList<>(folds);
        for (int i = 0; i < folds; i++) {
            int testStart = firstTestStart + i * testSize;
            out.add(new Fold(i, testStart, testStart, testStart + testSize));
        }
        return out;
    }

    public static void validate(int size, int folds) {
        if (folds < MIN_FOLDS) {
            throw new IllegalArgumentException("folds должно быть >= " + MIN_FOLDS + ", а пришло: " + folds);
        }
        if (size < folds + 1) {
            throw new IllegalArgumentException("слишком мало строк для " + folds + " фолдов: size=" + size);
        }
    }
}
