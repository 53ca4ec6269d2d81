package com.chicu.aiforecast.ai.ml.dataset;

import java.util.List;
import java.util.UUID;

/**
 * Dataset
 * =======
 * Упорядоченный по времени датасет:
 * - x: матрица [n_samples][n_features]
 * - y: таргет [n_samples]
 *
 * Индекс строки = порядок во времени. Никогда не перемешивается.
 * Массивы копируются при создании и наружу не отдаются напрямую.
 */
public final class Dataset {

    private final String datasetId;
    private final double[][] x;
    private final double[] y;
    private final int features;

    private Dataset(String datasetId, double[][] x, double[] y, int features) {
        this.datasetId = datasetId;
        this.x = x;
        this.y = y;
        this.features = features;
    }

    public static Dataset of(double[][] x, double[] y) {
        return of(null, x, y);
    }

    public static Dataset of(String datasetId, double[][] x, double[] y) {
        if (x == null || y == null) {
            throw new IllegalArgumentException("dataset: x/y is null");
        }
        if (x.length == 0) {
            throw new IllegalArgumentException("dataset пустой (x=0)");
        }
        if (x.length != y.length) {
            throw new IllegalArgumentException("размеры не совпадают: x=" + x.length + " y=" + y.length);
        }

        int n = x.length;
        int f = -1;
        double[][] copy = new double[n][];

        for (int i = 0; i < n; i++) {
            double[] r = x[i];
            if (r == null) throw new IllegalArgumentException("x[" + i + "]=null");
            if (f < 0) f = r.length;
            if (r.length != f) {
                throw new IllegalArgumentException("разная длина фич: row=" + i + " len=" + r.length + " expected=" + f);
            }
            copy[i] = r.clone();
        }
        if (f == 0) {
            throw new IllegalArgumentException("dataset без фич (features=0)");
        }

        String id = (datasetId == null || datasetId.isBlank())
                ? UUID.randomUUID().toString()
                : datasetId.trim();

        return new Dataset(id, copy, y.clone(), f);
    }

    /**
     * Сборка из строк: каждая строка = фичи, таргет отдельным списком.
     */
    public static Dataset fromRows(List<double[]> rows, List<Double> target) {
        if (rows == null || target == null) {
            throw new IllegalArgumentException("rows/target is null");
        }
        double[][] x = rows.toArray(new double[0][]);
        double[] y = new double[target.size()];
        for (int i = 0; i < y.length; i++) {
            Double v = target.get(i);
            if (v == null) throw new IllegalArgumentException("y[" + i + "]=null");
            y[i] = v;
        }
        return of(x, y);
    }

    public String datasetId() {
        return datasetId;
    }

    public int size() {
        return y.length;
    }

    public int features() {
        return features;
    }

    /** Копия матрицы фич. */
    public double[][] x() {
        return slice(0, size()).x;
    }

    /** Копия таргета. */
    public double[] y() {
        return y.clone();
    }

    public double[][] xRange(int fromInclusive, int toExclusive) {
        checkRange(fromInclusive, toExclusive);
        double[][] out = new double[toExclusive - fromInclusive][];
        for (int i = fromInclusive; i < toExclusive; i++) {
            out[i - fromInclusive] = x[i].clone();
        }
        return out;
    }

    public double[] yRange(int fromInclusive, int toExclusive) {
        checkRange(fromInclusive, toExclusive);
        double[] out = new double[toExclusive - fromInclusive];
        System.arraycopy(y, fromInclusive, out, 0, out.length);
        return out;
    }

    /**
     * Непрерывный кусок [from, to) — порядок сохраняется.
     */
    public Dataset slice(int fromInclusive, int toExclusive) {
        double[][] xs = xRange(fromInclusive, toExclusive);
        double[] ys = yRange(fromInclusive, toExclusive);
        return new Dataset(datasetId + "[" + fromInclusive + ":" + toExclusive + "]", xs, ys, features);
    }

    private void checkRange(int from, int to) {
        if (from < 0 || to > size() || from >= to) {
            throw new IllegalArgumentException("bad range [" + from + ", " + to + ") for size=" + size());
        }
    }

    @Override
    public String toString() {
        return "Dataset{id=" + datasetId + ", samples=" + size() + ", features=" + features + "}";
    }
}
