package com.chicu.aiforecast.ml.tuning.eval;

public final class RegressionMetrics {

    private RegressionMetrics() {}

    public static double mse(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return sum / actual.length;
    }

    public static double mae(double[] actual, double[] predicted) {
        check(actual, predicted);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    /**
     * Коэффициент детерминации. Для константного таргета возвращает 0.
     */
    public static double r2(double[] actual, double[] predicted) {
        check(actual, predicted);
        double mean = 0.0;
        for (double v : actual) mean += v;
        mean /= actual.length;

        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double r = actual[i] - predicted[i];
            double t = actual[i] - mean;
            ssRes += r * r;
            ssTot += t * t;
        }
        if (ssTot == 0.0) return 0.0;
        return 1.0 - ssRes / ssTot;
    }

    private static void check(double[] actual, double[] predicted) {
        if (actual == null || predicted == null) {
            throw new IllegalArgumentException("actual/predicted is null");
        }
        if (actual.length == 0) {
            throw new IllegalArgumentException("пустой набор для метрик");
        }
        if (actual.length != predicted.length) {
            throw new IllegalArgumentException("размеры не совпадают: actual=" + actual.length
                    + " predicted=" + predicted.length);
        }
    }
}
