package com.chicu.aiforecast.ai.ml.model;

import java.util.Locale;
import java.util.Map;

/**
 * Приведение значений гиперпараметров (после сэмплера или JSON) к нужным типам.
 */
public final class ModelParams {

    private ModelParams() {}

    public static double getDouble(Map<String, Object> params, String name, double def) {
        Object v = params == null ? null : params.get(name);
        if (v == null) return def;
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ModelTrainingException("param " + name + " is not a number: " + v, e);
        }
    }

    public static int getInt(Map<String, Object> params, String name, int def) {
        Object v = params == null ? null : params.get(name);
        if (v == null) return def;
        if (v instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ModelTrainingException("param " + name + " is not an int: " + v, e);
        }
    }

    public static boolean getBoolean(Map<String, Object> params, String name, boolean def) {
        Object v = params == null ? null : params.get(name);
        if (v == null) return def;
        if (v instanceof Boolean b) return b;
        String s = v.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new ModelTrainingException("param " + name + " is not a boolean: " + v);
        };
    }

    public static String getString(Map<String, Object> params, String name, String def) {
        Object v = params == null ? null : params.get(name);
        if (v == null) return def;
        String s = v.toString().trim();
        return s.isEmpty() ? def : s;
    }

    /**
     * Общая проверка обучающего набора для моделей: непустой, прямоугольный, без NaN/Inf.
     */
    public static void checkTrainingSet(double[][] x, double[] y) {
        if (x == null || y == null) throw new ModelTrainingException("x/y is null");
        if (x.length == 0) throw new ModelTrainingException("empty training set");
        if (x.length != y.length) {
            throw new ModelTrainingException("x/y size mismatch: " + x.length + " vs " + y.length);
        }
        int p = x[0] == null ? 0 : x[0].length;
        if (p == 0) throw new ModelTrainingException("no features");
        for (int i = 0; i < x.length; i++) {
            if (x[i] == null || x[i].length != p) throw new ModelTrainingException("ragged row " + i);
            if (!Double.isFinite(y[i])) throw new ModelTrainingException("non-finite y at row " + i);
            for (double v : x[i]) {
                if (!Double.isFinite(v)) throw new ModelTrainingException("non-finite x at row " + i);
            }
        }
    }
}
