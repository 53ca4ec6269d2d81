package com.chicu.aiforecast.ai.ml.model.weka;

import com.chicu.aiforecast.ai.ml.model.ModelParams;
import com.chicu.aiforecast.ai.ml.model.ModelTrainingException;
import weka.classifiers.Classifier;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;
import weka.core.Utils;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;

/**
 * Мост double[][] / double[] <-> Weka {@link Instances}.
 * Признаки x0..x{p-1}, таргет "y" последним атрибутом (class index).
 */
public final class WekaInstances {

    private static final String RELATION = "automl";
    private static final String TARGET = "y";

    private WekaInstances() {
    }

    public static Instances training(double[][] x, double[] y) {
        ModelParams.checkTrainingSet(x, y);

        Instances data = header(x[0].length, x.length);
        int p = x[0].length;
        for (int i = 0; i < x.length; i++) {
            double[] values = new double[p + 1];
            System.arraycopy(x[i], 0, values, 0, p);
            values[p] = y[i];
            data.add(new DenseInstance(1.0, values));
        }
        return data;
    }

    /**
     * Пустая копия структуры обучающего набора (для предсказаний и состояния).
     */
    public static Instances emptyHeader(Instances data) {
        return new Instances(data, 0);
    }

    public static double[] predict(Classifier classifier, Instances header, double[][] x) {
        if (classifier == null || header == null) throw new ModelTrainingException("model is not fitted");
        if (x == null) throw new ModelTrainingException("x is null");

        int p = header.numAttributes() - 1;
        double[] out = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double[] row = x[i];
            if (row == null || row.length != p) {
                throw new ModelTrainingException("row " + i + ": expected " + p + " features");
            }
            double[] values = new double[p + 1];
            System.arraycopy(row, 0, values, 0, p);
            values[p] = Utils.missingValue();

            Instance inst = new DenseInstance(1.0, values);
            inst.setDataset(header);
            try {
                out[i] = classifier.classifyInstance(inst);
            } catch (Exception e) {
                throw new ModelTrainingException("predict failed at row " + i + ": " + e.getMessage(), e);
            }
        }
        return out;
    }

    public static byte[] serialize(Object... parts) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try {
            SerializationHelper.writeAll(bytes, parts);
        } catch (Exception e) {
            throw new ModelTrainingException("state export failed: " + e.getMessage(), e);
        }
        return bytes.toByteArray();
    }

    public static Object[] deserialize(byte[] state, int expectedParts) {
        if (state == null) throw new ModelTrainingException("state is null");

        Object[] parts;
        try {
            parts = SerializationHelper.readAll(new ByteArrayInputStream(state));
        } catch (Exception e) {
            throw new ModelTrainingException("state is corrupt: " + e.getMessage(), e);
        }
        if (parts == null || parts.length != expectedParts) {
            throw new ModelTrainingException("state is corrupt: expected " + expectedParts + " parts");
        }
        return parts;
    }

    private static Instances header(int features, int capacity) {
        ArrayList<Attribute> attributes = new ArrayList<>(features + 1);
        for (int j = 0; j < features; j++) {
            attributes.add(new Attribute("x" + j));
        }
        attributes.add(new Attribute(TARGET));

        Instances data = new Instances(RELATION, attributes, capacity);
        data.setClassIndex(features);
        return data;
    }
}
