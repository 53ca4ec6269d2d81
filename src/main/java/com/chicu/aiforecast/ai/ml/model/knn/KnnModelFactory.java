package com.chicu.aiforecast.ai.ml.model.knn;

import com.chicu.aiforecast.ai.ml.model.ModelParams;
import com.chicu.aiforecast.ai.ml.model.ModelTrainingException;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.TrainableModelFactory;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

@Component
public class KnnModelFactory implements TrainableModelFactory {

    public static final String K = "k";
    public static final String WEIGHTING = "weighting";

    private static final SearchSpace DEFAULT_SPACE = SearchSpace.builder()
            .intRange(K, 1, 30)
            .categorical(WEIGHTING, "uniform", "distance")
            .build();

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.KNN;
    }

    @Override
    public SearchSpace defaultSpace() {
        return DEFAULT_SPACE;
    }

    @Override
    public TrainableModel create(Map<String, Object> params) {
        int k = ModelParams.getInt(params, K, 5);
        String w = ModelParams.getString(params, WEIGHTING, "uniform");

        KnnRegressionModel.Weighting weighting;
        try {
            weighting = KnnRegressionModel.Weighting.valueOf(w.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelTrainingException("unknown weighting: " + w, e);
        }
        return new KnnRegressionModel(k, weighting);
    }

    @Override
    public TrainableModel restore(byte[] state) {
        return KnnRegressionModel.fromState(state);
    }
}
