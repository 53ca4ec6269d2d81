package com.chicu.aiforecast.ai.ml.model.ridge;

import com.chicu.aiforecast.ai.ml.model.ModelParams;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.TrainableModelFactory;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class RidgeModelFactory implements TrainableModelFactory {

    public static final String ALPHA = "alpha";
    public static final String ELIMINATE_COLINEAR = "eliminateColinear";

    private static final SearchSpace DEFAULT_SPACE = SearchSpace.builder()
            .floatRange(ALPHA, 0.0001, 10.0)
            .categorical(ELIMINATE_COLINEAR, false, true)
            .build();

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.RIDGE;
    }

    @Override
    public SearchSpace defaultSpace() {
        return DEFAULT_SPACE;
    }

    @Override
    public TrainableModel create(Map<String, Object> params) {
        double alpha = ModelParams.getDouble(params, ALPHA, 1.0);
        boolean eliminateColinear = ModelParams.getBoolean(params, ELIMINATE_COLINEAR, false);
        return new RidgeRegressionModel(alpha, eliminateColinear);
    }

    @Override
    public TrainableModel restore(byte[] state) {
        return RidgeRegressionModel.fromState(state);
    }
}
