package com.chicu.aiforecast.ml.tuning.candidates;

import com.chicu.aiforecast.ml.tuning.space.ParamSpaceItem;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Service
public class RandomParamSampler implements ParamSampler {

    @Override
    public Map<String, Object> sample(SearchSpace space, Random rnd) {
        if (space == null) throw new IllegalArgumentException("space is null");
        if (rnd == null) throw new IllegalArgumentException("rnd is null");

        Map<String, Object> params = new LinkedHashMap<>();
        for (ParamSpaceItem item : space.asMap().values()) {
            params.put(item.name(), generateValue(item, rnd));
        }
        return params;
    }

    private Object generateValue(ParamSpaceItem item, Random rnd) {
        return switch (item.type()) {
            case INT -> generateInt(item, rnd);
            case FLOAT -> generateFloat(item, rnd);
            case CATEGORICAL -> pick(item.values(), rnd);
        };
    }

    private static Integer generateInt(ParamSpaceItem item, Random rnd) {
        long min = Math.round(item.min());
        long max = Math.round(item.max());
        long bound = (max - min) + 1;
        // границы уже проверены валидатором: укладываются в int
        return (int) (min + rnd.nextLong(bound));
    }

    private static Double generateFloat(ParamSpaceItem item, Random rnd) {
        double min = item.min();
        double max = item.max();
        double v = min + rnd.nextDouble() * (max - min);
        // защита от округления вверх до max
        return v < max ? v : Math.nextDown(max);
    }

    private static Object pick(List<Object> values, Random rnd) {
        return values.get(rnd.nextInt(values.size()));
    }
}
