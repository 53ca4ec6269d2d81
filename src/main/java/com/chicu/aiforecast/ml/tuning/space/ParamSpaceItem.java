package com.chicu.aiforecast.ml.tuning.space;

import lombok.Builder;

import java.util.Arrays;
import java.util.List;

/**
 * Описание одного гиперпараметра.
 * INT: [min, max] включительно. FLOAT: [min, max). CATEGORICAL: values.
 */
@Builder(toBuilder = true)
public record ParamSpaceItem(
        String name,
        ParamValueType type,
        Double min,
        Double max,
        List<Object> values
) {

    public static ParamSpaceItem intRange(String name, int min, int max) {
        return ParamSpaceItem.builder()
                .name(name)
                .type(ParamValueType.INT)
                .min((double) min)
                .max((double) max)
                .build();
    }

    public static ParamSpaceItem floatRange(String name, double min, double max) {
        return ParamSpaceItem.builder()
                .name(name)
                .type(ParamValueType.FLOAT)
                .min(min)
                .max(max)
                .build();
    }

    public static ParamSpaceItem categorical(String name, Object... values) {
        return ParamSpaceItem.builder()
                .name(name)
                .type(ParamValueType.CATEGORICAL)
                .values(values == null ? null : Arrays.asList(values))
                .build();
    }
}
