package com.chicu.aiforecast.ml.tuning.space;

public final class ParamSpaceValidator {

    private ParamSpaceValidator() {}

    public static void validateOrThrow(ParamSpaceItem item) {
        if (item == null) throw new InvalidSearchSpaceException("ParamSpace: item is null");
        if (item.name() == null || item.name().trim().isEmpty()) {
            throw new InvalidSearchSpaceException("ParamSpace: name пустой");
        }
        if (item.type() == null) {
            throw new InvalidSearchSpaceException("ParamSpace: type не задан для " + item.name());
        }

        ParamValueType t = item.type();

        if (t == ParamValueType.CATEGORICAL) {
            if (item.values() == null || item.values().isEmpty()) {
                throw new InvalidSearchSpaceException("ParamSpace: пустой набор values для " + item.name());
            }
            if (item.values().contains(null)) {
                throw new InvalidSearchSpaceException("ParamSpace: null среди values для " + item.name());
            }
            return;
        }

        Double min = item.min();
        Double max = item.max();

        if (min == null || max == null) {
            throw new InvalidSearchSpaceException("ParamSpace: min/max должны быть заданы для " + item.name());
        }
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new InvalidSearchSpaceException("ParamSpace: min/max должны быть конечными для " + item.name());
        }
        if (min >= max) {
            throw new InvalidSearchSpaceException("ParamSpace: min >= max для " + item.name());
        }

        // Для INT — границы целые.
        if (t == ParamValueType.INT) {
            if (min != Math.rint(min) || max != Math.rint(max)) {
                throw new InvalidSearchSpaceException("ParamSpace: INT параметр требует целые min/max: " + item.name());
            }
            if (min < Integer.MIN_VALUE || max > Integer.MAX_VALUE) {
                throw new InvalidSearchSpaceException("ParamSpace: INT границы вне диапазона int: " + item.name());
            }
        }
    }
}
