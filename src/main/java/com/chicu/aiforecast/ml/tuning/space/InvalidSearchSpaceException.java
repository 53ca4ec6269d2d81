package com.chicu.aiforecast.ml.tuning.space;

public class InvalidSearchSpaceException extends IllegalArgumentException {

    public InvalidSearchSpaceException(String message) {
        super(message);
    }
}
