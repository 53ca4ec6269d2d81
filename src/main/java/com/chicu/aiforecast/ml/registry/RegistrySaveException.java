package com.chicu.aiforecast.ml.registry;

public class RegistrySaveException extends RuntimeException {

    public RegistrySaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
