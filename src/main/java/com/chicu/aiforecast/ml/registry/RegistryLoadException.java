package com.chicu.aiforecast.ml.registry;

/**
 * Хранилище отсутствует или повреждено. Пустой реестр — это не ошибка.
 */
public class RegistryLoadException extends RuntimeException {

    public RegistryLoadException(String message) {
        super(message);
    }

    public RegistryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
