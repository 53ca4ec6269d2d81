package com.chicu.aiforecast.ml.registry;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Байтовое хранилище по пути.
 */
public interface RegistryStorage {

    boolean exists(Path path);

    byte[] read(Path path) throws IOException;

    /**
     * Запись "всё или ничего": читатель видит либо старое содержимое, либо новое целиком.
     */
    void writeAtomically(Path path, byte[] content) throws IOException;

    /**
     * Все файлы под {@code dir} (рекурсивно). Каталога нет — пустой список.
     */
    List<Path> list(Path dir) throws IOException;

    /**
     * Удаляет файл; опустевший родительский каталог удаляется тоже.
     */
    void delete(Path path) throws IOException;
}
