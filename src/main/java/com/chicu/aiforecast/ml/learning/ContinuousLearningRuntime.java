package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.ml.registry.RegistryProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Фоновый learn(): каждая пришедшая пачка уходит в свой пул, вызывающий не ждёт.
 */
@Slf4j
@Service
public class ContinuousLearningRuntime {

    private final ContinuousLearningController controller;
    private final ModelRegistry registry;
    private final RegistryProperties registryProps;
    private final LearningProperties props;

    private final ExecutorService executor;

    public ContinuousLearningRuntime(ContinuousLearningController controller,
                                     ModelRegistry registry,
                                     RegistryProperties registryProps,
                                     LearningProperties props) {
        this.controller = controller;
        this.registry = registry;
        this.registryProps = registryProps;
        this.props = props;

        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, props.getAsyncWorkers()), r -> {
            Thread t = new Thread(r, "ml-learn-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<RetrainingReport> submit(Dataset newData) {
        if (newData == null) {
            throw new IllegalArgumentException("newData = null");
        }
        return CompletableFuture.supplyAsync(() -> runBatch(newData), executor);
    }

    private RetrainingReport runBatch(Dataset newData) {
        RetrainingReport report = controller.learn(newData);

        if (props.isAutosave() && !report.retrainedNames().isEmpty()) {
            // ошибка сохранения не отменяет ретрейн — в памяти уже новые модели
            try {
                registry.save(Path.of(registryProps.getPath()));
            } catch (RuntimeException e) {
                log.error("❌ AUTOSAVE FAILED path={}: {}", registryProps.getPath(), e.getMessage(), e);
            }
        }
        return report;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("⚠️ ml-learn: не все пачки успели завершиться, прерываю");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
