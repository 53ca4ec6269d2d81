package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import com.chicu.aiforecast.ml.registry.RegistryProperties;
import com.chicu.aiforecast.ml.registry.RegistrySaveException;
import com.chicu.aiforecast.support.MlFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ContinuousLearningRuntimeTest {

    @Mock
    private ContinuousLearningController controller;

    @Mock
    private ModelRegistry registry;

    private ContinuousLearningRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) runtime.shutdown();
    }

    @Test
    void submit_shouldRunLearnInBackground_andAutosaveWhenRetrained() throws Exception {
        Dataset data = MlFixtures.constant(10, 1.0);
        when(controller.learn(data)).thenReturn(report(List.of("load")));

        runtime = runtime(true, "target/reg.json");
        RetrainingReport report = runtime.submit(data).get(10, TimeUnit.SECONDS);

        assertEquals(List.of("load"), report.retrainedNames());
        verify(registry).save(Path.of("target/reg.json"));
    }

    @Test
    void nothingRetrained_shouldNotSave() throws Exception {
        Dataset data = MlFixtures.constant(10, 1.0);
        when(controller.learn(data)).thenReturn(report(List.of()));

        runtime = runtime(true, "target/reg.json");
        runtime.submit(data).get(10, TimeUnit.SECONDS);

        verifyNoInteractions(registry);
    }

    @Test
    void autosaveFailure_shouldNotFailTheBatch() throws Exception {
        Dataset data = MlFixtures.constant(10, 1.0);
        when(controller.learn(data)).thenReturn(report(List.of("load")));
        doThrow(new RegistrySaveException("disk full", null)).when(registry).save(any());

        runtime = runtime(true, "target/reg.json");

        assertEquals(List.of("load"), runtime.submit(data).get(10, TimeUnit.SECONDS).retrainedNames());
    }

    @Test
    void learnFailure_shouldCompleteFutureExceptionally() {
        Dataset data = MlFixtures.constant(10, 1.0);
        when(controller.learn(data)).thenThrow(new IllegalStateException("boom"));

        runtime = runtime(false, "target/reg.json");

        Exception e = assertThrows(Exception.class, () -> runtime.submit(data).get(10, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    private ContinuousLearningRuntime runtime(boolean autosave, String path) {
        LearningProperties props = new LearningProperties();
        props.setAutosave(autosave);
        RegistryProperties registryProps = new RegistryProperties();
        registryProps.setPath(path);
        return new ContinuousLearningRuntime(controller, registry, registryProps, props);
    }

    private static RetrainingReport report(List<String> retrained) {
        return RetrainingReport.builder()
                .retrainedNames(retrained)
                .performanceByName(Map.of())
                .outcomes(List.of())
                .completedAt(Instant.now())
                .build();
    }
}
