package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.ai.ml.dataset.Dataset;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ai.ml.model.knn.KnnModelFactory;
import com.chicu.aiforecast.ai.ml.model.ridge.RidgeModelFactory;
import com.chicu.aiforecast.common.enums.ModelFamily;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import com.chicu.aiforecast.support.MlFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ModelRegistryTest {

    @TempDir
    Path dir;

    private ModelRegistry registry;

    private final Dataset data = MlFixtures.seasonalHourly(120, 9);

    @BeforeEach
    void setUp() {
        registry = newRegistry();
    }

    @Test
    void saveThenLoad_shouldRestoreEqualRecords_andSamePredictions() throws Exception {
        ModelRecord ridge = ridgeRecord("load", 0.5, "v1");
        ModelRecord knn = knnRecord("temp/hourly", 4, "v7");
        registry.promote(ridge);
        registry.promote(knn);

        Path index = dir.resolve("store/registry.json");
        registry.save(index);
        assertTrue(Files.exists(index));

        ModelRegistry reloaded = newRegistry();
        reloaded.load(index);

        assertEquals(registry.describe(), reloaded.describe());

        double[][] q = data.xRange(100, 120);
        assertArrayEquals(ridge.model().predict(q), reloaded.get("load").orElseThrow().model().predict(q), 0.0);
        assertArrayEquals(knn.model().predict(q), reloaded.get("temp/hourly").orElseThrow().model().predict(q), 0.0);
    }

    @Test
    void emptyRegistry_shouldRoundTrip() {
        Path index = dir.resolve("empty.json");
        registry.save(index);

        ModelRegistry reloaded = newRegistry();
        reloaded.promote(ridgeRecord("stale", 1.0, "v0"));
        reloaded.load(index);

        assertEquals(0, reloaded.size(), "load заменяет содержимое целиком");
    }

    @Test
    void missingStore_shouldFailWithLoadError() {
        registry.promote(ridgeRecord("keep", 1.0, "v1"));

        assertThrows(RegistryLoadException.class, () -> registry.load(dir.resolve("nope.json")));
        assertTrue(registry.get("keep").isPresent(), "после неудачной загрузки старое содержимое не трогаем");
    }

    @Test
    void corruptStore_shouldFailWithLoadError() throws Exception {
        Path index = dir.resolve("broken.json");
        Files.writeString(index, "{ \"formatVersion\": 1, \"models\": { \"x\": ", StandardCharsets.UTF_8);

        assertThrows(RegistryLoadException.class, () -> registry.load(index));
    }

    @Test
    void missingArtifact_shouldFailWithLoadError() throws Exception {
        registry.promote(ridgeRecord("load", 0.5, "v1"));
        Path index = dir.resolve("reg.json");
        registry.save(index);

        try (Stream<Path> files = Files.walk(dir.resolve("reg.json.artifacts"))) {
            for (Path p : files.filter(Files::isRegularFile).toList()) {
                Files.delete(p);
            }
        }

        assertThrows(RegistryLoadException.class, () -> newRegistry().load(index));
    }

    @Test
    void promote_shouldReplaceWholeRecord_andReturnPrevious() {
        ModelRecord first = ridgeRecord("load", 0.5, "v1");
        ModelRecord second = ridgeRecord("load", 2.0, "v2");

        assertTrue(registry.promote(first).isEmpty());
        Optional<ModelRecord> prev = registry.promote(second);

        assertEquals("v1", prev.orElseThrow().version());
        assertSame(second, registry.get("load").orElseThrow());
        assertEquals(1, registry.size());
        assertEquals(Set.of("load"), registry.names());

        assertEquals("v2", registry.remove("load").orElseThrow().version());
        assertTrue(registry.get("load").isEmpty());
    }

    @Test
    void saveAfterRetrain_shouldKeepOnlyLiveArtifacts() throws Exception {
        registry.promote(ridgeRecord("load", 0.5, "v1"));
        registry.promote(knnRecord("gone", 3, "v1"));
        Path index = dir.resolve("reg.json");
        registry.save(index);

        registry.promote(ridgeRecord("load", 2.0, "v2"));
        registry.remove("gone");
        registry.save(index);

        Path artifacts = dir.resolve("reg.json.artifacts");
        List<String> left;
        try (Stream<Path> files = Files.walk(artifacts)) {
            left = files.filter(Files::isRegularFile)
                    .map(p -> artifacts.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
        assertEquals(List.of("load/v2.bin"), left, "старые версии и удалённые модели подчищены");
        assertFalse(Files.exists(artifacts.resolve("gone")));

        ModelRegistry reloaded = newRegistry();
        reloaded.load(index);
        assertEquals("v2", reloaded.get("load").orElseThrow().version());
    }

    @Test
    void concurrentReaders_shouldSeeWholeRecords_duringPromoteAndLoad() throws Exception {
        TrainableModel model = ridgeRecord("seed", 1.0, "v0").model();

        // на диске лежит своя версия "shared" — load будет подменять карту целиком
        ModelRegistry other = newRegistry();
        other.promote(versioned(model, 1_000_000));
        Path index = dir.resolve("concurrent.json");
        other.save(index);

        registry.promote(versioned(model, 0));

        AtomicBoolean stop = new AtomicBoolean();
        AtomicReference<String> mismatch = new AtomicReference<>();
        AtomicInteger reads = new AtomicInteger();

        ExecutorService pool = Executors.newFixedThreadPool(6);
        try {
            List<Future<?>> readers = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                readers.add(pool.submit(() -> {
                    while (!stop.get()) {
                        registry.get("shared").ifPresent(rec -> {
                            reads.incrementAndGet();
                            String expected = "v" + rec.hyperparams().get("n");
                            if (!expected.equals(rec.version())) {
                                mismatch.compareAndSet(null, rec.version() + " != " + expected);
                            }
                        });
                    }
                }));
            }

            Future<?> promotes = pool.submit(() -> {
                for (int i = 1; i <= 2_000; i++) {
                    registry.promote(versioned(model, i));
                }
            });
            Future<?> loads = pool.submit(() -> {
                for (int i = 0; i < 20; i++) {
                    registry.load(index);
                }
            });

            promotes.get(30, TimeUnit.SECONDS);
            loads.get(30, TimeUnit.SECONDS);
            stop.set(true);
            for (Future<?> f : readers) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            stop.set(true);
            pool.shutdownNow();
        }

        assertNull(mismatch.get(), "читатель увидел смесь двух записей");
        assertTrue(reads.get() > 0);
        ModelRecord last = registry.get("shared").orElseThrow();
        assertEquals("v" + last.hyperparams().get("n"), last.version());
    }

    @Test
    void record_withoutRequiredFields_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> ridgeRecord("x", 1.0, "v1").toBuilder().model(null).build());
        assertThrows(IllegalArgumentException.class, () -> ridgeRecord("x", 1.0, "v1").toBuilder().performance(null).build());
        assertThrows(IllegalArgumentException.class, () -> registry.promote(null));
    }

    // =========================================================
    // helpers
    // =========================================================

    private ModelRegistry newRegistry() {
        return new ModelRegistry(MlFixtures.factories(), new FileSystemRegistryStorage(), MlFixtures.json(), MlFixtures.CLOCK);
    }

    private ModelRecord ridgeRecord(String name, double alpha, String version) {
        RidgeModelFactory f = new RidgeModelFactory();
        Map<String, Object> params = Map.of(RidgeModelFactory.ALPHA, alpha, RidgeModelFactory.ELIMINATE_COLINEAR, false);
        TrainableModel m = f.create(params);
        m.fit(data.x(), data.y());
        return record(name, ModelFamily.RIDGE, m, params, f.defaultSpace(), version);
    }

    private ModelRecord knnRecord(String name, int k, String version) {
        KnnModelFactory f = new KnnModelFactory();
        Map<String, Object> params = Map.of(KnnModelFactory.K, k, KnnModelFactory.WEIGHTING, "distance");
        TrainableModel m = f.create(params);
        m.fit(data.xRange(0, 100), data.yRange(0, 100));
        return record(name, ModelFamily.KNN, m, params, f.defaultSpace(), version);
    }

    private static ModelRecord versioned(TrainableModel model, int n) {
        return record("shared", ModelFamily.RIDGE, model, Map.of("n", n), new RidgeModelFactory().defaultSpace(), "v" + n);
    }

    private static ModelRecord record(String name, ModelFamily family, TrainableModel m,
                                      Map<String, Object> params, SearchSpace space, String version) {
        return ModelRecord.builder()
                .name(name)
                .family(family)
                .model(m)
                .hyperparams(params)
                .score(1.25)
                .performance(MlFixtures.snapshot(1.5))
                .promotedAt(Instant.now().truncatedTo(ChronoUnit.MILLIS))
                .searchSpace(space)
                .version(version)
                .build();
    }
}
