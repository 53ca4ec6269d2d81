package com.chicu.aiforecast.ml.registry;

import com.chicu.aiforecast.ai.ml.model.ModelFactoryRegistry;
import com.chicu.aiforecast.ai.ml.model.TrainableModel;
import com.chicu.aiforecast.ml.tuning.space.SearchSpace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Реестр лучших моделей: одно живое значение на имя.
 *
 * Запись меняется только целиком через {@link #promote}; читатели видят
 * либо старую запись, либо новую, но не смесь. {@link #load} подменяет
 * всю карту сразу и только после того, как прочитано всё.
 */
@Slf4j
@Service
public class ModelRegistry {

    private final ModelFactoryRegistry factories;
    private final RegistryStorage storage;
    private final ObjectMapper json;
    private final Clock clock;

    private volatile Map<String, ModelRecord> records = new ConcurrentHashMap<>();

    // promote/remove — read-lock (между собой их разводит ConcurrentHashMap), load — write-lock
    private final ReentrantReadWriteLock swapLock = new ReentrantReadWriteLock();
    private final ReentrantLock saveLock = new ReentrantLock();

    public ModelRegistry(ModelFactoryRegistry factories,
                         RegistryStorage storage,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.factories = factories;
        this.storage = storage;
        this.clock = clock;
        this.json = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS.mappedFeature());
    }

    // =========================================================
    // in-memory
    // =========================================================

    /**
     * Атомарно заменяет запись для {@code record.name()} целиком.
     *
     * @return предыдущая запись, если была
     */
    public Optional<ModelRecord> promote(ModelRecord record) {
        if (record == null) throw new IllegalArgumentException("record = null");

        swapLock.readLock().lock();
        try {
            ModelRecord prev = records.put(record.name(), record);
            log.info("✅ PROMOTED name={} family={} version={} score={} mse={} prevVersion={}",
                    record.name(), record.family(), record.version(), record.score(),
                    record.performance().mse(), prev != null ? prev.version() : null);
            return Optional.ofNullable(prev);
        } finally {
            swapLock.readLock().unlock();
        }
    }

    public Optional<ModelRecord> get(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(records.get(name));
    }

    public Optional<ModelRecord> remove(String name) {
        if (name == null) return Optional.empty();
        swapLock.readLock().lock();
        try {
            ModelRecord prev = records.remove(name);
            if (prev != null) {
                log.info("🗑️ REMOVED name={} version={}", name, prev.version());
            }
            return Optional.ofNullable(prev);
        } finally {
            swapLock.readLock().unlock();
        }
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeMap<>(records).keySet());
    }

    public int size() {
        return records.size();
    }

    public Map<String, ModelRecord> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(records));
    }

    public Map<String, ModelDescriptor> describe() {
        Map<String, ModelDescriptor> out = new LinkedHashMap<>();
        snapshot().forEach((name, r) -> out.put(name, r.describe()));
        return Collections.unmodifiableMap(out);
    }

    // =========================================================
    // persistence
    // =========================================================

    /**
     * Сначала артефакты моделей (каждый атомарно, имя = версия), затем индекс.
     * Если упасть посередине — старый индекс остаётся целым и указывает на свои артефакты.
     */
    public void save(Path path) {
        if (path == null) throw new IllegalArgumentException("path = null");

        saveLock.lock();
        try {
            Map<String, ModelRecord> snap = snapshot();
            Path index = path.toAbsolutePath();
            Path baseDir = index.getParent();

            Map<String, RegistryDocument.Entry> entries = new LinkedHashMap<>();
            Set<Path> live = new HashSet<>();

            for (ModelRecord r : snap.values()) {
                String ref = artifactRef(index, r);
                byte[] state;
                try {
                    state = r.model().exportState();
                } catch (RuntimeException e) {
                    throw new RegistrySaveException("export state failed for " + r.name(), e);
                }
                Path artifact = baseDir.resolve(ref).normalize();
                storage.writeAtomically(artifact, state);
                live.add(artifact);

                entries.put(r.name(), RegistryDocument.Entry.builder()
                        .family(r.family())
                        .hyperparams(r.hyperparams())
                        .score(r.score())
                        .performance(r.performance())
                        .promotedAt(r.promotedAt())
                        .version(r.version())
                        .modelArtifactRef(ref)
                        .searchSpace(r.searchSpace() != null ? r.searchSpace().items() : null)
                        .build());
            }

            RegistryDocument doc = RegistryDocument.builder()
                    .formatVersion(RegistryDocument.FORMAT_VERSION)
                    .savedAt(clock.instant())
                    .models(entries)
                    .build();

            storage.writeAtomically(index, json.writeValueAsBytes(doc));
            log.info("💾 REGISTRY SAVED path={} models={}", index, entries.size());

            pruneArtifacts(baseDir.resolve(index.getFileName() + ".artifacts"), live);

        } catch (IOException e) {
            log.error("❌ REGISTRY SAVE FAILED path={}: {}", path, e.getMessage(), e);
            throw new RegistrySaveException("registry save failed: " + path, e);
        } finally {
            saveLock.unlock();
        }
    }

    /**
     * Полностью заменяет содержимое реестра тем, что лежит по {@code path}.
     *
     * @throws RegistryLoadException если хранилища нет или оно повреждено
     */
    public void load(Path path) {
        if (path == null) throw new IllegalArgumentException("path = null");

        Path index = path.toAbsolutePath();
        if (!storage.exists(index)) {
            throw new RegistryLoadException("registry store not found: " + index);
        }

        RegistryDocument doc;
        try {
            doc = json.readValue(storage.read(index), RegistryDocument.class);
        } catch (JsonProcessingException e) {
            throw new RegistryLoadException("registry store is corrupt: " + index, e);
        } catch (IOException e) {
            throw new RegistryLoadException("registry store is unreadable: " + index, e);
        }

        if (doc == null || doc.formatVersion() != RegistryDocument.FORMAT_VERSION) {
            throw new RegistryLoadException("unsupported registry format: "
                    + (doc == null ? "empty document" : doc.formatVersion()));
        }

        Map<String, ModelRecord> loaded = new ConcurrentHashMap<>();
        Map<String, RegistryDocument.Entry> models = doc.models() != null ? doc.models() : Map.of();

        for (Map.Entry<String, RegistryDocument.Entry> e : models.entrySet()) {
            loaded.put(e.getKey(), toRecord(index, e.getKey(), e.getValue()));
        }

        swapLock.writeLock().lock();
        try {
            records = loaded;
        } finally {
            swapLock.writeLock().unlock();
        }

        log.info("📂 REGISTRY LOADED path={} models={} savedAt={}", index, loaded.size(), doc.savedAt());
    }

    /**
     * Удаляет артефакты, на которые новый индекс уже не ссылается.
     * Индекс к этому моменту записан, поэтому сбой здесь сохранение не ломает.
     */
    private void pruneArtifacts(Path artifactsDir, Set<Path> live) {
        int removed = 0;
        try {
            for (Path file : storage.list(artifactsDir)) {
                Path p = file.toAbsolutePath().normalize();
                if (!live.contains(p)) {
                    storage.delete(p);
                    removed++;
                }
            }
        } catch (IOException e) {
            log.warn("⚠️ REGISTRY PRUNE FAILED dir={} removed={}: {}", artifactsDir, removed, e.getMessage());
            return;
        }
        if (removed > 0) {
            log.info("🧹 REGISTRY PRUNED dir={} removed={}", artifactsDir, removed);
        }
    }

    private ModelRecord toRecord(Path index, String name, RegistryDocument.Entry entry) {
        if (entry == null || entry.family() == null || entry.modelArtifactRef() == null) {
            throw new RegistryLoadException("registry entry is incomplete: " + name);
        }

        Path artifact = index.getParent().resolve(entry.modelArtifactRef()).normalize();
        if (!storage.exists(artifact)) {
            throw new RegistryLoadException("model artifact not found for " + name + ": " + artifact);
        }

        try {
            TrainableModel model = factories.get(entry.family()).restore(storage.read(artifact));
            SearchSpace space = entry.searchSpace() != null && !entry.searchSpace().isEmpty()
                    ? SearchSpace.of(entry.searchSpace())
                    : null;

            return ModelRecord.builder()
                    .name(name)
                    .family(entry.family())
                    .model(model)
                    .hyperparams(entry.hyperparams())
                    .score(entry.score())
                    .performance(entry.performance())
                    .promotedAt(entry.promotedAt())
                    .searchSpace(space)
                    .version(entry.version())
                    .build();

        } catch (IOException e) {
            throw new RegistryLoadException("model artifact unreadable for " + name + ": " + artifact, e);
        } catch (RuntimeException e) {
            throw new RegistryLoadException("registry entry is invalid: " + name + " (" + e.getMessage() + ")", e);
        }
    }

    private static String artifactRef(Path index, ModelRecord r) {
        return index.getFileName() + ".artifacts/" + sanitize(r.name()) + "/" + sanitize(r.version()) + ".bin";
    }

    private static String sanitize(String s) {
        return s.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
