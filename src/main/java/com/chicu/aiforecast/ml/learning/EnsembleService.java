package com.chicu.aiforecast.ml.learning;

import com.chicu.aiforecast.ml.monitor.PerformanceMonitor;
import com.chicu.aiforecast.ml.monitor.PerformanceSnapshot;
import com.chicu.aiforecast.ml.registry.ModelRecord;
import com.chicu.aiforecast.ml.registry.ModelRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ансамбли поверх реестра: прогноз = взвешенная сумма прогнозов участников,
 * вес ~ 1 / mse последнего снимка участника.
 *
 * Веса всех ансамблей пересчитываются разом ({@link #refresh()}) и подменяются целиком.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnsembleService {

    // mse = 0 даёт бесконечный вес — ограничиваем
    private static final double MIN_MSE = 1e-12;

    private final ModelRegistry registry;
    private final PerformanceMonitor monitor;

    private final Map<String, List<String>> definitions = new ConcurrentHashMap<>();

    private volatile Map<String, Map<String, Double>> weights = Map.of();

    public void define(String ensembleName, List<String> members) {
        if (ensembleName == null || ensembleName.isBlank()) {
            throw new IllegalArgumentException("ensembleName не задан");
        }
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("ensemble " + ensembleName + ": нет участников");
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String m : members) {
            if (m == null || m.isBlank()) {
                throw new IllegalArgumentException("ensemble " + ensembleName + ": пустое имя участника");
            }
            unique.add(m.trim());
        }

        definitions.put(ensembleName, List.copyOf(unique));
        log.info("🧩 ENSEMBLE DEFINED name={} members={}", ensembleName, unique);
        refresh();
    }

    public boolean remove(String ensembleName) {
        boolean removed = definitions.remove(ensembleName) != null;
        if (removed) refresh();
        return removed;
    }

    public Map<String, List<String>> definitions() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(definitions));
    }

    /**
     * Текущие веса ансамбля (сумма = 1 по доступным участникам, отсутствующие = 0).
     */
    public Map<String, Double> weights(String ensembleName) {
        Map<String, Double> w = weights.get(ensembleName);
        if (w != null) return w;
        List<String> members = definitions.get(ensembleName);
        if (members == null) {
            throw new IllegalArgumentException("ensemble не найден: " + ensembleName);
        }
        // определили, но refresh ещё не видели (гонка с define) — считаем на месте
        return computeWeights(members);
    }

    public double[] predict(String ensembleName, double[][] x) {
        if (x == null || x.length == 0) {
            throw new IllegalArgumentException("x пустой");
        }
        Map<String, Double> w = weights(ensembleName);

        double[] out = new double[x.length];
        double used = 0.0;

        for (Map.Entry<String, Double> e : w.entrySet()) {
            double weight = e.getValue();
            if (weight <= 0.0) continue;

            Optional<ModelRecord> rec = registry.get(e.getKey());
            if (rec.isEmpty()) continue;

            double[] p = rec.get().model().predict(x);
            if (p == null || p.length != x.length) {
                throw new IllegalStateException("ensemble " + ensembleName + ": участник "
                        + e.getKey() + " вернул прогноз неверной длины");
            }
            for (int i = 0; i < out.length; i++) {
                out[i] += weight * p[i];
            }
            used += weight;
        }

        if (used <= 0.0) {
            throw new IllegalStateException("ensemble " + ensembleName + ": нет доступных участников");
        }
        // участник мог пропасть из реестра после refresh — перенормируем
        if (Math.abs(used - 1.0) > 1e-9) {
            for (int i = 0; i < out.length; i++) {
                out[i] /= used;
            }
        }
        return out;
    }

    /**
     * Пересчёт весов всех ансамблей; читатели видят либо старые веса, либо новые.
     */
    public synchronized void refresh() {
        Map<String, Map<String, Double>> next = new LinkedHashMap<>();
        definitions.forEach((name, members) -> next.put(name, computeWeights(members)));
        weights = Collections.unmodifiableMap(next);
        if (!next.isEmpty()) {
            log.info("🧩 ENSEMBLES REFRESHED count={} weights={}", next.size(), next);
        }
    }

    private Map<String, Double> computeWeights(List<String> members) {
        Map<String, Double> raw = new LinkedHashMap<>();
        List<String> available = new ArrayList<>();
        double sum = 0.0;

        for (String m : members) {
            Optional<ModelRecord> rec = registry.get(m);
            if (rec.isEmpty()) {
                raw.put(m, 0.0);
                continue;
            }
            available.add(m);

            PerformanceSnapshot s = monitor.latest(m).orElse(rec.get().performance());
            double mse = s.mse();
            double w = Double.isFinite(mse) ? 1.0 / Math.max(mse, MIN_MSE) : 0.0;
            raw.put(m, w);
            sum += w;
        }

        Map<String, Double> out = new LinkedHashMap<>();
        if (sum > 0.0) {
            for (Map.Entry<String, Double> e : raw.entrySet()) {
                out.put(e.getKey(), e.getValue() / sum);
            }
        } else {
            // ни одного конечного mse — поровну между теми, кто есть в реестре
            for (String m : members) {
                out.put(m, available.contains(m) ? 1.0 / available.size() : 0.0);
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
