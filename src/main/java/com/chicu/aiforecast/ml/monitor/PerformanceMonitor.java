package com.chicu.aiforecast.ml.monitor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * История качества по каждой модели (append-only) + тренд и детект деградации.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PerformanceMonitor {

    private final MonitorProperties props;

    // на каждое имя — своя очередь, она же служит локом
    private final Map<String, Deque<PerformanceSnapshot>> history = new ConcurrentHashMap<>();

    public void record(String name, PerformanceSnapshot snapshot) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("name не задан");
        if (snapshot == null) throw new IllegalArgumentException("snapshot = null");

        Deque<PerformanceSnapshot> h = history.computeIfAbsent(name, k -> new ArrayDeque<>());
        int limit = Math.max(1, props.getHistoryLimit());

        synchronized (h) {
            h.addLast(snapshot);
            while (h.size() > limit) {
                h.removeFirst();
            }
        }
        log.debug("📈 PERF name={} mse={} r2={} at={}", name, snapshot.mse(), snapshot.r2(), snapshot.measuredAt());
    }

    public List<PerformanceSnapshot> history(String name) {
        Deque<PerformanceSnapshot> h = history.get(name);
        if (h == null) return List.of();
        synchronized (h) {
            return List.copyOf(h);
        }
    }

    public Optional<PerformanceSnapshot> latest(String name) {
        Deque<PerformanceSnapshot> h = history.get(name);
        if (h == null) return Optional.empty();
        synchronized (h) {
            return Optional.ofNullable(h.peekLast());
        }
    }

    public void forget(String name) {
        history.remove(name);
    }

    public void clear() {
        history.clear();
    }

    /**
     * Тренд: среднее mse последних k снимков против k предыдущих.
     * Неуспешные оценки (mse = +inf) в тренд не входят.
     */
    public TrendReport trend(String name) {
        List<Double> mse = new ArrayList<>();
        for (PerformanceSnapshot s : history(name)) {
            if (!s.isFailed()) mse.add(s.mse());
        }

        int n = mse.size();
        if (n < 2) {
            return TrendReport.insufficient(n);
        }

        int k = Math.min(Math.max(1, props.getTrendWindow()), n / 2);

        List<Double> recent = mse.subList(n - k, n);
        List<Double> previous = mse.subList(n - 2 * k, n - k);

        double recentMean = mean(recent);
        double previousMean = mean(previous);

        double rate = previousMean == 0.0
                ? (recentMean == 0.0 ? 0.0 : -1.0)
                : (previousMean - recentMean) / previousMean;

        double tol = Math.max(0.0, props.getTrendTolerance());
        PerformanceTrend trend;
        if (rate > tol) {
            trend = PerformanceTrend.IMPROVING;
        } else if (rate < -tol) {
            trend = PerformanceTrend.DEGRADING;
        } else {
            trend = PerformanceTrend.STABLE;
        }

        return TrendReport.builder()
                .trend(trend)
                .improvementRate(rate)
                .volatility(coefficientOfVariation(recent, recentMean))
                .samples(n)
                .build();
    }

    public boolean isDegraded(String name, PerformanceSnapshot current, PerformanceSnapshot baseline) {
        return isDegraded(name, current, baseline, props.getDegradationThreshold());
    }

    /**
     * true тогда и только тогда, когда current.mse > baseline.mse * (1 + threshold).
     * Ровно на границе — false.
     */
    public boolean isDegraded(String name,
                              PerformanceSnapshot current,
                              PerformanceSnapshot baseline,
                              double threshold) {
        if (current == null || baseline == null) {
            throw new IllegalArgumentException("current/baseline = null для " + name);
        }
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold должен быть >= 0, а пришло: " + threshold);
        }

        boolean degraded = current.mse() > baseline.mse() * (1.0 + threshold);
        if (degraded) {
            log.info("📉 DEGRADED name={} mse={} baseline={} threshold={}",
                    name, current.mse(), baseline.mse(), threshold);
        }
        return degraded;
    }

    private static double mean(List<Double> xs) {
        double s = 0.0;
        for (double x : xs) s += x;
        return s / xs.size();
    }

    private static double coefficientOfVariation(List<Double> xs, double mean) {
        if (xs.size() < 2 || mean == 0.0) return 0.0;
        double s = 0.0;
        for (double x : xs) {
            double d = x - mean;
            s += d * d;
        }
        return Math.sqrt(s / xs.size()) / Math.abs(mean);
    }
}
