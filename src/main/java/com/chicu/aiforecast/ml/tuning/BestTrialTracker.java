package com.chicu.aiforecast.ml.tuning;

import java.util.ArrayList;
import java.util.List;

/**
 * Лучший триал прогона. Все обновления — под одним монитором:
 * триалы идут параллельно, но "лучший" меняется строго последовательно.
 */
final class BestTrialTracker {

    private final List<Trial> completed = new ArrayList<>();
    private final List<Double> bestHistory = new ArrayList<>();
    private Trial best;

    synchronized void offer(Trial trial) {
        completed.add(trial);
        if (trial.scored() && isBetter(trial)) {
            best = trial;
        }
        bestHistory.add(best == null ? Double.POSITIVE_INFINITY : best.score());
    }

    // строго меньше; при равенстве остаётся более ранний триал (меньший id)
    private boolean isBetter(Trial t) {
        if (best == null) return true;
        if (t.score() < best.score()) return true;
        return t.score() == best.score() && t.id() < best.id();
    }

    synchronized Trial best() {
        return best;
    }

    synchronized List<Trial> completed() {
        return List.copyOf(completed);
    }

    synchronized List<Double> bestHistory() {
        return List.copyOf(bestHistory);
    }

    synchronized int failedCount() {
        int n = 0;
        for (Trial t : completed) {
            if (!t.scored()) n++;
        }
        return n;
    }
}
