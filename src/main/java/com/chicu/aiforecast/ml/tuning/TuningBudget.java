package com.chicu.aiforecast.ml.tuning;

import java.time.Duration;

/**
 * Бюджет прогона: что наступит раньше — maxTrials или maxWallClock.
 * Хотя бы одна граница обязана быть задана.
 */
public record TuningBudget(
        Integer maxTrials,
        Duration maxWallClock
) {
    public TuningBudget {
        if (maxTrials == null && maxWallClock == null) {
            throw new IllegalArgumentException("budget: нужен maxTrials и/или maxWallClock");
        }
        if (maxTrials != null && maxTrials < 1) {
            throw new IllegalArgumentException("budget: maxTrials должно быть >= 1, а пришло: " + maxTrials);
        }
        if (maxWallClock != null && (maxWallClock.isZero() || maxWallClock.isNegative())) {
            throw new IllegalArgumentException("budget: maxWallClock должно быть > 0, а пришло: " + maxWallClock);
        }
    }

    public static TuningBudget trials(int maxTrials) {
        return new TuningBudget(maxTrials, null);
    }

    public static TuningBudget wallClock(Duration maxWallClock) {
        return new TuningBudget(null, maxWallClock);
    }

    public static TuningBudget of(int maxTrials, Duration maxWallClock) {
        return new TuningBudget(maxTrials, maxWallClock);
    }
}
