package com.chicu.aiforecast.ml.tuning.eval;

/**
 * Результат оценки кандидата. Провал — это данные (score = +inf), а не исключение.
 */
public record TrialScore(
        double score,
        String error
) {
    public static final double FAILED_SCORE = Double.POSITIVE_INFINITY;

    public static TrialScore ok(double score) {
        return new TrialScore(score, null);
    }

    public static TrialScore failed(String reason) {
        return new TrialScore(FAILED_SCORE, reason == null || reason.isBlank() ? "unknown" : reason);
    }

    public boolean ok() {
        return error == null || error.isBlank();
    }
}
