package com.chicu.aiforecast.ml.tuning;

import com.chicu.aiforecast.ml.tuning.eval.TrialScore;
import lombok.Builder;

import java.util.Map;

/**
 * Один сэмпл гиперпараметров и его оценка. Живёт только внутри одного прогона.
 */
@Builder(toBuilder = true)
public record Trial(
        int id,
        Map<String, Object> params,
        TrialStatus status,
        double score,
        String error,
        long durationMs
) {

    public static Trial of(int id, Map<String, Object> params, TrialScore score, long durationMs) {
        return Trial.builder()
                .id(id)
                .params(params)
                .status(score.ok() ? TrialStatus.SCORED : TrialStatus.FAILED)
                .score(score.score())
                .error(score.error())
                .durationMs(durationMs)
                .build();
    }

    public static Trial failed(int id, Map<String, Object> params, String reason) {
        return of(id, params, TrialScore.failed(reason), 0L);
    }

    public boolean scored() {
        return status == TrialStatus.SCORED && Double.isFinite(score);
    }
}
