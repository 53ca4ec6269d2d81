package com.chicu.aiforecast.ml.tuning;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ml.tuning")
public class MlTuningProperties {

    /** Число walk-forward фолдов. */
    private int folds = 5;

    /** Сколько триалов одновременно. */
    private int workers = 4;

    /** Таймаут одного триала, 0 = без таймаута. */
    private long trialTimeoutMs = 0L;

    private int maxTrials = 50;
    private long maxWallClockMs = 1_800_000L; // 30 минут

    private long seed = 42L;
}
