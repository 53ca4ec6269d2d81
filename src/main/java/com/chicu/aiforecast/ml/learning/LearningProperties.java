package com.chicu.aiforecast.ml.learning;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ml.learning")
public class LearningProperties {

    /** Бюджет одного ретрейна: триалы. */
    private int budgetMaxTrials = 20;

    /** Бюджет одного ретрейна: стена, мс. */
    private long budgetMaxWallClockMs = 600_000L; // 10 минут

    /** Сколько пачек learn() обрабатывается в фоне одновременно. */
    private int asyncWorkers = 1;

    /** Сохранять реестр после каждой фоновой пачки. */
    private boolean autosave = false;
}
