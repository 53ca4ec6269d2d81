package com.chicu.aiforecast.ml.monitor;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ml.monitor")
public class MonitorProperties {

    /** Относительный порог деградации mse против снимка на момент продвижения. */
    private double degradationThreshold = 0.10;

    /** Размер окна k: последние k снимков против k предыдущих. */
    private int trendWindow = 3;

    /** Относительное изменение mse, ниже которого тренд считается STABLE. */
    private double trendTolerance = 0.05;

    /** Сколько снимков держим на модель (старые выкидываются). */
    private int historyLimit = 200;
}
