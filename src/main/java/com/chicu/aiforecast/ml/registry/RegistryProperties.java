package com.chicu.aiforecast.ml.registry;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ml.registry")
public class RegistryProperties {

    /** Путь к JSON-индексу реестра; артефакты лежат рядом в {@code <path>.artifacts/}. */
    private String path = "data/model-registry.json";
}
