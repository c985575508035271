package io.github.yok.flexetl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code staging} section used by the raw data staging
 * utility.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "staging")
@Data
public class StagingConfig {

    // Directory that keeps a copy of every staged file
    private String processedDir = "data/processed";

    // Rows per JDBC batch insert
    private int batchSize = 25_000;
}
