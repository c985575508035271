package io.github.yok.flexetl.config;

import com.google.common.collect.ImmutableList;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that holds the settings of the ETL pipeline itself.
 *
 * <p>
 * You can specify the following properties in {@code application.yml} or
 * {@code application.properties}.
 * </p>
 * <ul>
 * <li>{@code pipeline.batchSize}: number of rows fetched per batch (default 15000)</li>
 * <li>{@code pipeline.maxRetries}: attempts made when opening a connection (default 3)</li>
 * <li>{@code pipeline.retryDelay}: fixed pause between attempts (default 5s)</li>
 * <li>{@code pipeline.fieldMapping}: column rename table applied by the transform pipeline</li>
 * <li>{@code pipeline.excludeTables}: source tables that are never extracted</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "pipeline")
@Getter
@Setter
@NoArgsConstructor
public class PipelineConfig {

    /**
     * Maximum number of rows per extracted batch.
     */
    private int batchSize = 15_000;

    /**
     * Maximum number of attempts for a retried connection operation.
     */
    private int maxRetries = 3;

    /**
     * Fixed pause between two attempts.
     */
    private Duration retryDelay = Duration.ofSeconds(5);

    /**
     * Column rename table (old name to new name).
     */
    private Map<String, String> fieldMapping = defaultFieldMapping();

    /**
     * List of source table names to exclude from extraction.
     */
    private List<String> excludeTables = ImmutableList.of();

    private static Map<String, String> defaultFieldMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("old_column_name", "new_column_name");
        return mapping;
    }
}
