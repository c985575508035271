package io.github.yok.flexetl.config;

import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code source} section in {@code application.yml}.
 *
 * <pre>
 * source:
 *   url: jdbc:postgresql://localhost:5432/postgres
 *   user: etl
 *   password: secret
 *   driverClass: org.postgresql.Driver
 *   schema: private_schema
 *   statementTimeoutMs: 600000
 * </pre>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "source")
@Data
public class SourceConfig {

    // JDBC connection URL of the source store
    private String url;
    // Database user name
    private String user;
    // Database password
    @ToString.Exclude
    private String password;
    // Fully qualified JDBC driver class name (optional; JDBC 4 auto-loading otherwise)
    private String driverClass;
    // Schema whose tables are extracted
    private String schema = "private_schema";
    // Server-side statement timeout in milliseconds
    private long statementTimeoutMs = 600_000L;

    /**
     * Returns the JDBC URL after checking that it has been configured.
     *
     * @return source JDBC URL
     * @throws IllegalStateException if {@code source.url} is blank
     */
    public String requireUrl() {
        if (StringUtils.isBlank(url)) {
            throw new IllegalStateException(
                    "source.url is not configured. Please set 'source.url' in application.yml.");
        }
        return url;
    }
}
