package io.github.yok.flexetl.config;

import lombok.Data;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code sink} section in {@code application.yml}.
 *
 * <p>
 * The sink is the analytical column store that receives the transformed records. Transport
 * security is enabled by default; certificate verification is disabled by default to match the
 * managed endpoints this tool is usually pointed at, and should be enabled in production.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "sink")
@Data
public class SinkConfig {

    // JDBC connection URL of the sink store
    private String url;
    // Database user name
    private String user;
    // Database password
    @ToString.Exclude
    private String password;
    // Fully qualified JDBC driver class name (optional)
    private String driverClass;
    // Destination table receiving payload/captured_at/tag rows
    private String table = "grupox";
    // Use TLS for the sink connection
    private boolean secure = true;
    // Verify the server certificate when TLS is used
    private boolean verifyCertificate = false;

    /**
     * Returns the JDBC URL after checking that it has been configured.
     *
     * @return sink JDBC URL
     * @throws IllegalStateException if {@code sink.url} is blank
     */
    public String requireUrl() {
        if (StringUtils.isBlank(url)) {
            throw new IllegalStateException(
                    "sink.url is not configured. Please set 'sink.url' in application.yml.");
        }
        return url;
    }
}
