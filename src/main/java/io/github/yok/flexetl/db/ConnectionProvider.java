package io.github.yok.flexetl.db;

import io.github.yok.flexetl.config.SinkConfig;
import io.github.yok.flexetl.config.SourceConfig;
import io.github.yok.flexetl.util.JdbcDriverLoader;
import io.github.yok.flexetl.util.RetryPolicy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Opens the source and sink connections of a run.
 *
 * <p>
 * Both {@link #openSource()} and {@link #openSink()} are wrapped by {@link RetryPolicy}: transient
 * failures (network, authentication) are retried with a fixed delay, and exhaustion raises
 * {@link io.github.yok.flexetl.util.RetryExhaustedException}, which the caller does not catch.
 * The caller owns the returned connections and must close them.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ConnectionProvider {

    private final SourceConfig sourceConfig;
    private final SinkConfig sinkConfig;
    private final RetryPolicy retryPolicy;

    /**
     * Creates a provider.
     *
     * @param sourceConfig source connection settings
     * @param sinkConfig sink connection settings
     * @param retryPolicy retry policy applied to every open
     */
    public ConnectionProvider(SourceConfig sourceConfig, SinkConfig sinkConfig,
            RetryPolicy retryPolicy) {
        this.sourceConfig = sourceConfig;
        this.sinkConfig = sinkConfig;
        this.retryPolicy = retryPolicy;
    }

    /**
     * Opens the source connection with a statement timeout and auto-commit disabled (required for
     * cursor-based batch fetching).
     *
     * @return source connection
     * @throws IllegalStateException if {@code source.url} is not configured
     */
    public Connection openSource() {
        String url = sourceConfig.requireUrl();
        return retryPolicy.execute("openSource", () -> connectSource(url));
    }

    /**
     * Opens the sink connection with the configured transport security.
     *
     * @return sink connection
     * @throws IllegalStateException if {@code sink.url} is not configured
     */
    public Connection openSink() {
        String url = sinkConfig.requireUrl();
        return retryPolicy.execute("openSink", () -> connectSink(url));
    }

    /**
     * Opens and closes a source connection to verify the settings.
     */
    public void checkSource() {
        check("source", openSource());
    }

    /**
     * Opens and closes a sink connection to verify the settings.
     */
    public void checkSink() {
        check("sink", openSink());
    }

    private void check(String name, Connection conn) {
        try {
            conn.close();
            log.info("Connection check succeeded: {}", name);
        } catch (SQLException e) {
            log.warn("Connection check for {} succeeded but closing failed: {}", name,
                    e.getMessage());
        }
    }

    private Connection connectSource(String url) throws SQLException, ClassNotFoundException {
        log.info("Connecting to source database...");
        JdbcDriverLoader.loadIfConfigured(sourceConfig.getDriverClass());

        Properties props = credentials(sourceConfig.getUser(), sourceConfig.getPassword());
        props.setProperty("options",
                "-c statement_timeout=" + sourceConfig.getStatementTimeoutMs());

        Connection conn = DriverManager.getConnection(url, props);
        try {
            conn.setAutoCommit(false);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        log.info("Source connection established. schema={}", sourceConfig.getSchema());
        return conn;
    }

    private Connection connectSink(String url) throws SQLException, ClassNotFoundException {
        log.info("Connecting to sink database...");
        JdbcDriverLoader.loadIfConfigured(sinkConfig.getDriverClass());

        Properties props = credentials(sinkConfig.getUser(), sinkConfig.getPassword());
        if (sinkConfig.isSecure()) {
            props.setProperty("ssl", "true");
            if (sinkConfig.isVerifyCertificate()) {
                props.setProperty("sslmode", "strict");
            } else {
                log.warn("Sink certificate verification is disabled; "
                        + "enable sink.verifyCertificate in production.");
                props.setProperty("sslmode", "none");
            }
        }

        Connection conn = DriverManager.getConnection(url, props);
        log.info("Sink connection established. table={}", sinkConfig.getTable());
        return conn;
    }

    private static Properties credentials(String user, String password) {
        Properties props = new Properties();
        if (StringUtils.isNotEmpty(user)) {
            props.setProperty("user", user);
        }
        if (password != null) {
            props.setProperty("password", password);
        }
        return props;
    }
}
