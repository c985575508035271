package io.github.yok.flexetl.util;

import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Utility for optional JDBC driver class loading.
 *
 * <p>
 * When {@code source.driverClass} or {@code sink.driverClass} is configured, the class is loaded
 * explicitly; otherwise JDBC 4 auto-loading picks the driver from the URL.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public final class JdbcDriverLoader {

    @Generated
    private JdbcDriverLoader() {}

    /**
     * Loads the JDBC driver class only when the class name is configured.
     *
     * @param driverClass fully qualified JDBC driver class name, or {@code null}/blank
     * @throws ClassNotFoundException when the specified class cannot be found
     */
    public static void loadIfConfigured(String driverClass) throws ClassNotFoundException {
        if (StringUtils.isBlank(driverClass)) {
            return;
        }
        Class.forName(driverClass.trim());
    }
}
