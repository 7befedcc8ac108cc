package io.github.yok.tablemailer.config;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Database connection settings, bound from the {@code db} section.
 *
 * <pre>
 * db:
 *   host: 192.0.2.10
 *   port: 5236
 *   username: USERNAME
 *   password: PASSWORD
 *   # optional
 *   url: jdbc:dm://192.0.2.10:5236
 *   driver-class: dm.jdbc.driver.DmDriver
 * </pre>
 *
 * <p>
 * When {@code url} is not given, a DM URL is composed from {@code host} and {@code port}. The JDBC
 * driver itself is expected on the runtime classpath.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "db")
@Data
public class DbConfig {

    /**
     * Scheme used when no explicit JDBC URL is configured.
     */
    public static final String DEFAULT_URL_PREFIX = "jdbc:dm://";

    // Database host
    private String host;
    // Database port
    private int port;
    // Database user
    private String username;
    // Database password
    private String password;
    // Explicit JDBC URL; overrides host/port when set
    private String url;
    // Fully qualified JDBC driver class name; blank means JDBC 4 auto-loading
    private String driverClass;

    /**
     * Returns the JDBC URL to connect with.
     *
     * @return {@code url} when configured, otherwise {@code jdbc:dm://host:port}
     */
    public String resolveJdbcUrl() {
        if (StringUtils.isNotBlank(url)) {
            return url.trim();
        }
        return DEFAULT_URL_PREFIX + host + ":" + port;
    }
}
