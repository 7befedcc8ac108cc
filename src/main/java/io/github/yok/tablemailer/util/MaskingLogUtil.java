package io.github.yok.tablemailer.util;

import io.github.yok.tablemailer.config.DbConfig;
import io.github.yok.tablemailer.config.EmailConfig;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Generated;

/**
 * Masks credentials before configuration values are written to the log.
 *
 * @author Yasuharu.Okawauchi
 */
public final class MaskingLogUtil {

    /**
     * Embedded credentials in authority-style JDBC URLs ({@code jdbc:x://user:pass@host}).
     */
    private static final Pattern JDBC_AUTH_PATTERN =
            Pattern.compile("(jdbc:[^:]+://[^:/?#@]+:)([^@/]+)(@.*)", Pattern.CASE_INSENSITIVE);
    /**
     * Password query parameters in JDBC URLs.
     */
    private static final Pattern PASSWORD_QUERY_PATTERN =
            Pattern.compile("(?i)(password=)([^;&]+)");

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private MaskingLogUtil() {}

    /**
     * Masks a sensitive value.
     *
     * @param value raw text
     * @return {@code "***"}, or the input itself when it is {@code null} or empty
     */
    public static String maskText(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return "***";
    }

    /**
     * Masks password fragments in a JDBC URL.
     *
     * @param url JDBC URL
     * @return masked URL, or {@code null} when input is {@code null}
     */
    public static String maskJdbcUrl(String url) {
        if (url == null) {
            return null;
        }
        String masked = url;
        Matcher authMatcher = JDBC_AUTH_PATTERN.matcher(masked);
        if (authMatcher.find()) {
            masked = authMatcher.replaceFirst("$1***$3");
        }
        return PASSWORD_QUERY_PATTERN.matcher(masked).replaceAll("$1***");
    }

    /**
     * Formats database settings for logging.
     *
     * @param config database settings
     * @return masked description
     */
    public static String describe(DbConfig config) {
        if (config == null) {
            return "<null>";
        }
        return "url=" + maskJdbcUrl(config.resolveJdbcUrl()) + ", user=" + config.getUsername()
                + ", password=" + maskText(config.getPassword()) + ", driverClass="
                + config.getDriverClass();
    }

    /**
     * Formats SMTP settings for logging.
     *
     * @param config SMTP settings
     * @return masked description
     */
    public static String describe(EmailConfig config) {
        if (config == null) {
            return "<null>";
        }
        return "host=" + config.getHost() + ", port=" + config.getPort() + ", user="
                + config.getUsername() + ", password=" + maskText(config.getPassword());
    }
}
