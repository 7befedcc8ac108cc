package io.github.yok.tablemailer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * SMTP submission server settings, bound from the {@code email} section.
 *
 * <pre>
 * email:
 *   host: smtp.example.com
 *   port: 465
 *   username: USERNAME
 *   password: PASSWORD
 * </pre>
 *
 * <p>
 * The server is always reached over implicit TLS, so {@code port} is normally {@code 465}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties(prefix = "email")
@Data
public class EmailConfig {

    // SMTP server host name (also used for certificate identity checks)
    private String host;
    // SMTP server port
    private int port;
    // Login user for SMTP AUTH
    private String username;
    // Login password for SMTP AUTH
    private String password;
}
