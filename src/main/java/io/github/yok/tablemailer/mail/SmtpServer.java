package io.github.yok.tablemailer.mail;

import io.github.yok.tablemailer.config.EmailConfig;
import lombok.ToString;
import lombok.Value;

/**
 * Address and credentials of the SMTP submission server.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SmtpServer {

    String host;
    int port;
    String username;
    @ToString.Exclude
    String password;

    /**
     * Creates the server description from the {@code email} configuration.
     *
     * @param config SMTP settings
     * @return server description
     */
    public static SmtpServer from(EmailConfig config) {
        return new SmtpServer(config.getHost(), config.getPort(), config.getUsername(),
                config.getPassword());
    }
}
