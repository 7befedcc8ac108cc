package io.github.yok.tablemailer.mail;

import com.google.common.base.Preconditions;
import jakarta.mail.Address;
import jakarta.mail.AuthenticationFailedException;
import jakarta.mail.MessagingException;
import jakarta.mail.SendFailedException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import java.io.ByteArrayInputStream;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.angus.mail.smtp.SMTPMessage;

/**
 * Delivers a prepared message to exactly one recipient over SMTP with implicit TLS.
 *
 * <p>
 * Each call opens its own connection: TLS handshake with certificate and host-name verification,
 * {@code EHLO}, {@code AUTH} ({@code PLAIN}, falling back to {@code LOGIN}), {@code MAIL FROM},
 * {@code RCPT TO}, {@code DATA}, then {@code QUIT}. Verification cannot be switched off. The message
 * bytes are transmitted unchanged. Nothing is retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MailTransport {

    static final String PROTOCOL = "smtps";

    /**
     * Opens a {@link Transport} for a session.
     */
    @FunctionalInterface
    interface TransportProvider {
        Transport open(Session session) throws MessagingException;
    }

    private final TransportProvider transportProvider;

    /**
     * Creates a transport backed by the Jakarta Mail {@code smtps} provider.
     */
    public MailTransport() {
        this(session -> session.getTransport(PROTOCOL));
    }

    MailTransport(TransportProvider transportProvider) {
        this.transportProvider = transportProvider;
    }

    /**
     * Sends the message to a single envelope recipient.
     *
     * @param server SMTP server and credentials
     * @param fromAddr envelope sender ({@code MAIL FROM})
     * @param toAddr envelope recipient ({@code RCPT TO})
     * @param messageBytes complete message as produced by {@link MimeMessageBuilder}
     * @throws MailDeliveryException if any stage of the exchange fails
     */
    public void send(SmtpServer server, String fromAddr, String toAddr, byte[] messageBytes)
            throws MailDeliveryException {
        Preconditions.checkNotNull(server, "server must not be null");
        Preconditions.checkNotNull(messageBytes, "messageBytes must not be null");

        log.info("Sending mail to {} via {}:{}", toAddr, server.getHost(), server.getPort());
        Session session = Session.getInstance(buildProperties(server));

        SMTPMessage message;
        Address[] recipients;
        try {
            message = new SMTPMessage(session, new ByteArrayInputStream(messageBytes));
            message.setEnvelopeFrom(fromAddr);
            recipients = new Address[] {new InternetAddress(toAddr, true)};
        } catch (MessagingException e) {
            throw fail(toAddr, MailDeliveryException.Stage.PREPARE, e);
        }

        Transport transport;
        try {
            transport = transportProvider.open(session);
        } catch (MessagingException e) {
            throw fail(toAddr, MailDeliveryException.Stage.CONNECT, e);
        }

        try {
            try {
                transport.connect(server.getHost(), server.getPort(), server.getUsername(),
                        server.getPassword());
            } catch (AuthenticationFailedException e) {
                throw fail(toAddr, MailDeliveryException.Stage.AUTH, e);
            } catch (MessagingException e) {
                throw fail(toAddr, MailDeliveryException.Stage.CONNECT, e);
            }

            try {
                transport.sendMessage(message, recipients);
            } catch (SendFailedException e) {
                throw fail(toAddr, MailDeliveryException.Stage.ENVELOPE, e);
            } catch (MessagingException e) {
                throw fail(toAddr, MailDeliveryException.Stage.DATA, e);
            }
        } finally {
            closeTransport(transport);
        }
        log.info("Successfully sent mail to {}", toAddr);
    }

    /**
     * Builds the session properties for an {@code smtps} connection.
     *
     * @param server SMTP server
     * @return session properties
     */
    static Properties buildProperties(SmtpServer server) {
        Properties props = new Properties();
        props.setProperty("mail.transport.protocol", PROTOCOL);
        props.setProperty("mail.smtps.host", server.getHost());
        props.setProperty("mail.smtps.port", String.valueOf(server.getPort()));
        props.setProperty("mail.smtps.auth", "true");
        props.setProperty("mail.smtps.auth.mechanisms", "PLAIN LOGIN");
        props.setProperty("mail.smtps.ssl.checkserveridentity", "true");
        return props;
    }

    private MailDeliveryException fail(String toAddr, MailDeliveryException.Stage stage,
            MessagingException cause) {
        log.error("Mail to {} failed at {}: {}", toAddr, stage, cause.getMessage());
        return new MailDeliveryException(toAddr, stage, cause);
    }

    private void closeTransport(Transport transport) {
        try {
            transport.close();
        } catch (MessagingException e) {
            log.warn("Failed to close SMTP connection: {}", e.getMessage());
        }
    }
}
