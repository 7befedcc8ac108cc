package io.github.yok.tablemailer.mail;

import lombok.Getter;

/**
 * Signals that a message could not be delivered to one recipient.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MailDeliveryException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * SMTP exchange stage at which delivery failed.
     */
    public enum Stage {
        // Preparing the message for the wire
        PREPARE,
        // TLS connect and greeting
        CONNECT,
        // SMTP AUTH
        AUTH,
        // MAIL FROM / RCPT TO
        ENVELOPE,
        // DATA transfer
        DATA
    }

    private final String recipient;
    private final Stage stage;

    /**
     * Creates the exception.
     *
     * @param recipient envelope recipient
     * @param stage failing stage
     * @param cause root cause
     */
    public MailDeliveryException(String recipient, Stage stage, Throwable cause) {
        super("Failed to deliver mail to " + recipient + " at stage " + stage + ": "
                + cause.getMessage(), cause);
        this.recipient = recipient;
        this.stage = stage;
    }
}
