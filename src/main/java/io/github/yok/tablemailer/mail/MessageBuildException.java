package io.github.yok.tablemailer.mail;

/**
 * Signals that a message could not be assembled. No partial message accompanies it.
 *
 * @author Yasuharu.Okawauchi
 */
public class MessageBuildException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message detail message
     * @param cause root cause
     */
    public MessageBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
