package io.github.yok.tablemailer.mail;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Top-level addressing headers of a message.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class MessageHeaders {

    // From header
    String from;
    /**
     * Addresses for the To header. Every recipient of the message sees the whole list, even though
     * each address receives its own SMTP delivery.
     */
    List<String> to;
    // Subject header
    String subject;

    /**
     * Creates headers.
     *
     * @param from sender address
     * @param to recipient addresses written to the {@code To} header
     * @param subject subject line
     */
    public MessageHeaders(String from, List<String> to, String subject) {
        this.from = from;
        this.to = ImmutableList.copyOf(to);
        this.subject = subject;
    }
}
