package io.github.yok.tablemailer.config;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Delivery definitions ("posts"), bound from the top-level {@code post} list.
 *
 * <pre>
 * post:
 *   - from: report@example.com
 *     to: [alice@example.com, bob@example.com]
 *     subject: Daily report
 *     body: See attached.
 *     attachment:
 *       - table: TEST_01
 *         excel: 01.xlsx
 * </pre>
 *
 * <p>
 * Each post produces one message that is delivered separately to every address in {@code to}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class PostConfig {

    /**
     * Posts in processing order.
     */
    private List<Entry> post = ImmutableList.of();

    /**
     * One configured post.
     */
    @Data
    public static class Entry {
        // Sender address (header and envelope)
        private String from;
        // Recipient addresses; one SMTP delivery per address
        private List<String> to = ImmutableList.of();
        // Subject line
        private String subject;
        // Plain-text body
        private String body;
        // Tables to export, in attachment order
        private List<TableAttachment> attachment = ImmutableList.of();
    }

    /**
     * One table/view exported as one spreadsheet attachment.
     */
    @Data
    public static class TableAttachment {
        // Table or view name, used verbatim in SELECT * FROM
        private String table;
        // Attachment file name (e.g. "01.xlsx")
        private String excel;
    }
}
