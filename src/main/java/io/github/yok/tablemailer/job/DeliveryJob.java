package io.github.yok.tablemailer.job;

import com.google.common.collect.ImmutableList;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.tablemailer.config.DbConfig;
import io.github.yok.tablemailer.config.EmailConfig;
import io.github.yok.tablemailer.config.PostConfig;
import io.github.yok.tablemailer.core.TableExportException;
import io.github.yok.tablemailer.core.TabularExporter;
import io.github.yok.tablemailer.core.WorkbookWriter;
import io.github.yok.tablemailer.db.DataSourceFactory;
import io.github.yok.tablemailer.mail.Attachment;
import io.github.yok.tablemailer.mail.MailDeliveryException;
import io.github.yok.tablemailer.mail.MailTransport;
import io.github.yok.tablemailer.mail.MessageBuildException;
import io.github.yok.tablemailer.mail.MessageHeaders;
import io.github.yok.tablemailer.mail.MimeMessageBuilder;
import io.github.yok.tablemailer.mail.SmtpServer;
import io.github.yok.tablemailer.util.ErrorHandler;
import io.github.yok.tablemailer.util.MaskingLogUtil;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Body of one job run: exports the configured tables and mails them.
 *
 * <p>
 * <strong>Flow:</strong>
 * </p>
 * <ol>
 * <li>Open the pool and borrow one connection for the whole run.</li>
 * <li>For each post, export every attachment table to XLSX, build one message, then send that same
 * message once per recipient, each over its own SMTP connection.</li>
 * <li>Release the connection and the pool, whatever happened.</li>
 * </ol>
 *
 * <p>
 * The run is fail-fast: the first connectivity, export, build or delivery error is logged and the
 * rest of the run is skipped (remaining attachments, recipients and posts). Deliveries that already
 * succeeded are not undone and nothing is retried.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class DeliveryJob {

    private final EmailConfig emailConfig;
    private final DbConfig dbConfig;
    private final PostConfig postConfig;
    private final DataSourceFactory dataSourceFactory;
    private final TabularExporter exporter;
    private final MimeMessageBuilder messageBuilder;
    private final MailTransport mailTransport;

    /**
     * Creates a job with the default pipeline components.
     *
     * @param emailConfig SMTP settings
     * @param dbConfig database settings
     * @param postConfig posts to deliver
     */
    public DeliveryJob(EmailConfig emailConfig, DbConfig dbConfig, PostConfig postConfig) {
        this(emailConfig, dbConfig, postConfig, new DataSourceFactory(), new TabularExporter(),
                new MimeMessageBuilder(), new MailTransport());
    }

    /**
     * Creates a job with explicit pipeline components.
     *
     * @param emailConfig SMTP settings
     * @param dbConfig database settings
     * @param postConfig posts to deliver
     * @param dataSourceFactory pool factory
     * @param exporter table exporter
     * @param messageBuilder message builder
     * @param mailTransport SMTP transport
     */
    public DeliveryJob(EmailConfig emailConfig, DbConfig dbConfig, PostConfig postConfig,
            DataSourceFactory dataSourceFactory, TabularExporter exporter,
            MimeMessageBuilder messageBuilder, MailTransport mailTransport) {
        this.emailConfig = emailConfig;
        this.dbConfig = dbConfig;
        this.postConfig = postConfig;
        this.dataSourceFactory = dataSourceFactory;
        this.exporter = exporter;
        this.messageBuilder = messageBuilder;
        this.mailTransport = mailTransport;
    }

    /**
     * Executes one run.
     *
     * @return {@code true} if every post was delivered to every recipient
     */
    public boolean run() {
        log.info("=== Job run started ===");
        SmtpServer server = SmtpServer.from(emailConfig);
        List<PostConfig.Entry> posts = nullToEmpty(postConfig.getPost());

        try (HikariDataSource dataSource = dataSourceFactory.create(dbConfig);
                Connection conn = dataSource.getConnection()) {
            for (int i = 0; i < posts.size(); i++) {
                deliverPost(conn, server, posts.get(i), i);
            }
        } catch (SQLException e) {
            ErrorHandler.logAbort("connect",
                    "database " + MaskingLogUtil.maskJdbcUrl(dbConfig.resolveJdbcUrl()), e);
            return false;
        } catch (TableExportException e) {
            ErrorHandler.logAbort("export", "table " + e.getRelationName(), e);
            return false;
        } catch (MessageBuildException e) {
            ErrorHandler.logAbort("build", "message", e);
            return false;
        } catch (MailDeliveryException e) {
            ErrorHandler.logAbort("deliver", "recipient " + e.getRecipient(), e);
            return false;
        }

        log.info("=== Job run completed successfully: posts={} ===", posts.size());
        return true;
    }

    /**
     * Exports, builds and sends one post.
     *
     * @param conn connection shared by the run
     * @param server SMTP server
     * @param post post definition
     * @param index position of the post, for logging
     * @throws TableExportException if any attachment table fails to export
     * @throws MessageBuildException if the message cannot be built
     * @throws MailDeliveryException if any recipient cannot be reached
     */
    void deliverPost(Connection conn, SmtpServer server, PostConfig.Entry post, int index)
            throws TableExportException, MessageBuildException, MailDeliveryException {
        log.info("Post[{}] started. subject={}, attachments={}, recipients={}", index,
                post.getSubject(), nullToEmpty(post.getAttachment()).size(),
                nullToEmpty(post.getTo()).size());

        List<Attachment> attachments = new ArrayList<>();
        for (PostConfig.TableAttachment spec : nullToEmpty(post.getAttachment())) {
            byte[] workbook = exporter.exportToWorkbook(conn, spec.getTable());
            attachments
                    .add(new Attachment(spec.getExcel(), WorkbookWriter.XLSX_MIME_TYPE, workbook));
        }

        MessageHeaders headers =
                new MessageHeaders(post.getFrom(), nullToEmpty(post.getTo()), post.getSubject());
        byte[] message = messageBuilder.build(headers, post.getBody(), attachments);

        for (String recipient : nullToEmpty(post.getTo())) {
            mailTransport.send(server, post.getFrom(), recipient, message);
        }
        log.info("Post[{}] completed.", index);
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? ImmutableList.of() : list;
    }
}
