package io.github.yok.tablemailer.mail;

import com.google.common.base.Preconditions;
import jakarta.activation.DataHandler;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import jakarta.mail.internet.MimeUtility;
import jakarta.mail.util.ByteArrayDataSource;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Properties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Assembles a {@code multipart/mixed} message and serializes it to bytes, independent of transport.
 *
 * <p>
 * <strong>Part order:</strong>
 * </p>
 * <ol>
 * <li>Top-level headers ({@code From}, {@code To}, {@code Subject}, {@code Date},
 * {@code Message-ID}, {@code MIME-Version: 1.0}, {@code Content-Type: multipart/mixed}).</li>
 * <li>One {@code text/plain; charset=utf-8} body part in quoted-printable.</li>
 * <li>One base64 part per attachment, in the order supplied, each with
 * {@code Content-Disposition: attachment; filename="..."}.</li>
 * </ol>
 *
 * <p>
 * The boundary is generated per message by Jakarta Mail. Its {@code "=_"} sequence cannot occur in
 * quoted-printable or base64 output, so it never collides with encoded content. Both encoders wrap
 * lines at 76 characters.
 * </p>
 *
 * <p>
 * Line breaks in the body text are sent as CRLF, so a body written with bare {@code \n} decodes
 * with {@code \r\n} line endings on the receiving side.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MimeMessageBuilder {

    static final String TEXT_CONTENT_TYPE = "text/plain; charset=utf-8";
    static final String QUOTED_PRINTABLE = "quoted-printable";
    static final String BASE64 = "base64";

    private final Session session;

    /**
     * Creates a builder backed by a transport-less mail session.
     */
    public MimeMessageBuilder() {
        this(Session.getInstance(new Properties()));
    }

    /**
     * Creates a builder backed by the given session.
     *
     * @param session mail session used only for message construction
     */
    public MimeMessageBuilder(Session session) {
        this.session = session;
    }

    /**
     * Builds the message.
     *
     * @param headers addressing headers
     * @param bodyText plain-text body
     * @param attachments attachments in part order
     * @return RFC 5322 message bytes with CRLF line endings
     * @throws MessageBuildException if any header, part or the serialization fails
     */
    public byte[] build(MessageHeaders headers, String bodyText, List<Attachment> attachments)
            throws MessageBuildException {
        Preconditions.checkNotNull(headers, "headers must not be null");
        Preconditions.checkNotNull(attachments, "attachments must not be null");

        log.info("Building message. to={}, subject={}, attachments={}", headers.getTo(),
                headers.getSubject(), attachments.size());
        try {
            MimeMessage message = new MimeMessage(session);
            message.setFrom(new InternetAddress(headers.getFrom()));
            message.setRecipients(Message.RecipientType.TO,
                    InternetAddress.parse(String.join(",", headers.getTo())));
            message.setSubject(StringUtils.defaultString(headers.getSubject()),
                    StandardCharsets.UTF_8.name());
            message.setSentDate(new Date());

            MimeMultipart multipart = new MimeMultipart("mixed");
            multipart.addBodyPart(createBodyPart(StringUtils.defaultString(bodyText)));
            for (Attachment attachment : attachments) {
                multipart.addBodyPart(createAttachmentPart(attachment));
                log.debug("Attachment [{}] added. bytes={}", attachment.getFileName(),
                        attachment.size());
            }
            message.setContent(multipart);
            message.saveChanges();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            byte[] bytes = out.toByteArray();
            log.info("Message built. bytes={}", bytes.length);
            return bytes;
        } catch (MessagingException | IOException e) {
            log.error("Failed to build message: {}", e.getMessage());
            throw new MessageBuildException("Failed to build message: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the quoted-printable text part.
     *
     * @param bodyText body text
     * @return body part
     * @throws MessagingException if the part cannot be populated
     */
    MimeBodyPart createBodyPart(String bodyText) throws MessagingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setText(bodyText, "utf-8");
        part.setHeader("Content-Type", TEXT_CONTENT_TYPE);
        part.setHeader("Content-Transfer-Encoding", QUOTED_PRINTABLE);
        return part;
    }

    /**
     * Creates a base64 attachment part.
     *
     * @param attachment attachment
     * @return attachment part
     * @throws MessagingException if the part cannot be populated
     * @throws UnsupportedEncodingException if the file name cannot be encoded
     */
    MimeBodyPart createAttachmentPart(Attachment attachment)
            throws MessagingException, UnsupportedEncodingException {
        MimeBodyPart part = new MimeBodyPart();
        part.setDataHandler(new DataHandler(
                new ByteArrayDataSource(attachment.getPayload(), attachment.getMimeType())));
        part.setHeader("Content-Type", attachment.getMimeType());
        part.setHeader("Content-Transfer-Encoding", BASE64);
        part.setHeader("Content-Disposition",
                "attachment; filename=\"" + encodeFileName(attachment.getFileName()) + "\"");
        return part;
    }

    /**
     * Renders a file name for a quoted {@code filename} parameter. Non-ASCII names are written as
     * an RFC 2047 encoded word.
     *
     * @param fileName raw file name
     * @return value safe to place between double quotes
     * @throws UnsupportedEncodingException if UTF-8 is unavailable
     */
    static String encodeFileName(String fileName) throws UnsupportedEncodingException {
        String encoded = MimeUtility.encodeText(fileName, StandardCharsets.UTF_8.name(), null);
        return encoded.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
