package io.github.yok.tablemailer.mail;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Binary payload attached to a message as one MIME part.
 *
 * <p>
 * Immutable: the payload is copied when the attachment is created and again whenever it is read.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "payload")
public final class Attachment {

    private final String fileName;
    private final String mimeType;
    @Getter(AccessLevel.NONE)
    private final byte[] payload;

    /**
     * Creates an attachment.
     *
     * @param fileName file name shown to the recipient
     * @param mimeType content type of the payload
     * @param payload file content
     */
    public Attachment(String fileName, String mimeType, byte[] payload) {
        Preconditions.checkArgument(StringUtils.isNotBlank(fileName),
                "fileName must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(mimeType),
                "mimeType must not be blank");
        Preconditions.checkNotNull(payload, "payload must not be null");
        this.fileName = fileName;
        this.mimeType = mimeType;
        this.payload = payload.clone();
    }

    /**
     * Returns a copy of the payload.
     *
     * @return payload bytes
     */
    public byte[] getPayload() {
        return payload.clone();
    }

    /**
     * Returns the payload size in bytes.
     *
     * @return payload length
     */
    public int size() {
        return payload.length;
    }
}
