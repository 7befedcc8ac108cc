/**
 * Mail assembly and delivery package.
 *
 * <p>
 * {@link io.github.yok.tablemailer.mail.MimeMessageBuilder} turns headers, body text and
 * attachments into RFC 5322 message bytes; {@link io.github.yok.tablemailer.mail.MailTransport}
 * delivers those bytes to one recipient per call over SMTP with implicit TLS.
 * </p>
 */
package io.github.yok.tablemailer.mail;
