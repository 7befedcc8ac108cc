/**
 * Root package of TableMailer.
 *
 * <p>
 * A scheduled job that exports database tables to XLSX files and mails them as attachments.
 * </p>
 *
 * <ul>
 * <li>{@code io.github.yok.tablemailer.config}: configuration models and validation</li>
 * <li>{@code io.github.yok.tablemailer.core}: table export and workbook rendering</li>
 * <li>{@code io.github.yok.tablemailer.mail}: MIME assembly and SMTP delivery</li>
 * <li>{@code io.github.yok.tablemailer.job}: job run and scheduling</li>
 * <li>{@code io.github.yok.tablemailer.db}: connection pool</li>
 * </ul>
 */
package io.github.yok.tablemailer;
