/**
 * Table export package.
 *
 * <p>
 * Reads a whole table or view over JDBC into a {@link io.github.yok.tablemailer.core.TabularDocument}
 * and renders it as an XLSX workbook for use as a mail attachment.
 * </p>
 */
package io.github.yok.tablemailer.core;
