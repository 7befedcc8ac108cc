/**
 * Configuration model package for TableMailer.
 *
 * <p>
 * Defines classes bound from {@code application.yml} or the file given with {@code --config}: SMTP
 * settings, database settings, the posts to deliver and the schedule.
 * </p>
 *
 * <p>
 * This package holds configuration data and its startup validation only; the pipeline lives in
 * {@code core}, {@code mail} and {@code job}.
 * </p>
 */
package io.github.yok.tablemailer.config;
