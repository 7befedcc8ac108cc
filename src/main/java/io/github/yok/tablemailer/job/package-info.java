/**
 * Job orchestration package.
 *
 * <p>
 * {@link io.github.yok.tablemailer.job.DeliveryJob} runs the export-and-deliver pipeline once;
 * {@link io.github.yok.tablemailer.job.JobScheduler} fires it on the configured
 * {@link io.github.yok.tablemailer.job.ScheduleExpression} without ever overlapping two runs.
 * </p>
 */
package io.github.yok.tablemailer.job;
