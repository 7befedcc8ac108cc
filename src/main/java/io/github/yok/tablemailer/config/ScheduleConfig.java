package io.github.yok.tablemailer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Holds the top-level {@code time} property, the schedule on which the job runs.
 *
 * <p>
 * Accepted forms are 5- or 6-field cron expressions, the {@code @daily}-style macros and
 * {@code @every <duration>}. See {@link io.github.yok.tablemailer.job.ScheduleExpression}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ConfigurationProperties
@Data
public class ScheduleConfig {

    // Schedule expression (e.g. "0 0 0 * * *")
    private String time;
}
