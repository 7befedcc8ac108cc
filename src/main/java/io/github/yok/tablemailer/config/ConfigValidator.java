package io.github.yok.tablemailer.config;

import io.github.yok.tablemailer.job.ScheduleExpression;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Validates the bound configuration before the job is scheduled.
 *
 * <p>
 * Every problem found here is a configuration error: the caller reports it and the job is never
 * registered. Validation stops at the first problem and raises {@link IllegalArgumentException}
 * with a message naming the offending property.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class ConfigValidator {

    /**
     * Validates all configuration sections.
     *
     * @param emailConfig SMTP settings
     * @param dbConfig database settings
     * @param postConfig post definitions
     * @param scheduleConfig schedule setting
     * @throws IllegalArgumentException if any setting is missing or invalid
     */
    public void validate(EmailConfig emailConfig, DbConfig dbConfig, PostConfig postConfig,
            ScheduleConfig scheduleConfig) {
        validateEmail(emailConfig);
        validateDb(dbConfig);
        validatePosts(postConfig);
        validateSchedule(scheduleConfig);
    }

    /**
     * Validates SMTP settings.
     *
     * @param config SMTP settings
     */
    void validateEmail(EmailConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("email section is required.");
        }
        requireText(config.getHost(), "email.host");
        requirePort(config.getPort(), "email.port");
        requireText(config.getUsername(), "email.username");
        requireText(config.getPassword(), "email.password");
    }

    /**
     * Validates database settings. Host and port may be omitted only when an explicit URL is set.
     *
     * @param config database settings
     */
    void validateDb(DbConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("db section is required.");
        }
        if (StringUtils.isBlank(config.getUrl())) {
            requireText(config.getHost(), "db.host");
            requirePort(config.getPort(), "db.port");
        }
        requireText(config.getUsername(), "db.username");
        requireText(config.getPassword(), "db.password");
    }

    /**
     * Validates post definitions.
     *
     * @param config post definitions
     */
    void validatePosts(PostConfig config) {
        if (config == null || config.getPost() == null || config.getPost().isEmpty()) {
            throw new IllegalArgumentException("post must contain at least one entry.");
        }
        List<PostConfig.Entry> posts = config.getPost();
        for (int i = 0; i < posts.size(); i++) {
            PostConfig.Entry post = posts.get(i);
            String prefix = "post[" + i + "]";
            if (post == null) {
                throw new IllegalArgumentException(prefix + " must not be empty.");
            }
            requireText(post.getFrom(), prefix + ".from");
            if (post.getTo() == null || post.getTo().isEmpty()) {
                throw new IllegalArgumentException(prefix + ".to must contain at least one address.");
            }
            for (String to : post.getTo()) {
                requireText(to, prefix + ".to");
            }
            if (post.getAttachment() != null) {
                for (int j = 0; j < post.getAttachment().size(); j++) {
                    PostConfig.TableAttachment attachment = post.getAttachment().get(j);
                    String attPrefix = prefix + ".attachment[" + j + "]";
                    if (attachment == null) {
                        throw new IllegalArgumentException(attPrefix + " must not be empty.");
                    }
                    requireText(attachment.getTable(), attPrefix + ".table");
                    requireText(attachment.getExcel(), attPrefix + ".excel");
                }
            }
        }
    }

    /**
     * Validates the schedule expression by parsing it.
     *
     * @param config schedule setting
     */
    void validateSchedule(ScheduleConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("time is required.");
        }
        requireText(config.getTime(), "time");
        ScheduleExpression.parse(config.getTime());
    }

    private static void requireText(String value, String name) {
        if (StringUtils.isBlank(value)) {
            throw new IllegalArgumentException(name + " is required.");
        }
    }

    private static void requirePort(int port, String name) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException(name + " must be between 1 and 65535: " + port);
        }
    }
}
