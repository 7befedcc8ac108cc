package io.github.yok.tablemailer.job;

import com.google.common.base.Splitter;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

/**
 * Parsed form of the {@code time} setting.
 *
 * <p>
 * Accepted syntax:
 * </p>
 * <ul>
 * <li>5-field cron ({@code min hour dom mon dow}); runs at second 0.</li>
 * <li>6-field cron with a leading seconds field.</li>
 * <li>Macros {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly},
 * {@code @daily}, {@code @midnight}, {@code @hourly}.</li>
 * <li>{@code @every <duration>} with units {@code h}, {@code m}, {@code s}, {@code ms}, e.g.
 * {@code @every 1h30m}. The interval is truncated to whole seconds, with a minimum of one second; the
 * first run happens one interval after start.</li>
 * <li>When both day-of-month and day-of-week are restricted, the job runs on days matching either
 * field, as in standard cron.</li>
 * <li>Any cron form may be prefixed with {@code CRON_TZ=<zone>} or {@code TZ=<zone>}; otherwise the
 * system default zone applies.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString(exclude = "trigger")
public final class ScheduleExpression {

    private static final String EVERY_PREFIX = "@every";
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");
    private static final Splitter WHITESPACE = Splitter.on(Pattern.compile("\\s+"))
            .omitEmptyStrings();

    private final String expression;
    private final Trigger trigger;

    private ScheduleExpression(String expression, Trigger trigger) {
        this.expression = expression;
        this.trigger = trigger;
    }

    /**
     * Parses a schedule expression.
     *
     * @param expression raw {@code time} value
     * @return parsed schedule
     * @throws IllegalArgumentException if the expression is blank or malformed
     */
    public static ScheduleExpression parse(String expression) {
        if (StringUtils.isBlank(expression)) {
            throw new IllegalArgumentException("Schedule expression must not be blank.");
        }
        String spec = expression.trim();

        if (StringUtils.startsWithIgnoreCase(spec, EVERY_PREFIX)) {
            Duration interval = parseEvery(spec.substring(EVERY_PREFIX.length()).trim());
            PeriodicTrigger periodic = new PeriodicTrigger(interval);
            periodic.setInitialDelay(interval);
            return new ScheduleExpression(expression, periodic);
        }

        ZoneId zone = ZoneId.systemDefault();
        if (spec.startsWith("CRON_TZ=") || spec.startsWith("TZ=")) {
            int space = spec.indexOf(' ');
            if (space < 0) {
                throw new IllegalArgumentException("Missing cron fields after time zone: " + spec);
            }
            String zoneId = spec.substring(spec.indexOf('=') + 1, space);
            try {
                zone = ZoneId.of(zoneId);
            } catch (DateTimeException e) {
                throw new IllegalArgumentException("Unknown time zone: " + zoneId, e);
            }
            spec = spec.substring(space + 1).trim();
        }

        return new ScheduleExpression(expression, cronTrigger(toSpringCron(spec), zone));
    }

    /**
     * Creates the trigger for a 6-field Spring cron expression.
     *
     * <p>
     * Standard cron fires when <em>either</em> day-of-month or day-of-week matches if both fields
     * are restricted (e.g. {@code 0 0 1 * MON}: the 1st of each month and every Monday). Spring
     * requires both to match, so such an expression is split into a day-of-month trigger and a
     * day-of-week trigger, and the earlier of the two fires. A field starting with {@code *} or
     * {@code ?} counts as unrestricted.
     * </p>
     *
     * @param springCron 6-field expression or macro
     * @param zone time zone for evaluation
     * @return trigger with standard cron day semantics
     */
    static Trigger cronTrigger(String springCron, ZoneId zone) {
        List<String> fields = WHITESPACE.splitToList(springCron);
        if (fields.size() != 6 || !isRestricted(fields.get(3)) || !isRestricted(fields.get(5))) {
            return new CronTrigger(springCron, zone);
        }
        String prefix = String.join(" ", fields.subList(0, 3));
        CronTrigger dayOfMonth =
                new CronTrigger(prefix + " " + fields.get(3) + " " + fields.get(4) + " *", zone);
        CronTrigger dayOfWeek =
                new CronTrigger(prefix + " * " + fields.get(4) + " " + fields.get(5), zone);
        return new EitherDayTrigger(dayOfMonth, dayOfWeek);
    }

    private static boolean isRestricted(String field) {
        return !field.startsWith("*") && !field.startsWith("?");
    }

    /**
     * Converts a cron expression or macro into Spring's 6-field syntax.
     *
     * @param spec cron fields or macro, without time zone prefix
     * @return expression accepted by {@link CronTrigger}
     */
    static String toSpringCron(String spec) {
        if (spec.startsWith("@")) {
            // Spring understands the standard macros natively
            return spec.toLowerCase(Locale.ROOT);
        }
        List<String> fields = WHITESPACE.splitToList(spec);
        if (fields.size() == 5) {
            return "0 " + String.join(" ", fields);
        }
        if (fields.size() == 6) {
            return String.join(" ", fields);
        }
        throw new IllegalArgumentException(
                "Cron expression must have 5 or 6 fields but has " + fields.size() + ": " + spec);
    }

    /**
     * Parses a Go-style duration such as {@code 1h30m} or {@code 90s}.
     *
     * @param text duration text
     * @return duration truncated to seconds, at least one second
     */
    static Duration parseEvery(String text) {
        if (text.isEmpty()) {
            throw new IllegalArgumentException("@every requires a duration, e.g. '@every 1h'.");
        }
        Matcher matcher = DURATION_PART.matcher(text);
        long millis = 0;
        int end = 0;
        while (matcher.find()) {
            if (matcher.start() != end) {
                break;
            }
            double amount = Double.parseDouble(matcher.group(1));
            millis += (long) (amount * unitMillis(matcher.group(2)));
            end = matcher.end();
        }
        if (end == 0 || end != text.length()) {
            throw new IllegalArgumentException("Invalid duration in @every: " + text);
        }
        long seconds = Math.max(1L, millis / 1000L);
        return Duration.ofSeconds(seconds);
    }

    private static long unitMillis(String unit) {
        switch (unit) {
            case "h":
                return 3_600_000L;
            case "m":
                return 60_000L;
            case "s":
                return 1_000L;
            default:
                return 1L;
        }
    }

    /**
     * Fires at the earlier of two cron triggers.
     */
    @ToString
    static final class EitherDayTrigger implements Trigger {

        private final CronTrigger dayOfMonth;
        private final CronTrigger dayOfWeek;

        EitherDayTrigger(CronTrigger dayOfMonth, CronTrigger dayOfWeek) {
            this.dayOfMonth = dayOfMonth;
            this.dayOfWeek = dayOfWeek;
        }

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            Instant byMonth = dayOfMonth.nextExecution(triggerContext);
            Instant byWeek = dayOfWeek.nextExecution(triggerContext);
            if (byMonth == null) {
                return byWeek;
            }
            if (byWeek == null) {
                return byMonth;
            }
            return byMonth.isBefore(byWeek) ? byMonth : byWeek;
        }
    }
}
