package io.github.yok.tablemailer;

import io.github.yok.tablemailer.config.ConfigValidator;
import io.github.yok.tablemailer.config.DbConfig;
import io.github.yok.tablemailer.config.EmailConfig;
import io.github.yok.tablemailer.config.PostConfig;
import io.github.yok.tablemailer.config.ScheduleConfig;
import io.github.yok.tablemailer.job.DeliveryJob;
import io.github.yok.tablemailer.job.JobScheduler;
import io.github.yok.tablemailer.job.ScheduleExpression;
import io.github.yok.tablemailer.util.ErrorHandler;
import io.github.yok.tablemailer.util.MaskingLogUtil;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Argument specification:
 * </p>
 * <ul>
 * <li>{@code --config <file>} or {@code -c <file>} loads an additional configuration file (YAML or
 * JSON) on top of {@code application.yml}.</li>
 * <li>{@code --once} or {@code -o} runs the job a single time and exits instead of scheduling
 * it.</li>
 * <li>{@code --help} or {@code -h} prints usage.</li>
 * </ul>
 *
 * <p>
 * The configuration is validated before anything is scheduled; an invalid configuration is reported
 * through {@link ErrorHandler} and the job is never registered. Otherwise a {@link JobScheduler}
 * fires {@link DeliveryJob} on the {@code time} schedule until the process is stopped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see EmailConfig
 * @see DbConfig
 * @see PostConfig
 * @see ScheduleConfig
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({EmailConfig.class, DbConfig.class, PostConfig.class,
        ScheduleConfig.class})
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    static final String CONFIG_LOCATION_PROPERTY = "spring.config.additional-location";

    static final String USAGE = "Usage: tablemailer [--config <file>] [--once]\n"
            + "  -c, --config <file>  additional configuration file (YAML or JSON)\n"
            + "  -o, --once           run the job once and exit\n"
            + "  -h, --help           show this help";

    private final EmailConfig emailConfig;
    private final DbConfig dbConfig;
    private final PostConfig postConfig;
    private final ScheduleConfig scheduleConfig;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        String configPath = findConfigPath(args);
        if (configPath != null) {
            app.setDefaultProperties(
                    Map.of(CONFIG_LOCATION_PROPERTY, toConfigLocation(configPath)));
        }
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        boolean once = false;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config":
                case "-c":
                    // consumed in main()
                    i++;
                    break;
                case "--once":
                case "-o":
                    once = true;
                    break;
                case "--help":
                case "-h":
                    System.out.println(USAGE);
                    return;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        ScheduleExpression schedule;
        try {
            new ConfigValidator().validate(emailConfig, dbConfig, postConfig, scheduleConfig);
            schedule = ScheduleExpression.parse(scheduleConfig.getTime());
        } catch (IllegalArgumentException e) {
            ErrorHandler.errorAndExit("Invalid configuration: " + e.getMessage(), e);
            return;
        }

        log.info("Configuration loaded successfully. email[{}], db[{}], posts={}, time={}",
                MaskingLogUtil.describe(emailConfig), MaskingLogUtil.describe(dbConfig),
                postConfig.getPost().size(), scheduleConfig.getTime());

        DeliveryJob job = new DeliveryJob(emailConfig, dbConfig, postConfig);
        if (once) {
            log.info("Running job once (--once).");
            if (!job.run()) {
                ErrorHandler.errorAndExit("Single run failed; see the log for the aborted stage.");
                return;
            }
            log.info("Single run finished successfully.");
            return;
        }

        JobScheduler scheduler = new JobScheduler(job::run, schedule.getTrigger());
        scheduler.start();
        Runtime.getRuntime().addShutdownHook(new Thread(scheduler::stop, "tablemailer-shutdown"));
        log.info("Job scheduled with [{}]; waiting for triggers.", scheduleConfig.getTime());
    }

    /**
     * Returns the value following {@code --config}/{@code -c}, if any.
     *
     * @param args command-line arguments
     * @return configuration file path, or {@code null}
     */
    static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i]) || "-c".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    /**
     * Converts a file path to a Spring config location. Files without a {@code .yml},
     * {@code .yaml} or {@code .properties} extension (e.g. JSON) are read as YAML.
     *
     * @param path configuration file path
     * @return config location string
     */
    static String toConfigLocation(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".yml") || lower.endsWith(".yaml") || lower.endsWith(".properties")) {
            return "file:" + path;
        }
        return "file:" + path + "[.yaml]";
    }
}
