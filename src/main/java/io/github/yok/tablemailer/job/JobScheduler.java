package io.github.yok.tablemailer.job;

import com.google.common.base.Preconditions;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Owns the single scheduled task of the process and guarantees that two runs never overlap.
 *
 * <p>
 * Runs are guarded by a lock taken with {@code tryLock()}: when a trigger fires (or
 * {@link #runNow()} is called) while a run is still in progress, the new run is skipped and logged
 * at WARN. Skipped triggers are not queued. {@link #stop()} cancels the trigger and shuts the
 * scheduler thread down.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class JobScheduler {

    static final String THREAD_NAME_PREFIX = "tablemailer-job-";

    /**
     * Result of one attempt to run the job.
     */
    public enum RunOutcome {
        // Job ran to completion
        COMPLETED,
        // Job ran and aborted on an error
        FAILED,
        // Another run was in progress
        SKIPPED
    }

    private final BooleanSupplier job;
    private final Trigger trigger;
    private final ThreadPoolTaskScheduler taskScheduler;
    private final ReentrantLock runLock = new ReentrantLock();
    private ScheduledFuture<?> scheduled;

    /**
     * Creates a scheduler backed by a one-thread {@link ThreadPoolTaskScheduler}.
     *
     * @param job job body; returns {@code true} when the run succeeded
     * @param trigger trigger that decides when the job runs
     */
    public JobScheduler(BooleanSupplier job, Trigger trigger) {
        this(job, trigger, createTaskScheduler());
    }

    JobScheduler(BooleanSupplier job, Trigger trigger, ThreadPoolTaskScheduler taskScheduler) {
        this.job = Preconditions.checkNotNull(job, "job must not be null");
        this.trigger = Preconditions.checkNotNull(trigger, "trigger must not be null");
        this.taskScheduler = taskScheduler;
    }

    private static ThreadPoolTaskScheduler createTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix(THREAD_NAME_PREFIX);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        return scheduler;
    }

    /**
     * Registers the job with the trigger. Calling it twice has no further effect.
     */
    public synchronized void start() {
        if (scheduled != null) {
            log.warn("Scheduler already started");
            return;
        }
        taskScheduler.initialize();
        scheduled = taskScheduler.schedule(this::runNow, trigger);
        log.info("Job scheduled. trigger={}", trigger);
    }

    /**
     * Runs the job on the calling thread unless a run is already in progress.
     *
     * @return outcome of the attempt
     */
    public RunOutcome runNow() {
        if (!runLock.tryLock()) {
            log.warn("Previous run is still in progress; this trigger is skipped.");
            return RunOutcome.SKIPPED;
        }
        try {
            return job.getAsBoolean() ? RunOutcome.COMPLETED : RunOutcome.FAILED;
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Returns whether a run is currently executing.
     *
     * @return {@code true} while the job body runs
     */
    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Cancels future triggers and shuts the scheduler down, letting an in-flight run finish.
     */
    public synchronized void stop() {
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
        taskScheduler.shutdown();
        log.info("Scheduler stopped.");
    }
}
