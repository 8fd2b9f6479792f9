package com.example.backendtemplate.service.job;

import com.example.backendtemplate.config.JobSchedulerProperties;
import com.example.backendtemplate.config.MetricsConfig;
import com.example.backendtemplate.exception.ConflictingJobException;
import com.example.backendtemplate.exception.InvalidConfigurationException;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cron scheduler for in-process jobs.
 * <p>
 * Each registered job has exactly one pending trigger on a {@link ThreadPoolTaskScheduler}.
 * When a trigger fires, the next one is scheduled first and the job body then runs on the
 * firing thread.
 * <p>
 * Run rules per job:
 * - A fire later than the misfire grace time is skipped
 * - At most {@code maxInstances} runs execute at once; with coalesce, fires arriving while
 *   the job is busy collapse into a single pending run started when the job finishes,
 *   otherwise they are skipped
 * - Several fire times missed at once (scheduler down or overloaded) collapse into one
 *   run with coalesce, otherwise each runs in turn
 * - Job bodies run under a ShedLock lock named after the job, so instances sharing the
 *   database do not run the same job concurrently
 * - A failing run is logged; the job stays scheduled
 * <p>
 * Next run times are written to the {@link JobStore}, so fires missed while the process
 * was down are detected on the next start.
 */
@Slf4j
public class CronJobScheduler {

    private static final int MAX_CATCH_UP_FIRES = 1000;

    private final JobStore jobStore;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;
    private final ZoneId zone;
    private final Clock clock;

    private final Map<String, JobEntry> jobs = new ConcurrentHashMap<>();
    private final Object monitor = new Object();
    private volatile ThreadPoolTaskScheduler taskScheduler;

    public CronJobScheduler(JobStore jobStore, LockingTaskExecutor lockingTaskExecutor,
                            MetricsConfig metricsConfig, JobSchedulerProperties properties) {
        this(jobStore, lockingTaskExecutor, metricsConfig, properties, Clock.systemUTC());
    }

    public CronJobScheduler(JobStore jobStore, LockingTaskExecutor lockingTaskExecutor,
                            MetricsConfig metricsConfig, JobSchedulerProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.zone = ZoneId.of(properties.getTimeZone());
        this.clock = clock;
    }

    // === Registration ===

    /**
     * Start a descriptor pre-filled with the configured job defaults
     */
    public JobDescriptor.JobDescriptorBuilder newJob(String name, String cronExpression, Runnable task) {
        return JobDescriptor.builder()
                .name(name)
                .cronExpression(cronExpression)
                .task(task)
                .coalesce(properties.isCoalesce())
                .maxInstances(properties.getMaxInstances())
                .misfireGraceTime(properties.getMisfireGraceTime());
    }

    /**
     * Register a job, or replace the trigger of a job with the same name.
     *
     * @throws InvalidConfigurationException if the cron expression or the job options are invalid
     * @throws ConflictingJobException       if the name is taken and {@code replaceExisting} is false
     */
    public void register(JobDescriptor descriptor) {
        var cron = parseCron(descriptor.getName(), descriptor.getCronExpression());
        if (descriptor.getMaxInstances() < 1) {
            throw new InvalidConfigurationException(descriptor.getName() + ".maxInstances", "must be at least 1");
        }
        if (descriptor.getMisfireGraceTime() == null || descriptor.getMisfireGraceTime().isNegative()) {
            throw new InvalidConfigurationException(descriptor.getName() + ".misfireGraceTime", "must not be negative");
        }

        synchronized (monitor) {
            var existing = jobs.get(descriptor.getName());
            if (existing != null) {
                if (!descriptor.isReplaceExisting()) {
                    throw new ConflictingJobException(descriptor.getName());
                }
                existing.retire();
                log.info("Replacing trigger of job '{}': '{}' -> '{}'", descriptor.getName(),
                        existing.descriptor.getCronExpression(), descriptor.getCronExpression());
            }

            var entry = existing != null ? existing.replacedBy(descriptor, cron) : new JobEntry(descriptor, cron);
            entry.nextFireTime = restoreNextFireTime(entry);
            jobs.put(descriptor.getName(), entry);
            persist(entry);

            if (taskScheduler != null) {
                scheduleFire(entry, entry.nextFireTime);
            }
            log.info("Registered job '{}' with cron '{}', next run at {}",
                    descriptor.getName(), descriptor.getCronExpression(), entry.nextFireTime);
        }
    }

    /**
     * Remove a job and its stored trigger state
     *
     * @return true if a job with that name was registered
     */
    public boolean unregister(String name) {
        synchronized (monitor) {
            var entry = jobs.remove(name);
            if (entry == null) {
                return false;
            }
            entry.retire();
            jobStore.remove(name);
            log.info("Unregistered job '{}'", name);
            return true;
        }
    }

    public Optional<ScheduledJobInfo> getJob(String name) {
        return Optional.ofNullable(jobs.get(name)).map(JobEntry::toInfo);
    }

    public List<ScheduledJobInfo> getJobs() {
        return jobs.values().stream()
                .map(JobEntry::toInfo)
                .sorted(Comparator.comparing(ScheduledJobInfo::getName))
                .toList();
    }

    // === Lifecycle ===

    public void start() {
        synchronized (monitor) {
            if (taskScheduler != null) {
                log.debug("Job scheduler already running");
                return;
            }
            var scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(properties.getPoolSize());
            scheduler.setThreadNamePrefix("job-scheduler-");
            scheduler.setClock(clock);
            scheduler.setRemoveOnCancelPolicy(true);
            scheduler.setWaitForTasksToCompleteOnShutdown(true);
            scheduler.setAwaitTerminationSeconds(properties.getShutdownTimeoutSeconds());
            scheduler.setErrorHandler(t -> log.error("Unhandled error in job scheduler thread: {}", t.getMessage(), t));
            scheduler.initialize();
            taskScheduler = scheduler;

            removeOrphanedTriggers();
            jobs.values().forEach(entry -> scheduleFire(entry, entry.nextFireTime));
            log.info("Job scheduler started with {} job(s)", jobs.size());
        }
    }

    /**
     * Stop firing triggers.
     *
     * @param waitForRunningJobs wait (bounded by the configured shutdown timeout) for job
     *                           bodies that are executing right now
     */
    public void shutdown(boolean waitForRunningJobs) {
        ThreadPoolTaskScheduler scheduler;
        synchronized (monitor) {
            scheduler = taskScheduler;
            if (scheduler == null) {
                log.debug("Job scheduler not running");
                return;
            }
            taskScheduler = null;
            jobs.values().forEach(JobEntry::cancelNextFire);
        }
        scheduler.setWaitForTasksToCompleteOnShutdown(waitForRunningJobs);
        scheduler.shutdown();
        log.info("Job scheduler shut down");
    }

    public boolean isRunning() {
        return taskScheduler != null;
    }

    /**
     * Drop stored triggers of jobs this process no longer registers
     */
    private void removeOrphanedTriggers() {
        try {
            for (var stored : jobStore.findAll()) {
                if (!jobs.containsKey(stored.getId())) {
                    log.warn("Removing stored trigger of unknown job '{}' (cron '{}')", stored.getId(), stored.getCronExpression());
                    jobStore.remove(stored.getId());
                }
            }
        } catch (RuntimeException e) {
            log.error("Failed to clean up stored job triggers: {}", e.getMessage(), e);
        }
    }

    // === Firing ===

    private void scheduleFire(JobEntry entry, Instant fireTime) {
        var scheduler = taskScheduler;
        if (scheduler == null || fireTime == null || entry.isRetired()) {
            return;
        }
        try {
            entry.nextFire = scheduler.schedule(() -> onTrigger(entry, fireTime), fireTime);
        } catch (TaskRejectedException e) {
            log.debug("Scheduler is shutting down, not scheduling job '{}'", entry.getName());
        }
    }

    private void onTrigger(JobEntry entry, Instant fireTime) {
        if (entry.isRetired() || !isRunning()) {
            return;
        }
        var now = clock.instant();
        var runTimes = dueRunTimes(entry, fireTime, now);

        var next = nextFireTime(entry.cron, now);
        entry.nextFireTime = next;
        persist(entry);
        scheduleFire(entry, next);

        for (var runTime : runTimes) {
            runWithInstanceLimit(entry, runTime);
        }
    }

    private List<Instant> dueRunTimes(JobEntry entry, Instant fireTime, Instant now) {
        var runTimes = new ArrayList<Instant>();
        var runTime = fireTime;
        while (runTime != null && !runTime.isAfter(now) && runTimes.size() < MAX_CATCH_UP_FIRES) {
            runTimes.add(runTime);
            runTime = nextFireTime(entry.cron, runTime);
        }
        if (runTimes.isEmpty()) {
            runTimes.add(fireTime);
        }
        if (entry.descriptor.isCoalesce() && runTimes.size() > 1) {
            log.info("Coalescing {} missed fires of job '{}' into one run", runTimes.size(), entry.getName());
            return List.of(runTimes.get(runTimes.size() - 1));
        }
        return runTimes;
    }

    private void runWithInstanceLimit(JobEntry entry, Instant runTime) {
        var current = entry;
        var pending = runTime;
        while (pending != null) {
            if (!current.tryAcquireInstance()) {
                deferOrSkip(current, pending);
                return;
            }
            try {
                runIfWithinGrace(current, pending);
                pending = takePendingRun(current);
            } finally {
                current.releaseInstance();
            }
            if (pending == null) {
                // a fire may have been deferred between the check above and the release
                pending = takePendingRun(current);
            }
            current = latest(current);
            if (pending != null && current.isRetired()) {
                log.info("Job '{}' was unregistered, dropping deferred run", current.getName());
                return;
            }
        }
    }

    /**
     * The entry that now owns the run state of the given one; a deferred run of a
     * replaced job runs the replacement's body.
     */
    private JobEntry latest(JobEntry entry) {
        var registered = jobs.get(entry.getName());
        return registered != null && registered.sharesRunStateWith(entry) ? registered : entry;
    }

    private Instant takePendingRun(JobEntry entry) {
        var pending = entry.pendingRun.getAndSet(null);
        if (pending != null && !isRunning()) {
            log.info("Scheduler shutting down, dropping deferred run of job '{}'", entry.getName());
            return null;
        }
        return pending;
    }

    private void deferOrSkip(JobEntry entry, Instant runTime) {
        if (entry.descriptor.isCoalesce()) {
            var previous = entry.pendingRun.getAndSet(runTime);
            log.info("Job '{}' still running, fire at {} deferred{}", entry.getName(), runTime,
                    previous != null ? " (coalesced with fire at " + previous + ")" : "");
            metricsConfig.recordJobSkipped(entry.getName(), "coalesced");
            return;
        }
        log.warn("Execution of job '{}' skipped: maximum number of running instances reached ({})",
                entry.getName(), entry.descriptor.getMaxInstances());
        metricsConfig.recordJobSkipped(entry.getName(), "max_instances");
    }

    private void runIfWithinGrace(JobEntry entry, Instant runTime) {
        var lateness = Duration.between(runTime, clock.instant());
        if (lateness.compareTo(entry.descriptor.getMisfireGraceTime()) > 0) {
            log.warn("Run time of job '{}' was missed by {}", entry.getName(), lateness);
            metricsConfig.recordJobSkipped(entry.getName(), "misfire");
            return;
        }
        execute(entry, runTime);
    }

    private void execute(JobEntry entry, Instant runTime) {
        var name = entry.getName();
        var lockConfig = new LockConfiguration(clock.instant(), "job:" + name, properties.getLockAtMostFor(), Duration.ZERO);
        var executed = new AtomicBoolean(false);
        var timerSample = metricsConfig.startJobTimer();

        log.info("Running job '{}' (scheduled run time {})", name, runTime);
        try {
            lockingTaskExecutor.executeWithLock((Runnable) () -> {
                executed.set(true);
                entry.descriptor.getTask().run();
            }, lockConfig);

            if (!executed.get()) {
                log.info("Job '{}' is locked by another instance, skipping run at {}", name, runTime);
                metricsConfig.recordJobSkipped(name, "locked");
                return;
            }
            entry.lastRunTime = runTime;
            persist(entry);
            metricsConfig.recordJobRun(timerSample, name, true);
            log.info("Job '{}' executed successfully", name);
        } catch (Exception e) {
            metricsConfig.recordJobRun(timerSample, name, false);
            log.error("Job '{}' raised an exception: {}", name, e.getMessage(), e);
        }
    }

    // === Helpers ===

    private Instant restoreNextFireTime(JobEntry entry) {
        var now = clock.instant();
        var stored = jobStore.find(entry.getName());
        if (stored.isPresent()
                && entry.descriptor.getCronExpression().equals(stored.get().getCronExpression())
                && stored.get().getNextRunTime() != null) {
            entry.lastRunTime = stored.get().getLastRunTime();
            return stored.get().getNextRunTime();
        }
        return nextFireTime(entry.cron, now);
    }

    private void persist(JobEntry entry) {
        try {
            jobStore.save(StoredJob.builder()
                    .id(entry.getName())
                    .cronExpression(entry.descriptor.getCronExpression())
                    .nextRunTime(entry.nextFireTime)
                    .lastRunTime(entry.lastRunTime)
                    .build());
        } catch (RuntimeException e) {
            if (taskScheduler == null) {
                // registration happens before start; a broken store must fail startup
                throw e;
            }
            log.error("Failed to store trigger state of job '{}': {}", entry.getName(), e.getMessage(), e);
        }
    }

    private Instant nextFireTime(CronExpression cron, Instant after) {
        var next = cron.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    /**
     * Parse a five-field crontab or six-field (seconds first) expression
     */
    static CronExpression parseCron(String jobName, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidConfigurationException(jobName + ".cron", "cron expression is required");
        }
        var trimmed = expression.trim();
        var normalized = !trimmed.startsWith("@") && trimmed.split("\\s+").length == 5 ? "0 " + trimmed : trimmed;
        try {
            return CronExpression.parse(normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(jobName + ".cron", "malformed cron expression '" + expression + "'", e);
        }
    }

    private static final class JobEntry {

        private final JobDescriptor descriptor;
        private final CronExpression cron;
        private final AtomicInteger runningInstances;
        private final AtomicReference<Instant> pendingRun;
        private final AtomicBoolean retired = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> nextFire;
        private volatile Instant nextFireTime;
        private volatile Instant lastRunTime;

        private JobEntry(JobDescriptor descriptor, CronExpression cron) {
            this(descriptor, cron, new AtomicInteger(), new AtomicReference<>());
        }

        private JobEntry(JobDescriptor descriptor, CronExpression cron,
                         AtomicInteger runningInstances, AtomicReference<Instant> pendingRun) {
            this.descriptor = descriptor;
            this.cron = cron;
            this.runningInstances = runningInstances;
            this.pendingRun = pendingRun;
        }

        /**
         * New trigger for the same job. Runs still in flight keep counting against the
         * instance limit, and a deferred run carries over.
         */
        private JobEntry replacedBy(JobDescriptor descriptor, CronExpression cron) {
            return new JobEntry(descriptor, cron, runningInstances, pendingRun);
        }

        private boolean sharesRunStateWith(JobEntry other) {
            return runningInstances == other.runningInstances;
        }

        private String getName() {
            return descriptor.getName();
        }

        private boolean tryAcquireInstance() {
            while (true) {
                var current = runningInstances.get();
                if (current >= descriptor.getMaxInstances()) {
                    return false;
                }
                if (runningInstances.compareAndSet(current, current + 1)) {
                    return true;
                }
            }
        }

        private void releaseInstance() {
            runningInstances.decrementAndGet();
        }

        private void cancelNextFire() {
            var future = nextFire;
            if (future != null) {
                future.cancel(false);
            }
        }

        private void retire() {
            retired.set(true);
            cancelNextFire();
        }

        private boolean isRetired() {
            return retired.get();
        }

        private ScheduledJobInfo toInfo() {
            return ScheduledJobInfo.builder()
                    .name(descriptor.getName())
                    .cronExpression(descriptor.getCronExpression())
                    .coalesce(descriptor.isCoalesce())
                    .maxInstances(descriptor.getMaxInstances())
                    .misfireGraceTime(descriptor.getMisfireGraceTime())
                    .nextRunTime(nextFireTime)
                    .lastRunTime(lastRunTime)
                    .runningInstances(runningInstances.get())
                    .build();
        }
    }
}
