package io.minicron.core.scheduler;

import io.minicron.core.error.ConflictException;
import io.minicron.core.error.NotFoundException;
import io.minicron.core.error.StorageException;
import io.minicron.core.exec.CommandExecutor;
import io.minicron.core.exec.ExecutionResult;
import io.minicron.core.job.JobRecord;
import io.minicron.core.job.JobState;
import io.minicron.core.job.JobStore;
import io.minicron.core.log.ExecutionLogEntry;
import io.minicron.core.log.ExecutionLogStore;
import io.minicron.core.log.RunStatus;
import io.minicron.core.log.TriggerSource;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the job store, dispatches due jobs to a bounded worker pool and writes their results back.
 *
 * <p>At most one execution per job is in flight. A job found due while it is still running has that
 * tick recorded as {@link RunStatus#SKIPPED}; a manual run against a running job is rejected with
 * {@link ConflictException}. The next run is computed from the completion time, and occurrences
 * missed while the scheduler was stopped are never replayed.
 */
public final class JobScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore store;
    private final ExecutionLogStore logStore;
    private final CommandExecutor executor;
    private final SchedulerSettings settings;
    private final Clock clock;
    private final Map<String, Instant> running = new ConcurrentHashMap<>();
    private final Queue<PendingCompletion> pending = new ConcurrentLinkedQueue<>();
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final ThreadPoolExecutor workers;
    private final Object lifecycle = new Object();
    private ScheduledExecutorService loop;
    private boolean started;
    private boolean stopped;
    private volatile Instant lastTickAt;

    public JobScheduler(
        JobStore store,
        ExecutionLogStore logStore,
        CommandExecutor executor,
        SchedulerSettings settings,
        Clock clock
    ) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.logStore = Objects.requireNonNull(logStore, "logStore must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        BlockingQueue<Runnable> queue = settings.queueCapacity() == 0
            ? new SynchronousQueue<>()
            : new ArrayBlockingQueue<>(settings.queueCapacity());
        this.workers = new ThreadPoolExecutor(
            settings.maxConcurrentRuns(),
            settings.maxConcurrentRuns(),
            60,
            TimeUnit.SECONDS,
            queue,
            namedThreads("minicron-worker-"),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void start() {
        synchronized (lifecycle) {
            if (stopped) {
                throw new IllegalStateException("scheduler has been stopped");
            }
            if (started) {
                return;
            }
            recover();
            loop = Executors.newSingleThreadScheduledExecutor(namedThreads("minicron-scheduler-"));
            long intervalMs = settings.pollInterval().toMillis();
            loop.scheduleWithFixedDelay(this::safeTick, 0, intervalMs, TimeUnit.MILLISECONDS);
            started = true;
        }
        LOG.info(
            "Scheduler started (poll every {} ms, up to {} concurrent runs)",
            settings.pollInterval().toMillis(),
            settings.maxConcurrentRuns()
        );
    }

    public void stop() {
        ScheduledExecutorService currentLoop;
        synchronized (lifecycle) {
            if (stopped) {
                return;
            }
            stopped = true;
            currentLoop = loop;
        }
        if (currentLoop != null) {
            currentLoop.shutdown();
        }
        workers.shutdown();
        try {
            if (currentLoop != null) {
                currentLoop.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            }
            if (!workers.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.warn("{} execution(s) still running after shutdown grace, interrupting", running.size());
                workers.shutdownNow();
                workers.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        retryPending();
        if (!pending.isEmpty()) {
            LOG.warn("{} execution result(s) could not be persisted before shutdown", pending.size());
        }
        LOG.info("Scheduler stopped");
    }

    @Override
    public void close() {
        stop();
    }

    public int tick() {
        Instant now = clock.instant();
        lastTickAt = now;
        retryPending();

        int dispatched = 0;
        for (JobRecord job : store.list()) {
            if (!job.enabled() || job.nextRunAt() == null || job.nextRunAt().isAfter(now)) {
                continue;
            }
            Instant runningSince = running.get(job.id());
            if (runningSince != null) {
                if (job.nextRunAt().isAfter(runningSince)) {
                    skip(job, now, runningSince);
                } else {
                    LOG.debug("Cron job {} is due but its dispatched execution has not started yet", job.id());
                }
                continue;
            }
            try {
                dispatch(job, TriggerSource.SCHEDULER);
                dispatched++;
            } catch (ConflictException e) {
                LOG.warn("Deferring cron job {} to the next tick: {}", job.id(), e.getMessage());
            }
        }
        LOG.debug("Tick at {} dispatched {} job(s)", now, dispatched);
        return dispatched;
    }

    public CompletableFuture<ExecutionLogEntry> runNow(String jobId) {
        synchronized (lifecycle) {
            if (stopped) {
                throw new ConflictException("scheduler is stopping");
            }
        }
        JobRecord job = store.get(jobId);
        LOG.info("Manual run requested for cron job {}", jobId);
        return dispatch(job, TriggerSource.MANUAL);
    }

    public boolean isRunning(String jobId) {
        return running.containsKey(jobId);
    }

    public JobState stateOf(JobRecord job) {
        if (running.containsKey(job.id())) {
            return JobState.RUNNING;
        }
        if (!job.enabled() || job.nextRunAt() == null) {
            return JobState.IDLE;
        }
        if (!job.nextRunAt().isAfter(clock.instant())) {
            return JobState.DUE;
        }
        if (settings.cooldownEnabled() && job.consecutiveFailures() >= settings.cooldownAfterFailures()) {
            return JobState.COOLDOWN;
        }
        return JobState.IDLE;
    }

    public SchedulerStatus status() {
        List<JobRecord> jobs = store.list();
        boolean active;
        synchronized (lifecycle) {
            active = started && !stopped;
        }
        return new SchedulerStatus(
            active,
            settings.pollInterval().toMillis(),
            jobs.size(),
            (int) jobs.stream().filter(JobRecord::enabled).count(),
            running.size(),
            settings.maxConcurrentRuns(),
            lastTickAt
        );
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!running.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    void recover() {
        Instant now = clock.instant();
        int interrupted = 0;
        int rescheduled = 0;
        for (JobRecord job : store.list()) {
            try {
                if (job.state() == JobState.RUNNING && !running.containsKey(job.id())) {
                    RunStatus status = closedRunStatus(job).orElse(null);
                    if (status == null) {
                        Instant startedAt = job.lastRunAt() == null ? now : job.lastRunAt();
                        logStore.append(ExecutionLogEntry.interrupted(job.id(), startedAt, now));
                        status = RunStatus.INTERRUPTED;
                        interrupted++;
                    }
                    store.recordCompletion(job.id(), status, now);
                } else if (job.enabled() && (job.nextRunAt() == null || job.nextRunAt().isBefore(now))) {
                    store.reschedule(job.id(), now);
                    rescheduled++;
                }
            } catch (StorageException e) {
                LOG.warn("Failed to recover cron job {}: {}", job.id(), e.getMessage());
            }
        }
        LOG.info("Recovery closed {} interrupted execution(s) and rescheduled {} overdue job(s)", interrupted, rescheduled);
    }

    private Optional<RunStatus> closedRunStatus(JobRecord job) {
        if (job.lastRunAt() == null) {
            return Optional.empty();
        }
        return logStore.latest(job.id())
            .filter(entry -> entry.exitStatus() != RunStatus.SKIPPED)
            .filter(entry -> !entry.startedAt().isBefore(job.lastRunAt()))
            .map(ExecutionLogEntry::exitStatus);
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOG.error("Scheduler tick failed", e);
        }
    }

    private CompletableFuture<ExecutionLogEntry> dispatch(JobRecord job, TriggerSource trigger) {
        Instant startedAt = clock.instant();
        Instant previous = running.putIfAbsent(job.id(), startedAt);
        if (previous != null) {
            throw new ConflictException("cron job " + job.id() + " is already running since " + previous);
        }
        CompletableFuture<ExecutionLogEntry> future = new CompletableFuture<>();
        try {
            workers.execute(() -> execute(job, startedAt, trigger, future));
        } catch (RejectedExecutionException e) {
            running.remove(job.id(), startedAt);
            throw new ConflictException(
                "all " + settings.maxConcurrentRuns() + " workers are busy, cron job " + job.id() + " was not started");
        }
        LOG.info("Dispatched cron job {} ({})", job.id(), trigger.name().toLowerCase());
        return future;
    }

    private void execute(JobRecord dispatched, Instant startedAt, TriggerSource trigger, CompletableFuture<ExecutionLogEntry> future) {
        JobRecord job = dispatched;
        try {
            job = store.markRunning(dispatched.id(), startedAt);
        } catch (NotFoundException e) {
            running.remove(dispatched.id(), startedAt);
            future.completeExceptionally(e);
            return;
        } catch (StorageException e) {
            LOG.warn("Could not mark cron job {} running, executing anyway: {}", dispatched.id(), e.getMessage());
        }

        Duration timeout = job.timeoutSeconds() == null
            ? settings.defaultTimeout()
            : Duration.ofSeconds(job.timeoutSeconds());
        ExecutionResult result;
        try {
            result = executor.run(job.command(), timeout);
        } catch (IOException e) {
            LOG.warn("Cron job {} could not be started: {}", job.id(), e.getMessage());
            result = ExecutionResult.error("failed to start command: " + e.getMessage(), Duration.between(startedAt, clock.instant()));
        } catch (RuntimeException e) {
            LOG.error("Executor failed for cron job {}", job.id(), e);
            result = ExecutionResult.error("executor failure: " + e.getMessage(), Duration.between(startedAt, clock.instant()));
        }

        Instant finishedAt = clock.instant();
        ExecutionLogEntry entry = ExecutionLogEntry.completed(job.id(), startedAt, finishedAt, trigger, result);
        PendingCompletion completion = new PendingCompletion(entry, earliestNextRun(job, result.status(), finishedAt));
        if (!persist(completion)) {
            pending.add(completion);
        }
        LOG.info(
            "Cron job {} finished with {} in {} ms",
            job.id(),
            result.status().name().toLowerCase(),
            entry.durationMs()
        );
        notifyListeners(job, entry);
        future.complete(entry);
    }

    private Instant earliestNextRun(JobRecord job, RunStatus status, Instant finishedAt) {
        if (status.isSuccess() || !settings.cooldownEnabled()) {
            return finishedAt;
        }
        int failures = job.consecutiveFailures() + 1;
        if (failures < settings.cooldownAfterFailures()) {
            return finishedAt;
        }
        LOG.warn("Cron job {} failed {} time(s) in a row, cooling down for {}", job.id(), failures, settings.cooldown());
        return finishedAt.plus(settings.cooldown());
    }

    private boolean persist(PendingCompletion completion) {
        ExecutionLogEntry entry = completion.entry;
        try {
            if (!completion.logged) {
                logStore.append(entry);
                completion.logged = true;
            }
            try {
                store.recordCompletion(entry.jobId(), entry.exitStatus(), completion.earliestNextRun);
            } catch (NotFoundException e) {
                LOG.info("Cron job {} was deleted while running; its log entry is kept", entry.jobId());
            }
            running.remove(entry.jobId(), entry.startedAt());
            return true;
        } catch (StorageException e) {
            LOG.warn("Failed to persist result of cron job {}, retrying on next tick: {}", entry.jobId(), e.getMessage());
            return false;
        }
    }

    private void retryPending() {
        int attempts = pending.size();
        for (int i = 0; i < attempts; i++) {
            PendingCompletion completion = pending.poll();
            if (completion == null) {
                return;
            }
            if (!persist(completion)) {
                pending.add(completion);
            }
        }
    }

    private void skip(JobRecord job, Instant now, Instant runningSince) {
        LOG.warn("Skipping due tick of cron job {}: previous execution running since {}", job.id(), runningSince);
        try {
            logStore.append(ExecutionLogEntry.skipped(job.id(), now, runningSince));
            store.reschedule(job.id(), now);
        } catch (NotFoundException e) {
            LOG.debug("Cron job {} was deleted during the tick", job.id());
        } catch (StorageException e) {
            LOG.warn("Failed to record skipped tick of cron job {}: {}", job.id(), e.getMessage());
        }
    }

    private void notifyListeners(JobRecord job, ExecutionLogEntry entry) {
        for (ExecutionListener listener : listeners) {
            try {
                listener.onExecutionFinished(job, entry);
            } catch (RuntimeException e) {
                LOG.warn("Execution listener failed for cron job {}", job.id(), e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static final class PendingCompletion {
        private final ExecutionLogEntry entry;
        private final Instant earliestNextRun;
        private volatile boolean logged;

        private PendingCompletion(ExecutionLogEntry entry, Instant earliestNextRun) {
            this.entry = entry;
            this.earliestNextRun = earliestNextRun;
        }
    }
}
