package com.scrapesentinel.service.runtime;

import com.scrapesentinel.core.bus.CallbackDispatcher;
import com.scrapesentinel.core.error.FetchException;
import com.scrapesentinel.core.error.NotFoundException;
import com.scrapesentinel.core.error.ScrapeException;
import com.scrapesentinel.core.events.JobFailed;
import com.scrapesentinel.core.events.JobSucceeded;
import com.scrapesentinel.core.model.JobDefinition;
import com.scrapesentinel.core.model.JobHistoryEntry;
import com.scrapesentinel.core.model.JobState;
import com.scrapesentinel.core.model.JobStatus;
import com.scrapesentinel.core.model.SchedulerSummary;
import com.scrapesentinel.monitors.api.JobRunResult;
import com.scrapesentinel.monitors.api.JobRunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the recurring scrape jobs. A single coordinator thread ticks over the job table, hands due
 * jobs to the worker pool and collects their completions from a queue, so it never waits on a
 * running scrape. Callbacks for finished runs are delivered on one callback thread in completion
 * order.
 *
 * <p>State transitions:
 * <ul>
 *     <li>IDLE to RUNNING when due, by compare-and-set, so a job never runs twice at once;</li>
 *     <li>RUNNING to IDLE on success, due again one interval after completion;</li>
 *     <li>RUNNING to IDLE on a retryable failure while retries remain, due after the backoff;</li>
 *     <li>RUNNING to FAILED once retries are exhausted or the failure is not retryable;</li>
 *     <li>any state to CANCELLED through {@link #cancel(String)}.</li>
 * </ul>
 * FAILED and CANCELLED are terminal; a FAILED job only runs again after {@link #resume(String)}.
 *
 * <p>A run's writes to the shared stores are committed only when its completion is accepted, that
 * is when the job moves from RUNNING back to IDLE. A run that was cancelled or hit the execution
 * timeout never commits.
 */
public class JobScheduler {
    public static final int HISTORY_LIMIT = 10;

    private static final Logger LOGGER = Logger.getLogger(JobScheduler.class.getName());

    private final JobRunner runner;
    private final CallbackDispatcher dispatcher;
    private final Clock clock;
    private final SchedulerSettings settings;
    private final ScheduledExecutorService timerExecutor;
    private final Executor workerExecutor;
    private final Executor callbackExecutor;
    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicBoolean started = new AtomicBoolean();

    public JobScheduler(JobRunner runner, CallbackDispatcher dispatcher, Clock clock, SchedulerSettings settings) {
        this(
                runner,
                dispatcher,
                clock,
                settings,
                Executors.newSingleThreadScheduledExecutor(),
                Executors.newFixedThreadPool(settings.maxConcurrency()),
                Executors.newSingleThreadExecutor()
        );
    }

    JobScheduler(
            JobRunner runner,
            CallbackDispatcher dispatcher,
            Clock clock,
            SchedulerSettings settings,
            ScheduledExecutorService timerExecutor,
            Executor workerExecutor,
            Executor callbackExecutor
    ) {
        this.runner = runner;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.settings = settings;
        this.timerExecutor = timerExecutor;
        this.workerExecutor = workerExecutor;
        this.callbackExecutor = callbackExecutor;
    }

    /**
     * Registers the job, due immediately. The job id is the definition's name. A cancelled job whose
     * last run is still in flight can be replaced, but the replacement is not dispatched before that
     * run completes.
     *
     * @throws IllegalStateException if a job with that name is idle or running
     */
    public String schedule(JobDefinition definition) {
        String id = definition.name();
        Job created = new Job(definition, clock.instant());
        jobs.compute(id, (key, existing) -> {
            if (existing != null && !existing.state.get().terminal()) {
                throw new IllegalStateException("Job already scheduled: " + id);
            }
            if (existing != null) {
                created.predecessor = existing.executing ? existing : existing.predecessor;
            }
            return created;
        });
        LOGGER.info(() -> "Scheduled job " + id + " every " + definition.interval() + " for " + definition.target().url());
        return id;
    }

    /**
     * Marks the job cancelled. A run already in flight is left to finish; its outcome is recorded
     * but it neither reschedules the job nor reaches the callbacks.
     *
     * @return false if the job is unknown or already cancelled
     */
    public boolean cancel(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            return false;
        }
        JobState previous = job.state.getAndSet(JobState.CANCELLED);
        if (previous == JobState.CANCELLED) {
            return false;
        }
        LOGGER.info(() -> "Cancelled job " + jobId + " (was " + previous + ")");
        return true;
    }

    /**
     * Makes an idle job due now.
     *
     * @return false if the job is not idle
     */
    public boolean runNow(String jobId) {
        Job job = require(jobId);
        if (job.state.get() != JobState.IDLE) {
            return false;
        }
        job.nextDue = clock.instant();
        return true;
    }

    /**
     * Returns a failed job to the idle state with a fresh retry budget, due now.
     *
     * @return false if the job is not in the failed state
     */
    public boolean resume(String jobId) {
        Job job = require(jobId);
        if (job.state.get() != JobState.FAILED) {
            return false;
        }
        job.retryCount = 0;
        job.nextDue = clock.instant();
        boolean resumed = job.state.compareAndSet(JobState.FAILED, JobState.IDLE);
        if (resumed) {
            LOGGER.info(() -> "Resumed job " + jobId);
        }
        return resumed;
    }

    public List<JobStatus> getStatus() {
        List<JobStatus> statuses = new ArrayList<>();
        for (Job job : jobs.values()) {
            statuses.add(job.status());
        }
        statuses.sort(Comparator.comparing(JobStatus::id));
        return statuses;
    }

    public Optional<JobStatus> getStatus(String jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.status());
    }

    public SchedulerSummary summary() {
        int total = 0;
        int active = 0;
        int running = 0;
        int failed = 0;
        long runs = 0;
        long errors = 0;
        for (Job job : jobs.values()) {
            JobState state = job.state.get();
            total++;
            if (!state.terminal()) {
                active++;
            }
            if (state == JobState.RUNNING) {
                running++;
            } else if (state == JobState.FAILED) {
                failed++;
            }
            runs += job.runCount;
            errors += job.errorCount;
        }
        return new SchedulerSummary(started.get(), total, active, running, failed, runs, errors);
    }

    /**
     * Most recent runs first, at most {@value #HISTORY_LIMIT} entries.
     */
    public List<JobHistoryEntry> history(String jobId, int limit) {
        Job job = jobs.get(jobId);
        if (job == null || limit <= 0) {
            return List.of();
        }
        return job.recentHistory(Math.min(limit, HISTORY_LIMIT));
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Scheduler already started");
        }
        long tickMillis = settings.tickInterval().toMillis();
        timerExecutor.scheduleWithFixedDelay(this::safeTick, 0, tickMillis, TimeUnit.MILLISECONDS);
    }

    public void shutdown() {
        started.set(false);
        timerExecutor.shutdown();
        shutdownIfOwned(workerExecutor);
        shutdownIfOwned(callbackExecutor);
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            awaitIfOwned(workerExecutor);
            awaitIfOwned(callbackExecutor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One coordinator pass: records finished runs, flags overdue runs and dispatches due jobs while
     * worker capacity remains.
     */
    synchronized void tick() {
        drainCompletions();
        Instant now = clock.instant();
        List<Job> ordered = new ArrayList<>(jobs.values());
        ordered.sort(Comparator.comparing((Job job) -> job.nextDue).thenComparing(job -> job.id));
        for (Job job : ordered) {
            JobState state = job.state.get();
            if (state == JobState.RUNNING) {
                if (!job.overdue && !now.isBefore(job.nextDue)) {
                    job.overdue = true;
                    LOGGER.warning("Job " + job.id + " is still running past its next due time " + job.nextDue);
                }
                continue;
            }
            if (state != JobState.IDLE || now.isBefore(job.nextDue)) {
                continue;
            }
            if (job.awaitingPredecessor()) {
                LOGGER.fine(() -> "Job " + job.id + " waits for the previous run under its name to finish");
                continue;
            }
            if (inFlight.get() >= settings.maxConcurrency()) {
                LOGGER.fine(() -> "Concurrency limit reached; job " + job.id + " waits for the next tick");
                continue;
            }
            if (job.state.compareAndSet(JobState.IDLE, JobState.RUNNING)) {
                launch(job, now);
            }
        }
        drainCompletions();
    }

    static Duration backoff(Duration base, Duration cap, int retriesSpent) {
        Duration delay = base;
        for (int i = 0; i < retriesSpent; i++) {
            delay = delay.multipliedBy(2);
            if (delay.compareTo(cap) >= 0) {
                return cap;
            }
        }
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Scheduler tick failed", e);
        }
    }

    private void launch(Job job, Instant now) {
        inFlight.incrementAndGet();
        job.executing = true;
        job.nextDue = now.plus(job.definition.interval());
        job.lastRunAt = now;
        try {
            workerExecutor.execute(() -> execute(job, now));
        } catch (RejectedExecutionException e) {
            completions.add(new Completion(job, now, null, e));
        }
    }

    private void execute(Job job, Instant startedAt) {
        CompletableFuture<JobRunResult> run;
        try {
            run = runner.run(job.definition);
        } catch (RuntimeException e) {
            run = CompletableFuture.failedFuture(e);
        }
        run.orTimeout(settings.executionTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, error) -> completions.add(new Completion(job, startedAt, result, error)));
    }

    private void drainCompletions() {
        Completion completion;
        while ((completion = completions.poll()) != null) {
            inFlight.decrementAndGet();
            completion.job().executing = false;
            try {
                complete(completion);
            } catch (RuntimeException e) {
                LOGGER.log(Level.SEVERE, "Failed recording completion of job " + completion.job().id, e);
            }
        }
    }

    private void complete(Completion completion) {
        Job job = completion.job();
        Instant now = clock.instant();
        long durationMillis = Duration.between(completion.startedAt(), now).toMillis();
        job.runCount++;
        job.overdue = false;

        if (completion.error() != null) {
            fail(job, now, asFailure(job, unwrap(completion.error())), JobState.RUNNING);
            return;
        }

        JobRunResult result = completion.result();
        job.lastResult = result.message();
        if (!job.state.compareAndSet(JobState.RUNNING, JobState.IDLE)) {
            job.record(new JobHistoryEntry(now, true, result.message() + " (discarded after cancellation)"));
            LOGGER.info(() -> "Job " + job.id + " finished after cancellation; result discarded");
            return;
        }
        JobRunResult.Committed committed;
        try {
            committed = result.commit();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Committing the run of job " + job.id + " failed", e);
            fail(job, now, e, JobState.IDLE);
            return;
        }
        job.record(new JobHistoryEntry(now, true, result.message()));
        job.retryCount = 0;
        job.nextDue = now.plus(job.definition.interval());
        JobSucceeded succeeded = new JobSucceeded(now, job.id, result.message(), durationMillis, committed.stats());
        deliver(() -> {
            dispatcher.dispatchAll(committed.events());
            dispatcher.dispatch(succeeded);
        });
    }

    private void fail(Job job, Instant now, Throwable failure, JobState expected) {
        String message = failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
        job.errorCount++;
        job.lastError = message;
        job.lastResult = "Failed: " + message;
        job.record(new JobHistoryEntry(now, false, message));

        boolean retryable = failure instanceof ScrapeException scrapeFailure && scrapeFailure.retryable();
        int retries = job.retryCount + 1;
        boolean terminal = !retryable || retries >= job.definition.maxRetries();
        JobState next = terminal ? JobState.FAILED : JobState.IDLE;
        Instant nextDue = terminal
                ? null
                : now.plus(backoff(settings.backoffBase(), settings.backoffCap(), retries - 1));
        if (!job.state.compareAndSet(expected, next)) {
            LOGGER.info(() -> "Job " + job.id + " failed after cancellation; callbacks suppressed: " + message);
            return;
        }
        job.retryCount = retries;
        if (nextDue != null) {
            job.nextDue = nextDue;
        }
        if (terminal) {
            LOGGER.warning("Job " + job.id + " failed permanently after " + retries + " attempt(s): " + message);
        } else {
            LOGGER.info(() -> "Job " + job.id + " failed (attempt " + retries + "), retrying at " + nextDue + ": " + message);
        }
        JobFailed failed = new JobFailed(
                now,
                job.id,
                failure.getClass().getSimpleName(),
                message,
                retries,
                terminal,
                nextDue
        );
        deliver(() -> dispatcher.dispatch(failed));
    }

    private Throwable asFailure(Job job, Throwable error) {
        if (error instanceof TimeoutException) {
            return new FetchException(
                    job.definition.target().url(),
                    "Execution of job " + job.id + " timed out after " + settings.executionTimeout(),
                    error
            );
        }
        return error;
    }

    private void deliver(Runnable callbacks) {
        try {
            callbackExecutor.execute(callbacks);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.WARNING, "Callback executor rejected delivery", e);
        }
    }

    private Job require(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new NotFoundException("Unknown job: " + jobId);
        }
        return job;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static void shutdownIfOwned(Executor executor) {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    private static void awaitIfOwned(Executor executor) throws InterruptedException {
        if (executor instanceof ExecutorService service) {
            service.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private record Completion(Job job, Instant startedAt, JobRunResult result, Throwable error) {
    }

    private static final class Job {
        private final String id;
        private final JobDefinition definition;
        private final AtomicReference<JobState> state = new AtomicReference<>(JobState.IDLE);
        private final Deque<JobHistoryEntry> history = new ArrayDeque<>();
        private volatile Instant nextDue;
        private volatile int retryCount;
        private volatile boolean overdue;
        private volatile String lastResult;
        private volatile String lastError;
        private volatile Instant lastRunAt;
        private volatile int runCount;
        private volatile int errorCount;
        private volatile boolean executing;
        // earlier job under the same id whose run was still in flight when this one replaced it
        private volatile Job predecessor;

        private Job(JobDefinition definition, Instant firstDue) {
            this.id = definition.name();
            this.definition = definition;
            this.nextDue = firstDue;
        }

        private boolean awaitingPredecessor() {
            Job previous = predecessor;
            if (previous == null) {
                return false;
            }
            if (previous.executing) {
                return true;
            }
            predecessor = null;
            return false;
        }

        private JobStatus status() {
            JobState current = state.get();
            return new JobStatus(
                    id,
                    current,
                    current.terminal() ? null : nextDue,
                    lastResult,
                    retryCount,
                    definition.maxRetries(),
                    overdue,
                    runCount,
                    errorCount,
                    lastError,
                    lastRunAt
            );
        }

        private void record(JobHistoryEntry entry) {
            synchronized (history) {
                history.addFirst(entry);
                while (history.size() > HISTORY_LIMIT) {
                    history.removeLast();
                }
            }
        }

        private List<JobHistoryEntry> recentHistory(int limit) {
            synchronized (history) {
                return history.stream().limit(limit).toList();
            }
        }
    }
}
