package com.aistudio.orchestrator.service;

import com.aistudio.orchestrator.agent.CancellationToken;
import com.aistudio.orchestrator.model.BriefCard;
import com.aistudio.orchestrator.model.Job;
import com.aistudio.orchestrator.model.JobStatus;
import com.aistudio.orchestrator.model.JobType;
import com.aistudio.orchestrator.model.ResumeDecision;
import com.aistudio.orchestrator.model.Resumption;
import com.aistudio.orchestrator.repository.JobStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Authoritative registry of background jobs and the only place job state changes.
 *
 * Every mutation runs under one lock and swaps in a new immutable {@link Job}
 * snapshot, so status, progress and result/error always change together.
 * Listeners are notified after the lock is released, one snapshot at a time
 * and in commit order; a snapshot already superseded by a newer one for the
 * same job is not delivered.
 *
 * A job's deadline clock stops while it awaits input: the remaining budget
 * is set aside on pause and a fresh deadline is computed from it on resume.
 *
 * State machine:
 * <pre>
 *   queued         → running          startJob
 *   running        → running          updateProgress / reportStep
 *   running        → completed        completeJob
 *   running        → failed           failJob
 *   running        → awaiting_input   pauseForInput
 *   awaiting_input → running          resumeWithInput (approve / edit)
 *   awaiting_input → cancelled        resumeWithInput (cancel)
 *   non-terminal   → cancelled        cancelJob (cancelable jobs only)
 * </pre>
 * Anything else throws {@link InvalidTransitionException}.
 */
@Service
public class JobQueueManager {

    private static final Logger log = LoggerFactory.getLogger(JobQueueManager.class);

    public static final String DEADLINE_EXCEEDED = "DeadlineExceeded";

    private static final Set<JobStatus> RUNNING        = EnumSet.of(JobStatus.RUNNING);
    private static final Set<JobStatus> NON_TERMINAL   =
            EnumSet.of(JobStatus.QUEUED, JobStatus.RUNNING, JobStatus.AWAITING_INPUT);

    private final Object lock        = new Object();
    private final Object publishLock = new Object();

    // guarded by lock
    private long                        sequence;
    private final Map<String, Duration> pausedBudgets = new HashMap<>();

    // guarded by publishLock
    private final Map<String, Long> lastPublished = new HashMap<>();

    private final JobStore                jobStore;
    private final List<JobUpdateListener> listeners;
    private final MeterRegistry           meterRegistry;
    private final Duration                defaultTimeout;
    private final Clock                   clock;

    @Autowired
    public JobQueueManager(JobStore jobStore,
                           List<JobUpdateListener> listeners,
                           MeterRegistry meterRegistry,
                           @Value("${ai-studio.jobs.default-timeout-minutes:0}") long defaultTimeoutMinutes) {
        this(jobStore, listeners, meterRegistry,
                defaultTimeoutMinutes > 0 ? Duration.ofMinutes(defaultTimeoutMinutes) : null,
                Clock.systemUTC());
    }

    JobQueueManager(JobStore jobStore,
                    List<JobUpdateListener> listeners,
                    MeterRegistry meterRegistry,
                    Duration defaultTimeout,
                    Clock clock) {
        this.jobStore       = jobStore;
        this.listeners      = List.copyOf(listeners);
        this.meterRegistry  = meterRegistry;
        this.defaultTimeout = defaultTimeout;
        this.clock          = clock;
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    public String createJob(JobType type, String title, String description) {
        return createJob(type, title, description, 1, true, Map.of(), null);
    }

    public String createJob(JobType type, String title, String description, int totalSteps) {
        return createJob(type, title, description, totalSteps, true, Map.of(), null);
    }

    /**
     * Register a new QUEUED job.
     *
     * @param timeout optional run-time limit; null falls back to the configured default
     * @return the new job id
     */
    public String createJob(JobType type, String title, String description, int totalSteps,
                            boolean cancelable, Map<String, Object> metadata, Duration timeout) {
        Instant now = clock.instant();
        Duration effectiveTimeout = timeout != null ? timeout : defaultTimeout;
        Job job = Job.newJob(UUID.randomUUID().toString(), type, title, description,
                totalSteps, cancelable, copyOf(metadata), now,
                effectiveTimeout == null ? null : now.plus(effectiveTimeout));

        long seq;
        synchronized (lock) {
            jobStore.put(job);
            seq = ++sequence;
        }
        countTransition(job.status());
        log.info("Created job {} ({}: '{}', steps={})", job.id(), type.wireName(), title, job.stepsTotal());
        publish(job, seq);
        return job.id();
    }

    public Job getJob(String jobId) {
        synchronized (lock) {
            return require(jobId);
        }
    }

    /**
     * Jobs newest first.
     *
     * @param status only jobs in this state, or null for all
     */
    public List<Job> listJobs(JobStatus status, int limit) {
        List<Job> all;
        synchronized (lock) {
            all = new ArrayList<>(jobStore.all());
        }
        return all.stream()
                .filter(j -> status == null || j.status() == status)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .limit(Math.max(limit, 0))
                .toList();
    }

    // ------------------------------------------------------------------
    // Running
    // ------------------------------------------------------------------

    public Job startJob(String jobId) {
        Job job = transition(jobId, "start", EnumSet.of(JobStatus.QUEUED), d -> {
            d.status          = JobStatus.RUNNING;
            d.startedAt       = clock.instant();
            d.progressMessage = "Started";
        });
        log.info("Job {} started", jobId);
        return job;
    }

    /**
     * Record progress on a running job.
     *
     * The value is clamped to [0, 1]; a value lower than the current one keeps
     * the current progress but still updates the message and step.
     */
    public Job updateProgress(String jobId, double progress, String message, String currentStep) {
        return transition(jobId, "update progress of", RUNNING, d -> {
            d.progress        = Math.max(d.progress, clamp(progress));
            d.progressMessage = message;
            if (currentStep != null) d.currentStep = currentStep;
        });
    }

    /** Progress for the start of step {@code stepNumber} (1-based) of {@code stepsTotal}. */
    public Job reportStep(String jobId, int stepNumber, String stepId, String message) {
        return transition(jobId, "report step of", RUNNING, d -> {
            int completed     = Math.max(0, Math.min(stepNumber - 1, d.stepsTotal));
            d.stepsCompleted  = Math.max(d.stepsCompleted, completed);
            d.progress        = Math.max(d.progress, clamp((double) completed / d.stepsTotal));
            d.currentStep     = stepId;
            d.progressMessage = message;
        });
    }

    public Job completeJob(String jobId, Map<String, Object> result) {
        Job job = transition(jobId, "complete", RUNNING, d -> {
            d.status          = JobStatus.COMPLETED;
            d.result          = copyOf(result);
            d.progress        = 1.0;
            d.stepsCompleted  = d.stepsTotal;
            d.progressMessage = "Completed";
            d.completedAt     = clock.instant();
        });
        log.info("Job {} completed", jobId);
        return job;
    }

    public Job failJob(String jobId, String error) {
        return failJob(jobId, error, "Error");
    }

    public Job failJob(String jobId, Throwable cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return failJob(jobId, message, cause.getClass().getSimpleName());
    }

    public Job failJob(String jobId, String error, String errorType) {
        Job job = transition(jobId, "fail", RUNNING, d -> {
            d.status          = JobStatus.FAILED;
            d.error           = error;
            d.errorType       = errorType;
            d.progressMessage = "Failed";
            d.completedAt     = clock.instant();
        });
        log.error("Job {} FAILED ({}): {}", jobId, errorType, error);
        return job;
    }

    /**
     * Cancel a job that has not finished yet.
     *
     * Only flips the state; a running task notices through its
     * {@link #cancellationToken} and stops at its next check.
     */
    public Job cancelJob(String jobId) {
        Job job = transition(jobId, "cancel", NON_TERMINAL, d -> {
            if (!d.cancelable) {
                throw new InvalidTransitionException(jobId, d.status, "Job " + jobId + " is not cancelable");
            }
            d.status          = JobStatus.CANCELLED;
            d.awaitingData    = null;
            d.briefCard       = null;
            d.progressMessage = "Cancelled";
            pausedBudgets.remove(jobId);
            d.completedAt     = clock.instant();
        });
        log.info("Job {} cancelled", jobId);
        return job;
    }

    // ------------------------------------------------------------------
    // Human-in-the-loop
    // ------------------------------------------------------------------

    public Job pauseForInput(String jobId, Map<String, Object> awaitingData, BriefCard briefCard) {
        if (awaitingData == null) {
            throw new IllegalArgumentException("awaitingData is required to pause job " + jobId);
        }
        Job job = transition(jobId, "pause", RUNNING, d -> {
            if (d.deadline != null) {
                Duration left = Duration.between(clock.instant(), d.deadline);
                pausedBudgets.put(jobId, left.isNegative() ? Duration.ZERO : left);
                d.deadline = null;
            }
            d.status          = JobStatus.AWAITING_INPUT;
            d.awaitingData    = copyOf(awaitingData);
            d.briefCard       = briefCard;
            d.progressMessage = briefCard != null ? briefCard.title() : "Awaiting input";
        });
        log.info("Job {} awaiting input", jobId);
        return job;
    }

    /**
     * Apply a human decision to a paused job.
     *
     * Approve and edit move the job back to RUNNING; cancel ends it. Either way
     * the awaiting data is handed back in the {@link Resumption} and cleared
     * from the job in the same atomic step, so only one caller can ever act on
     * a given proposal.
     */
    public Resumption resumeWithInput(String jobId, ResumeDecision decision) {
        AtomicReference<Map<String, Object>> proposal = new AtomicReference<>();
        Job job = transition(jobId, "resume", EnumSet.of(JobStatus.AWAITING_INPUT), d -> {
            proposal.set(d.awaitingData);
            d.userInput    = decision.toUserInput();
            d.awaitingData = null;
            d.briefCard    = null;
            Duration left  = pausedBudgets.remove(jobId);
            if (decision.proceeds()) {
                if (left != null) d.deadline = clock.instant().plus(left);
                d.status          = JobStatus.RUNNING;
                d.progressMessage = "Resumed (" + decision.action().wireName() + ")";
            } else {
                d.status          = JobStatus.CANCELLED;
                d.progressMessage = "Cancelled by user";
                d.completedAt     = clock.instant();
            }
        });
        log.info("Job {} resumed with action '{}' → {}", jobId, decision.action().wireName(), job.status().wireName());
        return new Resumption(job, proposal.get(), decision);
    }

    // ------------------------------------------------------------------
    // Cancellation and deadlines
    // ------------------------------------------------------------------

    /**
     * Token that reports cancellation once the job is terminal (cancelled, or
     * finished by someone else), has been deleted, or is past its deadline.
     */
    public CancellationToken cancellationToken(String jobId) {
        return () -> {
            Job job;
            synchronized (lock) {
                job = jobStore.get(jobId).orElse(null);
            }
            return job == null || job.isTerminal() || job.isPastDeadline(clock.instant());
        };
    }

    /**
     * Fail every RUNNING job whose deadline has passed. Jobs awaiting input are
     * exempt: a pending human decision has no timeout.
     *
     * @return number of jobs failed
     */
    public int expireOverdueJobs() {
        Instant now = clock.instant();
        List<String> overdue;
        synchronized (lock) {
            overdue = jobStore.all().stream()
                    .filter(j -> j.status() == JobStatus.RUNNING && j.isPastDeadline(now))
                    .map(Job::id)
                    .toList();
        }
        int expired = 0;
        for (String jobId : overdue) {
            if (expireIfOverdue(jobId)) expired++;
        }
        return expired;
    }

    /**
     * Fail the job with {@value #DEADLINE_EXCEEDED} if it is RUNNING and past
     * its deadline. Used by tasks that stopped on their cancellation token.
     *
     * @return true if this call failed the job
     */
    public boolean expireIfOverdue(String jobId) {
        try {
            Job job = transition(jobId, "expire", RUNNING, d -> {
                if (d.base.isPastDeadline(clock.instant())) {
                    d.status          = JobStatus.FAILED;
                    d.error           = "Job exceeded its deadline";
                    d.errorType       = DEADLINE_EXCEEDED;
                    d.progressMessage = "Failed";
                    d.completedAt     = clock.instant();
                }
            });
            if (job.status() == JobStatus.FAILED) {
                log.error("Job {} FAILED ({}): {}", jobId, DEADLINE_EXCEEDED, job.error());
                return true;
            }
            return false;
        } catch (InvalidTransitionException | JobNotFoundException e) {
            // finished or removed in the meantime
            log.debug("Job {} not expired: {}", jobId, e.getMessage());
            return false;
        }
    }

    // ------------------------------------------------------------------
    // Deletion and retention
    // ------------------------------------------------------------------

    /** Remove a finished job. Unfinished jobs must be cancelled first. */
    public void deleteJob(String jobId) {
        synchronized (lock) {
            Job job = require(jobId);
            if (!job.isTerminal()) {
                log.warn("Rejected delete of job {} in state '{}'", jobId, job.status().wireName());
                throw new InvalidTransitionException(jobId, "delete", job.status());
            }
            jobStore.remove(jobId);
        }
        forgetPublished(List.of(jobId));
        log.info("Job {} deleted", jobId);
    }

    /**
     * Drop terminal jobs that finished more than {@code maxAge} ago.
     *
     * @return number of jobs removed
     */
    public int cleanupOldJobs(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        List<String> removedIds = new ArrayList<>();
        synchronized (lock) {
            for (Job job : jobStore.all()) {
                if (job.isTerminal() && job.completedAt() != null && job.completedAt().isBefore(cutoff)) {
                    jobStore.remove(job.id());
                    removedIds.add(job.id());
                }
            }
        }
        forgetPublished(removedIds);
        int removed = removedIds.size();
        if (removed > 0) {
            log.info("Removed {} jobs finished before {}", removed, cutoff);
        }
        return removed;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job transition(String jobId, String operation, Set<JobStatus> allowedFrom, Consumer<Draft> change) {
        Job before;
        Job after;
        long seq;
        synchronized (lock) {
            before = require(jobId);
            if (!allowedFrom.contains(before.status())) {
                log.warn("Rejected {} on job {} in state '{}'", operation, jobId, before.status().wireName());
                throw new InvalidTransitionException(jobId, operation, before.status());
            }
            Draft draft = new Draft(before);
            change.accept(draft);
            after = draft.build();
            jobStore.put(after);
            seq = ++sequence;
        }
        if (after.status() != before.status()) {
            countTransition(after.status());
        }
        publish(after, seq);
        return after;
    }

    private Job require(String jobId) {
        return jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Deliver a committed snapshot to every listener unless a later commit for
     * the same job has already been delivered. A listener that changes the job
     * itself publishes the newer snapshot first; the rest of this delivery is
     * then dropped.
     */
    private void publish(Job job, long seq) {
        synchronized (publishLock) {
            Long last = lastPublished.get(job.id());
            if (last != null && last > seq) {
                log.debug("Dropping stale update #{} for job {} (already sent #{})", seq, job.id(), last);
                return;
            }
            lastPublished.put(job.id(), seq);
            for (JobUpdateListener listener : listeners) {
                if (lastPublished.getOrDefault(job.id(), seq) != seq) {
                    return;
                }
                try {
                    listener.onJobUpdated(job);
                } catch (RuntimeException e) {
                    log.warn("Job update listener {} failed for job {}: {}",
                            listener.getClass().getSimpleName(), job.id(), e.getMessage());
                }
            }
        }
    }

    private void forgetPublished(List<String> jobIds) {
        if (jobIds.isEmpty()) return;
        synchronized (publishLock) {
            jobIds.forEach(lastPublished::remove);
        }
    }

    private void countTransition(JobStatus status) {
        meterRegistry.counter("aistudio.jobs.transitions", "status", status.wireName()).increment();
    }

    private static double clamp(double progress) {
        if (Double.isNaN(progress)) return 0.0;
        return Math.max(0.0, Math.min(1.0, progress));
    }

    // Values may be null, so Map.copyOf is not an option.
    private static Map<String, Object> copyOf(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /** Mutable working copy of a snapshot, used only inside {@link #transition}. */
    private static final class Draft {
        private final Job base;

        JobStatus           status;
        double              progress;
        String              currentStep;
        int                 stepsTotal;
        int                 stepsCompleted;
        String              progressMessage;
        Map<String, Object> result;
        String              error;
        String              errorType;
        Map<String, Object> awaitingData;
        BriefCard           briefCard;
        Map<String, Object> userInput;
        boolean             cancelable;
        Instant             startedAt;
        Instant             completedAt;
        Instant             deadline;

        Draft(Job job) {
            this.base            = job;
            this.status          = job.status();
            this.progress        = job.progress();
            this.currentStep     = job.currentStep();
            this.stepsTotal      = job.stepsTotal();
            this.stepsCompleted  = job.stepsCompleted();
            this.progressMessage = job.progressMessage();
            this.result          = job.result();
            this.error           = job.error();
            this.errorType       = job.errorType();
            this.awaitingData    = job.awaitingData();
            this.briefCard       = job.briefCard();
            this.userInput       = job.userInput();
            this.cancelable      = job.cancelable();
            this.startedAt       = job.startedAt();
            this.completedAt     = job.completedAt();
            this.deadline        = job.deadline();
        }

        Job build() {
            return new Job(base.id(), base.type(), status, base.title(), base.description(),
                    progress, currentStep, stepsTotal, stepsCompleted, progressMessage,
                    result, error, errorType,
                    awaitingData, briefCard, userInput,
                    base.metadata(), cancelable,
                    base.createdAt(), startedAt, completedAt, deadline);
        }
    }
}
