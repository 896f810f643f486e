package com.storyforge.orchestrator.dispatch;

import com.storyforge.orchestrator.error.JobExecutionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative cancellation signal handed to every job.
 *
 * Cancelling only sets a flag. The job observes it when it next calls
 * {@link #checkpoint()}; a job that has passed its last checkpoint runs to
 * completion and reports back normally. The same checkpoints enforce the
 * soft time limit, which starts counting when the job is {@link #arm armed}.
 */
public class CancellationToken {

    private final Duration softTimeLimit;
    private final Clock    clock;

    private volatile boolean cancelled;
    private volatile Instant deadline;

    public CancellationToken(Duration softTimeLimit, Clock clock) {
        this.softTimeLimit = softTimeLimit;
        this.clock         = clock;
    }

    /** A token that is never cancelled and has no time limit. */
    public static CancellationToken none() {
        return new CancellationToken(null, Clock.systemUTC());
    }

    public void cancel() {
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Start the soft time limit clock. Called by the dispatcher when the job starts running. */
    public void arm() {
        if (softTimeLimit != null) {
            this.deadline = clock.instant().plus(softTimeLimit);
        }
    }

    /**
     * @throws JobCancelledException if the job was cancelled
     * @throws JobExecutionException with category SOFT_TIMEOUT once the soft limit has passed
     */
    public void checkpoint() {
        if (cancelled) {
            throw new JobCancelledException("Job cancelled");
        }
        Instant d = deadline;
        if (d != null && clock.instant().isAfter(d)) {
            throw new JobExecutionException(JobExecutionException.Category.SOFT_TIMEOUT,
                    "Soft time limit of " + softTimeLimit.toSeconds() + "s exceeded");
        }
    }
}
