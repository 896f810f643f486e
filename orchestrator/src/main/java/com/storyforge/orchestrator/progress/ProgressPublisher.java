package com.storyforge.orchestrator.progress;

import java.time.Duration;
import java.util.UUID;

/**
 * Real-time progress fan-out keyed by project and optionally stage.
 *
 * Delivery is at-most-once with no replay: a subscriber only sees events
 * published after it subscribed. Events published for one stage reach its
 * subscribers in publish order; nothing is promised across stages.
 */
public interface ProgressPublisher {

    /**
     * Publish {@code event} on the stage channel (or the project channel when
     * {@code stage} is null). Wildcard subscribers of the project see both.
     * Never throws; delivery failures are logged and dropped.
     */
    void publish(UUID projectId, String stage, ProgressEvent event);

    /**
     * Open a subscription. A stage subscription ends after done/error; a
     * wildcard subscription ({@code stage == null}) ends only when
     * {@code idleTimeout} passes without traffic.
     */
    ProgressSubscription subscribe(UUID projectId, String stage, Duration idleTimeout);
}
