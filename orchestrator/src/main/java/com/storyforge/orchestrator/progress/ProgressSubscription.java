package com.storyforge.orchestrator.progress;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * A live feed of events for one channel, read by a single consumer thread.
 *
 * {@link #next()} blocks up to the idle timeout. The feed always finishes
 * with exactly one {@code stream_end} event, after which {@code next()}
 * returns empty and the subscription is detached from its broker.
 */
public class ProgressSubscription implements AutoCloseable {

    private final UUID     projectId;
    private final String   stage;
    private final Duration idleTimeout;
    private final Consumer<ProgressSubscription> onClose;

    private final BlockingQueue<ProgressEvent> queue = new LinkedBlockingQueue<>();

    private volatile boolean closed;
    private boolean terminalSeen;
    private boolean ended;

    ProgressSubscription(UUID projectId, String stage, Duration idleTimeout,
                         Consumer<ProgressSubscription> onClose) {
        this.projectId   = projectId;
        this.stage       = stage;
        this.idleTimeout = idleTimeout;
        this.onClose     = onClose;
    }

    public UUID    projectId()  { return projectId; }
    public String  stage()      { return stage; }
    public boolean isWildcard() { return stage == null; }
    public boolean isClosed()   { return closed; }

    /** Called by the broker on the publishing thread. */
    void deliver(ProgressEvent event) {
        if (!closed) {
            queue.offer(event);
        }
    }

    /**
     * Next event, or empty once the stream has ended.
     *
     * @throws InterruptedException if the reading thread is interrupted while waiting
     */
    public Optional<ProgressEvent> next() throws InterruptedException {
        if (ended) {
            return Optional.empty();
        }
        if (terminalSeen || closed) {
            return Optional.of(end());
        }
        ProgressEvent event = queue.poll(idleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (event == null) {
            return Optional.of(end());
        }
        if (!isWildcard() && event.type().isTerminal()) {
            terminalSeen = true;
        }
        return Optional.of(event);
    }

    private ProgressEvent end() {
        ended = true;
        close();
        return ProgressEvent.streamEnd(projectId, stage);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            queue.clear();
            onClose.accept(this);
        }
    }
}
