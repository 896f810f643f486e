package com.storyforge.orchestrator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;
import com.storyforge.orchestrator.progress.ProgressSubscription;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bridges a {@link ProgressSubscription} to a Server-Sent Events response.
 *
 * Each stream is pumped by its own thread: {@code connected} first, then
 * one {@code data: <json>} frame per event, ending with {@code stream_end}.
 * Subscribe before dispatching work so no early event is missed.
 */
@Component
public class ProgressStreamer {

    private static final Logger log = LoggerFactory.getLogger(ProgressStreamer.class);

    private final ProgressPublisher publisher;
    private final ObjectMapper      json;
    private final Duration          stageTimeout;
    private final Duration          projectTimeout;
    private final ExecutorService   pumps = Executors.newCachedThreadPool(new CustomizableThreadFactory("sse-"));

    public ProgressStreamer(ProgressPublisher publisher,
                            ObjectMapper json,
                            @Value("${storyforge.progress.stage-timeout:PT10M}") Duration stageTimeout,
                            @Value("${storyforge.progress.project-timeout:PT30M}") Duration projectTimeout) {
        this.publisher      = publisher;
        this.json           = json;
        this.stageTimeout   = stageTimeout;
        this.projectTimeout = projectTimeout;
    }

    /** Subscribe to one stage, or to the whole project when {@code stage} is null. */
    public ProgressSubscription subscribe(UUID projectId, String stage) {
        return publisher.subscribe(projectId, stage, stage == null ? projectTimeout : stageTimeout);
    }

    public SseEmitter stream(ProgressSubscription subscription) {
        Duration idle = subscription.isWildcard() ? projectTimeout : stageTimeout;
        // The subscription ends the stream on idle; the emitter limit is only a backstop.
        SseEmitter emitter = new SseEmitter(idle.multipliedBy(2).toMillis());
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());
        pumps.execute(() -> pump(subscription, emitter));
        return emitter;
    }

    void pump(ProgressSubscription subscription, SseEmitter emitter) {
        try {
            String message = subscription.isWildcard()
                    ? "Listening to project " + subscription.projectId()
                    : "Listening to stage " + subscription.stage();
            send(emitter, ProgressEvent.connected(message)
                    .scopedTo(subscription.projectId(), subscription.stage()));
            Optional<ProgressEvent> next;
            while ((next = subscription.next()).isPresent()) {
                send(emitter, next.get());
            }
            emitter.complete();
        } catch (IOException e) {
            log.debug("SSE client for project {} went away: {}", subscription.projectId(), e.getMessage());
            subscription.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            emitter.complete();
        }
    }

    private void send(SseEmitter emitter, ProgressEvent event) throws IOException {
        try {
            emitter.send(SseEmitter.event().data(json.writeValueAsString(event.toPayload())));
        } catch (JsonProcessingException e) {
            log.warn("Dropping unencodable {} event: {}", event.type().value(), e.getOriginalMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        pumps.shutdownNow();
    }
}
