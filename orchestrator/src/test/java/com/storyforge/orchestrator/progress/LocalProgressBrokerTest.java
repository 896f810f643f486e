package com.storyforge.orchestrator.progress;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for LocalProgressBroker without Redis: the relay provider mock
 * returns null, so delivery is direct.
 */
@ExtendWith(MockitoExtension.class)
class LocalProgressBrokerTest {

    private static final Duration SHORT = Duration.ofMillis(200);
    private static final Duration LONG  = Duration.ofSeconds(5);

    @Mock ObjectProvider<RedisProgressRelay> relayProvider;

    LocalProgressBroker broker;
    UUID                projectId;

    @BeforeEach
    void setUp() {
        broker    = new LocalProgressBroker(relayProvider);
        projectId = UUID.randomUUID();
    }

    // ------------------------------------------------------------------
    // Stage channel
    // ------------------------------------------------------------------

    @Test
    void stageSubscription_receivesEventsInOrder_thenEndsAfterDone() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", LONG);

        for (int i = 1; i <= 4; i++) {
            broker.publish(projectId, "rewrite", ProgressEvent.token("t" + i, "t1..t" + i));
        }
        broker.publish(projectId, "rewrite", ProgressEvent.done(Map.of("text", "final"), null));

        List<ProgressEvent> events = drain(sub);

        assertThat(events).extracting(ProgressEvent::type).containsExactly(
                EventType.TOKEN, EventType.TOKEN, EventType.TOKEN, EventType.TOKEN,
                EventType.DONE, EventType.STREAM_END);
        assertThat(events.get(0).data()).containsEntry("content", "t1");
        assertThat(events.get(3).data()).containsEntry("content", "t4");
        assertThat(sub.next()).isEmpty();
        assertThat(sub.isClosed()).isTrue();
        assertThat(broker.subscriberCount(ProgressChannels.channel(projectId, "rewrite"))).isZero();
    }

    @Test
    void stageSubscription_endsAfterError() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "storyboard", LONG);

        broker.publish(projectId, "storyboard", ProgressEvent.error("upstream down", 1));
        broker.publish(projectId, "storyboard", ProgressEvent.stageUpdate("processing", 0, "retrying"));

        assertThat(drain(sub)).extracting(ProgressEvent::type)
                .containsExactly(EventType.ERROR, EventType.STREAM_END);
    }

    @Test
    void publish_stampsProjectAndStage() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", LONG);

        broker.publish(projectId, "rewrite", ProgressEvent.stageUpdate("processing", 10, "go"));

        ProgressEvent event = sub.next().orElseThrow();
        assertThat(event.projectId()).isEqualTo(projectId);
        assertThat(event.stage()).isEqualTo("rewrite");
        sub.close();
    }

    @Test
    void otherStagesAndProjects_areNotDelivered() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", SHORT);

        broker.publish(projectId, "storyboard", ProgressEvent.stageUpdate("processing", 0, "x"));
        broker.publish(UUID.randomUUID(), "rewrite", ProgressEvent.stageUpdate("processing", 0, "y"));

        assertThat(drain(sub)).extracting(ProgressEvent::type).containsExactly(EventType.STREAM_END);
    }

    @Test
    void lateSubscriber_seesNoReplay() throws Exception {
        broker.publish(projectId, "rewrite", ProgressEvent.token("early", "early"));

        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", SHORT);

        assertThat(drain(sub)).extracting(ProgressEvent::type).containsExactly(EventType.STREAM_END);
    }

    // ------------------------------------------------------------------
    // Project wildcard
    // ------------------------------------------------------------------

    @Test
    void wildcard_seesEveryStage_ignoresDone_endsOnIdleTimeout() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, null, SHORT);

        broker.publish(projectId, "rewrite", ProgressEvent.done(Map.of(), null));
        broker.publish(projectId, "storyboard", ProgressEvent.stageUpdate("processing", 0, "next"));

        List<ProgressEvent> events = drain(sub);

        assertThat(sub.isWildcard()).isTrue();
        assertThat(events).extracting(ProgressEvent::type)
                .containsExactly(EventType.DONE, EventType.STAGE_UPDATE, EventType.STREAM_END);
        assertThat(events).extracting(ProgressEvent::stage)
                .containsExactly("rewrite", "storyboard", null);
    }

    @Test
    void close_detachesSubscription() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", LONG);
        String channel = ProgressChannels.channel(projectId, "rewrite");
        assertThat(broker.subscriberCount(channel)).isEqualTo(1);

        sub.close();
        broker.publish(projectId, "rewrite", ProgressEvent.token("x", "x"));

        assertThat(broker.subscriberCount(channel)).isZero();
        assertThat(sub.next()).map(ProgressEvent::type).contains(EventType.STREAM_END);
        assertThat(sub.next()).isEmpty();
    }

    @Test
    void subscribeRacingLastUnsubscribe_neverLosesSubscription() throws Exception {
        String channel = ProgressChannels.channel(projectId, "rewrite");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<ProgressSubscription>> kept = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                kept.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < 200; i++) {
                        broker.subscribe(projectId, "rewrite", LONG).close();
                    }
                    return broker.subscribe(projectId, "rewrite", LONG);
                }));
            }
            go.countDown();
            List<ProgressSubscription> subs = new ArrayList<>();
            for (Future<ProgressSubscription> f : kept) {
                subs.add(f.get(10, TimeUnit.SECONDS));
            }

            assertThat(broker.subscriberCount(channel)).isEqualTo(threads);
            broker.publish(projectId, "rewrite", ProgressEvent.token("x", "x"));
            for (ProgressSubscription sub : subs) {
                assertThat(sub.next()).map(ProgressEvent::type).contains(EventType.TOKEN);
                sub.close();
            }
        } finally {
            pool.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Wire format
    // ------------------------------------------------------------------

    @Test
    void channel_format() {
        UUID id = UUID.fromString("00000000-0000-0000-0000-000000000042");

        assertThat(ProgressChannels.channel(id, "image_generation"))
                .isEqualTo("project:00000000-0000-0000-0000-000000000042:stage:image_generation");
        assertThat(ProgressChannels.channel(id, null))
                .isEqualTo("project:00000000-0000-0000-0000-000000000042");
    }

    @Test
    void toPayload_flattensDataUnderEnvelope() {
        ProgressEvent event = ProgressEvent.progress(2, 5, "shot 2").scopedTo(projectId, "image_generation");

        Map<String, Object> payload = event.toPayload();

        assertThat(payload).containsEntry("type", "progress")
                .containsEntry("project_id", projectId.toString())
                .containsEntry("stage", "image_generation")
                .containsEntry("current", 2)
                .containsEntry("total", 5)
                .containsEntry("item_name", "shot 2")
                .containsKey("timestamp");
        assertThat(ProgressEvent.fromPayload(payload).data()).containsEntry("item_name", "shot 2");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<ProgressEvent> drain(ProgressSubscription sub) throws InterruptedException {
        List<ProgressEvent> events = new ArrayList<>();
        Optional<ProgressEvent> next;
        while ((next = sub.next()).isPresent()) {
            events.add(next.get());
        }
        return events;
    }
}
