package com.storyforge.orchestrator.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for RedisProgressRelay with a mocked Redis template: what goes out
 * on publish is fed back through onMessage, the way the pattern listener
 * would deliver it.
 */
@ExtendWith(MockitoExtension.class)
class RedisProgressRelayTest {

    private static final Duration LONG = Duration.ofSeconds(5);

    @Mock StringRedisTemplate                redisTemplate;
    @Mock ObjectProvider<RedisProgressRelay> relayProvider;

    final ObjectMapper objectMapper = new ObjectMapper();

    LocalProgressBroker broker;
    RedisProgressRelay  relay;
    UUID                projectId;

    @BeforeEach
    void setUp() {
        broker    = new LocalProgressBroker(relayProvider);
        relay     = new RedisProgressRelay(redisTemplate, broker, objectMapper);
        projectId = UUID.randomUUID();
    }

    @Test
    void publishedEvent_roundTripsToLocalSubscriber() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", LONG);
        when(relayProvider.getIfAvailable()).thenReturn(relay);

        broker.publish(projectId, "rewrite", ProgressEvent.error("upstream 503", 2));

        ArgumentCaptor<String> channel = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> body    = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(channel.capture(), body.capture());
        assertThat(channel.getValue()).isEqualTo("project:" + projectId + ":stage:rewrite");

        Map<?, ?> wire = objectMapper.readValue(body.getValue(), Map.class);
        assertThat(wire.get("type")).isEqualTo("error");
        assertThat(wire.get("project_id")).isEqualTo(projectId.toString());
        assertThat(wire.get("message")).isEqualTo("upstream 503");
        assertThat(wire.get("retry_count")).isEqualTo(2);

        // Nothing reaches the subscriber until Redis echoes the message back.
        relay.onMessage(message(channel.getValue(), body.getValue()), null);

        ProgressEvent received = sub.next().orElseThrow();
        assertThat(received.type()).isEqualTo(EventType.ERROR);
        assertThat(received.projectId()).isEqualTo(projectId);
        assertThat(received.stage()).isEqualTo("rewrite");
        assertThat(received.data()).containsEntry("message", "upstream 503")
                                   .containsEntry("retry_count", 2);
        assertThat(sub.next().orElseThrow().type()).isEqualTo(EventType.STREAM_END);
    }

    @Test
    void onMessage_stageEvent_reachesProjectWildcardToo() throws Exception {
        ProgressSubscription project = broker.subscribe(projectId, null, Duration.ofMillis(200));
        ProgressEvent event = ProgressEvent.token("Hi", "Hi").scopedTo(projectId, "rewrite");
        String body = objectMapper.writeValueAsString(event.toPayload());

        relay.onMessage(message("project:" + projectId + ":stage:rewrite", body), null);

        assertThat(project.next().orElseThrow().data()).containsEntry("full_text", "Hi");
    }

    @Test
    void onMessage_malformedBody_isDropped() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", Duration.ofMillis(200));

        assertThatCode(() -> relay.onMessage(message("project:" + projectId, "{not json"), null))
                .doesNotThrowAnyException();
        assertThatCode(() -> relay.onMessage(message("project:" + projectId,
                        "{\"type\":\"bogus\",\"project_id\":\"" + projectId + "\"}"), null))
                .doesNotThrowAnyException();

        assertThat(sub.next().orElseThrow().type()).isEqualTo(EventType.STREAM_END);
    }

    @Test
    void publish_redisDown_doesNotThrow() {
        when(redisTemplate.convertAndSend(anyString(), anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        assertThatCode(() -> relay.publish(ProgressEvent.done(Map.of("images", List.of()), null)
                .scopedTo(projectId, "image")))
                .doesNotThrowAnyException();
    }

    @Test
    void publish_withoutRelay_neverTouchesRedis() throws Exception {
        ProgressSubscription sub = broker.subscribe(projectId, "rewrite", LONG);

        broker.publish(projectId, "rewrite", ProgressEvent.token("a", "a"));

        assertThat(sub.next().orElseThrow().type()).isEqualTo(EventType.TOKEN);
        verify(redisTemplate, never()).convertAndSend(anyString(), anyString());
    }

    private static Message message(String channel, String body) {
        Message message = mock(Message.class);
        when(message.getBody()).thenReturn(body.getBytes(StandardCharsets.UTF_8));
        // Only read when the body is rejected.
        lenient().when(message.getChannel())
                .thenReturn(channel.getBytes(StandardCharsets.UTF_8));
        return message;
    }
}
