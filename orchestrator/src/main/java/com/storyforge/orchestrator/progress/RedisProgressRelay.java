package com.storyforge.orchestrator.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Carries progress events between instances over Redis pub/sub.
 *
 * Each event is published on its own channel key ({@code project:<id>} or
 * {@code project:<id>:stage:<stage>}); every instance listens on the
 * {@code project:*} pattern and hands what it receives to its local broker.
 * Registered by {@link RedisProgressConfig} only when Redis is enabled.
 */
public class RedisProgressRelay implements MessageListener {

    private static final Logger log = LoggerFactory.getLogger(RedisProgressRelay.class);

    private final StringRedisTemplate redisTemplate;
    private final LocalProgressBroker broker;
    private final ObjectMapper        objectMapper;

    public RedisProgressRelay(StringRedisTemplate redisTemplate,
                              LocalProgressBroker broker,
                              ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.broker        = broker;
        this.objectMapper  = objectMapper;
    }

    public void publish(ProgressEvent event) {
        String channel = ProgressChannels.channel(event.projectId(), event.stage());
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(event.toPayload()));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise progress event for {}", channel, e);
        } catch (RuntimeException e) {
            // Progress is fire-and-forget; a Redis outage must not fail the job.
            log.warn("Failed to publish progress event on {}: {}", channel, e.getMessage());
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        try {
            Map<String, Object> payload = objectMapper.readValue(body, new TypeReference<>() {});
            broker.deliverLocal(ProgressEvent.fromPayload(payload));
        } catch (Exception e) {
            log.error("Dropping malformed progress message from channel {}",
                    new String(message.getChannel(), StandardCharsets.UTF_8), e);
        }
    }
}
