package com.storyforge.orchestrator.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.PatternTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

/**
 * Cross-instance progress delivery. Enabled with
 * {@code storyforge.progress.redis.enabled=true}; without it every instance
 * only serves the subscribers of jobs it runs itself.
 */
@Configuration
@ConditionalOnProperty(prefix = "storyforge.progress.redis", name = "enabled", havingValue = "true")
public class RedisProgressConfig {

    @Bean
    public RedisProgressRelay redisProgressRelay(StringRedisTemplate redisTemplate,
                                                 LocalProgressBroker broker,
                                                 ObjectMapper objectMapper) {
        return new RedisProgressRelay(redisTemplate, broker, objectMapper);
    }

    @Bean
    public RedisMessageListenerContainer progressListenerContainer(RedisConnectionFactory connectionFactory,
                                                                  RedisProgressRelay relay) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relay, new PatternTopic(ProgressChannels.PATTERN));
        return container;
    }
}
