package com.storyforge.orchestrator.progress;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Default {@link ProgressPublisher}: keeps subscriptions of this instance in
 * memory and hands each published event to every matching one.
 *
 * When a {@link RedisProgressRelay} is configured, publishing goes through
 * Redis instead so subscribers attached to other instances see the event;
 * the relay calls {@link #deliverLocal} on every instance, this one included.
 * Without Redis, delivery is direct.
 */
@Component
public class LocalProgressBroker implements ProgressPublisher {

    private static final Logger log = LoggerFactory.getLogger(LocalProgressBroker.class);

    private final Map<String, Set<ProgressSubscription>> subscriptions = new ConcurrentHashMap<>();
    private final ObjectProvider<RedisProgressRelay> relayProvider;

    public LocalProgressBroker(ObjectProvider<RedisProgressRelay> relayProvider) {
        this.relayProvider = relayProvider;
    }

    @Override
    public void publish(UUID projectId, String stage, ProgressEvent event) {
        ProgressEvent scoped = event.scopedTo(projectId, stage);
        RedisProgressRelay relay = relayProvider.getIfAvailable();
        log.debug("Publishing {} on {} via {}", scoped.type().value(),
                ProgressChannels.channel(projectId, stage), relay != null ? "Redis" : "Direct");
        if (relay != null) {
            relay.publish(scoped);
        } else {
            deliverLocal(scoped);
        }
    }

    @Override
    public ProgressSubscription subscribe(UUID projectId, String stage, Duration idleTimeout) {
        String channel = ProgressChannels.channel(projectId, stage);
        ProgressSubscription sub = new ProgressSubscription(projectId, stage, idleTimeout,
                s -> unsubscribe(channel, s));
        // Add inside compute so a concurrent unsubscribe cannot drop the set
        // between lookup and add.
        subscriptions.compute(channel, (k, subs) -> {
            Set<ProgressSubscription> target = subs == null ? new CopyOnWriteArraySet<>() : subs;
            target.add(sub);
            return target;
        });
        log.debug("Subscribed to {} (timeout={})", channel, idleTimeout);
        return sub;
    }

    /**
     * Hand an already-scoped event to the subscribers of this instance: the
     * stage channel's subscribers first, then the project wildcard's.
     */
    public void deliverLocal(ProgressEvent event) {
        if (event.stage() != null) {
            deliverTo(ProgressChannels.channel(event.projectId(), event.stage()), event);
        }
        deliverTo(ProgressChannels.channel(event.projectId(), null), event);
    }

    /** Number of open subscriptions on a channel. */
    public int subscriberCount(String channel) {
        Set<ProgressSubscription> subs = subscriptions.get(channel);
        return subs == null ? 0 : subs.size();
    }

    private void deliverTo(String channel, ProgressEvent event) {
        Set<ProgressSubscription> subs = subscriptions.get(channel);
        if (subs == null) {
            return;
        }
        for (ProgressSubscription sub : subs) {
            sub.deliver(event);
        }
    }

    private void unsubscribe(String channel, ProgressSubscription sub) {
        subscriptions.computeIfPresent(channel, (k, subs) -> {
            subs.remove(sub);
            return subs.isEmpty() ? null : subs;
        });
        log.debug("Unsubscribed from {}", channel);
    }
}
