package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;
import com.storyforge.orchestrator.service.StageCompletionService;
import com.storyforge.orchestrator.service.StageCompletionService.StalledStage;
import com.storyforge.orchestrator.store.StageStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Keeps stages from staying PROCESSING after their job is gone.
 *
 * Every tick this instance first vouches for the stage jobs it still holds
 * (queued, delayed or running) by touching their heartbeats, then fails
 * every PROCESSING stage nobody has vouched for within the stall timeout.
 * That covers jobs lost to a restart and jobs whose failure report itself
 * failed. The first tick runs shortly after startup.
 */
@Component
public class StageRecoveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(StageRecoveryScheduler.class);

    private final TaskDispatcher         dispatcher;
    private final StageStateStore        store;
    private final StageCompletionService completion;
    private final ProgressPublisher      publisher;
    private final Duration               stallTimeout;

    public StageRecoveryScheduler(TaskDispatcher dispatcher,
                                  StageStateStore store,
                                  StageCompletionService completion,
                                  ProgressPublisher publisher,
                                  @Value("${storyforge.recovery.stall-timeout:PT5M}") Duration stallTimeout) {
        this.dispatcher   = dispatcher;
        this.store        = store;
        this.completion   = completion;
        this.publisher    = publisher;
        this.stallTimeout = stallTimeout;
    }

    @Scheduled(initialDelayString = "${storyforge.recovery.initial-delay-ms:30000}",
               fixedDelayString   = "${storyforge.recovery.interval-ms:60000}")
    public void tick() {
        Set<String> live = dispatcher.activeStageHandles();
        if (!live.isEmpty()) {
            int touched = store.touchHeartbeats(live);
            log.debug("Heartbeat touched {} stage(s) for {} live job(s)", touched, live.size());
        }

        List<StalledStage> recovered = completion.recoverStalledStages(stallTimeout);
        for (StalledStage stalled : recovered) {
            if (!stalled.outcome().discarded()) {
                publisher.publish(stalled.projectId(), stalled.stageType().value(),
                        ProgressEvent.error(stalled.outcome().message(), stalled.outcome().retryCount()));
            }
        }
        if (!recovered.isEmpty()) {
            log.warn("Recovered {} stalled stage(s)", recovered.size());
        }
    }
}
