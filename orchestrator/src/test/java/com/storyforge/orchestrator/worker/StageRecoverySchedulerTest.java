package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.model.*;
import com.storyforge.orchestrator.progress.EventType;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;
import com.storyforge.orchestrator.service.StageCompletionService;
import com.storyforge.orchestrator.store.InMemoryStageStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StageRecoveryScheduler over the in-memory store: jobs this instance still
 * holds keep their stages alive, everything else past the stall timeout fails.
 */
@ExtendWith(MockitoExtension.class)
class StageRecoverySchedulerTest {

    @Mock TaskDispatcher    dispatcher;
    @Mock ProgressPublisher publisher;

    InMemoryStageStateStore store;
    StageRecoveryScheduler  scheduler;
    Project                 project;

    @BeforeEach
    void setUp() {
        store = new InMemoryStageStateStore();
        StageCompletionService completion = new StageCompletionService(store, dispatcher,
                Duration.ofSeconds(60), Duration.ofMinutes(10));
        scheduler = new StageRecoveryScheduler(dispatcher, store, completion, publisher, Duration.ofMinutes(5));
        project   = store.createProject("p", "u-1");
        store.forceProject(project.getId(), ProjectStatus.PROCESSING);
    }

    @Test
    void tick_liveJob_isTouchedAndNotRecovered() {
        stalled(StageType.REWRITE, "job-live");
        when(dispatcher.activeStageHandles()).thenReturn(Set.of("job-live"));

        scheduler.tick();

        Stage stage = stage(StageType.REWRITE);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.PROCESSING);
        assertThat(stage.getHeartbeatAt()).isAfter(Instant.now().minus(Duration.ofMinutes(1)));
        verifyNoInteractions(publisher);
    }

    @Test
    void tick_lostJobWithoutRetries_failsStageAndPublishesError() {
        stalled(StageType.IMAGE_GENERATION, "job-lost").setRetryCount(Stage.DEFAULT_MAX_RETRIES);
        when(dispatcher.activeStageHandles()).thenReturn(Set.of());

        scheduler.tick();

        Stage stage = stage(StageType.IMAGE_GENERATION);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getErrorMessage()).isEqualTo("Worker heartbeat timed out after 5 minutes");
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.FAILED);

        ArgumentCaptor<ProgressEvent> captor = ArgumentCaptor.forClass(ProgressEvent.class);
        verify(publisher).publish(eq(project.getId()), eq("image_generation"), captor.capture());
        assertThat(captor.getValue().type()).isEqualTo(EventType.ERROR);
        assertThat(captor.getValue().data()).containsEntry("retry_count", Stage.DEFAULT_MAX_RETRIES);
    }

    @Test
    void tick_nothingStalled_doesNothing() {
        when(dispatcher.activeStageHandles()).thenReturn(Set.of());

        scheduler.tick();

        verify(dispatcher, never()).submit(any(), any(), any(), any(), any(Duration.class));
        verifyNoInteractions(publisher);
    }

    private Stage stalled(StageType type, String handle) {
        Stage stage = store.force(project.getId(), type, StageStatus.PROCESSING, handle);
        stage.setHeartbeatAt(Instant.now().minus(Duration.ofMinutes(10)));
        return stage;
    }

    private Stage stage(StageType type) {
        return store.findStage(project.getId(), type).orElseThrow();
    }
}
