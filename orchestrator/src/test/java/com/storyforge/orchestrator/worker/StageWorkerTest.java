package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.JobStatus;
import com.storyforge.orchestrator.dispatch.StageJob;
import com.storyforge.orchestrator.dispatch.TaskDispatcher;
import com.storyforge.orchestrator.error.DispatchException;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.generation.GenerationClient;
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
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StageWorker with the real completion service over the in-memory store;
 * generation, dispatch and publishing are mocks.
 */
@ExtendWith(MockitoExtension.class)
class StageWorkerTest {

    @Mock GenerationClient  generation;
    @Mock TaskDispatcher    dispatcher;
    @Mock ProgressPublisher publisher;

    InMemoryStageStateStore store;
    StageWorker             worker;
    Project                 project;

    @BeforeEach
    void setUp() {
        store = new InMemoryStageStateStore();
        StageCompletionService completion = new StageCompletionService(store, dispatcher,
                Duration.ofSeconds(60), Duration.ofMinutes(10));
        StageProcessorRegistry processors = new StageProcessorRegistry(List.of(
                new LlmStageProcessor(generation), new MediaStageProcessor(generation)));
        worker  = new StageWorker(processors, completion, publisher);
        project = store.createProject("p", "u-1");
        store.forceProject(project.getId(), ProjectStatus.PROCESSING);
    }

    // ------------------------------------------------------------------
    // Success
    // ------------------------------------------------------------------

    @Test
    void llmStage_streamsTokensThenCompletes() {
        when(generation.completeText(eq("rewrite"), eq("Once upon a time"), any())).thenAnswer(inv -> {
            Consumer<String> onChunk = inv.getArgument(2);
            onChunk.accept("Long ");
            onChunk.accept("ago");
            return "Long ago";
        });
        StageJob job = running(StageType.REWRITE, "job-1", Map.of("text", "Once upon a time"));

        JobStatus status = worker.run(job, CancellationToken.none());

        assertThat(status).isEqualTo(JobStatus.SUCCESS);
        Stage stage = stage(StageType.REWRITE);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.COMPLETED);
        assertThat(stage.getOutputData()).containsEntry("text", "Long ago");

        List<ProgressEvent> events = published("rewrite");
        assertThat(events).extracting(ProgressEvent::type).containsExactly(
                EventType.STAGE_UPDATE, EventType.STAGE_UPDATE,
                EventType.TOKEN, EventType.TOKEN,
                EventType.STAGE_UPDATE, EventType.DONE);
        assertThat(events.get(3).data()).containsEntry("full_text", "Long ago");
    }

    @Test
    void storyboard_fallsBackToRewriteOutput() {
        store.force(project.getId(), StageType.REWRITE, StageStatus.COMPLETED, null)
                .setOutputData(Map.of("text", "rewritten story"));
        when(generation.completeText(eq("storyboard"), eq("rewritten story"), any())).thenReturn("scene 1\n\nscene 2");
        StageJob job = running(StageType.STORYBOARD, "job-1", Map.of());

        assertThat(worker.run(job, CancellationToken.none())).isEqualTo(JobStatus.SUCCESS);
        assertThat(stage(StageType.STORYBOARD).getOutputData()).containsEntry("text", "scene 1\n\nscene 2");
    }

    @Test
    void imageStage_splitsStoryboardIntoScenes() {
        store.force(project.getId(), StageType.STORYBOARD, StageStatus.COMPLETED, null)
                .setOutputData(Map.of("text", "a harbor at night\n\na lighthouse\n"));
        when(generation.generateImage(eq("a harbor at night"), anyMap())).thenReturn("https://cdn/1.png");
        when(generation.generateImage(eq("a lighthouse"), anyMap())).thenReturn("https://cdn/2.png");
        StageJob job = running(StageType.IMAGE_GENERATION, "job-1", Map.of());

        assertThat(worker.run(job, CancellationToken.none())).isEqualTo(JobStatus.SUCCESS);

        assertThat(stage(StageType.IMAGE_GENERATION).getOutputData())
                .containsEntry("images", List.of("https://cdn/1.png", "https://cdn/2.png"));
        assertThat(published("image_generation")).filteredOn(e -> e.type() == EventType.PROGRESS)
                .extracting(e -> e.data().get("current"))
                .containsExactly(1, 2);
    }

    @Test
    void imageStage_passesRequestOptionsToGateway() {
        when(generation.generateImage(eq("a cat"), anyMap())).thenReturn("https://cdn/cat.png");
        StageJob job = running(StageType.IMAGE_GENERATION, "job-1", Map.of(
                "prompts", List.of("a cat"),
                "options", Map.of("size", "1024x1024", "steps", 30)));

        assertThat(worker.run(job, CancellationToken.none())).isEqualTo(JobStatus.SUCCESS);

        ArgumentCaptor<Map<String, Object>> options = ArgumentCaptor.forClass(Map.class);
        verify(generation).generateImage(eq("a cat"), options.capture());
        assertThat(options.getValue()).hasSize(2)
                .containsEntry("size", "1024x1024")
                .containsEntry("steps", 30);
    }

    // ------------------------------------------------------------------
    // Failure
    // ------------------------------------------------------------------

    @Test
    void missingInput_failsStageWithoutRetry() {
        StageJob job = running(StageType.STORYBOARD, "job-1", Map.of());

        JobStatus status = worker.run(job, CancellationToken.none());

        assertThat(status).isEqualTo(JobStatus.FAILURE);
        assertThat(stage(StageType.STORYBOARD).getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(store.findProject(project.getId()).orElseThrow().getStatus()).isEqualTo(ProjectStatus.FAILED);
        assertThat(published("storyboard")).last()
                .satisfies(e -> assertThat(e.type()).isEqualTo(EventType.ERROR));
        verifyNoInteractions(generation, dispatcher);
    }

    @Test
    void transientFailure_publishesErrorAndSchedulesRetry() {
        when(generation.generateImage(any(), anyMap()))
                .thenThrow(new JobExecutionException(Category.NETWORK, "image service unavailable"));
        when(dispatcher.submit(eq(StageType.IMAGE_GENERATION), eq(project.getId()), anyMap(), eq("u-1"),
                eq(Duration.ofSeconds(60)))).thenReturn("job-2");
        StageJob job = running(StageType.IMAGE_GENERATION, "job-1", Map.of("prompts", List.of("a cat")));

        JobStatus status = worker.run(job, CancellationToken.none());

        assertThat(status).isEqualTo(JobStatus.RETRYING);
        Stage stage = stage(StageType.IMAGE_GENERATION);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.PROCESSING);
        assertThat(stage.getJobHandle()).isEqualTo("job-2");
        ProgressEvent error = published("image_generation").stream()
                .filter(e -> e.type() == EventType.ERROR).findFirst().orElseThrow();
        assertThat(error.data()).containsEntry("retry_count", 1)
                .containsEntry("message", "image service unavailable");
    }

    @Test
    void unexpectedException_isTreatedAsInternalFailure() {
        when(generation.completeText(any(), any(), any())).thenThrow(new IllegalStateException("bug"));
        StageJob job = running(StageType.REWRITE, "job-1", Map.of("text", "x"));

        assertThat(worker.run(job, CancellationToken.none())).isEqualTo(JobStatus.FAILURE);
        assertThat(stage(StageType.REWRITE).getStatus()).isEqualTo(StageStatus.FAILED);
    }

    @Test
    void refusedResubmission_stillFailsStageAndPublishesError() {
        when(generation.completeText(any(), any(), any()))
                .thenThrow(new JobExecutionException(Category.NETWORK, "gateway 503"));
        when(dispatcher.submit(any(), any(), any(), any(), any(Duration.class)))
                .thenThrow(new DispatchException("Worker pool rejected job job-2"));
        StageJob job = running(StageType.REWRITE, "job-1", Map.of("text", "x"));

        assertThat(worker.run(job, CancellationToken.none())).isEqualTo(JobStatus.FAILURE);

        Stage stage = stage(StageType.REWRITE);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(stage.getJobHandle()).isNull();
        assertThat(stage.getErrorMessage()).contains("Worker pool rejected job job-2");
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.FAILED);
        assertThat(published("rewrite")).extracting(ProgressEvent::type).contains(EventType.ERROR);
    }

    @Test
    void abandon_failsOwnedStageAndPublishesError() {
        StageJob job = running(StageType.STORYBOARD, "job-1", Map.of());

        worker.abandon(job, "Worker pool rejected job job-1");

        assertThat(stage(StageType.STORYBOARD).getStatus()).isEqualTo(StageStatus.FAILED);
        assertThat(project.getStatus()).isEqualTo(ProjectStatus.FAILED);
        ProgressEvent error = published("storyboard").get(0);
        assertThat(error.type()).isEqualTo(EventType.ERROR);
        assertThat(error.data()).containsEntry("message", "Worker pool rejected job job-1");
    }

    @Test
    void abandon_staleJob_publishesNothing() {
        running(StageType.STORYBOARD, "job-2", Map.of());

        worker.abandon(new StageJob("job-1", StageType.STORYBOARD, project.getId(), Map.of(), "u-1"), "rejected");

        assertThat(stage(StageType.STORYBOARD).getStatus()).isEqualTo(StageStatus.PROCESSING);
        verifyNoInteractions(publisher);
    }

    // ------------------------------------------------------------------
    // Stale and cancelled jobs
    // ------------------------------------------------------------------

    @Test
    void staleJob_doesNothing() {
        running(StageType.REWRITE, "job-2", Map.of("text", "x"));
        StageJob stale = new StageJob("job-1", StageType.REWRITE, project.getId(), Map.of("text", "x"), "u-1");

        assertThat(worker.run(stale, CancellationToken.none())).isEqualTo(JobStatus.FAILURE);

        verifyNoInteractions(generation, publisher);
        assertThat(stage(StageType.REWRITE).getJobHandle()).isEqualTo("job-2");
    }

    @Test
    void cancelledMidStream_writesNoOutcome() {
        CancellationToken token = CancellationToken.none();
        when(generation.completeText(any(), any(), any())).thenAnswer(inv -> {
            Consumer<String> onChunk = inv.getArgument(2);
            onChunk.accept("first");
            token.cancel();
            onChunk.accept("second");
            return "never";
        });
        StageJob job = running(StageType.REWRITE, "job-1", Map.of("text", "x"));

        assertThat(worker.run(job, token)).isEqualTo(JobStatus.FAILURE);

        Stage stage = stage(StageType.REWRITE);
        assertThat(stage.getStatus()).isEqualTo(StageStatus.PROCESSING);
        assertThat(stage.getOutputData()).isNull();
        assertThat(stage.getRetryCount()).isZero();
        assertThat(published("rewrite")).extracting(ProgressEvent::type)
                .doesNotContain(EventType.DONE, EventType.ERROR);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageJob running(StageType type, String handle, Map<String, Object> input) {
        store.force(project.getId(), type, StageStatus.PROCESSING, handle).setInputData(input);
        return new StageJob(handle, type, project.getId(), input, "u-1");
    }

    private Stage stage(StageType type) {
        return store.findStage(project.getId(), type).orElseThrow();
    }

    private List<ProgressEvent> published(String stage) {
        ArgumentCaptor<ProgressEvent> captor = ArgumentCaptor.forClass(ProgressEvent.class);
        verify(publisher, atLeastOnce()).publish(eq(project.getId()), eq(stage), captor.capture());
        return captor.getAllValues();
    }
}
