package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.dispatch.CancellationToken;
import com.storyforge.orchestrator.dispatch.StageJob;
import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.model.StageType;
import com.storyforge.orchestrator.progress.ProgressEvent;
import com.storyforge.orchestrator.progress.ProgressPublisher;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What a {@link StageProcessor} sees of the job it runs: the stage input,
 * outputs of earlier completed stages, the cancellation token and a way
 * to publish progress on the stage's channel.
 */
public class StageContext {

    private final StageJob                            job;
    private final Map<StageType, Map<String, Object>> upstream;
    private final CancellationToken                   token;
    private final ProgressPublisher                   publisher;

    public StageContext(StageJob job,
                        Map<StageType, Map<String, Object>> upstream,
                        CancellationToken token,
                        ProgressPublisher publisher) {
        this.job       = job;
        this.upstream  = upstream;
        this.token     = token;
        this.publisher = publisher;
    }

    public UUID                projectId() { return job.projectId(); }
    public StageType           stageType() { return job.stageType(); }
    public Map<String, Object> input()     { return job.input(); }

    /** Output of an earlier completed stage, or an empty map. */
    public Map<String, Object> upstream(StageType stageType) {
        return upstream.getOrDefault(stageType, Map.of());
    }

    public void checkpoint() {
        token.checkpoint();
    }

    public void publish(ProgressEvent event) {
        publisher.publish(job.projectId(), job.stageType().value(), event);
    }

    /**
     * First non-blank string found under {@code key} in the input, then in the
     * given upstream stage's output.
     *
     * @throws JobExecutionException MISSING_DATA if neither has it
     */
    public String requireText(String key, StageType fallback) {
        Object value = input().get(key);
        if (isBlank(value) && fallback != null) {
            value = upstream(fallback).get(key);
        }
        if (isBlank(value)) {
            throw new JobExecutionException(Category.MISSING_DATA,
                    stageType().value() + " needs '" + key + "' in its input"
                    + (fallback != null ? " or from " + fallback.value() : ""));
        }
        return value.toString();
    }

    /** String list under {@code key} in the input, then in the fallback stage's output. */
    public List<String> stringList(String key, StageType fallback) {
        Object value = input().get(key);
        if (!(value instanceof List<?>) && fallback != null) {
            value = upstream(fallback).get(key);
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    private static boolean isBlank(Object value) {
        return value == null || value.toString().isBlank();
    }
}
