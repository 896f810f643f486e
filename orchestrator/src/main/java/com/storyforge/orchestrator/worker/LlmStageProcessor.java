package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.model.StageType;
import com.storyforge.orchestrator.progress.ProgressEvent;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Text stages: rewrite, storyboard, camera movement.
 *
 * Each stage reads "text" from its input, or else from the stage before it,
 * streams the model's reply as token events and stores the full reply as
 * "text" in its output.
 */
@Component
public class LlmStageProcessor implements StageProcessor {

    private final GenerationClient generation;

    public LlmStageProcessor(GenerationClient generation) {
        this.generation = generation;
    }

    @Override
    public Set<StageType> supports() {
        return Set.of(StageType.REWRITE, StageType.STORYBOARD, StageType.CAMERA_MOVEMENT);
    }

    @Override
    public Map<String, Object> process(StageContext ctx) {
        String prompt = ctx.requireText("text", sourceOf(ctx.stageType()));
        ctx.publish(ProgressEvent.stageUpdate("processing", 10,
                "Generating " + ctx.stageType().displayName()));

        StringBuilder full = new StringBuilder();
        String text = generation.completeText(ctx.stageType().value(), prompt, chunk -> {
            ctx.checkpoint();
            full.append(chunk);
            ctx.publish(ProgressEvent.token(chunk, full.toString()));
        });

        Map<String, Object> output = new LinkedHashMap<>();
        output.put("text", text);
        output.put("source_length", prompt.length());
        return output;
    }

    /** Which earlier stage's text a stage falls back to when the input has none. */
    private static StageType sourceOf(StageType stage) {
        return switch (stage) {
            case STORYBOARD      -> StageType.REWRITE;
            case CAMERA_MOVEMENT -> StageType.STORYBOARD;
            default              -> null;
        };
    }
}
