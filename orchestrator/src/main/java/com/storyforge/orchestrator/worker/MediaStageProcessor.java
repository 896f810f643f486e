package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.error.JobExecutionException;
import com.storyforge.orchestrator.error.JobExecutionException.Category;
import com.storyforge.orchestrator.generation.GenerationClient;
import com.storyforge.orchestrator.model.StageType;
import com.storyforge.orchestrator.progress.ProgressEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Media stages: one generation call per scene, with a progress event and a
 * cancellation checkpoint between scenes.
 *
 * image_generation takes "prompts" from its input, or splits the storyboard
 * text into scenes (blank-line separated). video_generation takes "images"
 * from its input or from image_generation, and pairs each image with the
 * matching camera movement line when there is one.
 */
@Component
public class MediaStageProcessor implements StageProcessor {

    private final GenerationClient generation;

    public MediaStageProcessor(GenerationClient generation) {
        this.generation = generation;
    }

    @Override
    public Set<StageType> supports() {
        return Set.of(StageType.IMAGE_GENERATION, StageType.VIDEO_GENERATION);
    }

    @Override
    public Map<String, Object> process(StageContext ctx) {
        return ctx.stageType() == StageType.IMAGE_GENERATION ? images(ctx) : videos(ctx);
    }

    private Map<String, Object> images(StageContext ctx) {
        List<String> prompts = ctx.stringList("prompts", null);
        if (prompts.isEmpty()) {
            Object storyboard = ctx.upstream(StageType.STORYBOARD).get("text");
            prompts = storyboard == null ? List.of() : scenes(storyboard.toString());
        }
        if (prompts.isEmpty()) {
            throw new JobExecutionException(Category.MISSING_DATA,
                    "image_generation needs 'prompts' or a completed storyboard");
        }
        Map<String, Object> options = options(ctx);
        List<String> urls = new ArrayList<>();
        for (int i = 0; i < prompts.size(); i++) {
            ctx.checkpoint();
            urls.add(generation.generateImage(prompts.get(i), options));
            ctx.publish(ProgressEvent.progress(i + 1, prompts.size(), "scene " + (i + 1)));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("images", urls);
        output.put("prompts", prompts);
        return output;
    }

    private Map<String, Object> videos(StageContext ctx) {
        List<String> images = ctx.stringList("images", StageType.IMAGE_GENERATION);
        if (images.isEmpty()) {
            throw new JobExecutionException(Category.MISSING_DATA,
                    "video_generation needs 'images' or a completed image_generation");
        }
        Object camera = ctx.upstream(StageType.CAMERA_MOVEMENT).get("text");
        List<String> moves = camera == null ? List.of() : scenes(camera.toString());
        Map<String, Object> options = options(ctx);

        List<String> urls = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            ctx.checkpoint();
            String move = i < moves.size() ? moves.get(i) : "";
            urls.add(generation.generateVideo(images.get(i), move, options));
            ctx.publish(ProgressEvent.progress(i + 1, images.size(), "clip " + (i + 1)));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("videos", urls);
        return output;
    }

    private static Map<String, Object> options(StageContext ctx) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (ctx.input().get("options") instanceof Map<?, ?> map) {
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
        }
        return copy;
    }

    static List<String> scenes(String text) {
        return Arrays.stream(text.split("\\n\\s*\\n"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
