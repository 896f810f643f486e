package com.storyforge.orchestrator.generation;

import com.storyforge.orchestrator.error.JobExecutionException;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Gateway to the external AI generation services.
 *
 * Implementations block the calling worker thread and report failures as
 * {@link JobExecutionException} with a category that tells the caller
 * whether retrying can help.
 */
public interface GenerationClient {

    /**
     * Run a text task (rewrite, storyboard, camera movement) and stream the
     * reply. {@code onChunk} receives each fragment in order; the return value
     * is the full text.
     */
    String completeText(String task, String prompt, Consumer<String> onChunk);

    /** Generate one image and return its URL. */
    String generateImage(String prompt, Map<String, Object> options);

    /** Animate an image into a clip and return the clip's URL. */
    String generateVideo(String imageUrl, String prompt, Map<String, Object> options);
}
