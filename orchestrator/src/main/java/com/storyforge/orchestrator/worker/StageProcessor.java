package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.model.StageType;

import java.util.Map;
import java.util.Set;

/**
 * Does the actual work of one or more pipeline stages.
 *
 * Implementations call {@link StageContext#checkpoint()} between units of
 * work and throw {@code JobExecutionException} on failure. The returned map
 * becomes the stage's output_data.
 */
public interface StageProcessor {

    Set<StageType> supports();

    Map<String, Object> process(StageContext ctx);
}
