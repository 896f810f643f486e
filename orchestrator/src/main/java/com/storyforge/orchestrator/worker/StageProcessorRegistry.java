package com.storyforge.orchestrator.worker;

import com.storyforge.orchestrator.model.StageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Stage type to processor lookup, built once at startup from every
 * {@link StageProcessor} bean. Fails fast if a stage has no processor or two.
 */
@Component
public class StageProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageProcessorRegistry.class);

    private final Map<StageType, StageProcessor> processors;

    public StageProcessorRegistry(List<StageProcessor> all) {
        Map<StageType, StageProcessor> map = new EnumMap<>(StageType.class);
        for (StageProcessor processor : all) {
            for (StageType type : processor.supports()) {
                StageProcessor previous = map.put(type, processor);
                if (previous != null) {
                    throw new IllegalStateException("Stage " + type.value() + " is handled by both "
                            + previous.getClass().getSimpleName() + " and " + processor.getClass().getSimpleName());
                }
            }
        }
        for (StageType type : StageType.PIPELINE) {
            if (!map.containsKey(type)) {
                throw new IllegalStateException("No processor registered for stage " + type.value());
            }
        }
        this.processors = Collections.unmodifiableMap(map);
        log.info("Registered stage processors for {}", processors.keySet());
    }

    public StageProcessor get(StageType type) {
        return processors.get(type);
    }
}
