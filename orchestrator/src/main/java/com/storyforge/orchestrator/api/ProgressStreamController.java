package com.storyforge.orchestrator.api;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

/**
 * Server-Sent Events feeds of pipeline progress.
 *
 * GET /sse/projects/{id}/stages/{stage}  one stage; ends after done/error or when idle
 * GET /sse/projects/{id}                 every stage of the project; ends when idle
 */
@RestController
@RequestMapping("/sse/projects")
public class ProgressStreamController {

    private final ProgressStreamer streamer;

    public ProgressStreamController(ProgressStreamer streamer) {
        this.streamer = streamer;
    }

    @GetMapping(value = "/{id}/stages/{stage}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stage(@PathVariable UUID id, @PathVariable String stage) {
        return streamer.stream(streamer.subscribe(id, stage));
    }

    @GetMapping(value = "/{id}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter project(@PathVariable UUID id) {
        return streamer.stream(streamer.subscribe(id, null));
    }
}
