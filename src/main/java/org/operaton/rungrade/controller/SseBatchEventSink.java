package org.operaton.rungrade.controller;

import org.operaton.rungrade.model.dto.BatchEvent;
import org.operaton.rungrade.service.BatchEventSink;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

/**
 * Writes batch events to a server-sent events stream as JSON {@code data:} lines.
 */
class SseBatchEventSink implements BatchEventSink {

    private final SseEmitter emitter;

    SseBatchEventSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void emit(BatchEvent event) throws IOException {
        try {
            emitter.send(SseEmitter.event().data(event, MediaType.APPLICATION_JSON));
        } catch (IllegalStateException e) {
            // emitter already completed or timed out
            throw new IOException("Event stream is closed", e);
        }
    }

    @Override
    public void complete() {
        emitter.complete();
    }
}
