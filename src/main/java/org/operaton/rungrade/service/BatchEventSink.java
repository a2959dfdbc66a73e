package org.operaton.rungrade.service;

import org.operaton.rungrade.model.dto.BatchEvent;

import java.io.IOException;

/**
 * Consumer of the events of one streamed batch job.
 */
public interface BatchEventSink {

    /**
     * Delivers one event.
     *
     * @throws IOException if the consumer is gone
     */
    void emit(BatchEvent event) throws IOException;

    /**
     * Called once after the terminal event, or after the job was cancelled.
     */
    void complete();
}
