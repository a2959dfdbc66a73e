package org.operaton.rungrade.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Event emitted while a batch job runs. Serialized with a {@code type} discriminator of
 * {@code progress}, {@code complete} or {@code error}.
 */
public interface BatchEvent {

    String type();

    /**
     * Emitted after every file, whether it succeeded or failed. {@code fileIndex} and
     * {@code filesProcessed} always carry the same count; both stay for wire-format compatibility
     * with existing clients.
     */
    record Progress(
            int fileIndex,
            int totalFiles,
            int progressPercent,
            int filesProcessed,
            String currentFile,
            List<RunResult> resultsSoFar,
            List<FileError> errorsSoFar
    ) implements BatchEvent {

        @Override
        @JsonProperty("type")
        public String type() {
            return "progress";
        }
    }

    /**
     * Terminal event of a job that processed all of its files.
     */
    record Complete(
            int totalFiles,
            int successfulFiles,
            int failedFiles,
            List<RunResult> results,
            List<FileError> errors
    ) implements BatchEvent {

        @Override
        @JsonProperty("type")
        public String type() {
            return "complete";
        }
    }

    /**
     * Terminal event of a job that failed as a whole.
     */
    record Failure(String error) implements BatchEvent {

        @Override
        @JsonProperty("type")
        public String type() {
            return "error";
        }
    }
}
