package org.operaton.rungrade.model.dto;

/**
 * Raw bytes of one uploaded activity file, detached from the HTTP request.
 */
public record UploadedFile(String filename, byte[] data) {

    public long size() {
        return data != null ? data.length : 0;
    }
}
