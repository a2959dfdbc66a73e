package org.operaton.rungrade.util;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.InvalidFitFileException;
import org.springframework.stereotype.Component;

/**
 * Validates FIT files before processing.
 * Checks file size and header.
 */
@Component
@Slf4j
public class FitFileValidator {

    private static final long MAX_FILE_SIZE = 50 * 1024 * 1024; // 50MB
    private static final int MIN_FILE_SIZE = 12; // Minimum FIT file header size
    private static final byte[] FIT_HEADER_SIGNATURE = {'.', 'F', 'I', 'T'};
    private static final int HEADER_SIZE_OFFSET = 0;
    private static final int PROTOCOL_VERSION_OFFSET = 1;
    private static final int SIGNATURE_OFFSET = 8;

    /**
     * Validates a FIT file from byte array.
     *
     * @param fileData the FIT file data
     * @throws InvalidFitFileException if the file is invalid
     */
    public void validate(byte[] fileData) {
        if (fileData == null || fileData.length == 0) {
            throw new InvalidFitFileException("FIT file is empty");
        }

        validateFileSize(fileData.length);
        validateFitHeader(fileData);
    }

    private void validateFileSize(long size) {
        if (size < MIN_FILE_SIZE) {
            throw new InvalidFitFileException(
                String.format("FIT file is too small. Size: %d bytes, minimum: %d bytes", size, MIN_FILE_SIZE)
            );
        }

        if (size > MAX_FILE_SIZE) {
            throw new InvalidFitFileException(
                String.format("FIT file is too large. Size: %d bytes, maximum: %d bytes", size, MAX_FILE_SIZE)
            );
        }
    }

    /**
     * Validates the FIT file header: header size 12 or 14 and the {@code .FIT} signature.
     */
    private void validateFitHeader(byte[] data) {
        int headerSize = data[HEADER_SIZE_OFFSET] & 0xFF;
        if (headerSize != 12 && headerSize != 14) {
            throw new InvalidFitFileException(
                String.format("Invalid FIT header size: %d. Expected 12 or 14", headerSize)
            );
        }

        for (int i = 0; i < FIT_HEADER_SIGNATURE.length; i++) {
            if (data[SIGNATURE_OFFSET + i] != FIT_HEADER_SIGNATURE[i]) {
                throw new InvalidFitFileException(
                    "Invalid FIT file signature. Expected '.FIT' at offset " + SIGNATURE_OFFSET
                );
            }
        }

        int protocolVersion = data[PROTOCOL_VERSION_OFFSET] & 0xFF;
        log.debug("FIT file header validated. Header size: {}, Protocol version: {}.{}",
            headerSize, protocolVersion >> 4, protocolVersion & 0x0F);
    }
}
