package org.operaton.rungrade.controller;

import org.operaton.rungrade.model.dto.UploadedFile;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Detaches multipart uploads from the request so they outlive it.
 */
final class UploadedFiles {

    private UploadedFiles() {
    }

    static List<UploadedFile> of(List<MultipartFile> files) {
        if (files == null) {
            return List.of();
        }
        List<UploadedFile> uploaded = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try {
                uploaded.add(new UploadedFile(file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read uploaded file " + file.getOriginalFilename(), e);
            }
        }
        return uploaded;
    }
}
