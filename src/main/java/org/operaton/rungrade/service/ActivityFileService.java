package org.operaton.rungrade.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.EmptyTrackException;
import org.operaton.rungrade.exception.UnsupportedFileFormatException;
import org.operaton.rungrade.model.dto.UploadedFile;
import org.operaton.rungrade.util.FitFileValidator;
import org.operaton.rungrade.util.FitParser;
import org.operaton.rungrade.util.GpxFileValidator;
import org.operaton.rungrade.util.GpxParser;
import org.operaton.rungrade.util.ParsedActivityData;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Unified entry point for reading activity files (FIT, GPX) into the normalized point schema.
 * Detects the file format from the extension and routes to the matching validator and parser.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActivityFileService {

    private final FitParser fitParser;
    private final GpxParser gpxParser;
    private final FitFileValidator fitValidator;
    private final GpxFileValidator gpxValidator;

    public enum FileFormat {
        FIT,
        GPX
    }

    /**
     * Validates and parses an uploaded activity file.
     *
     * @param file the uploaded file
     * @return the parsed data with at least one track point
     * @throws UnsupportedFileFormatException if the extension is neither .gpx nor .fit
     * @throws EmptyTrackException            if the file holds no usable track points
     */
    public ParsedActivityData parse(UploadedFile file) {
        FileFormat format = detectFileFormat(file.filename());
        log.debug("Detected file format {} for {}", format, file.filename());

        ParsedActivityData parsedData;
        if (format == FileFormat.FIT) {
            fitValidator.validate(file.data());
            parsedData = fitParser.parse(file.data());
        } else {
            gpxValidator.validate(file.data());
            parsedData = gpxParser.parse(file.data());
        }

        if (parsedData.getTrackPoints().isEmpty()) {
            throw new EmptyTrackException("No track data found in " + file.filename());
        }
        return parsedData;
    }

    /**
     * Detects the file format from the filename extension.
     *
     * @param filename the original filename
     * @return the detected format
     * @throws UnsupportedFileFormatException if the extension is not supported
     */
    public FileFormat detectFileFormat(String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".gpx")) {
            return FileFormat.GPX;
        }
        if (lower.endsWith(".fit")) {
            return FileFormat.FIT;
        }
        throw new UnsupportedFileFormatException("Unsupported file type. Only GPX and FIT files are supported.");
    }
}
