package org.operaton.rungrade.util;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.InvalidGpxFileException;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;

/**
 * Validates GPX files before processing.
 * Checks file size, XML well-formedness, and GPX structure.
 */
@Component
@Slf4j
public class GpxFileValidator {

    private static final long MAX_FILE_SIZE = 50 * 1024 * 1024; // 50MB
    private static final int MIN_FILE_SIZE = 100; // Minimum XML file size

    /**
     * Validates a GPX file from byte array.
     *
     * @param fileData the GPX file data
     * @throws InvalidGpxFileException if the file is invalid
     */
    public void validate(byte[] fileData) {
        if (fileData == null || fileData.length == 0) {
            throw new InvalidGpxFileException("GPX file is empty");
        }

        validateFileSize(fileData.length);
        validateGpxStructure(fileData);
    }

    private void validateFileSize(long size) {
        if (size < MIN_FILE_SIZE) {
            throw new InvalidGpxFileException(
                String.format("GPX file is too small. Size: %d bytes, minimum: %d bytes", size, MIN_FILE_SIZE)
            );
        }

        if (size > MAX_FILE_SIZE) {
            throw new InvalidGpxFileException(
                String.format("GPX file is too large. Size: %d bytes, maximum: %d bytes", size, MAX_FILE_SIZE)
            );
        }
    }

    /**
     * Validates GPX XML structure: a {@code <gpx>} root with at least one track or route.
     *
     * @param fileData the GPX file data
     * @throws InvalidGpxFileException if the structure is invalid
     */
    private void validateGpxStructure(byte[] fileData) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(new ByteArrayInputStream(fileData));

            Element root = doc.getDocumentElement();
            if (!"gpx".equals(root.getLocalName()) && !"gpx".equals(root.getNodeName())) {
                throw new InvalidGpxFileException("Root element must be <gpx>, found: <" + root.getNodeName() + ">");
            }

            NodeList tracks = doc.getElementsByTagNameNS("*", "trk");
            NodeList routes = doc.getElementsByTagNameNS("*", "rte");

            if (tracks.getLength() == 0 && routes.getLength() == 0) {
                throw new InvalidGpxFileException("No track data found");
            }

            log.debug("GPX validation successful. Tracks: {}, Routes: {}", tracks.getLength(), routes.getLength());
        } catch (InvalidGpxFileException e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidGpxFileException("Invalid GPX XML structure: " + e.getMessage(), e);
        }
    }
}
