package org.operaton.rungrade.util;

import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.GpxFileProcessingException;
import org.operaton.rungrade.model.TrackPoint;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parser for GPX (GPS Exchange Format) files.
 * Reads the points of the first track, falling back to the first route when the file has no
 * track points. GPX files lack session summaries, so file-level stats are calculated from the points.
 */
@Component
@Slf4j
public class GpxParser {

    private static final String GPXTPX_NS = "http://www.garmin.com/xmlschemas/TrackPointExtension/v1";

    /**
     * Parses a GPX file and returns the extracted data.
     *
     * @param fileData the GPX file data
     * @return ParsedActivityData containing activity information, possibly without points
     * @throws GpxFileProcessingException if parsing fails
     */
    public ParsedActivityData parse(byte[] fileData) {
        try {
            ParsedActivityData parsedData = new ParsedActivityData();
            parsedData.setSourceFormat("GPX");

            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            Document doc = builder.parse(new ByteArrayInputStream(fileData));

            List<TrackPoint> points = extractPoints(doc, "trk", "trkpt");
            if (points.isEmpty()) {
                points = extractPoints(doc, "rte", "rtept");
                if (!points.isEmpty()) {
                    log.debug("GPX file has no track points, using {} route points", points.size());
                }
            }
            parsedData.setTrackPoints(points);

            extractActivityType(doc, parsedData);
            calculateStats(parsedData);

            log.info("Successfully parsed GPX file: {} track points, sport: {}",
                points.size(), parsedData.getSport());

            return parsedData;
        } catch (GpxFileProcessingException e) {
            throw e;
        } catch (Exception e) {
            throw new GpxFileProcessingException("Failed to parse GPX file", e);
        }
    }

    /**
     * Extracts the points of the first container element (track or route) that has any.
     */
    private List<TrackPoint> extractPoints(Document doc, String containerTag, String pointTag) {
        NodeList containers = getElements(doc.getDocumentElement(), containerTag);
        for (int i = 0; i < containers.getLength(); i++) {
            Element container = (Element) containers.item(i);
            NodeList pointElements = getElements(container, pointTag);

            List<TrackPoint> points = new ArrayList<>();
            for (int k = 0; k < pointElements.getLength(); k++) {
                TrackPoint point = extractTrackPoint((Element) pointElements.item(k));
                if (point != null) {
                    points.add(point);
                }
            }
            if (!points.isEmpty()) {
                return points;
            }
        }
        return new ArrayList<>();
    }

    /**
     * Extracts a single point from a {@code <trkpt>} or {@code <rtept>} element.
     */
    private TrackPoint extractTrackPoint(Element pointElement) {
        String latStr = pointElement.getAttribute("lat");
        String lonStr = pointElement.getAttribute("lon");

        if (latStr.isEmpty() || lonStr.isEmpty()) {
            log.warn("Track point missing lat/lon attributes");
            return null;
        }

        try {
            TrackPoint.TrackPointBuilder point = TrackPoint.builder()
                .latitude(Double.parseDouble(latStr))
                .longitude(Double.parseDouble(lonStr));

            Double elevation = parseOptionalDouble(getElementText(pointElement, "ele"), "ele");
            if (elevation != null) {
                point.elevation(elevation);
            }

            String time = getElementText(pointElement, "time");
            if (time != null) {
                point.timestamp(parseIso8601DateTime(time));
            }

            extractExtensions(pointElement, point);

            return point.build();
        } catch (NumberFormatException e) {
            log.warn("Skipping track point with invalid position: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Extracts heart rate and cadence from Garmin TrackPointExtension elements.
     */
    private void extractExtensions(Element pointElement, TrackPoint.TrackPointBuilder point) {
        NodeList extensions = getElements(pointElement, "extensions");
        if (extensions.getLength() == 0) {
            return;
        }

        Element extensionsElement = (Element) extensions.item(0);

        String hr = getElementTextNS(extensionsElement, GPXTPX_NS, "hr");
        if (hr == null) hr = getElementText(extensionsElement, "hr");
        point.heartRate(parseOptionalInt(hr, "hr"));

        String cad = getElementTextNS(extensionsElement, GPXTPX_NS, "cad");
        if (cad == null) cad = getElementText(extensionsElement, "cad");
        point.cadence(parseOptionalInt(cad, "cad"));
    }

    /**
     * Parses an optional decimal field. A malformed value leaves only this field unset.
     */
    private Double parseOptionalDouble(String value, String field) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid <{}> value: {}", field, value);
            return null;
        }
    }

    /**
     * Parses an optional integer field. A malformed value leaves only this field unset.
     */
    private Integer parseOptionalInt(String value, String field) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring invalid <{}> value: {}", field, value);
            return null;
        }
    }

    /**
     * Extracts the activity type from the first track's {@code <type>} element.
     */
    private void extractActivityType(Document doc, ParsedActivityData parsedData) {
        NodeList tracks = getElements(doc.getDocumentElement(), "trk");
        if (tracks.getLength() > 0) {
            Element track = (Element) tracks.item(0);
            NodeList types = getElements(track, "type");
            if (types.getLength() > 0 && types.item(0).getParentNode() == track) {
                String type = types.item(0).getTextContent();
                if (type != null && !type.isBlank()) {
                    parsedData.setSport(type.trim().toLowerCase());
                }
            }
        }
    }

    /**
     * Calculates distance, elapsed time, elevation gain and heart rate stats from the points.
     */
    private void calculateStats(ParsedActivityData parsedData) {
        List<TrackPoint> points = parsedData.getTrackPoints();
        if (points.isEmpty()) {
            return;
        }

        TrackPoint first = points.get(0);
        TrackPoint last = points.get(points.size() - 1);
        parsedData.setStartTime(first.timestamp());
        parsedData.setEndTime(last.timestamp());
        parsedData.setTotalTimeSeconds(ActivityStats.elapsedSeconds(points));
        parsedData.setTotalDistanceMeters(ActivityStats.totalDistanceMeters(points));
        parsedData.setElevationGainMeters(ActivityStats.elevationGainMeters(points));
        parsedData.setAverageHeartRate(ActivityStats.averageHeartRate(points));
        parsedData.setMaxHeartRate(ActivityStats.maxHeartRate(points));
    }

    /**
     * Parses ISO 8601 datetime string (GPX standard). Timestamps without an offset are read as UTC.
     */
    private Instant parseIso8601DateTime(String dateTimeStr) {
        try {
            return OffsetDateTime.parse(dateTimeStr, DateTimeFormatter.ISO_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(dateTimeStr + "Z");
            } catch (DateTimeParseException fallbackFailure) {
                log.warn("Failed to parse datetime: {}", dateTimeStr);
                return null;
            }
        }
    }

    private NodeList getElements(Element parent, String tagName) {
        NodeList nodes = parent.getElementsByTagName(tagName);
        if (nodes.getLength() == 0) {
            nodes = parent.getElementsByTagNameNS("*", tagName);
        }
        return nodes;
    }

    /**
     * Gets text content of child element by tag name.
     */
    private String getElementText(Element parent, String tagName) {
        NodeList nodes = getElements(parent, tagName);
        if (nodes.getLength() > 0) {
            Node node = nodes.item(0);
            String text = node.getTextContent();
            return (text != null && !text.trim().isEmpty()) ? text.trim() : null;
        }
        return null;
    }

    /**
     * Gets text content of child element by namespace and tag name.
     */
    private String getElementTextNS(Element parent, String namespace, String tagName) {
        NodeList nodes = parent.getElementsByTagNameNS(namespace, tagName);
        if (nodes.getLength() > 0) {
            String text = nodes.item(0).getTextContent();
            return (text != null && !text.trim().isEmpty()) ? text.trim() : null;
        }
        return null;
    }
}
