package org.operaton.rungrade.util;

import com.garmin.fit.DateTime;
import com.garmin.fit.Decode;
import com.garmin.fit.FitRuntimeException;
import com.garmin.fit.MesgBroadcaster;
import com.garmin.fit.RecordMesg;
import com.garmin.fit.RecordMesgListener;
import com.garmin.fit.SessionMesg;
import com.garmin.fit.SessionMesgListener;
import lombok.extern.slf4j.Slf4j;
import org.operaton.rungrade.exception.FitFileProcessingException;
import org.operaton.rungrade.model.TrackPoint;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

/**
 * Parser for Garmin FIT files.
 * Extracts GPS records and the first session's summary. Values missing from the session
 * are calculated from the records.
 */
@Component
@Slf4j
public class FitParser {

    private static final double SEMICIRCLES_TO_DEGREES = 180.0 / Math.pow(2, 31);
    private static final double MPS_TO_KPH = 3.6;

    /**
     * Parses a FIT file and returns the extracted data.
     *
     * @param fileData the FIT file data
     * @return ParsedActivityData containing activity information, possibly without points
     * @throws FitFileProcessingException if parsing fails
     */
    public ParsedActivityData parse(byte[] fileData) {
        try (InputStream inputStream = new ByteArrayInputStream(fileData)) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new FitFileProcessingException("Failed to parse FIT file", e);
        }
    }

    /**
     * Parses a FIT file from an input stream.
     *
     * @param inputStream the input stream
     * @return ParsedActivityData containing activity information
     * @throws FitFileProcessingException if parsing fails
     */
    public ParsedActivityData parse(InputStream inputStream) {
        ParsedActivityData parsedData = new ParsedActivityData();
        parsedData.setSourceFormat("FIT");
        SessionSummary session = new SessionSummary();

        Decode decode = new Decode();
        MesgBroadcaster broadcaster = new MesgBroadcaster(decode);

        broadcaster.addListener((RecordMesgListener) record -> {
            TrackPoint trackPoint = extractTrackPoint(record);
            if (trackPoint != null) {
                parsedData.getTrackPoints().add(trackPoint);
            }
        });

        broadcaster.addListener((SessionMesgListener) sessionMesg -> {
            if (session.mesg == null) {
                session.mesg = sessionMesg;
            } else {
                log.debug("Ignoring additional session message");
            }
        });

        try {
            if (!decode.read(inputStream, broadcaster)) {
                throw new FitFileProcessingException("Failed to decode FIT file");
            }
        } catch (FitRuntimeException e) {
            throw new FitFileProcessingException("Error decoding FIT file: " + e.getMessage(), e);
        }

        applyStats(parsedData, session.mesg);

        log.info("Successfully parsed FIT file: {} track points, sport: {}",
            parsedData.getTrackPoints().size(), parsedData.getSport());

        return parsedData;
    }

    /**
     * Extracts a track point from a record message. Records without a position are skipped.
     */
    private TrackPoint extractTrackPoint(RecordMesg record) {
        Integer positionLat = record.getPositionLat();
        Integer positionLong = record.getPositionLong();

        if (positionLat == null || positionLong == null) {
            return null;
        }

        TrackPoint.TrackPointBuilder point = TrackPoint.builder()
            .latitude(positionLat * SEMICIRCLES_TO_DEGREES)
            .longitude(positionLong * SEMICIRCLES_TO_DEGREES)
            .timestamp(toInstant(record.getTimestamp()));

        if (record.getAltitude() != null) {
            point.elevation(record.getAltitude());
        } else if (record.getEnhancedAltitude() != null) {
            point.elevation(record.getEnhancedAltitude());
        }

        if (record.getHeartRate() != null) {
            point.heartRate(record.getHeartRate().intValue());
        }

        if (record.getCadence() != null) {
            point.cadence(record.getCadence().intValue());
        }

        // m/s to km/h
        if (record.getSpeed() != null) {
            point.speed(record.getSpeed() * MPS_TO_KPH);
        } else if (record.getEnhancedSpeed() != null) {
            point.speed(record.getEnhancedSpeed() * MPS_TO_KPH);
        }

        return point.build();
    }

    /**
     * Fills file-level stats from the session, falling back to values calculated from the points.
     */
    private void applyStats(ParsedActivityData parsedData, SessionMesg session) {
        List<TrackPoint> points = parsedData.getTrackPoints();

        if (!points.isEmpty()) {
            parsedData.setStartTime(points.get(0).timestamp());
            parsedData.setEndTime(points.get(points.size() - 1).timestamp());
        }

        if (session == null) {
            log.debug("FIT file has no session message, calculating stats from {} records", points.size());
            parsedData.setTotalTimeSeconds(ActivityStats.elapsedSeconds(points));
            parsedData.setTotalDistanceMeters(ActivityStats.totalDistanceMeters(points));
            parsedData.setElevationGainMeters(ActivityStats.elevationGainMeters(points));
            parsedData.setAverageHeartRate(ActivityStats.averageHeartRate(points));
            parsedData.setMaxHeartRate(ActivityStats.maxHeartRate(points));
            return;
        }

        if (parsedData.getStartTime() == null) {
            parsedData.setStartTime(toInstant(session.getStartTime()));
        }

        if (session.getSport() != null) {
            parsedData.setSport(session.getSport().name().toLowerCase());
        }

        parsedData.setTotalTimeSeconds(positiveOr(session.getTotalTimerTime(), ActivityStats.elapsedSeconds(points)));
        parsedData.setTotalDistanceMeters(positiveOr(session.getTotalDistance(), ActivityStats.totalDistanceMeters(points)));
        parsedData.setElevationGainMeters(positiveOr(session.getTotalAscent(), ActivityStats.elevationGainMeters(points)));

        if (session.getAvgHeartRate() != null) {
            parsedData.setAverageHeartRate(session.getAvgHeartRate().intValue());
        }

        if (session.getMaxHeartRate() != null) {
            parsedData.setMaxHeartRate(session.getMaxHeartRate().intValue());
        }

        if (session.getTotalCalories() != null) {
            parsedData.setCalories(session.getTotalCalories());
        }
    }

    private static double positiveOr(Number sessionValue, double calculated) {
        if (sessionValue != null && sessionValue.doubleValue() > 0) {
            return sessionValue.doubleValue();
        }
        return calculated;
    }

    /**
     * Converts FIT DateTime to Instant. FIT timestamps count from 1989-12-31T00:00:00Z,
     * the SDK's {@link DateTime#getDate()} applies that offset.
     */
    private static Instant toInstant(DateTime dateTime) {
        return dateTime != null ? dateTime.getDate().toInstant() : null;
    }

    private static final class SessionSummary {
        private SessionMesg mesg;
    }
}
