package org.operaton.rungrade.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.rungrade.model.Bin;
import org.operaton.rungrade.model.dto.AnalysisRequest;
import org.operaton.rungrade.model.dto.HeartRateRange;
import org.operaton.rungrade.model.dto.RunResult;
import org.operaton.rungrade.util.TestTracks;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for the REST API, from HTTP request through parsing, binning and analysis.
 */
@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureMockMvc
class AnalysisApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private static MockMultipartFile upload(String filename, String content) {
        return new MockMultipartFile("files", filename, "application/octet-stream",
            content.getBytes(StandardCharsets.UTF_8));
    }

    private static Bin bin(double gradient, double distance, double seconds, Integer heartRate) {
        return Bin.builder()
            .gradientPercent(gradient)
            .distanceMeters(distance)
            .durationSeconds(seconds)
            .velocityMps(distance / seconds)
            .paceMinPerKm((seconds / 60) / (distance / 1000))
            .avgHeartRate(heartRate)
            .build();
    }

    @Test
    @DisplayName("Health endpoint should report the supported formats")
    void testHealth() throws Exception {
        mockMvc.perform(get("/api/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("OK"))
            .andExpect(jsonPath("$.supportedFormats", contains("GPX", "FIT")));
    }

    @Test
    @DisplayName("Should bin uploaded files and report failing files separately")
    void testAnalyzeWithBins() throws Exception {
        mockMvc.perform(multipart("/api/analyze-with-bins")
                .file(upload("run.gpx", TestTracks.gpxWithHeartRate()))
                .file(upload("notes.txt", "not an activity"))
                .param("binLength", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.summary.totalFiles").value(2))
            .andExpect(jsonPath("$.summary.successfulFiles").value(1))
            .andExpect(jsonPath("$.summary.filesWithHeartRate").value(1))
            .andExpect(jsonPath("$.results[0].filename").value("run.gpx"))
            .andExpect(jsonPath("$.results[0].sport").value("running"))
            .andExpect(jsonPath("$.results[0].bins", hasSize(2)))
            .andExpect(jsonPath("$.results[0].bins[0].startIndex").value(0))
            .andExpect(jsonPath("$.results[0].bins[1].startIndex").value(1))
            .andExpect(jsonPath("$.results[0].startTime").value("2024-05-01T07:00:00Z"))
            .andExpect(jsonPath("$.errors[0].filename").value("notes.txt"))
            .andExpect(jsonPath("$.errors[0].errorType").value("UNSUPPORTED_FORMAT"));
    }

    @Test
    @DisplayName("Should reject an upload without files")
    void testAnalyzeWithoutFiles() throws Exception {
        mockMvc.perform(multipart("/api/analyze-with-bins"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("No files provided"));
    }

    @Test
    @DisplayName("Should run the advanced analysis on posted results")
    void testAdvancedAnalysis() throws Exception {
        RunResult run = RunResult.builder()
            .filename("run.gpx")
            .bins(List.of(bin(0, 1000, 300, 150), bin(0.4, 1000, 330, 152), bin(10, 1000, 450, 165)))
            .build();
        String body = objectMapper.writeValueAsString(new AnalysisRequest(List.of(run), false, null));

        mockMvc.perform(post("/api/advanced-analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.analyses.gradientPace.totalBinsAnalyzed").value(3))
            .andExpect(jsonPath("$.analyses.paceByGradientChart[0].gradient").value("0"))
            .andExpect(jsonPath("$.analyses.paceByGradientChart[0].binCount").value(2))
            .andExpect(jsonPath("$.analyses.gradeAdjustment.basePace").value(closeTo(5.25, 1e-9)))
            .andExpect(jsonPath("$.analyses.gradeAdjustment.basePaceLabel").value("5:15"))
            .andExpect(jsonPath("$.analyses.adjustmentExpectation.statistic").value("MEAN"));
    }

    @Test
    @DisplayName("Should honour the statistic parameter")
    void testAdvancedAnalysisMedian() throws Exception {
        String body = objectMapper.writeValueAsString(new AnalysisRequest(
            List.of(RunResult.builder().bins(List.of(bin(0, 1000, 300, null))).build()), false, null));

        mockMvc.perform(post("/api/advanced-analysis")
                .param("statistic", "MEDIAN")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analyses.adjustmentExpectation.statistic").value("MEDIAN"));
    }

    @Test
    @DisplayName("Should answer 400 when no results are posted")
    void testAdvancedAnalysisWithoutResults() throws Exception {
        mockMvc.perform(post("/api/advanced-analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("No results provided"));

        mockMvc.perform(post("/api/analyze-with-filters-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"removeUnreliableBins\": true}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("No results provided"));
    }

    @Test
    @DisplayName("Should answer 400 for null bins and skip null runs")
    void testMalformedResults() throws Exception {
        mockMvc.perform(post("/api/advanced-analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"results\": [{\"bins\": [null]}]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Bin list contains a null entry"));

        mockMvc.perform(post("/api/analyze-with-filters-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"results\": [{\"bins\": [null]}], \"removeUnreliableBins\": true}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Bin list contains a null entry"));

        mockMvc.perform(post("/api/analyze-with-filters-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"results\": [null]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalOriginalBins").value(0))
            .andExpect(jsonPath("$.filteredResults", hasSize(0)));
    }

    @Test
    @DisplayName("Should filter unreliable bins and out-of-range heart rates before analyzing")
    void testAnalyzeWithFilters() throws Exception {
        RunResult run = RunResult.builder()
            .filename("run.gpx")
            .bins(List.of(
                bin(1, 1000, 300, 150),
                bin(42, 100, 90, 150),
                bin(2, 1000, 320, 185)))
            .build();
        String body = objectMapper.writeValueAsString(
            new AnalysisRequest(List.of(run), true, new HeartRateRange(null, 180)));

        mockMvc.perform(post("/api/analyze-with-filters-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalOriginalBins").value(3))
            .andExpect(jsonPath("$.summary.totalFilteredBins").value(1))
            .andExpect(jsonPath("$.summary.exclusionCounts.gradient").value(1))
            .andExpect(jsonPath("$.summary.exclusionCounts.heartRate").value(1))
            .andExpect(jsonPath("$.summary.exclusionCounts.total").value(2))
            .andExpect(jsonPath("$.filteredResults[0].bins", hasSize(1)))
            .andExpect(jsonPath("$.analyses.gradientPace.totalBinsAnalyzed").value(1));
    }

    @Test
    @DisplayName("Should reject a negative heart rate bound")
    void testInvalidHeartRateRange() throws Exception {
        String body = "{\"results\": [], \"heartRateFilter\": {\"minHeartRate\": -10}}";

        mockMvc.perform(post("/api/analyze-with-filters-json")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Should stream a submitted batch as server-sent events")
    void testStreamedBatch() throws Exception {
        MvcResult uploadResult = mockMvc.perform(multipart("/api/upload-batch")
                .file(upload("run.gpx", TestTracks.gpxWithHeartRate()))
                .file(upload("empty.gpx", TestTracks.gpxWithEmptyTrack()))
                .param("binLength", "50"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.fileCount").value(2))
            .andReturn();

        JsonNode upload = objectMapper.readTree(uploadResult.getResponse().getContentAsString());
        String batchId = upload.get("batchId").asText();

        MvcResult streamResult = mockMvc.perform(get("/api/process-batch/{batchId}", batchId))
            .andExpect(request().asyncStarted())
            .andReturn();
        streamResult.getAsyncResult(10_000);

        String events = streamResult.getResponse().getContentAsString();
        assertEquals(2, countOccurrences(events, "\"type\":\"progress\""));
        assertEquals(1, countOccurrences(events, "\"type\":\"complete\""));
        assertTrue(events.contains("\"errorType\":\"EMPTY_TRACK\""));
        assertTrue(events.contains("\"progressPercent\":100"));

        // a batch can only be streamed once
        mockMvc.perform(get("/api/process-batch/{batchId}", batchId))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should upload and stream a batch in one request")
    void testOneShotStreamedBatch() throws Exception {
        MvcResult streamResult = mockMvc.perform(multipart("/api/analyze-batch")
                .file(upload("run.gpx", TestTracks.gpxWithHeartRate()))
                .file(upload("notes.txt", "not an activity"))
                .param("binLength", "50"))
            .andExpect(request().asyncStarted())
            .andReturn();
        streamResult.getAsyncResult(10_000);

        String events = streamResult.getResponse().getContentAsString();
        assertEquals(2, countOccurrences(events, "\"type\":\"progress\""));
        assertEquals(1, countOccurrences(events, "\"type\":\"complete\""));
        assertTrue(events.contains("\"successfulFiles\":1"));
        assertTrue(events.contains("\"errorType\":\"UNSUPPORTED_FORMAT\""));
    }

    @Test
    @DisplayName("Should stream a single error event when the one-shot upload has no files")
    void testOneShotStreamWithoutFiles() throws Exception {
        MvcResult streamResult = mockMvc.perform(multipart("/api/analyze-batch"))
            .andExpect(status().isOk())
            .andReturn();

        String events = streamResult.getResponse().getContentAsString();
        assertEquals(1, countOccurrences(events, "\"type\":\"error\""));
        assertTrue(events.contains("No files provided"));
        assertFalse(events.contains("\"type\":\"progress\""));
    }

    @Test
    @DisplayName("Should answer 404 with an error event for unknown batches")
    void testUnknownBatch() throws Exception {
        mockMvc.perform(get("/api/process-batch/{batchId}", UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(content().string(containsString("Batch job not found")));
    }

    private static int countOccurrences(String text, String token) {
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }
}
