package org.operaton.rungrade.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.operaton.rungrade.model.BatchJob;
import org.operaton.rungrade.model.dto.UploadedFile;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BatchJobRegistry.
 */
class BatchJobRegistryTest {

    private BatchJobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new BatchJobRegistry();
    }

    private static BatchJob newJob() {
        return new BatchJob(List.of(new UploadedFile("run.gpx", new byte[]{1})), 50);
    }

    @Test
    @DisplayName("Should register, find and remove jobs")
    void testLifecycle() {
        BatchJob job = newJob();

        registry.register(job);

        assertSame(job, registry.find(job.getId()).orElseThrow());
        assertEquals(1, registry.size());

        registry.remove(job.getId());

        assertTrue(registry.find(job.getId()).isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should evict old jobs but leave processing jobs alone")
    void testEviction() {
        BatchJob waiting = newJob();
        BatchJob running = newJob();
        running.tryStart();
        registry.register(waiting);
        registry.register(running);

        int evicted = registry.evictCreatedBefore(Instant.now().plusSeconds(1));

        assertEquals(1, evicted);
        assertTrue(registry.find(waiting.getId()).isEmpty());
        assertTrue(waiting.getFiles().isEmpty());
        assertTrue(registry.find(running.getId()).isPresent());
    }

    @Test
    @DisplayName("Should keep jobs created after the cutoff")
    void testNoEvictionOfFreshJobs() {
        registry.register(newJob());

        assertEquals(0, registry.evictCreatedBefore(Instant.now().minusSeconds(60)));
        assertEquals(1, registry.size());
    }
}
