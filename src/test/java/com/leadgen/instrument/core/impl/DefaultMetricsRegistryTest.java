package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.model.AverageMetrics;
import com.leadgen.instrument.model.MetricSample;
import com.leadgen.instrument.model.OperationReport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DefaultMetricsRegistryTest {

    @Test
    void testSampleCountCappedAtMaxSamples() {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler());

        for (int n = 1; n <= 150; n++) {
            registry.record("scrape", 0.01);
            assertEquals(Math.min(n, 100), registry.samples("scrape").size());
        }

        List<MetricSample> samples = registry.samples("scrape");
        // oldest dropped: remaining call indexes are 51..150
        assertEquals(51, samples.get(0).callIndex());
        assertEquals(150, samples.get(99).callIndex());
        assertEquals(150, registry.average("scrape").orElseThrow().callCount());
    }

    @Test
    void testCustomMaxSamples() {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler(), 3);
        for (int i = 0; i < 5; i++) {
            registry.record("op", i);
        }
        assertEquals(3, registry.samples("op").size());
        assertThrows(IllegalArgumentException.class, () -> new DefaultMetricsRegistry(new FakeResourceSampler(), 0));
    }

    @Test
    void testSampleCarriesResourceAndCacheCounters() {
        FakeResourceSampler sampler = new FakeResourceSampler().residentMB(256).processCpuPercent(12.5);
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(sampler);

        registry.recordCacheMiss("lookup");
        registry.recordCacheHit("lookup");
        registry.recordCacheHit("lookup");
        registry.record("lookup", 0.2);

        MetricSample sample = registry.samples("lookup").get(0);
        assertEquals(12.5, sample.cpuPercent());
        assertEquals(256.0, sample.memoryMB());
        assertEquals(256.0 / 16384.0 * 100.0, sample.memoryPercent(), 1e-9);
        assertEquals(0.2, sample.executionTimeSeconds());
        assertEquals(1, sample.callIndex());
        assertEquals(2, sample.cacheHitsAtRecording());
        assertEquals(1, sample.cacheMissesAtRecording());
    }

    @Test
    void testAverage() {
        FakeResourceSampler sampler = new FakeResourceSampler();
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(sampler);

        assertTrue(registry.average("analyze").isEmpty());

        sampler.residentMB(100).processCpuPercent(10);
        registry.record("analyze", 0.1);
        sampler.residentMB(300).processCpuPercent(30);
        registry.recordCacheHit("analyze");
        registry.record("analyze", 0.3);

        AverageMetrics avg = registry.average("analyze").orElseThrow();
        assertEquals(20.0, avg.cpuPercent(), 1e-9);
        assertEquals(200.0, avg.memoryMB(), 1e-9);
        assertEquals(0.2, avg.executionTimeSeconds(), 1e-9);
        assertEquals(2, avg.callCount());
        assertEquals(1, avg.cacheHits());
        assertEquals(0, avg.cacheMisses());
        assertEquals(2, avg.sampleCount());
    }

    @Test
    void testReport() {
        FakeResourceSampler sampler = new FakeResourceSampler().residentMB(123.456).processCpuPercent(7.777);
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(sampler);

        registry.record("export", 0.0125);
        registry.record("export", 0.0375);
        registry.recordCacheHit("search");
        registry.recordCacheMiss("search");
        registry.recordCacheMiss("search");
        registry.recordCacheMiss("search");
        registry.record("search", 1.0);

        Map<String, OperationReport> report = registry.report();
        assertEquals(List.of("export", "search"), new ArrayList<>(report.keySet()));

        OperationReport export = report.get("export");
        assertEquals(7.78, export.avgCpuPercent());
        assertEquals(123.46, export.avgMemoryMB());
        assertEquals(25.0, export.avgExecutionTimeMs());
        assertEquals(12.5, export.minExecutionTimeMs());
        assertEquals(37.5, export.maxExecutionTimeMs());
        assertEquals(2, export.totalCalls());
        assertEquals(0.0, export.cacheHitRatePercent());
        assertEquals(0, export.totalCacheHits());
        assertEquals(0, export.totalCacheMisses());

        OperationReport search = report.get("search");
        assertEquals(25.0, search.cacheHitRatePercent());
        assertEquals(1, search.totalCacheHits());
        assertEquals(3, search.totalCacheMisses());
        assertEquals(1000.0, search.avgExecutionTimeMs());
    }

    @Test
    void testOperationsWithoutSamplesAreOmittedFromReport() {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler());
        registry.recordCacheHit("onlyHits");

        assertTrue(registry.report().isEmpty());
        assertTrue(registry.average("onlyHits").isEmpty());
        assertEquals(1, registry.operationNames().size());
    }

    @Test
    void testSamplingFailureIsSwallowed() {
        FakeResourceSampler sampler = new FakeResourceSampler().failMemory(true).failCpu(true);
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(sampler);

        assertDoesNotThrow(() -> registry.record("flaky", 0.5));

        MetricSample sample = registry.samples("flaky").get(0);
        assertEquals(0.0, sample.cpuPercent());
        assertEquals(0.0, sample.memoryMB());
        assertEquals(0.5, sample.executionTimeSeconds());
        assertEquals(1, sample.callIndex());
    }

    @Test
    void testSamplesAreDefensiveCopies() {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler());
        registry.record("op", 0.1);
        List<MetricSample> samples = registry.samples("op");

        assertThrows(UnsupportedOperationException.class, () -> samples.add(samples.get(0)));
        registry.record("op", 0.1);
        assertEquals(1, samples.size());
        assertTrue(registry.samples("missing").isEmpty());
    }

    @Test
    void testClear() {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler());
        registry.record("op", 0.1);
        registry.clear();

        assertTrue(registry.report().isEmpty());
        assertTrue(registry.operationNames().isEmpty());
    }

    @Test
    void testConcurrentRecordingKeepsCallIndexConsistent() throws Exception {
        DefaultMetricsRegistry registry = new DefaultMetricsRegistry(new FakeResourceSampler(), 1000);
        int threads = 8;
        int perThread = 100;

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < perThread; i++) {
                        registry.record("parallel", 0.001);
                        registry.recordCacheMiss("parallel");
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<MetricSample> samples = registry.samples("parallel");
        assertEquals(threads * perThread, samples.size());
        for (int i = 0; i < samples.size(); i++) {
            assertEquals(i + 1, samples.get(i).callIndex());
        }
        assertEquals(threads * perThread, registry.report().get("parallel").totalCacheMisses());
    }
}
