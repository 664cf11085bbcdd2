package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.KeyDerivationException;
import com.leadgen.instrument.core.Operation;
import com.leadgen.instrument.model.CacheInfo;
import com.leadgen.instrument.model.MetricSample;
import com.leadgen.instrument.model.OperationReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentedCacheTest {

    private FakeResourceSampler sampler;
    private DefaultMetricsRegistry registry;
    private MutableClock clock;
    private AtomicInteger invocations;

    @BeforeEach
    void setUp() {
        sampler = new FakeResourceSampler();
        registry = new DefaultMetricsRegistry(sampler);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        invocations = new AtomicInteger();
    }

    private InstrumentedCache<Integer, String> cache(int capacity, Duration ttl) {
        Operation<Integer, String> f = n -> {
            invocations.incrementAndGet();
            return switch (n) {
                case 1 -> "A";
                case 2 -> "B";
                case 3 -> "C";
                default -> "X" + n;
            };
        };
        return new InstrumentedCache<>("f", f, capacity, ttl, registry, new CacheKeyEncoder(), clock);
    }

    @Test
    void testCapacityEvictsOldestInsertion() throws Exception {
        InstrumentedCache<Integer, String> f = cache(2, null);

        assertEquals("A", f.apply(1));           // miss, table={1}
        clock.advance(Duration.ofMillis(1));
        assertEquals("B", f.apply(2));           // miss, table={1,2}
        clock.advance(Duration.ofMillis(1));
        assertEquals("A", f.apply(1));           // hit, insertedAt unchanged
        assertEquals(2, invocations.get());
        clock.advance(Duration.ofMillis(1));
        assertEquals("C", f.apply(3));           // miss, evicts 1 (oldest insertion, despite recent access)

        assertEquals(2, f.size());
        assertEquals(3, invocations.get());

        // 2 and 3 remain cached
        f.apply(2);
        f.apply(3);
        assertEquals(3, invocations.get());

        // 1 was evicted
        f.apply(1);
        assertEquals(4, invocations.get());

        CacheInfo info = f.info();
        assertEquals(2, info.size());
        assertEquals(2, info.capacity());
        assertNull(info.ttl());
        assertEquals(3, info.hits());
        assertEquals(4, info.misses());
        assertEquals(2, info.evictions());
    }

    @Test
    void testHitDoesNotInvokeOrRecordLatency() throws Exception {
        InstrumentedCache<Integer, String> f = cache(4, null);

        f.apply(1);
        f.apply(1);
        f.apply(1);

        assertEquals(1, invocations.get());
        // only the miss produced a latency sample
        assertEquals(1, registry.samples("f").size());

        OperationReport report = registry.report().get("f");
        assertEquals(2, report.totalCacheHits());
        assertEquals(1, report.totalCacheMisses());
        assertEquals(66.67, report.cacheHitRatePercent(), 0.001);
    }

    @Test
    void testTtlExpiry() throws Exception {
        InstrumentedCache<Integer, String> f = cache(4, Duration.ofSeconds(10));

        f.apply(1);
        clock.advance(Duration.ofSeconds(9));
        f.apply(1);
        assertEquals(1, invocations.get(), "still live just before ttl");

        clock.advance(Duration.ofSeconds(1).plusMillis(1));
        f.apply(1);
        assertEquals(2, invocations.get(), "expired entry is a miss");
        assertEquals(1, f.size());
        assertEquals(1, f.info().evictions());
    }

    @Test
    void testExpiredEntryRemovedEvenIfReloadFails() {
        AtomicInteger calls = new AtomicInteger();
        InstrumentedCache<String, String> f = new InstrumentedCache<>("g", key -> {
            if (calls.incrementAndGet() > 1) {
                throw new IOException("backend down");
            }
            return "v";
        }, 4, Duration.ofSeconds(1), registry, new CacheKeyEncoder(), clock);

        assertDoesNotThrow(() -> f.apply("k"));
        clock.advance(Duration.ofSeconds(2));

        assertThrows(IOException.class, () -> f.apply("k"));
        assertEquals(0, f.size());
    }

    @Test
    void testFailureIsPropagatedNotCachedButRecorded() {
        IllegalStateException failure = new IllegalStateException("scrape failed");
        InstrumentedCache<String, String> f = new InstrumentedCache<>("scrape", key -> {
            invocations.incrementAndGet();
            throw failure;
        }, 4, null, registry, new CacheKeyEncoder(), clock);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> f.apply("x"));
        assertSame(failure, thrown);
        assertThrows(IllegalStateException.class, () -> f.apply("x"));

        assertEquals(2, invocations.get());
        assertEquals(0, f.size());
        assertEquals(2, registry.samples("scrape").size());
        assertEquals(2, f.info().misses());
    }

    @Test
    void testCheckedExceptionPropagatesUnchanged() {
        IOException failure = new IOException("timeout");
        InstrumentedCache<String, String> f = new InstrumentedCache<>("io", key -> {
            throw failure;
        }, 4, null, registry);

        IOException thrown = assertThrows(IOException.class, () -> f.apply("x"));
        assertSame(failure, thrown);
    }

    @Test
    void testKeyDerivationFailsBeforeInvocation() {
        InstrumentedCache<Object, String> f = new InstrumentedCache<>("h", in -> {
            invocations.incrementAndGet();
            return "never";
        }, 4, null, registry);

        assertThrows(KeyDerivationException.class, () -> f.apply(new Object()));
        assertEquals(0, invocations.get());
        assertEquals(0, f.info().misses());
        assertTrue(registry.samples("h").isEmpty());
    }

    @Test
    void testClearAndInvalidate() throws Exception {
        InstrumentedCache<Integer, String> f = cache(4, null);
        f.apply(1);
        f.apply(2);

        assertTrue(f.invalidate(1));
        assertFalse(f.invalidate(1));
        assertEquals(1, f.size());

        f.clear();
        assertEquals(0, f.size());
        f.apply(2);
        assertEquals(3, invocations.get());
    }

    @Test
    void testNullValuesAreCached() throws Exception {
        InstrumentedCache<String, String> f = new InstrumentedCache<>("nullable", key -> {
            invocations.incrementAndGet();
            return null;
        }, 4, null, registry);

        assertNull(f.apply("a"));
        assertNull(f.apply("a"));
        assertEquals(1, invocations.get());
    }

    @Test
    void testInvalidConstruction() {
        assertThrows(IllegalArgumentException.class, () -> cache(0, null));
        assertThrows(IllegalArgumentException.class, () -> cache(2, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> cache(2, Duration.ofSeconds(-1)));
    }

    @Test
    void testDifferentKeysLoadConcurrently() throws Exception {
        CountDownLatch bothStarted = new CountDownLatch(2);
        InstrumentedCache<Integer, Integer> f = new InstrumentedCache<>("slow", n -> {
            bothStarted.countDown();
            // each load waits for the other; would deadlock if loads were serialized
            if (!bothStarted.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("loads were serialized");
            }
            return n * 10;
        }, 4, null, registry);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Integer> a = pool.submit(() -> f.apply(1));
            Future<Integer> b = pool.submit(() -> f.apply(2));
            assertEquals(10, a.get(10, TimeUnit.SECONDS));
            assertEquals(20, b.get(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(2, f.size());
    }

    @Test
    void testSameKeyLoadsAtMostOnce() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch entered = new CountDownLatch(1);
        InstrumentedCache<String, String> f = new InstrumentedCache<>("once", key -> {
            invocations.incrementAndGet();
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return key.toUpperCase();
        }, 4, null, registry);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            Future<String> first = pool.submit(() -> f.apply("lead"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            Future<String> second = pool.submit(() -> f.apply("lead"));
            Future<String> third = pool.submit(() -> f.apply("lead"));

            // give the waiters time to block on the in-flight load
            Thread.sleep(100);
            release.countDown();

            assertEquals("LEAD", first.get(5, TimeUnit.SECONDS));
            assertEquals("LEAD", second.get(5, TimeUnit.SECONDS));
            assertEquals("LEAD", third.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, invocations.get());
        CacheInfo info = f.info();
        assertEquals(1, info.misses());
        assertEquals(2, info.hits());
    }

    @Test
    void testClearDuringLoadDiscardsResult() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InstrumentedCache<String, String> f = new InstrumentedCache<>("racy", key -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return "stale";
        }, 4, null, registry);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> load = pool.submit(() -> f.apply("k"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            f.clear();
            release.countDown();
            assertEquals("stale", load.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(0, f.size());
    }

    @Test
    void testCallAfterClearDoesNotJoinEarlierLoad() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        InstrumentedCache<String, String> f = new InstrumentedCache<>("racy", key -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "stale";
            }
            return "fresh";
        }, 4, null, registry);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> load = pool.submit(() -> f.apply("k"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            f.clear();

            assertEquals("fresh", f.apply("k"));

            release.countDown();
            assertEquals("stale", load.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(2, calls.get());
        CacheInfo info = f.info();
        assertEquals(0, info.hits());
        assertEquals(2, info.misses());
        // the later load owns the table entry; the earlier one is not written back
        assertEquals(1, f.size());
        assertEquals("fresh", f.apply("k"));
    }

    @Test
    void testInvalidateDuringLoadDiscardsResult() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        InstrumentedCache<String, String> f = new InstrumentedCache<>("racy", key -> {
            if (calls.incrementAndGet() == 1) {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return "stale";
            }
            return "fresh";
        }, 4, null, registry);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> load = pool.submit(() -> f.apply("k"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            assertFalse(f.invalidate("k"));
            release.countDown();
            assertEquals("stale", load.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(0, f.size());
        assertEquals("fresh", f.apply("k"));
        assertEquals(2, calls.get());
    }

    @Test
    void testInfoCountsThisInstanceOnly() throws Exception {
        InstrumentedCache<Integer, String> first = cache(4, null);
        InstrumentedCache<Integer, String> second = cache(4, null);

        first.apply(1);
        first.apply(1);
        second.apply(2);

        assertEquals(1, first.info().hits());
        assertEquals(1, first.info().misses());
        assertEquals(0, second.info().hits());
        assertEquals(1, second.info().misses());
        OperationReport report = registry.report().get("f");
        assertEquals(1, report.totalCacheHits());
        assertEquals(2, report.totalCacheMisses());

        registry.clear();
        assertEquals(1, first.info().hits());
    }

    @Test
    void testCallIndexMatchesMissOrder() throws Exception {
        InstrumentedCache<Integer, String> f = cache(8, null);
        for (int i = 0; i < 5; i++) {
            f.apply(i);
        }
        List<MetricSample> samples = registry.samples("f");
        for (int i = 0; i < samples.size(); i++) {
            assertEquals(i + 1, samples.get(i).callIndex());
            assertEquals(i + 1, samples.get(i).cacheMissesAtRecording());
        }
    }
}
