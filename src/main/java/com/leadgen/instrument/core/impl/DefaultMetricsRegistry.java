package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.MetricsRegistry;
import com.leadgen.instrument.core.ResourceSampler;
import com.leadgen.instrument.core.SamplingException;
import com.leadgen.instrument.model.AverageMetrics;
import com.leadgen.instrument.model.MemorySnapshot;
import com.leadgen.instrument.model.MetricSample;
import com.leadgen.instrument.model.OperationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

import static com.leadgen.instrument.model.OperationReport.round2;

/**
 * 指标注册表默认实现。
 *
 * 每个操作保留最近 maxSamples 个采样点（默认100），超出时丢弃最旧的。
 * 资源快照在锁外采集，调用计数与采样追加在同一临界区内完成，
 * 因此同一操作的 callIndex 严格递增且与采样顺序一致。
 */
public class DefaultMetricsRegistry implements MetricsRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultMetricsRegistry.class);

    public static final int DEFAULT_MAX_SAMPLES = 100;

    private final ResourceSampler sampler;
    private final int maxSamples;

    /** 单一互斥锁，串行化全部读写 */
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, OperationStats> stats = new HashMap<>();

    public DefaultMetricsRegistry(ResourceSampler sampler) {
        this(sampler, DEFAULT_MAX_SAMPLES);
    }

    public DefaultMetricsRegistry(ResourceSampler sampler, int maxSamples) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive, got: " + maxSamples);
        }
        this.sampler = sampler;
        this.maxSamples = maxSamples;
        log.info("MetricsRegistry initialized. Max samples per operation: {}", maxSamples);
    }

    // ==================== 写入 ====================

    @Override
    public void record(String operationName, double executionTimeSeconds) {
        double cpuPercent = 0.0;
        double memoryPercent = 0.0;
        double memoryMB = 0.0;
        try {
            cpuPercent = sampler.processCpuPercent();
        } catch (SamplingException | RuntimeException e) {
            log.warn("Failed to sample CPU for '{}': {}", operationName, e.getMessage());
        }
        try {
            MemorySnapshot memory = sampler.memorySnapshot();
            memoryPercent = memory.percentOfSystem();
            memoryMB = memory.residentMB();
        } catch (SamplingException | RuntimeException e) {
            log.warn("Failed to sample memory for '{}': {}", operationName, e.getMessage());
        }

        lock.lock();
        try {
            OperationStats op = statsFor(operationName);
            op.callCounter++;
            op.samples.addLast(new MetricSample(
                    cpuPercent,
                    memoryPercent,
                    memoryMB,
                    executionTimeSeconds,
                    op.callCounter,
                    op.hits,
                    op.misses));
            while (op.samples.size() > maxSamples) {
                op.samples.pollFirst();
            }
        } finally {
            lock.unlock();
        }
        log.trace("Recorded '{}' in {}s", operationName, executionTimeSeconds);
    }

    @Override
    public void recordCacheHit(String operationName) {
        lock.lock();
        try {
            statsFor(operationName).hits++;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordCacheMiss(String operationName) {
        lock.lock();
        try {
            statsFor(operationName).misses++;
        } finally {
            lock.unlock();
        }
    }

    // ==================== 读取 ====================

    @Override
    public Optional<AverageMetrics> average(String operationName) {
        lock.lock();
        try {
            OperationStats op = stats.get(operationName);
            if (op == null || op.samples.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(averageOf(op));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Map<String, OperationReport> report() {
        Map<String, OperationReport> report = new TreeMap<>();
        lock.lock();
        try {
            for (Map.Entry<String, OperationStats> entry : stats.entrySet()) {
                OperationStats op = entry.getValue();
                if (op.samples.isEmpty()) {
                    continue;
                }
                AverageMetrics avg = averageOf(op);
                double minSeconds = Double.MAX_VALUE;
                double maxSeconds = 0.0;
                for (MetricSample sample : op.samples) {
                    minSeconds = Math.min(minSeconds, sample.executionTimeSeconds());
                    maxSeconds = Math.max(maxSeconds, sample.executionTimeSeconds());
                }
                report.put(entry.getKey(), new OperationReport(
                        round2(avg.cpuPercent()),
                        round2(avg.memoryMB()),
                        round2(avg.executionTimeSeconds() * 1000.0),
                        round2(minSeconds * 1000.0),
                        round2(maxSeconds * 1000.0),
                        avg.callCount(),
                        round2(OperationReport.hitRatePercent(op.hits, op.misses)),
                        op.hits,
                        op.misses));
            }
        } finally {
            lock.unlock();
        }
        return Collections.unmodifiableMap(report);
    }

    @Override
    public List<MetricSample> samples(String operationName) {
        lock.lock();
        try {
            OperationStats op = stats.get(operationName);
            return op == null ? List.of() : List.copyOf(op.samples);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> operationNames() {
        lock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(stats.keySet()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            stats.clear();
        } finally {
            lock.unlock();
        }
        log.info("All metrics cleared.");
    }

    public int getMaxSamples() {
        return maxSamples;
    }

    // ==================== 内部方法（调用方需持有锁） ====================

    private OperationStats statsFor(String operationName) {
        return stats.computeIfAbsent(operationName, k -> new OperationStats());
    }

    /**
     * 平均值取自保留的采样；调用计数与命中统计取最新采样记录时的值。
     */
    private static AverageMetrics averageOf(OperationStats op) {
        List<MetricSample> samples = new ArrayList<>(op.samples);
        int count = samples.size();
        double cpu = 0;
        double memPercent = 0;
        double memMB = 0;
        double time = 0;
        for (MetricSample s : samples) {
            cpu += s.cpuPercent();
            memPercent += s.memoryPercent();
            memMB += s.memoryMB();
            time += s.executionTimeSeconds();
        }
        MetricSample latest = samples.get(count - 1);
        return new AverageMetrics(
                cpu / count,
                memPercent / count,
                memMB / count,
                time / count,
                latest.callIndex(),
                latest.cacheHitsAtRecording(),
                latest.cacheMissesAtRecording(),
                count);
    }

    /**
     * 单个操作的统计数据，仅由注册表持有。
     */
    private static final class OperationStats {
        private final Deque<MetricSample> samples = new ArrayDeque<>();
        private long callCounter;
        private long hits;
        private long misses;
    }
}
