package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.Operation;
import com.leadgen.instrument.core.ResourceSampler;
import com.leadgen.instrument.core.ResourceWarningListener;
import com.leadgen.instrument.core.SamplingException;
import com.leadgen.instrument.model.CpuSnapshot;
import com.leadgen.instrument.model.MemorySnapshot;
import com.leadgen.instrument.model.ResourceWarning;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 资源阈值观测器。
 *
 * 调用前采集内存与CPU快照，超过阈值时发出告警；调用后再次采集内存，
 * 增长超过 memoryGrowthThresholdMB 时再发出一次告警。
 * 纯观测：不会因阈值超限而抛出异常，也不会阻止或取消被包装的调用。
 */
public class ThresholdGuard {

    private static final Logger log = LoggerFactory.getLogger(ThresholdGuard.class);

    public static final double DEFAULT_MEMORY_GROWTH_MB = 50.0;
    public static final Duration DEFAULT_CPU_SAMPLE_INTERVAL = Duration.ofSeconds(1);

    private final double memoryThresholdMB;
    private final double cpuThresholdPercent;
    private final double memoryGrowthThresholdMB;
    private final Duration cpuSampleInterval;
    private final ResourceSampler sampler;

    private final List<ResourceWarningListener> listeners = new CopyOnWriteArrayList<>();

    public ThresholdGuard(double memoryThresholdMB, double cpuThresholdPercent, ResourceSampler sampler) {
        this(memoryThresholdMB, cpuThresholdPercent, DEFAULT_MEMORY_GROWTH_MB,
                DEFAULT_CPU_SAMPLE_INTERVAL, sampler);
    }

    public ThresholdGuard(double memoryThresholdMB, double cpuThresholdPercent,
                          double memoryGrowthThresholdMB, Duration cpuSampleInterval,
                          ResourceSampler sampler) {
        if (memoryThresholdMB < 0 || cpuThresholdPercent < 0 || memoryGrowthThresholdMB < 0) {
            throw new IllegalArgumentException(String.format(
                    "Thresholds must be non-negative: memory=%sMB, cpu=%s%%, growth=%sMB",
                    memoryThresholdMB, cpuThresholdPercent, memoryGrowthThresholdMB));
        }
        this.memoryThresholdMB = memoryThresholdMB;
        this.cpuThresholdPercent = cpuThresholdPercent;
        this.memoryGrowthThresholdMB = memoryGrowthThresholdMB;
        this.cpuSampleInterval = cpuSampleInterval;
        this.sampler = sampler;
    }

    public ThresholdGuard addListener(ResourceWarningListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * 用阈值观测包装一个操作。
     *
     * @param operationName 告警中使用的操作名
     * @param operation     被包装的操作
     */
    public <I, O> Operation<I, O> wrap(String operationName, Operation<I, O> operation) {
        return input -> {
            MemorySnapshot before = checkBefore(operationName);
            try {
                return operation.apply(input);
            } finally {
                checkAfter(operationName, before);
            }
        };
    }

    private MemorySnapshot checkBefore(String operationName) {
        MemorySnapshot memory = null;
        try {
            memory = sampler.memorySnapshot();
            if (memory.residentMB() > memoryThresholdMB) {
                emit(new ResourceWarning(operationName, ResourceWarning.Kind.MEMORY_THRESHOLD,
                        memory.residentMB(), memoryThresholdMB,
                        String.format("High memory usage before %s: %.1fMB", operationName, memory.residentMB())));
            }
        } catch (SamplingException | RuntimeException e) {
            samplingFailed(operationName, "memory", e);
        }

        try {
            CpuSnapshot cpu = sampler.cpuSnapshot(cpuSampleInterval);
            if (cpu.percentTotal() > cpuThresholdPercent) {
                emit(new ResourceWarning(operationName, ResourceWarning.Kind.CPU_THRESHOLD,
                        cpu.percentTotal(), cpuThresholdPercent,
                        String.format("High CPU usage before %s: %.1f%%", operationName, cpu.percentTotal())));
            }
        } catch (SamplingException | RuntimeException e) {
            samplingFailed(operationName, "CPU", e);
        }
        return memory;
    }

    private void checkAfter(String operationName, MemorySnapshot before) {
        if (before == null) {
            return;
        }
        try {
            MemorySnapshot after = sampler.memorySnapshot();
            double growth = after.residentMB() - before.residentMB();
            if (growth > memoryGrowthThresholdMB) {
                emit(new ResourceWarning(operationName, ResourceWarning.Kind.MEMORY_GROWTH,
                        growth, memoryGrowthThresholdMB,
                        String.format("Operation %s increased memory by %.1fMB", operationName, growth)));
            }
        } catch (SamplingException | RuntimeException e) {
            samplingFailed(operationName, "memory", e);
        }
    }

    private void samplingFailed(String operationName, String resource, Exception e) {
        emit(new ResourceWarning(operationName, ResourceWarning.Kind.SAMPLING_FAILURE, 0.0, 0.0,
                String.format("Failed to sample %s around %s: %s", resource, operationName, e.getMessage())));
    }

    private void emit(ResourceWarning warning) {
        log.warn(warning.message());
        for (ResourceWarningListener listener : listeners) {
            try {
                listener.onWarning(warning);
            } catch (RuntimeException e) {
                log.error("Resource warning listener failed for '{}': {}",
                        warning.operationName(), e.getMessage(), e);
            }
        }
    }

    public double getMemoryThresholdMB() { return memoryThresholdMB; }
    public double getCpuThresholdPercent() { return cpuThresholdPercent; }
    public double getMemoryGrowthThresholdMB() { return memoryGrowthThresholdMB; }
}
