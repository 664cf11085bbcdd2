package com.leadgen.instrument;

import com.leadgen.instrument.core.MemoryReclaimer;
import com.leadgen.instrument.core.MetricsRegistry;
import com.leadgen.instrument.core.Operation;
import com.leadgen.instrument.core.ResourceSampler;
import com.leadgen.instrument.core.ResourceWarningListener;
import com.leadgen.instrument.core.impl.BatchExecutor;
import com.leadgen.instrument.core.impl.DefaultMetricsRegistry;
import com.leadgen.instrument.core.impl.DefaultResourceSampler;
import com.leadgen.instrument.core.impl.GcMemoryReclaimer;
import com.leadgen.instrument.core.impl.InstrumentedCache;
import com.leadgen.instrument.core.impl.ThresholdGuard;
import com.leadgen.instrument.core.impl.TimedOperation;
import com.leadgen.instrument.model.OperationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 监控组件的统一入口。
 *
 * 显式构造，持有一个指标注册表并注入到它创建的每个包装器中；没有进程级全局实例。
 * 调用方（抓取、分析、导出模块）通过 wrapWith* 方法或 {@link #pipeline} 获得包装后的操作。
 *
 * <pre>{@code
 * try (Instrumentation instrumentation = Instrumentation.create()) {
 *     InstrumentedCache<String, Company> lookup =
 *         instrumentation.wrapWithCache("lookupCompany", registry::find, 256, Duration.ofMinutes(30));
 *     Company c = lookup.apply("01234567");
 * }
 * }</pre>
 */
public class Instrumentation implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Instrumentation.class);

    private final InstrumentConfig config;
    private final ResourceSampler sampler;
    private final MetricsRegistry registry;
    private final MemoryReclaimer reclaimer;
    private final List<ResourceWarningListener> warningListeners = new CopyOnWriteArrayList<>();

    public Instrumentation(InstrumentConfig config) {
        this(config, new DefaultResourceSampler());
    }

    public Instrumentation(InstrumentConfig config, ResourceSampler sampler) {
        this(config, sampler, new DefaultMetricsRegistry(sampler, config.getMetricsMaxSamples()),
                new GcMemoryReclaimer(sampler));
    }

    public Instrumentation(InstrumentConfig config, ResourceSampler sampler,
                           MetricsRegistry registry, MemoryReclaimer reclaimer) {
        this.config = config;
        this.sampler = sampler;
        this.registry = registry;
        this.reclaimer = reclaimer;
        log.info("Instrumentation initialized with config: {}", config);
    }

    /**
     * 使用类路径上的 {@value InstrumentConfig#DEFAULT_RESOURCE} 创建实例。
     */
    public static Instrumentation create() {
        return new Instrumentation(InstrumentConfig.loadFromClasspath());
    }

    // ==================== 包装器 ====================

    public <I, O> InstrumentedCache<I, O> wrapWithCache(String operationName, Operation<I, O> operation,
                                                        int capacity, Duration ttl) {
        return new InstrumentedCache<>(operationName, operation, capacity, ttl, registry);
    }

    /**
     * 使用配置中的默认容量与TTL。
     */
    public <I, O> InstrumentedCache<I, O> wrapWithCache(String operationName, Operation<I, O> operation) {
        return wrapWithCache(operationName, operation,
                config.getCacheDefaultCapacity(), config.getCacheDefaultTtl());
    }

    public <I, O> Operation<I, O> wrapWithThresholdGuard(String operationName, Operation<I, O> operation,
                                                         double memoryThresholdMB, double cpuThresholdPercent) {
        return newGuard(memoryThresholdMB, cpuThresholdPercent).wrap(operationName, operation);
    }

    public <I, O> Operation<I, O> wrapWithThresholdGuard(String operationName, Operation<I, O> operation) {
        return wrapWithThresholdGuard(operationName, operation,
                config.getGuardMemoryThresholdMB(), config.getGuardCpuThresholdPercent());
    }

    public <T, R> Operation<List<T>, List<R>> wrapWithBatching(String operationName,
                                                               Operation<List<T>, List<R>> operation,
                                                               int batchSize) {
        return newBatchExecutor(batchSize).wrap(operationName, operation);
    }

    /**
     * 使用配置中的默认批大小。
     */
    public <T, R> Operation<List<T>, List<R>> wrapWithBatching(String operationName,
                                                               Operation<List<T>, List<R>> operation) {
        return wrapWithBatching(operationName, operation, config.getBatchDefaultSize());
    }

    public <I, O> Operation<I, O> wrapWithMetrics(String operationName, Operation<I, O> operation) {
        return new TimedOperation<>(operationName, operation, registry);
    }

    /**
     * 开始一个显式组合的包装链，层按调用顺序从内到外叠加。
     */
    public <I, O> OperationPipeline<I, O> pipeline(String operationName, Operation<I, O> operation) {
        return new OperationPipeline<>(this, operationName, operation);
    }

    ThresholdGuard newGuard(double memoryThresholdMB, double cpuThresholdPercent) {
        ThresholdGuard guard = new ThresholdGuard(memoryThresholdMB, cpuThresholdPercent,
                config.getGuardMemoryGrowthMB(), config.getGuardCpuSampleInterval(), sampler);
        for (ResourceWarningListener listener : warningListeners) {
            guard.addListener(listener);
        }
        return guard;
    }

    BatchExecutor newBatchExecutor(int batchSize) {
        return new BatchExecutor(batchSize, config.getBatchReclaimEveryChunks(), reclaimer);
    }

    // ==================== 观测与报表 ====================

    /**
     * 注册资源告警观察者，对之后创建的阈值观测器生效。
     */
    public Instrumentation addWarningListener(ResourceWarningListener listener) {
        warningListeners.add(listener);
        return this;
    }

    public MetricsRegistry getMetricsRegistry() {
        return registry;
    }

    public ResourceSampler getResourceSampler() {
        return sampler;
    }

    public InstrumentConfig getConfig() {
        return config;
    }

    /**
     * 将当前报表逐行写入日志。
     */
    public void logReport() {
        Map<String, OperationReport> report = registry.report();
        if (report.isEmpty()) {
            log.info("Performance report: no operations recorded.");
            return;
        }
        log.info("Performance report ({} operations):", report.size());
        report.forEach((name, r) -> log.info(
                "  {}: calls={}, avg={}ms, min={}ms, max={}ms, cpu={}%, mem={}MB, hitRate={}% ({} hits / {} misses)",
                name, r.totalCalls(), r.avgExecutionTimeMs(), r.minExecutionTimeMs(), r.maxExecutionTimeMs(),
                r.avgCpuPercent(), r.avgMemoryMB(), r.cacheHitRatePercent(),
                r.totalCacheHits(), r.totalCacheMisses()));
    }

    /**
     * 输出最终报表并清空注册表。
     */
    @Override
    public void close() {
        logReport();
        registry.clear();
        log.info("Instrumentation shut down.");
    }
}
