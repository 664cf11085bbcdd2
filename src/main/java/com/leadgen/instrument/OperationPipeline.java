package com.leadgen.instrument;

import com.leadgen.instrument.core.Operation;
import com.leadgen.instrument.core.impl.InstrumentedCache;
import com.leadgen.instrument.core.impl.TimedOperation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 显式的包装链构造器。每次调用在当前操作外再包一层，先调用的层位于最内侧。
 *
 * <pre>{@code
 * Operation<List<String>, List<Lead>> enrich = instrumentation.pipeline("enrich", enricher)
 *     .batched(50)          // 最内层
 *     .guarded(500, 80)
 *     .timed()
 *     .cached(64, Duration.ofMinutes(10))   // 最外层
 *     .build();
 * }</pre>
 *
 * @param <I> 输入类型
 * @param <O> 输出类型
 */
public class OperationPipeline<I, O> {

    private final Instrumentation instrumentation;
    private final String operationName;
    private final List<String> layers = new ArrayList<>();
    private Operation<I, O> current;
    private InstrumentedCache<I, O> cache;

    OperationPipeline(Instrumentation instrumentation, String operationName, Operation<I, O> operation) {
        this.instrumentation = instrumentation;
        this.operationName = operationName;
        this.current = operation;
    }

    /**
     * 分批层。输入为 List 时分批执行；批结果为 List 时拼接，否则每批追加一个元素，
     * 因此只应用于输入输出均为 List 的操作。
     */
    @SuppressWarnings("unchecked")
    public OperationPipeline<I, O> batched(int batchSize) {
        Operation<Object, Object> dynamic = (Operation<Object, Object>) (Operation<?, ?>) current;
        Operation<Object, Object> wrapped = instrumentation.newBatchExecutor(batchSize)
                .wrapDynamic(operationName, dynamic);
        current = (Operation<I, O>) (Operation<?, ?>) wrapped;
        layers.add("batch");
        return this;
    }

    public OperationPipeline<I, O> batched() {
        return batched(instrumentation.getConfig().getBatchDefaultSize());
    }

    public OperationPipeline<I, O> guarded(double memoryThresholdMB, double cpuThresholdPercent) {
        current = instrumentation.newGuard(memoryThresholdMB, cpuThresholdPercent).wrap(operationName, current);
        layers.add("guard");
        return this;
    }

    public OperationPipeline<I, O> guarded() {
        InstrumentConfig config = instrumentation.getConfig();
        return guarded(config.getGuardMemoryThresholdMB(), config.getGuardCpuThresholdPercent());
    }

    public OperationPipeline<I, O> timed() {
        current = new TimedOperation<>(operationName, current, instrumentation.getMetricsRegistry());
        layers.add("timed");
        return this;
    }

    public OperationPipeline<I, O> cached(int capacity, Duration ttl) {
        cache = instrumentation.wrapWithCache(operationName, current, capacity, ttl);
        current = cache;
        layers.add("cache");
        return this;
    }

    public OperationPipeline<I, O> cached() {
        InstrumentConfig config = instrumentation.getConfig();
        return cached(config.getCacheDefaultCapacity(), config.getCacheDefaultTtl());
    }

    public Operation<I, O> build() {
        return current;
    }

    /**
     * 最近一次添加的缓存层，未添加时为null。用于 clear()/info()。
     */
    public InstrumentedCache<I, O> cache() {
        return cache;
    }

    /**
     * 已添加的层，从内到外。
     */
    public List<String> layers() {
        return Collections.unmodifiableList(layers);
    }
}
