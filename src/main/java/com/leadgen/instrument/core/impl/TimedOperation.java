package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.MetricsRegistry;
import com.leadgen.instrument.core.Operation;

/**
 * 计时包装器：每次调用（无论成功或失败）的耗时都记入指标注册表。
 */
public class TimedOperation<I, O> implements Operation<I, O> {

    private final String operationName;
    private final Operation<I, O> delegate;
    private final MetricsRegistry registry;

    public TimedOperation(String operationName, Operation<I, O> delegate, MetricsRegistry registry) {
        this.operationName = operationName;
        this.delegate = delegate;
        this.registry = registry;
    }

    @Override
    public O apply(I input) throws Exception {
        long startNanos = System.nanoTime();
        try {
            return delegate.apply(input);
        } finally {
            registry.record(operationName, (System.nanoTime() - startNanos) / 1_000_000_000.0);
        }
    }

    /**
     * 为任意代码块计时，关闭时记录耗时。
     *
     * <pre>{@code
     * try (TimedOperation.Sample sample = TimedOperation.start("export", registry)) {
     *     // do work...
     * }
     * }</pre>
     */
    public static Sample start(String operationName, MetricsRegistry registry) {
        return new Sample(operationName, registry);
    }

    public static final class Sample implements AutoCloseable {
        private final String operationName;
        private final MetricsRegistry registry;
        private final long startNanos;
        private boolean closed;

        private Sample(String operationName, MetricsRegistry registry) {
            this.operationName = operationName;
            this.registry = registry;
            this.startNanos = System.nanoTime();
        }

        @Override
        public void close() {
            if (!closed) {
                registry.record(operationName, (System.nanoTime() - startNanos) / 1_000_000_000.0);
                closed = true;
            }
        }
    }
}
