package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.InstrumentationException;
import com.leadgen.instrument.core.MetricsRegistry;
import com.leadgen.instrument.core.Operation;
import com.leadgen.instrument.model.CacheEntry;
import com.leadgen.instrument.model.CacheInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 带容量与TTL上限的记忆化缓存，包装单个操作。
 *
 * <ul>
 *   <li>命中：条目存在且未过期，直接返回缓存值，不调用底层操作，不刷新插入时间</li>
 *   <li>过期：移除条目后按未命中处理</li>
 *   <li>未命中：在锁外调用底层操作并计时，成功后写入；满容量时先淘汰插入时间最早的条目</li>
 *   <li>失败：异常原样抛出，不写入缓存，耗时仍记入指标</li>
 * </ul>
 *
 * 锁只保护表的元数据。同一个键的并发调用通过 in-flight 占位保证最多执行一次，
 * 不同键的调用可以并行执行底层操作。
 *
 * @param <I> 输入类型
 * @param <O> 输出类型
 */
public class InstrumentedCache<I, O> implements Operation<I, O> {

    private static final Logger log = LoggerFactory.getLogger(InstrumentedCache.class);

    private final String operationName;
    private final Operation<I, O> delegate;
    private final int capacity;
    /** null 表示不按时间过期 */
    private final Duration ttl;
    private final MetricsRegistry registry;
    private final CacheKeyEncoder keyEncoder;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    /** 按插入顺序排列的缓存表 */
    private final LinkedHashMap<String, CacheEntry<O>> table = new LinkedHashMap<>();
    /** 正在加载中的键。clear()/invalidate() 会移除占位，被移除的加载完成后不写回 */
    private final Map<String, CompletableFuture<O>> inFlight = new HashMap<>();

    private long hits;
    private long misses;
    private long evictions;

    public InstrumentedCache(String operationName, Operation<I, O> delegate, int capacity,
                             Duration ttl, MetricsRegistry registry) {
        this(operationName, delegate, capacity, ttl, registry, new CacheKeyEncoder(), Clock.systemUTC());
    }

    public InstrumentedCache(String operationName, Operation<I, O> delegate, int capacity,
                             Duration ttl, MetricsRegistry registry,
                             CacheKeyEncoder keyEncoder, Clock clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Cache capacity must be positive, got: " + capacity);
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("Cache TTL must be positive, got: " + ttl);
        }
        this.operationName = operationName;
        this.delegate = delegate;
        this.capacity = capacity;
        this.ttl = ttl;
        this.registry = registry;
        this.keyEncoder = keyEncoder;
        this.clock = clock;

        log.info("InstrumentedCache '{}' initialized. Capacity: {}, TTL: {}",
                operationName, capacity, ttl == null ? "none" : ttl);
    }

    @Override
    public O apply(I input) throws Exception {
        // 键无法编码时在任何统计与调用之前失败
        String key = keyEncoder.encode(input);

        CompletableFuture<O> pending;
        boolean owner = false;

        lock.lock();
        try {
            CacheEntry<O> entry = table.get(key);
            if (entry != null) {
                if (!entry.isExpired(clock.instant(), ttl)) {
                    hits++;
                    registry.recordCacheHit(operationName);
                    return entry.value();
                }
                table.remove(key);
                evictions++;
                log.debug("Cache entry for '{}' expired, key: {}", operationName, key);
            }

            pending = inFlight.get(key);
            if (pending == null) {
                pending = new CompletableFuture<>();
                inFlight.put(key, pending);
                owner = true;
                misses++;
                registry.recordCacheMiss(operationName);
            } else {
                // 同键加载已在进行，等待其结果而不重复执行
                hits++;
                registry.recordCacheHit(operationName);
            }
        } finally {
            lock.unlock();
        }

        if (!owner) {
            return await(pending);
        }
        return load(key, input, pending);
    }

    private O load(String key, I input, CompletableFuture<O> pending) throws Exception {
        long startNanos = System.nanoTime();
        O value;
        try {
            value = delegate.apply(input);
        } catch (Throwable t) {
            double seconds = elapsedSeconds(startNanos);
            lock.lock();
            try {
                inFlight.remove(key, pending);
            } finally {
                lock.unlock();
            }
            pending.completeExceptionally(t);
            registry.record(operationName, seconds);
            throw t;
        }

        double seconds = elapsedSeconds(startNanos);
        lock.lock();
        try {
            if (inFlight.remove(key, pending)) {
                table.remove(key);
                if (table.size() >= capacity) {
                    evictOldest();
                }
                table.put(key, new CacheEntry<>(key, value, clock.instant()));
            } else {
                log.debug("Key {} of '{}' was cleared or invalidated during load, result not stored", key, operationName);
            }
        } finally {
            lock.unlock();
        }
        pending.complete(value);
        registry.record(operationName, seconds);
        return value;
    }

    /**
     * 淘汰插入时间最早的条目（按插入顺序，而非最近访问顺序）。调用方需持有锁。
     */
    private void evictOldest() {
        table.values().stream()
                .min(Comparator.comparing(CacheEntry::insertedAt))
                .ifPresent(oldest -> {
                    table.remove(oldest.key());
                    evictions++;
                    log.debug("Evicted key {} from '{}' due to capacity limit.", oldest.key(), operationName);
                });
    }

    private O await(CompletableFuture<O> pending) throws Exception {
        try {
            return pending.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new InstrumentationException("Concurrent load for '" + operationName + "' failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }

    // ==================== 管理接口 ====================

    /**
     * 清空全部条目。正在进行中的加载仍返回给其调用方，但完成后不会写回，
     * 之后到达的调用按未命中重新加载。
     */
    public void clear() {
        lock.lock();
        try {
            table.clear();
            inFlight.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cache '{}' cleared.", operationName);
    }

    /**
     * 使指定参数对应的条目失效，该键正在进行中的加载完成后不会写回。
     *
     * @return 是否确实移除了条目
     */
    public boolean invalidate(I input) {
        String key = keyEncoder.encode(input);
        lock.lock();
        try {
            inFlight.remove(key);
            return table.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 本实例的状态与计数，语义见 {@link CacheInfo}。
     */
    public CacheInfo info() {
        lock.lock();
        try {
            return new CacheInfo(table.size(), capacity, ttl, hits, misses, evictions);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return table.size();
        } finally {
            lock.unlock();
        }
    }

    public String getOperationName() { return operationName; }
    public int getCapacity() { return capacity; }
    public Duration getTtl() { return ttl; }
}
