package com.leadgen.instrument.model;

import java.time.Duration;

/**
 * 缓存状态快照。ttl为null表示条目不按时间过期。
 *
 * hits、misses、evictions 为该缓存实例自身的计数，不随注册表的 clear() 归零，
 * 也不包含同名的其他缓存实例。按操作名汇总的命中统计见
 * {@link com.leadgen.instrument.core.MetricsRegistry#report()}。
 */
public record CacheInfo(
        int size,
        int capacity,
        Duration ttl,
        long hits,
        long misses,
        long evictions
) {
}
