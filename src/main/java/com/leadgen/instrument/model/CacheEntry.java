package com.leadgen.instrument.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 缓存条目。命中时不刷新插入时间戳。
 *
 * @param <V> 缓存值类型
 */
public record CacheEntry<V>(
        String key,
        V value,
        Instant insertedAt
) {

    /**
     * 判断条目在给定时刻是否已过期。ttl为null表示永不过期。
     */
    public boolean isExpired(Instant now, Duration ttl) {
        if (ttl == null) {
            return false;
        }
        return Duration.between(insertedAt, now).compareTo(ttl) >= 0;
    }
}
