package com.leadgen.instrument.model;

/**
 * 报表中单个操作的汇总统计。平均值与耗时均保留两位小数。
 */
public record OperationReport(
        double avgCpuPercent,
        double avgMemoryMB,
        double avgExecutionTimeMs,
        double minExecutionTimeMs,
        double maxExecutionTimeMs,
        long totalCalls,
        double cacheHitRatePercent,
        long totalCacheHits,
        long totalCacheMisses
) {

    /**
     * 命中率 = hits / (hits + misses) × 100，分母为0时返回0。
     */
    public static double hitRatePercent(long hits, long misses) {
        long total = hits + misses;
        return total > 0 ? (double) hits / total * 100.0 : 0.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
