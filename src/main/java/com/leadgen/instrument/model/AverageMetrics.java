package com.leadgen.instrument.model;

/**
 * 某个操作在当前采样窗口内的平均值，附带最新的调用计数和命中统计。
 */
public record AverageMetrics(
        double cpuPercent,
        double memoryPercent,
        double memoryMB,
        double executionTimeSeconds,
        long callCount,
        long cacheHits,
        long cacheMisses,
        int sampleCount
) {
}
