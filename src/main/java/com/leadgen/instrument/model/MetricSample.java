package com.leadgen.instrument.model;

/**
 * 单次调用的性能采样点。创建后不可变。
 *
 * @param cpuPercent             进程CPU占用（%）
 * @param memoryPercent          进程常驻内存占系统内存比例（%）
 * @param memoryMB               进程常驻内存（MB）
 * @param executionTimeSeconds   本次调用耗时（秒）
 * @param callIndex              记录时该操作的调用序号
 * @param cacheHitsAtRecording   记录时的累计缓存命中数
 * @param cacheMissesAtRecording 记录时的累计缓存未命中数
 */
public record MetricSample(
        double cpuPercent,
        double memoryPercent,
        double memoryMB,
        double executionTimeSeconds,
        long callIndex,
        long cacheHitsAtRecording,
        long cacheMissesAtRecording
) {
}
