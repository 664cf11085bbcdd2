package com.leadgen.instrument.core;

import com.leadgen.instrument.model.AverageMetrics;
import com.leadgen.instrument.model.MetricSample;
import com.leadgen.instrument.model.OperationReport;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 指标注册表接口：按操作名聚合耗时、资源占用与缓存命中统计。
 *
 * 实现必须线程安全：所有读写由同一把锁串行化，
 * 读取方看到的永远是一致的快照，不会看到写了一半的采样列表。
 */
public interface MetricsRegistry {

    /**
     * 记录一次调用。采集资源快照并与当前命中统计组成一个采样点。
     * 采样失败时只记录告警，本方法不会因此抛出异常。
     *
     * @param operationName        操作名
     * @param executionTimeSeconds 调用耗时（秒）
     */
    void record(String operationName, double executionTimeSeconds);

    void recordCacheHit(String operationName);

    void recordCacheMiss(String operationName);

    /**
     * 计算当前保留采样的平均值。
     *
     * @return 无采样数据时返回 empty
     */
    Optional<AverageMetrics> average(String operationName);

    /**
     * 生成全部操作的汇总报表，按操作名排序。
     */
    Map<String, OperationReport> report();

    /**
     * 返回保留采样的副本，按记录顺序排列。
     */
    List<MetricSample> samples(String operationName);

    Set<String> operationNames();

    /**
     * 清空所有统计。
     */
    void clear();
}
