package com.leadgen.instrument.core;

import com.leadgen.instrument.model.CpuSnapshot;
import com.leadgen.instrument.model.MemorySnapshot;

import java.time.Duration;

/**
 * 资源采样器接口：进程与主机CPU、内存计数器的只读查询。
 *
 * 所有方法都是纯查询，不修改任何状态（processCpuPercent 除外，它会推进内部的上次采样基线）。
 * 底层操作系统查询失败时抛出 {@link SamplingException}，由调用方决定吞掉还是上抛。
 */
public interface ResourceSampler {

    /**
     * 获取当前进程内存快照。
     *
     * @return 常驻内存、虚拟内存、占系统内存比例及系统可用内存（MB）
     * @throws SamplingException 内存计数器读取失败
     */
    MemorySnapshot memorySnapshot() throws SamplingException;

    /**
     * 在给定时间间隔内采样CPU使用率。
     * 这是本子系统中唯一有意阻塞的调用，阻塞时长约等于 interval。
     *
     * @param interval 采样间隔
     * @return 总体使用率、各核使用率以及1/5/15分钟负载均值
     * @throws SamplingException 读取失败或采样期间线程被中断
     */
    CpuSnapshot cpuSnapshot(Duration interval) throws SamplingException;

    /**
     * 非阻塞地获取当前进程自上次查询以来的CPU占用（%）。
     *
     * @throws SamplingException 进程CPU计数器不可用
     */
    double processCpuPercent() throws SamplingException;
}
