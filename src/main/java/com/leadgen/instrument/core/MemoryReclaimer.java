package com.leadgen.instrument.core;

/**
 * 内存回收提示。分批执行器每处理若干批次后调用一次。
 */
@FunctionalInterface
public interface MemoryReclaimer {

    /**
     * 发出一次内存回收提示。
     *
     * @return 回收前后常驻内存的差值（MB），无法测量时返回0
     */
    double reclaim();
}
