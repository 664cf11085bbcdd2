package com.leadgen.instrument.model;

/**
 * 资源阈值观测告警。仅用于通知，不影响被包装操作的执行。
 */
public record ResourceWarning(
        String operationName,
        Kind kind,
        double observedValue,
        double threshold,
        String message
) {

    public enum Kind {
        /** 调用前常驻内存超过阈值 */
        MEMORY_THRESHOLD,
        /** 调用前CPU占用超过阈值 */
        CPU_THRESHOLD,
        /** 调用期间常驻内存增长超过阈值 */
        MEMORY_GROWTH,
        /** 资源采样失败 */
        SAMPLING_FAILURE
    }
}
