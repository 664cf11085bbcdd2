package com.leadgen.instrument.core;

/**
 * 进程/主机资源查询失败。
 *
 * 受检异常：由调用方决定吞掉（记录告警）还是继续上抛。
 */
public class SamplingException extends Exception {

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
