package com.leadgen.instrument.core;

/**
 * 监控/缓存基础设施自身的错误基类。
 */
public class InstrumentationException extends RuntimeException {

    public InstrumentationException(String message) {
        super(message);
    }

    public InstrumentationException(String message, Throwable cause) {
        super(message, cause);
    }
}
