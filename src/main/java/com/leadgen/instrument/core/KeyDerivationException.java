package com.leadgen.instrument.core;

/**
 * 调用参数无法被确定性地编码为缓存键。在调用底层操作之前抛出。
 */
public class KeyDerivationException extends InstrumentationException {

    public KeyDerivationException(String message) {
        super(message);
    }
}
