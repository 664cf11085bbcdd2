package com.leadgen.instrument.core;

/**
 * 统一的可调用操作契约：所有包装器的输入与输出。
 *
 * 缓存、阈值观测、分批执行、计时等包装器都接收一个 Operation 并返回新的 Operation，
 * 因此可以按任意顺序显式组合。被包装操作抛出的异常原样穿透每一层包装器。
 *
 * @param <I> 输入类型
 * @param <O> 输出类型
 */
@FunctionalInterface
public interface Operation<I, O> {

    /**
     * 执行操作。
     *
     * @param input 调用参数
     * @return 操作结果
     * @throws Exception 被包装业务操作抛出的任何异常
     */
    O apply(I input) throws Exception;
}
