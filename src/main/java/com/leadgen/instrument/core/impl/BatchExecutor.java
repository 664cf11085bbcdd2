package com.leadgen.instrument.core.impl;

import com.leadgen.instrument.core.MemoryReclaimer;
import com.leadgen.instrument.core.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 分批执行器。
 *
 * 将有序输入切分为不超过 batchSize 的连续批次，逐批调用被包装操作并按批次顺序拼接结果，
 * 与对完整输入调用一次的结果顺序等价。每处理 reclaimEveryChunks 个批次发出一次内存回收提示。
 */
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    public static final int DEFAULT_RECLAIM_EVERY_CHUNKS = 10;

    private final int batchSize;
    private final int reclaimEveryChunks;
    private final MemoryReclaimer reclaimer;

    public BatchExecutor(int batchSize, MemoryReclaimer reclaimer) {
        this(batchSize, DEFAULT_RECLAIM_EVERY_CHUNKS, reclaimer);
    }

    public BatchExecutor(int batchSize, int reclaimEveryChunks, MemoryReclaimer reclaimer) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive, got: " + batchSize);
        }
        if (reclaimEveryChunks <= 0) {
            throw new IllegalArgumentException("Reclaim interval must be positive, got: " + reclaimEveryChunks);
        }
        this.batchSize = batchSize;
        this.reclaimEveryChunks = reclaimEveryChunks;
        this.reclaimer = reclaimer;
    }

    /**
     * 包装一个每批返回列表的操作，各批结果按顺序拼接。
     */
    public <T, R> Operation<List<T>, List<R>> wrap(String operationName, Operation<List<T>, List<R>> operation) {
        return input -> {
            List<R> results = new ArrayList<>();
            forEachChunk(operationName, input, chunk -> {
                List<R> chunkResult = operation.apply(chunk);
                if (chunkResult != null) {
                    results.addAll(chunkResult);
                } else {
                    results.add(null);
                }
            });
            return results;
        };
    }

    /**
     * 包装一个每批返回单个结果的操作，每个批次在结果中占一个元素。
     */
    public <T, R> Operation<List<T>, List<R>> wrapEach(String operationName, Operation<List<T>, R> operation) {
        return input -> {
            List<R> results = new ArrayList<>();
            forEachChunk(operationName, input, chunk -> results.add(operation.apply(chunk)));
            return results;
        };
    }

    /**
     * 运行时判定形式：输入为 List 时分批，批结果为 List 时拼接、否则追加；
     * 输入不是 List 时直接调用一次，不分批。
     */
    public Operation<Object, Object> wrapDynamic(String operationName, Operation<Object, Object> operation) {
        return input -> {
            if (!(input instanceof List<?>)) {
                return operation.apply(input);
            }
            List<Object> results = new ArrayList<>();
            forEachChunk(operationName, (List<?>) input, chunk -> {
                Object chunkResult = operation.apply(chunk);
                if (chunkResult instanceof List<?>) {
                    results.addAll((List<?>) chunkResult);
                } else {
                    results.add(chunkResult);
                }
            });
            return results;
        };
    }

    /**
     * 将列表切分为不超过 size 的连续子列表（副本）。
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Partition size must be positive, got: " + size);
        }
        List<List<T>> chunks = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            chunks.add(new ArrayList<>(items.subList(from, Math.min(items.size(), from + size))));
        }
        return chunks;
    }

    private <T> void forEachChunk(String operationName, List<T> input, ChunkHandler<T> handler) throws Exception {
        List<List<T>> chunks = partition(input, batchSize);
        log.debug("Processing {} items for '{}' in {} chunks of up to {}",
                input.size(), operationName, chunks.size(), batchSize);

        for (int i = 0; i < chunks.size(); i++) {
            handler.handle(chunks.get(i));
            if ((i + 1) % reclaimEveryChunks == 0) {
                hintReclamation(operationName, i + 1);
            }
        }
    }

    private void hintReclamation(String operationName, int processedChunks) {
        try {
            double freed = reclaimer.reclaim();
            log.debug("Reclamation hint after {} chunks of '{}', freed {}MB",
                    processedChunks, operationName, String.format("%.1f", freed));
        } catch (RuntimeException e) {
            log.warn("Reclamation hint failed for '{}': {}", operationName, e.getMessage());
        }
    }

    public int getBatchSize() { return batchSize; }
    public int getReclaimEveryChunks() { return reclaimEveryChunks; }

    @FunctionalInterface
    private interface ChunkHandler<T> {
        void handle(List<T> chunk) throws Exception;
    }
}
