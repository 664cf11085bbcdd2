package com.leadgen.instrument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * 监控组件配置。
 * 对应配置文件中的缓存、阈值观测、分批与指标参数，缺省项使用默认值。
 */
public class InstrumentConfig {

    private static final Logger log = LoggerFactory.getLogger(InstrumentConfig.class);

    public static final String DEFAULT_RESOURCE = "instrumentation.properties";

    // ---- 缓存 ----
    private int cacheDefaultCapacity = 128;
    private long cacheDefaultTtlMs = 0;          // 0 表示不按时间过期

    // ---- 阈值观测 ----
    private double guardMemoryThresholdMB = 500;
    private double guardCpuThresholdPercent = 80;
    private double guardMemoryGrowthMB = 50;
    private long guardCpuSampleIntervalMs = 1000;

    // ---- 分批 ----
    private int batchDefaultSize = 100;
    private int batchReclaimEveryChunks = 10;

    // ---- 指标 ----
    private int metricsMaxSamples = 100;

    public static InstrumentConfig defaults() {
        return new InstrumentConfig();
    }

    /**
     * 从文件加载配置，失败时记录告警并使用默认值。
     */
    public static InstrumentConfig load(Path configPath) {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
            return defaults();
        }
        return fromProperties(props, configPath.toString());
    }

    /**
     * 从类路径资源 {@value #DEFAULT_RESOURCE} 加载配置，资源不存在时使用默认值。
     */
    public static InstrumentConfig loadFromClasspath() {
        return loadFromClasspath(DEFAULT_RESOURCE);
    }

    public static InstrumentConfig loadFromClasspath(String resource) {
        Properties props = new Properties();
        try (InputStream in = InstrumentConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.info("Config resource '{}' not found on classpath, using defaults.", resource);
                return defaults();
            }
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config resource '{}', using defaults. Error: {}", resource, e.getMessage());
            return defaults();
        }
        return fromProperties(props, resource);
    }

    public static InstrumentConfig fromProperties(Properties props, String source) {
        InstrumentConfig config = new InstrumentConfig();
        try {
            config.cacheDefaultCapacity = Integer.parseInt(
                    props.getProperty("cache.default.capacity", "128").trim());
            config.cacheDefaultTtlMs = Long.parseLong(
                    props.getProperty("cache.default.ttl.ms", "0").trim());
            config.guardMemoryThresholdMB = Double.parseDouble(
                    props.getProperty("guard.memory.threshold.mb", "500").trim());
            config.guardCpuThresholdPercent = Double.parseDouble(
                    props.getProperty("guard.cpu.threshold.percent", "80").trim());
            config.guardMemoryGrowthMB = Double.parseDouble(
                    props.getProperty("guard.memory.growth.mb", "50").trim());
            config.guardCpuSampleIntervalMs = Long.parseLong(
                    props.getProperty("guard.cpu.sample.interval.ms", "1000").trim());
            config.batchDefaultSize = Integer.parseInt(
                    props.getProperty("batch.default.size", "100").trim());
            config.batchReclaimEveryChunks = Integer.parseInt(
                    props.getProperty("batch.reclaim.every.chunks", "10").trim());
            config.metricsMaxSamples = Integer.parseInt(
                    props.getProperty("metrics.max.samples", "100").trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid value in config {}, using defaults. Error: {}", source, e.getMessage());
            return defaults();
        }
        String problem = config.validate();
        if (problem != null) {
            log.warn("Out-of-range value in config {}, using defaults. Error: {}", source, problem);
            return defaults();
        }
        log.debug("Loaded config from {}: {}", source, config);
        return config;
    }

    /**
     * 检查取值范围，返回第一个问题的描述，全部合法时返回null。
     */
    private String validate() {
        if (cacheDefaultCapacity <= 0) {
            return "cache.default.capacity must be positive, got: " + cacheDefaultCapacity;
        }
        if (cacheDefaultTtlMs < 0) {
            return "cache.default.ttl.ms must not be negative, got: " + cacheDefaultTtlMs;
        }
        if (guardMemoryThresholdMB < 0 || guardCpuThresholdPercent < 0 || guardMemoryGrowthMB < 0) {
            return "guard thresholds must not be negative, got: memory=" + guardMemoryThresholdMB
                    + ", cpu=" + guardCpuThresholdPercent + ", growth=" + guardMemoryGrowthMB;
        }
        if (guardCpuSampleIntervalMs < 0) {
            return "guard.cpu.sample.interval.ms must not be negative, got: " + guardCpuSampleIntervalMs;
        }
        if (batchDefaultSize <= 0) {
            return "batch.default.size must be positive, got: " + batchDefaultSize;
        }
        if (batchReclaimEveryChunks <= 0) {
            return "batch.reclaim.every.chunks must be positive, got: " + batchReclaimEveryChunks;
        }
        if (metricsMaxSamples <= 0) {
            return "metrics.max.samples must be positive, got: " + metricsMaxSamples;
        }
        return null;
    }

    // ---- Getters ----
    public int getCacheDefaultCapacity() { return cacheDefaultCapacity; }
    public long getCacheDefaultTtlMs() { return cacheDefaultTtlMs; }
    public double getGuardMemoryThresholdMB() { return guardMemoryThresholdMB; }
    public double getGuardCpuThresholdPercent() { return guardCpuThresholdPercent; }
    public double getGuardMemoryGrowthMB() { return guardMemoryGrowthMB; }
    public long getGuardCpuSampleIntervalMs() { return guardCpuSampleIntervalMs; }
    public int getBatchDefaultSize() { return batchDefaultSize; }
    public int getBatchReclaimEveryChunks() { return batchReclaimEveryChunks; }
    public int getMetricsMaxSamples() { return metricsMaxSamples; }

    /** 默认TTL，未配置时为null */
    public Duration getCacheDefaultTtl() {
        return cacheDefaultTtlMs > 0 ? Duration.ofMillis(cacheDefaultTtlMs) : null;
    }

    public Duration getGuardCpuSampleInterval() {
        return Duration.ofMillis(guardCpuSampleIntervalMs);
    }

    @Override
    public String toString() {
        return "InstrumentConfig{cacheCapacity=" + cacheDefaultCapacity
                + ", cacheTtl=" + cacheDefaultTtlMs + "ms"
                + ", memoryThreshold=" + guardMemoryThresholdMB + "MB"
                + ", cpuThreshold=" + guardCpuThresholdPercent + "%"
                + ", batchSize=" + batchDefaultSize
                + ", maxSamples=" + metricsMaxSamples + "}";
    }
}
